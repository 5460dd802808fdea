package lending.settlement.address;

public record AddressValidation(boolean valid, String reason) {

    public static AddressValidation ok() {
        return new AddressValidation(true, null);
    }

    public static AddressValidation invalid(String reason) {
        return new AddressValidation(false, reason);
    }
}
