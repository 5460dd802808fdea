package lending.settlement.orchestration;

// KYC or second factor rejected; maps to 403.
public class VerificationFailedException extends RuntimeException {
    public VerificationFailedException(String message) {
        super(message);
    }
}
