package lending.settlement.adapter;

public class TransferRejectedException extends RuntimeException {
    public TransferRejectedException(String message) {
        super(message);
    }
}
