package lending.settlement.orchestration.verification;

public interface KycStatusProvider {

    boolean isVerified(String userId);
}
