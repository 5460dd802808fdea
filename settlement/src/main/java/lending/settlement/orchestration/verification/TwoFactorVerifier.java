package lending.settlement.orchestration.verification;

public interface TwoFactorVerifier {

    boolean verify(String userId, String code);
}
