package lending.settlement.sim.fakechain;

import lending.settlement.orchestration.verification.KycStatusProvider;
import lending.settlement.orchestration.verification.TwoFactorVerifier;

import java.util.Set;

// Local stand-in for the identity service: everyone is verified except the listed users.
public class SimulatedIdentityChecks implements KycStatusProvider, TwoFactorVerifier {

    private final Set<String> unverifiedUsers;
    private final String twoFactorCode;

    public SimulatedIdentityChecks(Set<String> unverifiedUsers, String twoFactorCode) {
        this.unverifiedUsers = Set.copyOf(unverifiedUsers);
        this.twoFactorCode = twoFactorCode;
    }

    @Override
    public boolean isVerified(String userId) {
        return !unverifiedUsers.contains(userId);
    }

    @Override
    public boolean verify(String userId, String code) {
        return twoFactorCode.equals(code);
    }
}
