package lending.settlement.escalation;

import java.util.Locale;

// Taxonomy shown to the admin reviewing a failed withdrawal.
public enum FailureType {
    TRANSACTION_TIMEOUT(FailurePriority.HIGH, false, "Review for potential refund - likely network congestion"),
    NETWORK_ERROR(FailurePriority.HIGH, false, "Check network status and consider refund if platform issue"),
    BLOCKCHAIN_REJECTION(FailurePriority.HIGH, true, "Investigate blockchain error - may require refund"),
    INSUFFICIENT_FUNDS(FailurePriority.CRITICAL, false, "Check platform wallet balance - investigate fund management"),
    INVALID_ADDRESS(FailurePriority.MEDIUM, false, "Verify if address validation failed - user error likely"),
    USER_ERROR(FailurePriority.LOW, false, "Review user actions - refund may not be appropriate"),
    SYSTEM_ERROR(FailurePriority.CRITICAL, false, "Investigate system error - platform responsibility likely"),
    MONITORING_FAILURE(FailurePriority.HIGH, false, "Check transaction status manually - confirmation monitoring exhausted");

    private final FailurePriority priority;
    private final boolean refundEligible;
    private final String recommendedAction;

    FailureType(FailurePriority priority, boolean refundEligible, String recommendedAction) {
        this.priority = priority;
        this.refundEligible = refundEligible;
        this.recommendedAction = recommendedAction;
    }

    public FailurePriority priority() {
        return priority;
    }

    public boolean refundEligible() {
        return refundEligible;
    }

    public String recommendedAction() {
        return recommendedAction;
    }

    /**
     * Classifies a free-text failure tag (e.g. one recorded by an older pipeline or an
     * external system) by keyword. Precedence: timeout, network, blockchain+rejection,
     * insufficient, address, user; anything else is a system error.
     */
    public static FailureType fromRawTag(String rawTag) {
        if (rawTag == null) {
            return SYSTEM_ERROR;
        }
        String tag = rawTag.toUpperCase(Locale.ROOT);
        if (tag.contains("TIMEOUT")) {
            return TRANSACTION_TIMEOUT;
        }
        if (tag.contains("NETWORK")) {
            return NETWORK_ERROR;
        }
        if (tag.contains("BLOCKCHAIN") && tag.contains("REJECTION")) {
            return BLOCKCHAIN_REJECTION;
        }
        if (tag.contains("INSUFFICIENT")) {
            return INSUFFICIENT_FUNDS;
        }
        if (tag.contains("ADDRESS")) {
            return INVALID_ADDRESS;
        }
        if (tag.contains("USER")) {
            return USER_ERROR;
        }
        return SYSTEM_ERROR;
    }
}
