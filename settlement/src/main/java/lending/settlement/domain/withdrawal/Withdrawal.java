package lending.settlement.domain.withdrawal;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "withdrawals",
       indexes = {
           @Index(name = "idx_withdrawal_idem", columnList = "idempotencyKey", unique = true),
           @Index(name = "idx_withdrawal_user", columnList = "userId"),
           @Index(name = "idx_withdrawal_sent_hash", columnList = "sentHash", unique = true)
       })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder
public class Withdrawal {

    static final int MAX_FAILURE_REASON_LENGTH = 1000;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Version
    private Long version;

    @Column(nullable = false, updatable = false, length = 128)
    private String idempotencyKey;

    @Column(nullable = false, updatable = false, length = 64)
    private String userId;

    @Column(nullable = false, updatable = false)
    private UUID beneficiaryId;

    @Column(nullable = false, updatable = false, length = 128)
    private String beneficiaryAddress;

    @Column(nullable = false, updatable = false, length = 64)
    private String currencyBlockchainKey;

    @Column(nullable = false, updatable = false, length = 128)
    private String currencyTokenId;

    @Column(nullable = false, updatable = false, precision = 38, scale = 18)
    private BigDecimal requestAmount;

    @Column(nullable = false, updatable = false, precision = 38, scale = 18)
    private BigDecimal platformFee;

    @Column(nullable = false, updatable = false, precision = 38, scale = 18)
    private BigDecimal estimatedNetworkFee;

    // requestAmount - platformFee: the value handed to the chain before the network fee is taken
    @Column(nullable = false, updatable = false, precision = 38, scale = 18)
    private BigDecimal amount;

    @Column(nullable = false, updatable = false, precision = 38, scale = 18)
    private BigDecimal netAmount;

    @Column(precision = 38, scale = 18)
    private BigDecimal actualNetworkFee;

    @Column(precision = 38, scale = 18)
    private BigDecimal sentAmount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private WithdrawalStatus status;

    @Column(nullable = false, updatable = false)
    private Instant requestDate;

    private Instant transferStartedAt;

    private Instant sentDate;

    @Column(length = 128)
    private String sentHash;

    private Instant confirmedDate;

    private Instant failedDate;

    @Column(length = MAX_FAILURE_REASON_LENGTH)
    private String failureReason;

    @Column(nullable = false)
    private boolean autoRefundRequested;

    public static Withdrawal requested(
            String idempotencyKey,
            String userId,
            UUID beneficiaryId,
            String beneficiaryAddress,
            String blockchainKey,
            String tokenId,
            BigDecimal requestAmount,
            BigDecimal platformFee,
            BigDecimal estimatedNetworkFee,
            Instant requestDate) {
        BigDecimal amount = requestAmount.subtract(platformFee);
        BigDecimal netAmount = amount.subtract(estimatedNetworkFee);
        if (netAmount.signum() <= 0) {
            throw new IllegalArgumentException("net amount must be positive: request=" + requestAmount
                    + ", platformFee=" + platformFee + ", networkFee=" + estimatedNetworkFee);
        }
        return Withdrawal.builder()
                .idempotencyKey(idempotencyKey)
                .userId(userId)
                .beneficiaryId(beneficiaryId)
                .beneficiaryAddress(beneficiaryAddress)
                .currencyBlockchainKey(blockchainKey)
                .currencyTokenId(tokenId)
                .requestAmount(requestAmount)
                .platformFee(platformFee)
                .estimatedNetworkFee(estimatedNetworkFee)
                .amount(amount)
                .netAmount(netAmount)
                .status(WithdrawalStatus.REQUESTED)
                .requestDate(requestDate)
                .autoRefundRequested(false)
                .build();
    }

    // Recorded before the hot wallet is called so a crashed worker never re-sends the same withdrawal.
    public void markTransferStarted(Instant at) {
        if (status != WithdrawalStatus.REQUESTED) {
            throw new IllegalStateException("transfer can only start from REQUESTED, current=" + status);
        }
        this.transferStartedAt = at;
    }

    public void markSent(String txHash, BigDecimal sentAmount, BigDecimal actualNetworkFee, Instant at) {
        transitionTo(WithdrawalStatus.SENT);
        this.sentHash = txHash;
        this.sentAmount = sentAmount;
        this.actualNetworkFee = actualNetworkFee;
        this.sentDate = at;
    }

    public void markConfirmed(Instant at) {
        transitionTo(WithdrawalStatus.CONFIRMED);
        this.confirmedDate = at;
    }

    public void markFailed(Instant at, String reason) {
        transitionTo(WithdrawalStatus.FAILED);
        this.failedDate = at;
        this.failureReason = truncate(reason);
    }

    public void requestAutoRefund() {
        this.autoRefundRequested = true;
    }

    public boolean isTransferStarted() {
        return transferStartedAt != null;
    }

    private static String truncate(String reason) {
        if (reason == null || reason.length() <= MAX_FAILURE_REASON_LENGTH) {
            return reason;
        }
        return reason.substring(0, MAX_FAILURE_REASON_LENGTH);
    }

    private void transitionTo(WithdrawalStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("invalid withdrawal status transition: " + status + " -> " + next);
        }
        this.status = next;
    }
}
