package lending.settlement.orchestration;

import lending.settlement.domain.account.AccountBalance;
import lending.settlement.domain.account.AccountBalanceRepository;
import lending.settlement.domain.beneficiary.Beneficiary;
import lending.settlement.domain.beneficiary.BeneficiaryRepository;
import lending.settlement.domain.currency.CurrencyLimits;
import lending.settlement.domain.currency.CurrencyLimitsRepository;
import lending.settlement.domain.withdrawal.Withdrawal;
import lending.settlement.domain.withdrawal.WithdrawalRepository;
import lending.settlement.domain.withdrawal.WithdrawalStatus;
import lending.settlement.fee.FeePriority;
import lending.settlement.fee.NetworkFeeOracle;
import lending.settlement.notification.Notification;
import lending.settlement.notification.SettlementNotifier;
import lending.settlement.orchestration.verification.KycStatusProvider;
import lending.settlement.orchestration.verification.TwoFactorVerifier;
import lending.settlement.queue.Backoff;
import lending.settlement.queue.JobOptions;
import lending.settlement.queue.SettlementQueue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

@Service
@RequiredArgsConstructor
@Slf4j
public class WithdrawalValidationService {

    static final JobOptions PROCESSING_JOB_OPTIONS =
            new JobOptions(Duration.ofSeconds(5), 5, 5, Backoff.exponential(Duration.ofSeconds(3)));

    // withdrawals that count against the daily limit
    private static final Set<WithdrawalStatus> DAILY_LIMIT_STATUSES =
            EnumSet.of(WithdrawalStatus.REQUESTED, WithdrawalStatus.SENT, WithdrawalStatus.CONFIRMED);

    // not yet debited from the account balance
    private static final Set<WithdrawalStatus> IN_FLIGHT_STATUSES =
            EnumSet.of(WithdrawalStatus.REQUESTED, WithdrawalStatus.SENT);

    private final WithdrawalRepository withdrawalRepository;
    private final BeneficiaryRepository beneficiaryRepository;
    private final CurrencyLimitsRepository currencyLimitsRepository;
    private final AccountBalanceRepository accountBalanceRepository;
    private final NetworkFeeOracle feeOracle;
    private final SettlementQueue queue;
    private final SettlementNotifier notifier;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final ConcurrentHashMap<String, ReentrantLock> idempotencyLocks = new ConcurrentHashMap<>();

    // Provided by the identity service; when absent every request is refused.
    @Autowired(required = false)
    private KycStatusProvider kycStatusProvider;

    @Autowired(required = false)
    private TwoFactorVerifier twoFactorVerifier;

    private record Outcome(Withdrawal withdrawal, boolean created) {}

    // Same Idempotency-Key + same body returns the existing withdrawal instead of creating a second one.
    public Withdrawal requestWithdrawal(String userId, String idempotencyKey, CreateWithdrawalRequest req) {
        validateShape(userId, idempotencyKey, req);
        log.info(
                "event=withdrawal_validation.request.start idempotencyKey={} userId={} blockchainKey={} tokenId={} amount={}",
                idempotencyKey,
                userId,
                req.currencyBlockchainKey(),
                req.currencyTokenId(),
                req.amount()
        );
        ReentrantLock lock = idempotencyLocks.computeIfAbsent(idempotencyKey, key -> new ReentrantLock());
        lock.lock();
        try {
            Outcome outcome = transactionTemplate.execute(status ->
                    withdrawalRepository.findByIdempotencyKey(idempotencyKey)
                            .map(existing -> new Outcome(validateIdempotentRequest(existing, userId, req), false))
                            .orElseGet(() -> new Outcome(createAndEnqueue(userId, idempotencyKey, req), true))
            );
            if (outcome == null) {
                throw new IllegalStateException("failed to create or get withdrawal");
            }
            Withdrawal result = outcome.withdrawal();
            if (outcome.created()) {
                notifier.notifyUser(Notification.WITHDRAWAL_REQUESTED, userId, result.getId(), Map.of(
                        "name", "Withdrawal Requested",
                        "amount", result.getRequestAmount().toPlainString(),
                        "netAmount", result.getNetAmount().toPlainString(),
                        "blockchainKey", result.getCurrencyBlockchainKey()
                ));
            }
            log.info(
                    "event=withdrawal_validation.request.done idempotencyKey={} withdrawalId={} status={} created={}",
                    idempotencyKey,
                    result.getId(),
                    result.getStatus(),
                    outcome.created()
            );
            return result;
        } finally {
            lock.unlock();
        }
    }

    @Transactional(readOnly = true)
    public Withdrawal get(String userId, UUID withdrawalId) {
        return withdrawalRepository.findByIdAndUserId(withdrawalId, userId)
                .orElseThrow(() -> new WithdrawalNotFoundException(withdrawalId));
    }

    private Withdrawal createAndEnqueue(String userId, String idempotencyKey, CreateWithdrawalRequest req) {
        String blockchainKey = req.currencyBlockchainKey();
        String tokenId = req.currencyTokenId();
        BigDecimal amount = req.amount();

        Beneficiary beneficiary = beneficiaryRepository.findById(req.beneficiaryId())
                .filter(b -> b.isOwnedBy(userId))
                .orElseThrow(() -> new InvalidRequestException("beneficiary not found: " + req.beneficiaryId()));
        if (!beneficiary.matchesCurrency(blockchainKey, tokenId)) {
            throw new InvalidRequestException("beneficiary " + beneficiary.getId() + " is not registered for "
                    + blockchainKey + "/" + tokenId);
        }

        verifyIdentity(userId, req.twoFactorCode());

        CurrencyLimits limits = currencyLimitsRepository.findByBlockchainKeyAndTokenId(blockchainKey, tokenId)
                .orElseThrow(() -> new InvalidRequestException("currency not supported: " + blockchainKey + "/" + tokenId));
        checkLimits(userId, limits, amount);

        BigDecimal balance = accountBalanceRepository.lockForWithdrawal(userId, blockchainKey, tokenId)
                .map(AccountBalance::getBalance)
                .orElse(BigDecimal.ZERO);
        BigDecimal inFlight = withdrawalRepository.sumRequestAmount(userId, blockchainKey, tokenId, IN_FLIGHT_STATUSES);
        BigDecimal available = balance.subtract(inFlight);
        if (available.compareTo(amount) < 0) {
            log.warn(
                    "event=withdrawal_validation.insufficient_balance userId={} balance={} inFlight={} amount={}",
                    userId,
                    balance,
                    inFlight,
                    amount
            );
            throw new InvalidRequestException("insufficient balance: available "
                    + available.stripTrailingZeros().toPlainString()
                    + ", requested " + amount.stripTrailingZeros().toPlainString());
        }

        BigDecimal platformFee = amount.multiply(limits.getWithdrawalFeeRate())
                .setScale(limits.getDecimals(), RoundingMode.UP);
        BigDecimal networkFee = feeOracle.estimate(blockchainKey, tokenId, FeePriority.STANDARD, amount).fee();
        BigDecimal netAmount = amount.subtract(platformFee).subtract(networkFee);
        if (netAmount.signum() <= 0) {
            throw new InvalidRequestException("amount " + amount.toPlainString() + " does not cover platform fee "
                    + platformFee.toPlainString() + " and network fee " + networkFee.toPlainString());
        }

        Withdrawal saved = withdrawalRepository.save(Withdrawal.requested(
                idempotencyKey,
                userId,
                beneficiary.getId(),
                beneficiary.getAddress(),
                blockchainKey,
                tokenId,
                amount,
                platformFee,
                networkFee,
                clock.instant()
        ));
        log.info(
                "event=withdrawal_validation.persisted withdrawalId={} platformFee={} networkFee={} netAmount={}",
                saved.getId(),
                platformFee,
                networkFee,
                saved.getNetAmount()
        );

        queue.enqueue(
                WithdrawalProcessor.JOB_NAME,
                new WithdrawalProcessingJob(
                        saved.getId(),
                        userId,
                        saved.getAmount(),
                        blockchainKey,
                        tokenId,
                        beneficiary.getAddress()
                ),
                PROCESSING_JOB_OPTIONS
        );
        return saved;
    }

    private void verifyIdentity(String userId, String twoFactorCode) {
        if (kycStatusProvider == null || !kycStatusProvider.isVerified(userId)) {
            log.warn("event=withdrawal_validation.kyc_rejected userId={}", userId);
            throw new VerificationFailedException("KYC verification required");
        }
        if (twoFactorVerifier == null || twoFactorCode == null || !twoFactorVerifier.verify(userId, twoFactorCode)) {
            log.warn("event=withdrawal_validation.two_factor_rejected userId={}", userId);
            throw new VerificationFailedException("two-factor verification failed");
        }
    }

    private void checkLimits(String userId, CurrencyLimits limits, BigDecimal amount) {
        if (amount.compareTo(limits.getMinWithdrawalAmount()) < 0) {
            throw new InvalidRequestException("amount below minimum withdrawal of "
                    + limits.getMinWithdrawalAmount().toPlainString());
        }
        if (limits.hasMaxWithdrawalAmount() && amount.compareTo(limits.getMaxWithdrawalAmount()) > 0) {
            throw new InvalidRequestException("amount above maximum withdrawal of "
                    + limits.getMaxWithdrawalAmount().toPlainString());
        }
        if (limits.hasMaxDailyWithdrawalAmount()) {
            Instant startOfDay = clock.instant().truncatedTo(ChronoUnit.DAYS);
            BigDecimal today = withdrawalRepository.sumRequestAmountSince(
                    userId, limits.getBlockchainKey(), limits.getTokenId(), startOfDay, DAILY_LIMIT_STATUSES);
            if (today.add(amount).compareTo(limits.getMaxDailyWithdrawalAmount()) > 0) {
                throw new InvalidRequestException("daily withdrawal limit of "
                        + limits.getMaxDailyWithdrawalAmount().toPlainString() + " exceeded");
            }
        }
    }

    // Any body mismatch under the same key is a conflict; replaying it must never create a second withdrawal.
    private Withdrawal validateIdempotentRequest(Withdrawal existing, String userId, CreateWithdrawalRequest req) {
        boolean matches = existing.getUserId().equals(userId)
                && existing.getBeneficiaryId().equals(req.beneficiaryId())
                && existing.getCurrencyBlockchainKey().equals(req.currencyBlockchainKey())
                && existing.getCurrencyTokenId().equals(req.currencyTokenId())
                && existing.getRequestAmount().compareTo(req.amount()) == 0;

        if (!matches) {
            log.warn(
                    "event=withdrawal_validation.idempotency.conflict existingWithdrawalId={} idempotencyKey={}",
                    existing.getId(),
                    existing.getIdempotencyKey()
            );
            throw new IdempotencyConflictException("same Idempotency-Key cannot be used with a different request body");
        }

        log.info("event=withdrawal_validation.idempotency.hit withdrawalId={} idempotencyKey={}", existing.getId(), existing.getIdempotencyKey());
        return existing;
    }

    private void validateShape(String userId, String idempotencyKey, CreateWithdrawalRequest req) {
        if (userId == null || userId.isBlank()) {
            throw new InvalidRequestException("user id is required");
        }
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new InvalidRequestException("Idempotency-Key is required");
        }
        if (req == null) {
            throw new InvalidRequestException("request body is required");
        }
        if (req.beneficiaryId() == null) {
            throw new InvalidRequestException("beneficiaryId is required");
        }
        if (isBlank(req.currencyBlockchainKey()) || isBlank(req.currencyTokenId())) {
            throw new InvalidRequestException("currencyBlockchainKey and currencyTokenId are required");
        }
        if (Objects.isNull(req.amount()) || req.amount().signum() <= 0) {
            throw new InvalidRequestException("amount must be positive");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
