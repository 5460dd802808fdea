package lending.settlement.orchestration;

import lending.settlement.common.CorrelationIdFilter;
import lending.settlement.domain.withdrawal.Withdrawal;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequiredArgsConstructor
@RequestMapping("/withdrawals")
@Slf4j
public class WithdrawalController {

    private final WithdrawalValidationService withdrawalValidationService;

    // X-User-Id is set by the authenticating gateway in front of this service.
    @PostMapping
    public ResponseEntity<Withdrawal> create(
            @RequestHeader(CorrelationIdFilter.USER_ID_HEADER) String userId,
            @RequestHeader("Idempotency-Key") String idempotencyKey,
            @RequestBody CreateWithdrawalRequest req
    ) {
        log.info(
                "event=withdrawal.create.request blockchainKey={} tokenId={} amount={} beneficiaryId={} idempotencyKeyPresent={}",
                req.currencyBlockchainKey(),
                req.currencyTokenId(),
                req.amount(),
                req.beneficiaryId(),
                !idempotencyKey.isBlank()
        );
        Withdrawal w = withdrawalValidationService.requestWithdrawal(userId, idempotencyKey, req);
        log.info("event=withdrawal.create.response withdrawalId={} status={}", w.getId(), w.getStatus());
        return ResponseEntity.status(HttpStatus.CREATED).body(w);
    }

    @GetMapping("/{id}")
    public ResponseEntity<Withdrawal> get(
            @RequestHeader(CorrelationIdFilter.USER_ID_HEADER) String userId,
            @PathVariable UUID id
    ) {
        log.info("event=withdrawal.get.request withdrawalId={}", id);
        Withdrawal withdrawal = withdrawalValidationService.get(userId, id);
        log.info("event=withdrawal.get.response withdrawalId={} status={}", withdrawal.getId(), withdrawal.getStatus());
        return ResponseEntity.ok(withdrawal);
    }
}
