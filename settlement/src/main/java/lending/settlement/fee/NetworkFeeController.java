package lending.settlement.fee;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequiredArgsConstructor
@RequestMapping("/networks")
@Slf4j
public class NetworkFeeController {

    private final NetworkFeeOracle feeOracle;

    @GetMapping("/{blockchainKey}/fee-estimate")
    public ResponseEntity<NetworkFeeEstimate> estimate(
            @PathVariable String blockchainKey,
            @RequestParam(required = false) String tokenId,
            @RequestParam(required = false) String priority
    ) {
        FeePriority feePriority = FeePriority.parse(priority);
        log.info("event=network_fee.estimate.request blockchainKey={} tokenId={} priority={}", blockchainKey, tokenId, feePriority);
        return ResponseEntity.ok(feeOracle.estimate(blockchainKey, tokenId, feePriority));
    }
}
