package lending.settlement.sim.fakechain;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.web.bind.annotation.*;

import java.math.BigInteger;
import java.util.Map;
import java.util.UUID;

@RestController
@RequiredArgsConstructor
@RequestMapping("/sim")
@ConditionalOnProperty(prefix = "settlement.chain", name = "mode", havingValue = "mock", matchIfMissing = true)
public class SimController {

    private final FakeChain fakeChain;

    // Script the next transfer result so scenarios reproduce deterministically.
    @PostMapping("/withdrawals/{id}/next-outcome/{outcome}")
    public void setNextOutcome(@PathVariable UUID id, @PathVariable FakeChain.NextOutcome outcome) {
        fakeChain.setNextOutcome(id, outcome);
    }

    @PostMapping("/networks/{blockchainKey}/blocks")
    public Map<String, Object> mine(@PathVariable String blockchainKey, @RequestParam(defaultValue = "1") int count) {
        return Map.of("blockchainKey", blockchainKey, "height", fakeChain.mine(blockchainKey, count));
    }

    @PostMapping("/networks/{blockchainKey}/down")
    public void down(@PathVariable String blockchainKey) {
        fakeChain.setNetworkDown(blockchainKey, true);
    }

    @PostMapping("/networks/{blockchainKey}/up")
    public void up(@PathVariable String blockchainKey) {
        fakeChain.setNetworkDown(blockchainKey, false);
    }

    @PostMapping("/networks/{blockchainKey}/gas-price/{wei}")
    public void gasPrice(@PathVariable String blockchainKey, @PathVariable BigInteger wei) {
        fakeChain.setGasPrice(blockchainKey, wei);
    }

    // Simulates a revert after broadcast so the monitor sees a rejected transaction.
    @PostMapping("/transactions/{txHash}/fail")
    public void failTransaction(@PathVariable String txHash, @RequestParam(defaultValue = "execution reverted") String reason) {
        fakeChain.failTransaction(txHash, reason);
    }
}
