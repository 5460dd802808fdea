package lending.settlement.sim.fakechain;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;

// Mines one block on every fake network per tick so sent withdrawals eventually confirm.
@RequiredArgsConstructor
@Slf4j
public class FakeBlockProducer {

    private final FakeChain fakeChain;

    @Scheduled(fixedDelayString = "${settlement.sim.block-interval-ms:5000}")
    public void mine() {
        for (String key : fakeChain.networks()) {
            long height = fakeChain.mine(key, 1);
            log.debug("event=fake_chain.block_mined blockchainKey={} height={}", key, height);
        }
    }
}
