package lending.settlement.orchestration;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

// One transfer at a time per hot wallet in this process, so nonce / UTXO selection never races.
@Component
@Slf4j
public class HotWalletTransferLock {

    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String blockchainKey, String hotWalletAddress, Supplier<T> action) {
        String lockKey = blockchainKey + "|" + hotWalletAddress.toLowerCase(Locale.ROOT);
        ReentrantLock lock = locks.computeIfAbsent(lockKey, key -> new ReentrantLock());
        lock.lock();
        try {
            log.debug("event=hot_wallet_lock.acquired lockKey={}", lockKey);
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
