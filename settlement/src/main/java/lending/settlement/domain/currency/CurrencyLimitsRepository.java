package lending.settlement.domain.currency;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface CurrencyLimitsRepository extends JpaRepository<CurrencyLimits, UUID> {

    Optional<CurrencyLimits> findByBlockchainKeyAndTokenId(String blockchainKey, String tokenId);
}
