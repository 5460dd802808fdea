package lending.settlement.domain.withdrawal;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collection;
import java.util.Optional;
import java.util.UUID;

public interface WithdrawalRepository extends JpaRepository<Withdrawal, UUID> {

    Optional<Withdrawal> findByIdempotencyKey(String idempotencyKey);

    Optional<Withdrawal> findByIdAndUserId(UUID id, String userId);

    @Query("""
            select coalesce(sum(w.requestAmount), 0) from Withdrawal w
            where w.userId = :userId
              and w.currencyBlockchainKey = :blockchainKey
              and w.currencyTokenId = :tokenId
              and w.requestDate >= :since
              and w.status in :statuses
            """)
    BigDecimal sumRequestAmountSince(
            @Param("userId") String userId,
            @Param("blockchainKey") String blockchainKey,
            @Param("tokenId") String tokenId,
            @Param("since") Instant since,
            @Param("statuses") Collection<WithdrawalStatus> statuses
    );

    @Query("""
            select coalesce(sum(w.requestAmount), 0) from Withdrawal w
            where w.userId = :userId
              and w.currencyBlockchainKey = :blockchainKey
              and w.currencyTokenId = :tokenId
              and w.status in :statuses
            """)
    BigDecimal sumRequestAmount(
            @Param("userId") String userId,
            @Param("blockchainKey") String blockchainKey,
            @Param("tokenId") String tokenId,
            @Param("statuses") Collection<WithdrawalStatus> statuses
    );
}
