package lending.settlement.domain.account;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;
import java.util.UUID;

public interface AccountBalanceRepository extends JpaRepository<AccountBalance, UUID> {

    // Serializes withdrawal creation per user and currency until the surrounding transaction ends.
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("""
            select b from AccountBalance b
            where b.userId = :userId
              and b.blockchainKey = :blockchainKey
              and b.tokenId = :tokenId
            """)
    Optional<AccountBalance> lockForWithdrawal(
            @Param("userId") String userId,
            @Param("blockchainKey") String blockchainKey,
            @Param("tokenId") String tokenId
    );
}
