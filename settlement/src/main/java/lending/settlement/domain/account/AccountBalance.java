package lending.settlement.domain.account;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.util.UUID;

// Read-only view of the user's spendable balance; debits are booked by the accounting service.
@Entity
@Table(name = "account_balances", uniqueConstraints = {
        @UniqueConstraint(name = "uk_account_balance_owner", columnNames = {"userId", "blockchainKey", "tokenId"})
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder
public class AccountBalance {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, length = 64)
    private String userId;

    @Column(nullable = false, length = 64)
    private String blockchainKey;

    @Column(nullable = false, length = 128)
    private String tokenId;

    @Column(nullable = false, precision = 38, scale = 18)
    private BigDecimal balance;

    public static AccountBalance of(String userId, String blockchainKey, String tokenId, BigDecimal balance) {
        return AccountBalance.builder()
                .userId(userId)
                .blockchainKey(blockchainKey)
                .tokenId(tokenId)
                .balance(balance)
                .build();
    }
}
