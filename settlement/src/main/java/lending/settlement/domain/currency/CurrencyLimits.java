package lending.settlement.domain.currency;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.util.UUID;

@Entity
@Table(name = "currency_limits", uniqueConstraints = {
        @UniqueConstraint(name = "uk_currency_limits_currency", columnNames = {"blockchainKey", "tokenId"})
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder
public class CurrencyLimits {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, length = 64)
    private String blockchainKey;

    @Column(nullable = false, length = 128)
    private String tokenId;

    @Column(nullable = false)
    private int decimals;

    // fraction of the requested amount, e.g. 0.001 = 0.1%
    @Column(nullable = false, precision = 20, scale = 10)
    private BigDecimal withdrawalFeeRate;

    @Column(nullable = false, precision = 38, scale = 18)
    private BigDecimal minWithdrawalAmount;

    // null or zero means no upper bound
    @Column(precision = 38, scale = 18)
    private BigDecimal maxWithdrawalAmount;

    @Column(precision = 38, scale = 18)
    private BigDecimal maxDailyWithdrawalAmount;

    public boolean hasMaxWithdrawalAmount() {
        return maxWithdrawalAmount != null && maxWithdrawalAmount.signum() > 0;
    }

    public boolean hasMaxDailyWithdrawalAmount() {
        return maxDailyWithdrawalAmount != null && maxDailyWithdrawalAmount.signum() > 0;
    }
}
