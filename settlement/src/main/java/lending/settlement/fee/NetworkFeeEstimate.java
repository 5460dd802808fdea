package lending.settlement.fee;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.math.BigDecimal;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record NetworkFeeEstimate(
        BigDecimal fee,
        String feeUnit,
        String estimatedConfirmationTime,
        BigDecimal gasPriceGwei,
        Long gasLimit
) {
    public static NetworkFeeEstimate of(BigDecimal fee, String feeUnit, String estimatedConfirmationTime) {
        return new NetworkFeeEstimate(fee, feeUnit, estimatedConfirmationTime, null, null);
    }
}
