package lending.settlement.fee;

import java.math.BigDecimal;
import java.util.Locale;

public enum FeePriority {
    SLOW(new BigDecimal("0.8")),
    STANDARD(BigDecimal.ONE),
    FAST(new BigDecimal("1.5"));

    private final BigDecimal multiplier;

    FeePriority(BigDecimal multiplier) {
        this.multiplier = multiplier;
    }

    public BigDecimal multiplier() {
        return multiplier;
    }

    public static FeePriority parse(String value) {
        if (value == null || value.isBlank()) {
            return STANDARD;
        }
        try {
            return FeePriority.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("invalid fee priority: " + value + " (allowed: slow, standard, fast)");
        }
    }
}
