package lending.settlement.config;

import lending.settlement.network.ChainFamily;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@Configuration
@ConfigurationProperties(prefix = "settlement")
public class SettlementProperties {

    private List<Network> networks = new ArrayList<>();

    private Worker worker = new Worker();

    @Getter
    @Setter
    public static class Network {
        private String key;
        private ChainFamily family;
        private String name;
        private String nativeUnit;
        private int requiredConfirmations = 12;
        private Duration initialMonitoringDelay = Duration.ofMinutes(2);
        private boolean eip1559;
        private BigDecimal staticGasPriceGwei;
        private String hotWalletAddress;
        private ConfirmationTimes confirmationTimes = new ConfirmationTimes();
    }

    @Getter
    @Setter
    public static class ConfirmationTimes {
        private String slow = "10-30 minutes";
        private String standard = "10-30 minutes";
        private String fast = "10-30 minutes";
    }

    @Getter
    @Setter
    public static class Worker {
        private boolean enabled = true;
        private int batchSize = 10;
        private int concurrency = 8;
        private Duration leaseTimeout = Duration.ofMinutes(10);
    }
}
