package dao.fhe.csl.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "settlement")
@Data
public class SettlementProperties {

    /**
     * Identity of this settlement instance (20-byte hex, 0x prefix).
     * Salted into every state commitment so a commitment cannot be replayed against another deployment.
     */
    private String systemIdentity;

    /**
     * Revenue = revenueMultiplier * totalBudget of the settled batch.
     * Default: 10
     */
    private long revenueMultiplier = 10;
}
