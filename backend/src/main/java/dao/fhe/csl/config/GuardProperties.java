package dao.fhe.csl.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "guard")
@Data
public class GuardProperties {

    /**
     * Initial administrator identity (hex address with 0x prefix)
     * Example: 0x5b38da6a701c568545dcfcb03fcb875f56beddc4
     */
    private String admin;

    /**
     * Providers authorized at startup.
     * Example: ["0xab8483f64d9c6d1ecf9b849ae677dd3315835cb2", "0x4b20993bc481177ec7e8f571cecae8a9e22c02db"]
     */
    private List<String> providers = new ArrayList<>();

    /**
     * Cooldown in seconds applied to both submissions and settlement requests, per actor.
     * Default: 60
     */
    private long cooldownSeconds = 60;

    /**
     * Start in paused state.
     */
    private boolean paused = false;
}
