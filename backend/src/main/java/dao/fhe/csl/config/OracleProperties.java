package dao.fhe.csl.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "oracle")
@Data
public class OracleProperties {

    /**
     * Identities allowed to deliver decryption callbacks.
     */
    private List<String> relayers = new ArrayList<>();

    /**
     * Addresses of the key-management signers whose signatures are accepted as authenticity proofs.
     * Example: ["0x7e5f4552091a69125d5dfcb7b8c2659029395bdf"]
     */
    private List<String> signers = new ArrayList<>();
}
