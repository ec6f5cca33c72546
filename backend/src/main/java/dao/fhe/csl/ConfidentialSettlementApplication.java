package dao.fhe.csl;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class ConfidentialSettlementApplication {

    public static void main(String[] args) {
        SpringApplication.run(ConfidentialSettlementApplication.class, args);
    }
}
