package com.flagship.pledge_ledger;

import com.flagship.pledge_ledger.config.LedgerProperties;
import com.flagship.pledge_ledger.outbox.OutboxPublisherProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties({LedgerProperties.class, OutboxPublisherProperties.class})
public class PledgeLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(PledgeLedgerApplication.class, args);
    }
}
