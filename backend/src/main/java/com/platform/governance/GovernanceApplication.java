package com.platform.governance;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * AI governance platform: translates AI telemetry into regulatory compliance
 * violations and required actions under versioned, encrypted policies.
 */
@SpringBootApplication
public class GovernanceApplication {
    
    public static void main(String[] args) {
        SpringApplication.run(GovernanceApplication.class, args);
    }
}
