package com.decisionledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DecisionLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(DecisionLedgerApplication.class, args);
    }
}
