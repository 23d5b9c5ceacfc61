package com.trancheledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TrancheLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(TrancheLedgerApplication.class, args);
    }
}
