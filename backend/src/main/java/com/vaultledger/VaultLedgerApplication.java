package com.vaultledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class VaultLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(VaultLedgerApplication.class, args);
    }
}
