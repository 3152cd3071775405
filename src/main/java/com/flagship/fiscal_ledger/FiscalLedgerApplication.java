package com.flagship.fiscal_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FiscalLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(FiscalLedgerApplication.class, args);
    }
}
