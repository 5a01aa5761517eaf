package com.flagship.inventory_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class InventoryLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(InventoryLedgerApplication.class, args);
    }
}
