package com.flagship.group_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class GroupLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(GroupLedgerApplication.class, args);
    }
}
