package com.paycycle.obligation;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Obligation Service Application
 *
 * Turns recurring bills and installment loans into dated payment schedules, records payments
 * against them together with ledger entries, reconciles stored payments with the ledger and
 * projects per-period budgets.
 */
@SpringBootApplication
@EnableJpaRepositories(basePackages = "com.paycycle.obligation.repository")
@EnableTransactionManagement
public class ObligationServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(ObligationServiceApplication.class, args);
    }
}
