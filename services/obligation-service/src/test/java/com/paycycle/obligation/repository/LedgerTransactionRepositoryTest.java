package com.paycycle.obligation.repository;

import com.paycycle.obligation.TestDataBuilder;
import com.paycycle.obligation.entity.LedgerTransaction;
import com.paycycle.obligation.ledger.JpaLedgerStore;
import com.paycycle.obligation.ledger.LedgerStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

/**
 * Integration tests for LedgerTransactionRepository account lookups and link release.
 */
@DataJpaTest
@ActiveProfiles("test")
@DisplayName("LedgerTransactionRepository Integration Tests")
class LedgerTransactionRepositoryTest {

    private static final String OTHER_ACCOUNT_ID = "Y";
    private static final YearMonth FEBRUARY = YearMonth.of(2026, 2);

    @Autowired
    private LedgerTransactionRepository transactionRepository;

    @Autowired
    private TestEntityManager entityManager;

    private LedgerStore ledgerStore;

    @BeforeEach
    void setUp() {
        ledgerStore = new JpaLedgerStore(transactionRepository, event -> { });

        persist("Groceries", LocalDate.of(2026, 1, 31), TestDataBuilder.TEST_ACCOUNT_ID);
        persist("Dining", LocalDate.of(2026, 2, 28), TestDataBuilder.TEST_ACCOUNT_ID);
        persist("Fuel", LocalDate.of(2026, 2, 1), TestDataBuilder.TEST_ACCOUNT_ID);
        persist("Pharmacy", LocalDate.of(2026, 3, 1), TestDataBuilder.TEST_ACCOUNT_ID);
        persist("Books", LocalDate.of(2026, 2, 10), OTHER_ACCOUNT_ID);
        entityManager.flush();
    }

    private LedgerTransaction persist(String name, LocalDate date, String accountId) {
        LedgerTransaction transaction = TestDataBuilder.createTransaction(name, date, new BigDecimal("100"));
        transaction.setId(null);
        transaction.setAccountId(accountId);
        return entityManager.persist(transaction);
    }

    @Test
    @DisplayName("Account lookup returns the account's entries within the month in date order")
    void shouldFindAccountEntriesForMonth() {
        assertThat(ledgerStore.getTransactionsForPeriodAndAccount(FEBRUARY, TestDataBuilder.TEST_ACCOUNT_ID))
                .extracting(LedgerTransaction::getOccurredOn)
                .containsExactly(LocalDate.of(2026, 2, 1), LocalDate.of(2026, 2, 28));
        assertThat(ledgerStore.getTransactionsForPeriodAndAccount(FEBRUARY, OTHER_ACCOUNT_ID))
                .extracting(LedgerTransaction::getName)
                .containsExactly("Books");
        assertThat(ledgerStore.getTransactionsForPeriodAndAccount(FEBRUARY, "UNKNOWN")).isEmpty();
    }

    @Test
    @DisplayName("Link is released only from the schedule it points at")
    void shouldUnlinkOnlyFromLinkedSchedule() {
        LedgerTransaction transaction = persist("Internet", LocalDate.of(2026, 2, 8), TestDataBuilder.TEST_ACCOUNT_ID);
        entityManager.flush();
        UUID scheduleId = UUID.randomUUID();
        assertThat(transactionRepository.linkIfUnlinked(transaction.getId(), scheduleId)).isEqualTo(1);

        assertThat(transactionRepository.unlinkIfLinkedTo(transaction.getId(), UUID.randomUUID())).isZero();
        assertThat(transactionRepository.unlinkIfLinkedTo(transaction.getId(), scheduleId)).isEqualTo(1);
        assertThat(transactionRepository.findByLinkedScheduleId(scheduleId)).isEmpty();
        assertThat(transactionRepository.linkIfUnlinked(transaction.getId(), UUID.randomUUID())).isEqualTo(1);
    }
}
