package com.paycycle.obligation.ledger;

import com.paycycle.obligation.TestDataBuilder;
import com.paycycle.obligation.entity.LedgerTransaction;
import com.paycycle.obligation.exception.DuplicatePaymentException;
import com.paycycle.obligation.repository.LedgerTransactionRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("JpaLedgerStore Unit Tests")
class JpaLedgerStoreTest {

    @Mock
    private LedgerTransactionRepository transactionRepository;

    @Mock
    private ApplicationEventPublisher applicationEventPublisher;

    @InjectMocks
    private JpaLedgerStore ledgerStore;

    @Test
    @DisplayName("Second entry for the same schedule surfaces as a duplicate payment")
    void shouldMapLinkConflictToDuplicate() {
        LedgerTransaction transaction = TestDataBuilder.createTransaction("Internet", LocalDate.of(2026, 1, 8),
                TestDataBuilder.INTERNET_AMOUNT);
        transaction.setLinkedScheduleId(UUID.randomUUID());
        when(transactionRepository.saveAndFlush(transaction))
                .thenThrow(new DataIntegrityViolationException("uk_ledger_linked_schedule"));

        assertThatThrownBy(() -> ledgerStore.createTransaction(transaction))
                .isInstanceOf(DuplicatePaymentException.class);
    }

    @Test
    @DisplayName("Deleting an entry publishes the deletion with its schedule link")
    void shouldPublishDeletion() {
        LedgerTransaction transaction = TestDataBuilder.createTransaction("Internet", LocalDate.of(2026, 1, 8),
                TestDataBuilder.INTERNET_AMOUNT);
        UUID scheduleId = UUID.randomUUID();
        transaction.setLinkedScheduleId(scheduleId);
        when(transactionRepository.findById(transaction.getId())).thenReturn(Optional.of(transaction));

        ledgerStore.deleteTransaction(transaction.getId());

        verify(transactionRepository).delete(transaction);
        ArgumentCaptor<LedgerTransactionDeletedEvent> eventCaptor = ArgumentCaptor.forClass(LedgerTransactionDeletedEvent.class);
        verify(applicationEventPublisher).publishEvent(eventCaptor.capture());
        assertThat(eventCaptor.getValue().getTransactionId()).isEqualTo(transaction.getId());
        assertThat(eventCaptor.getValue().getLinkedScheduleId()).isEqualTo(scheduleId);
    }

    @Test
    @DisplayName("Deleting a missing entry does nothing")
    void shouldIgnoreMissingEntry() {
        UUID missing = UUID.randomUUID();
        when(transactionRepository.findById(missing)).thenReturn(Optional.empty());

        ledgerStore.deleteTransaction(missing);

        verify(transactionRepository, never()).delete(any());
        verifyNoInteractions(applicationEventPublisher);
    }

    @Test
    @DisplayName("Period lookup covers the whole calendar month")
    void shouldQueryWholeMonth() {
        ledgerStore.getTransactionsForPeriod(YearMonth.of(2026, 2));

        verify(transactionRepository).findByOccurredOnBetweenOrderByOccurredOnAsc(
                LocalDate.of(2026, 2, 1), LocalDate.of(2026, 2, 28));
    }

    @Test
    @DisplayName("Linking an already linked entry reports false")
    void shouldReportFailedLink() {
        UUID transactionId = UUID.randomUUID();
        UUID scheduleId = UUID.randomUUID();
        when(transactionRepository.linkIfUnlinked(transactionId, scheduleId)).thenReturn(0);

        assertThat(ledgerStore.linkToSchedule(transactionId, scheduleId)).isFalse();
    }

    @Test
    @DisplayName("Account lookup covers the whole calendar month of that account")
    void shouldQueryWholeMonthForAccount() {
        ledgerStore.getTransactionsForPeriodAndAccount(YearMonth.of(2026, 2), TestDataBuilder.CARD_ACCOUNT_ID);

        verify(transactionRepository).findByAccountIdAndOccurredOnBetweenOrderByOccurredOnAsc(
                TestDataBuilder.CARD_ACCOUNT_ID, LocalDate.of(2026, 2, 1), LocalDate.of(2026, 2, 28));
    }

    @Test
    @DisplayName("Unlinking releases the entry only from the given schedule")
    void shouldUnlinkFromGivenSchedule() {
        UUID transactionId = UUID.randomUUID();
        UUID scheduleId = UUID.randomUUID();
        when(transactionRepository.unlinkIfLinkedTo(transactionId, scheduleId)).thenReturn(1);

        ledgerStore.unlinkFromSchedule(transactionId, scheduleId);

        verify(transactionRepository).unlinkIfLinkedTo(transactionId, scheduleId);
        verifyNoInteractions(applicationEventPublisher);
    }
}
