package com.paycycle.obligation;

import com.paycycle.obligation.domain.MatchPath;
import com.paycycle.obligation.domain.SyncReport;
import com.paycycle.obligation.entity.*;
import com.paycycle.obligation.exception.DuplicatePaymentException;
import com.paycycle.obligation.exception.OutOfOrderPaymentException;
import com.paycycle.obligation.ledger.LedgerStore;
import com.paycycle.obligation.repository.BillerRepository;
import com.paycycle.obligation.repository.InstallmentRepository;
import com.paycycle.obligation.repository.PaymentScheduleRepository;
import com.paycycle.obligation.service.ObligationService;
import com.paycycle.obligation.service.LinkedAccountSyncService;
import com.paycycle.obligation.service.PaymentApplier;
import com.paycycle.obligation.service.Reconciler;
import com.paycycle.obligation.service.ScheduleGenerator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

/**
 * End-to-end payment lifecycle over the real repositories and ledger store.
 */
@DisplayName("Obligation Lifecycle Integration Tests")
class ObligationLifecycleIntegrationTest extends BaseIntegrationTest {

    @Autowired
    private ObligationService obligationService;

    @Autowired
    private PaymentApplier paymentApplier;

    @Autowired
    private Reconciler reconciler;

    @Autowired
    private ScheduleGenerator scheduleGenerator;

    @Autowired
    private LinkedAccountSyncService linkedAccountSyncService;

    @Autowired
    private LedgerStore ledgerStore;

    @Autowired
    private BillerRepository billerRepository;

    @Autowired
    private InstallmentRepository installmentRepository;

    @Autowired
    private PaymentScheduleRepository scheduleRepository;

    /**
     * Internet biller with January to March 2026 schedules. The creation time is fixed in
     * memory before generation so the first scheduled month does not depend on the clock.
     */
    private Biller internetWithQuarterOfSchedules() {
        Biller biller = TestDataBuilder.createInternetBiller();
        biller.setId(null);
        Biller saved = billerRepository.save(biller);
        saved.setCreatedAt(LocalDateTime.of(2025, 12, 20, 9, 0));
        scheduleRepository.saveAll(scheduleGenerator.generate(saved, 3));
        return saved;
    }

    @Test
    @DisplayName("Paid biller schedule reconciles and later months derive their status from the date")
    void shouldPayAndReconcileBiller() {
        Biller internet = internetWithQuarterOfSchedules();
        PaymentSchedule january = obligationService.getSchedule(internet.getId(), YearMonth.of(2026, 1));

        PaymentSchedule paid = paymentApplier.applyPayment(january.getId(), new BigDecimal("1500"),
                LocalDate.of(2026, 1, 8), "X", null);

        assertThat(paid.getLinkedTransactionId()).isNotNull();
        assertThat(ledgerStore.findByLinkedSchedule(january.getId())).hasSize(1);

        SyncReport report = reconciler.reconcile(internet.getId(), YearMonth.of(2026, 1));
        assertThat(report.isInSync()).isTrue();
        assertThat(report.getMatchPath()).isEqualTo(MatchPath.LINKED);

        LocalDate asOf = LocalDate.of(2026, 2, 15);
        assertThat(obligationService.findSchedules(internet.getId()))
                .extracting(schedule -> schedule.statusAsOf(asOf))
                .containsExactly(PaymentStatus.PAID, PaymentStatus.OVERDUE, PaymentStatus.PENDING);
    }

    @Test
    @DisplayName("Second payment on a paid schedule is rejected and writes no ledger entry")
    void shouldRejectDoublePayment() {
        Biller internet = internetWithQuarterOfSchedules();
        PaymentSchedule january = obligationService.getSchedule(internet.getId(), YearMonth.of(2026, 1));
        paymentApplier.applyPayment(january.getId(), new BigDecimal("1500"), LocalDate.of(2026, 1, 8), "X", null);

        assertThatThrownBy(() -> paymentApplier.applyPayment(january.getId(), new BigDecimal("1500"),
                LocalDate.of(2026, 1, 9), "X", null))
                .isInstanceOf(DuplicatePaymentException.class);

        assertThat(obligationService.getSchedule(january.getId()).getPaidAmount()).isEqualByComparingTo("1500");
        assertThat(ledgerStore.getTransactionsForPeriod(YearMonth.of(2026, 1))).hasSize(1);
    }

    @Test
    @DisplayName("Installment payments accumulate, stay in order and revert when the ledger entry is deleted")
    void shouldTrackInstallmentThroughPaymentsAndRevert() {
        // Arrange
        Installment laptop = TestDataBuilder.createLaptopInstallment();
        laptop.setId(null);
        UUID laptopId = obligationService.createInstallment(laptop).getId();
        assertThat(obligationService.findSchedules(laptopId)).hasSize(12);

        // Act: three payments in order
        PaymentSchedule third = null;
        for (int month = 1; month <= 3; month++) {
            third = paymentApplier.applyInstallmentPayment(laptopId, new BigDecimal("5000"),
                    LocalDate.of(2026, month, 5), null, null);
        }

        // Assert
        assertThat(installmentRepository.findById(laptopId).orElseThrow().getCumulativePaid())
                .isEqualByComparingTo("15000");
        assertThat(paymentApplier.nextPayable(laptopId)).map(PaymentSchedule::getPaymentNumber).contains(4);

        PaymentSchedule sixth = obligationService.getSchedule(laptopId, YearMonth.of(2026, 6));
        assertThatThrownBy(() -> paymentApplier.applyPayment(sixth.getId(), new BigDecimal("5000"),
                LocalDate.of(2026, 4, 5), "X", null))
                .isInstanceOf(OutOfOrderPaymentException.class);

        // Deleting the third ledger entry returns schedule 3 to unpaid
        UUID thirdTransaction = third.getLinkedTransactionId();
        UUID thirdSchedule = third.getId();
        paymentApplier.deleteTransaction(thirdTransaction);

        PaymentSchedule reverted = obligationService.getSchedule(thirdSchedule);
        assertThat(reverted.getPaidAmount()).isNull();
        assertThat(reverted.getLinkedTransactionId()).isNull();
        assertThat(installmentRepository.findById(laptopId).orElseThrow().getCumulativePaid())
                .isEqualByComparingTo("10000");

        // A repeated revert is a no-op
        assertThatCode(() -> paymentApplier.revertForDeletedTransaction(thirdTransaction, thirdSchedule))
                .doesNotThrowAnyException();
        assertThat(paymentApplier.nextPayable(laptopId)).map(PaymentSchedule::getPaymentNumber).contains(3);
    }

    @Test
    @DisplayName("Correction takes the ledger value and links the matching entry")
    void shouldCorrectFromLedger() {
        Biller internet = internetWithQuarterOfSchedules();
        PaymentSchedule february = obligationService.getSchedule(internet.getId(), YearMonth.of(2026, 2));
        ledgerStore.createTransaction(LedgerTransaction.builder()
                .name("Internet - February")
                .occurredOn(LocalDate.of(2026, 2, 9))
                .amount(new BigDecimal("1500"))
                .accountId("X")
                .build());

        SyncReport before = reconciler.reconcileSchedule(february.getId());
        assertThat(before.getRecommendation().name()).isEqualTo("ACCEPT_LEDGER_VALUE");

        PaymentSchedule corrected = paymentApplier.applyCorrection(february.getId(), null);

        assertThat(corrected.getPaidAmount()).isEqualByComparingTo("1500");
        assertThat(corrected.getLinkedTransactionId()).isNotNull();
        assertThat(reconciler.reconcileSchedule(february.getId()).isInSync()).isTrue();
        List<LedgerTransaction> linked = ledgerStore.findByLinkedSchedule(february.getId());
        assertThat(linked).singleElement()
                .extracting(LedgerTransaction::getId)
                .isEqualTo(corrected.getLinkedTransactionId());
    }

    @Test
    @DisplayName("Credit card schedules take the purchases of the statement cycle they settle")
    void shouldSyncCreditCardFromLinkedAccount() {
        // Arrange: statement day 10, schedules January to March 2026
        Biller card = TestDataBuilder.createCreditCardBiller();
        card.setId(null);
        Biller saved = billerRepository.save(card);
        saved.setCreatedAt(LocalDateTime.of(2025, 12, 20, 9, 0));
        scheduleRepository.saveAll(scheduleGenerator.generate(saved, 3));

        recordCardPurchase("Groceries", LocalDate.of(2026, 1, 5), "400");
        recordCardPurchase("Dining", LocalDate.of(2026, 1, 12), "2000");
        recordCardPurchase("Fuel", LocalDate.of(2026, 2, 3), "1000");
        recordCardPurchase("Books", LocalDate.of(2026, 2, 12), "900");

        // Act
        List<PaymentSchedule> synced = linkedAccountSyncService.syncFromLinkedAccount(saved.getId(),
                LocalDate.of(2026, 2, 15));

        // Assert
        assertThat(synced).extracting(PaymentSchedule::getPeriod)
                .containsExactly(YearMonth.of(2026, 2), YearMonth.of(2026, 3));
        assertThat(obligationService.getSchedule(saved.getId(), YearMonth.of(2026, 1)).getExpectedAmount())
                .isEqualByComparingTo("0");
        assertThat(obligationService.getSchedule(saved.getId(), YearMonth.of(2026, 2)).getExpectedAmount())
                .isEqualByComparingTo("400");
        assertThat(obligationService.getSchedule(saved.getId(), YearMonth.of(2026, 3)).getExpectedAmount())
                .isEqualByComparingTo("3000");

        // The payment goes to the card account
        PaymentSchedule february = obligationService.getSchedule(saved.getId(), YearMonth.of(2026, 2));
        PaymentSchedule paid = paymentApplier.applyPayment(february.getId(), new BigDecimal("400"),
                LocalDate.of(2026, 2, 20), null, null);
        assertThat(paid.getLinkedAccountId()).isEqualTo(TestDataBuilder.CARD_ACCOUNT_ID);
    }

    private void recordCardPurchase(String name, LocalDate date, String amount) {
        ledgerStore.createTransaction(LedgerTransaction.builder()
                .name(name)
                .occurredOn(date)
                .amount(new BigDecimal(amount))
                .accountId(TestDataBuilder.CARD_ACCOUNT_ID)
                .build());
    }
}
