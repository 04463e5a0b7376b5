package com.paycycle.obligation;

import com.paycycle.obligation.entity.Installment;
import com.paycycle.obligation.entity.PaymentSchedule;
import com.paycycle.obligation.ledger.LedgerStore;
import com.paycycle.obligation.repository.InstallmentRepository;
import com.paycycle.obligation.service.ObligationService;
import com.paycycle.obligation.service.PaymentApplier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.orm.ObjectOptimisticLockingFailureException;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.reset;

/**
 * A payment whose schedule update fails after the ledger write leaves neither side changed.
 */
@DisplayName("Payment Compensation Integration Tests")
class PaymentCompensationIntegrationTest extends BaseIntegrationTest {

    @Autowired
    private ObligationService obligationService;

    @Autowired
    private PaymentApplier paymentApplier;

    @Autowired
    private LedgerStore ledgerStore;

    @SpyBean
    private InstallmentRepository installmentRepository;

    @AfterEach
    void resetSpy() {
        reset(installmentRepository);
    }

    @Test
    @DisplayName("Failed cumulative update rolls back the claim and removes the ledger entry")
    void shouldLeaveNoTraceWhenInstallmentUpdateFails() {
        // Arrange
        Installment laptop = TestDataBuilder.createLaptopInstallment();
        laptop.setId(null);
        UUID laptopId = obligationService.createInstallment(laptop).getId();
        PaymentSchedule first = obligationService.getSchedule(laptopId, YearMonth.of(2026, 1));
        doThrow(new ObjectOptimisticLockingFailureException(Installment.class, laptopId))
                .when(installmentRepository).save(any(Installment.class));

        // Act
        assertThatThrownBy(() -> paymentApplier.applyInstallmentPayment(laptopId, new BigDecimal("5000"),
                LocalDate.of(2026, 1, 5), null, null))
                .isInstanceOf(ObjectOptimisticLockingFailureException.class);

        // Assert
        PaymentSchedule unchanged = obligationService.getSchedule(first.getId());
        assertThat(unchanged.getPaidAmount()).isNull();
        assertThat(unchanged.getLinkedTransactionId()).isNull();
        assertThat(ledgerStore.findByLinkedSchedule(first.getId())).isEmpty();
        assertThat(ledgerStore.getTransactionsForPeriod(YearMonth.of(2026, 1))).isEmpty();

        // The same payment goes through once the update succeeds
        reset(installmentRepository);
        PaymentSchedule paid = paymentApplier.applyInstallmentPayment(laptopId, new BigDecimal("5000"),
                LocalDate.of(2026, 1, 5), null, null);

        assertThat(paid.getId()).isEqualTo(first.getId());
        assertThat(ledgerStore.findByLinkedSchedule(first.getId())).hasSize(1);
        assertThat(installmentRepository.findById(laptopId).orElseThrow().getCumulativePaid())
                .isEqualByComparingTo("5000");
    }
}
