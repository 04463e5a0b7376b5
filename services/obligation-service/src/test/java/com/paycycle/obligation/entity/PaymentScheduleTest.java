package com.paycycle.obligation.entity;

import com.paycycle.obligation.TestDataBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("PaymentSchedule Tests")
class PaymentScheduleTest {

    private PaymentSchedule schedule;

    @BeforeEach
    void setUp() {
        schedule = TestDataBuilder.createBillerSchedule(TestDataBuilder.createInternetBiller(), TestDataBuilder.JANUARY_2026);
    }

    @Nested
    @DisplayName("Status Derivation Tests")
    class StatusDerivationTests {

        @Test
        @DisplayName("Unpaid schedule is pending up to and including its due date")
        void shouldBePendingUntilDueDate() {
            assertThat(schedule.statusAsOf(LocalDate.of(2026, 1, 1))).isEqualTo(PaymentStatus.PENDING);
            assertThat(schedule.statusAsOf(LocalDate.of(2026, 1, 10))).isEqualTo(PaymentStatus.PENDING);
        }

        @Test
        @DisplayName("Unpaid schedule is overdue once its due date has passed")
        void shouldBeOverdueAfterDueDate() {
            assertThat(schedule.statusAsOf(LocalDate.of(2026, 1, 11))).isEqualTo(PaymentStatus.OVERDUE);
        }

        @Test
        @DisplayName("Paid amount below expected is partial, at or above expected is paid")
        void shouldDerivePartialAndPaid() {
            schedule.setPaidAmount(new BigDecimal("1000"));
            assertThat(schedule.statusAsOf(LocalDate.of(2026, 3, 1))).isEqualTo(PaymentStatus.PARTIAL);

            schedule.setPaidAmount(new BigDecimal("1500.00"));
            assertThat(schedule.statusAsOf(LocalDate.of(2026, 3, 1))).isEqualTo(PaymentStatus.PAID);

            schedule.setPaidAmount(new BigDecimal("1600"));
            assertThat(schedule.statusAsOf(LocalDate.of(2026, 3, 1))).isEqualTo(PaymentStatus.PAID);
        }

        @Test
        @DisplayName("A zero paid amount counts as unpaid")
        void shouldTreatZeroAsUnpaid() {
            schedule.setPaidAmount(BigDecimal.ZERO);

            assertThat(schedule.hasPaymentRecorded()).isFalse();
            assertThat(schedule.statusAsOf(LocalDate.of(2026, 2, 1))).isEqualTo(PaymentStatus.OVERDUE);
        }
    }

    @Test
    @DisplayName("Clearing a payment removes every payment field")
    void shouldClearPayment() {
        UUID transactionId = UUID.randomUUID();
        schedule.recordPayment(new BigDecimal("1500"), LocalDate.of(2026, 1, 8), "X", transactionId);
        assertThat(schedule.isLinked()).isTrue();
        assertThat(schedule.getOutstandingAmount()).isEqualByComparingTo("0");

        schedule.clearPayment();

        assertThat(schedule.getPaidAmount()).isNull();
        assertThat(schedule.getDatePaid()).isNull();
        assertThat(schedule.getLinkedAccountId()).isNull();
        assertThat(schedule.getLinkedTransactionId()).isNull();
        assertThat(schedule.getOutstandingAmount()).isEqualByComparingTo("1500");
    }

    @Test
    @DisplayName("Month name is spelled out")
    void shouldExposeMonthName() {
        assertThat(schedule.getMonthName()).isEqualTo("January");
    }
}
