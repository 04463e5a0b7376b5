package com.paycycle.obligation.service;

import com.paycycle.obligation.TestDataBuilder;
import com.paycycle.obligation.domain.BudgetPeriod;
import com.paycycle.obligation.domain.MonthlyAverage;
import com.paycycle.obligation.domain.PayoffPoint;
import com.paycycle.obligation.domain.PeriodProjection;
import com.paycycle.obligation.entity.BudgetSnapshot;
import com.paycycle.obligation.entity.Installment;
import com.paycycle.obligation.entity.ObligationType;
import com.paycycle.obligation.entity.TimingBucket;
import com.paycycle.obligation.repository.PaymentScheduleRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("ProjectionEngine Unit Tests")
class ProjectionEngineTest {

    private static final BudgetPeriod JAN_FIRST = BudgetPeriod.of(2026, 1, TimingBucket.FIRST_HALF);
    private static final BudgetPeriod JAN_SECOND = BudgetPeriod.of(2026, 1, TimingBucket.SECOND_HALF);

    @Mock
    private BudgetSnapshotService budgetSnapshotService;

    @Mock
    private ObligationService obligationService;

    @Mock
    private PaymentScheduleRepository scheduleRepository;

    @InjectMocks
    private ProjectionEngine projectionEngine;

    @BeforeEach
    void setUp() {
        ReflectionTestUtils.setField(projectionEngine, "payoffMaxPeriods", 24);
    }

    private BudgetSnapshot snapshot(BudgetPeriod period, String projectedSalary) {
        BudgetSnapshot snapshot = BudgetSnapshot.builder()
                .items(new ArrayList<>(List.of(
                        TestDataBuilder.createLineItem("Housing", "Rent", "6500", true),
                        TestDataBuilder.createLineItem("Utilities", "Internet", "1500", true),
                        TestDataBuilder.createLineItem("Leisure", "Concert", "2000", false))))
                .projectedSalary(new BigDecimal(projectedSalary))
                .build();
        snapshot.setPeriod(period);
        snapshot.recomputeTotal();
        return snapshot;
    }

    private MonthlyAverage average(int month, String value) {
        return MonthlyAverage.builder()
                .month(YearMonth.of(2026, month))
                .periodCount(2)
                .averageRemaining(new BigDecimal(value))
                .build();
    }

    @Nested
    @DisplayName("Period Projection Tests")
    class PeriodProjectionTests {

        @Test
        @DisplayName("Remaining is income minus included items")
        void shouldProjectRemaining() {
            when(budgetSnapshotService.getSnapshot(JAN_FIRST)).thenReturn(Optional.of(snapshot(JAN_FIRST, "11000")));

            PeriodProjection projection = projectionEngine.projectPeriod(JAN_FIRST);

            assertThat(projection.getIncome()).isEqualByComparingTo("11000");
            assertThat(projection.getTotalObligated()).isEqualByComparingTo("8000");
            assertThat(projection.getRemaining()).isEqualByComparingTo("3000");
        }

        @Test
        @DisplayName("Actual salary takes over from projected salary")
        void shouldUseActualSalary() {
            BudgetSnapshot snapshot = snapshot(JAN_FIRST, "11000");
            snapshot.setActualSalary(new BigDecimal("9500"));
            when(budgetSnapshotService.getSnapshot(JAN_FIRST)).thenReturn(Optional.of(snapshot));

            assertThat(projectionEngine.projectPeriod(JAN_FIRST).getRemaining()).isEqualByComparingTo("1500");
        }

        @Test
        @DisplayName("Period without a snapshot projects zeros")
        void shouldProjectZerosWithoutSnapshot() {
            when(budgetSnapshotService.getSnapshot(JAN_SECOND)).thenReturn(Optional.empty());

            PeriodProjection projection = projectionEngine.projectPeriod(JAN_SECOND);

            assertThat(projection.getIncome()).isEqualByComparingTo("0");
            assertThat(projection.getRemaining()).isEqualByComparingTo("0");
        }

        @Test
        @DisplayName("Range is inclusive and covers both halves of each month")
        void shouldProjectInclusiveRange() {
            when(budgetSnapshotService.getSnapshot(any(BudgetPeriod.class))).thenReturn(Optional.empty());

            List<PeriodProjection> projections = projectionEngine.project(JAN_FIRST,
                    BudgetPeriod.of(2026, 2, TimingBucket.FIRST_HALF));

            assertThat(projections).extracting(PeriodProjection::getPeriod)
                    .containsExactly(JAN_FIRST, JAN_SECOND, BudgetPeriod.of(2026, 2, TimingBucket.FIRST_HALF));
        }

        @Test
        @DisplayName("Single-period range yields one projection")
        void shouldProjectSinglePeriod() {
            when(budgetSnapshotService.getSnapshot(JAN_FIRST)).thenReturn(Optional.empty());

            assertThat(projectionEngine.project(JAN_FIRST, JAN_FIRST)).hasSize(1);
        }

        @Test
        @DisplayName("Reversed range yields nothing")
        void shouldReturnEmptyForReversedRange() {
            assertThat(projectionEngine.project(JAN_SECOND, JAN_FIRST)).isEmpty();
            verifyNoInteractions(budgetSnapshotService);
        }
    }

    @Nested
    @DisplayName("Monthly Average Tests")
    class MonthlyAverageTests {

        @Test
        @DisplayName("Averages the halves present for each month")
        void shouldAverageHalves() {
            List<PeriodProjection> projections = List.of(
                    PeriodProjection.builder().period(JAN_FIRST).remaining(new BigDecimal("3000")).build(),
                    PeriodProjection.builder().period(JAN_SECOND).remaining(new BigDecimal("1500")).build(),
                    PeriodProjection.builder().period(BudgetPeriod.of(2026, 2, TimingBucket.SECOND_HALF))
                            .remaining(new BigDecimal("-500")).build());

            List<MonthlyAverage> averages = projectionEngine.monthlyAverage(projections);

            assertThat(averages).hasSize(2);
            assertThat(averages.get(0).getMonth()).isEqualTo(YearMonth.of(2026, 1));
            assertThat(averages.get(0).getAverageRemaining()).isEqualByComparingTo("2250");
            assertThat(averages.get(1).getPeriodCount()).isEqualTo(1);
            assertThat(averages.get(1).getAverageRemaining()).isEqualByComparingTo("-500");
        }

        @Test
        @DisplayName("Best and worst month prefer the earliest month on a tie")
        void shouldBreakTiesByEarliestMonth() {
            List<MonthlyAverage> averages = List.of(
                    average(3, "2000"), average(1, "2000"), average(2, "500"), average(4, "500"));

            assertThat(projectionEngine.bestMonth(averages)).map(MonthlyAverage::getMonth)
                    .contains(YearMonth.of(2026, 1));
            assertThat(projectionEngine.worstMonth(averages)).map(MonthlyAverage::getMonth)
                    .contains(YearMonth.of(2026, 2));
        }

        @Test
        @DisplayName("No averages means no best or worst month")
        void shouldHandleEmptyAverages() {
            assertThat(projectionEngine.bestMonth(List.of())).isEmpty();
            assertThat(projectionEngine.worstMonth(List.of())).isEmpty();
        }
    }

    @Nested
    @DisplayName("Payoff Projection Tests")
    class PayoffTests {

        @Test
        @DisplayName("Projects from the next unpaid schedule until the balance is cleared")
        void shouldProjectPayoff() {
            Installment laptop = TestDataBuilder.createLaptopInstallment();
            laptop.setCumulativePaid(new BigDecimal("15000"));
            when(obligationService.getInstallment(laptop.getId())).thenReturn(laptop);
            when(scheduleRepository
                    .findFirstByObligationTypeAndObligationIdAndPaidAmountIsNullAndLinkedTransactionIdIsNullOrderByPaymentNumberAsc(
                            ObligationType.INSTALLMENT, laptop.getId()))
                    .thenReturn(Optional.of(TestDataBuilder.createInstallmentSchedule(laptop, 4)));

            List<PayoffPoint> points = projectionEngine.projectPayoff(laptop.getId(), LocalDate.of(2026, 3, 20));

            assertThat(points).hasSize(9);
            assertThat(points.get(0).getPeriod()).isEqualTo(YearMonth.of(2026, 4));
            assertThat(points.get(0).getRemainingBalance()).isEqualByComparingTo("40000");
            assertThat(points.get(0).getPercentComplete()).isEqualByComparingTo("33.33");
            assertThat(points.get(8).getPeriod()).isEqualTo(YearMonth.of(2026, 12));
            assertThat(points.get(8).getPercentComplete()).isEqualByComparingTo("100");
        }

        @Test
        @DisplayName("Last payment is capped at the remaining balance")
        void shouldCapLastPayment() {
            Installment phone = Installment.builder()
                    .id(UUID.randomUUID())
                    .name("Phone")
                    .totalAmount(new BigDecimal("1000"))
                    .periodAmount(new BigDecimal("400"))
                    .termPeriods(3)
                    .startDate(LocalDate.of(2026, 1, 5))
                    .build();
            when(obligationService.getInstallment(phone.getId())).thenReturn(phone);
            when(scheduleRepository
                    .findFirstByObligationTypeAndObligationIdAndPaidAmountIsNullAndLinkedTransactionIdIsNullOrderByPaymentNumberAsc(
                            ObligationType.INSTALLMENT, phone.getId()))
                    .thenReturn(Optional.empty());

            List<PayoffPoint> points = projectionEngine.projectPayoff(phone.getId(), LocalDate.of(2026, 5, 1));

            assertThat(points).extracting(PayoffPoint::getPayment)
                    .usingElementComparator(BigDecimal::compareTo)
                    .containsExactly(new BigDecimal("400"), new BigDecimal("400"), new BigDecimal("200"));
            assertThat(points.get(0).getPeriod()).isEqualTo(YearMonth.of(2026, 5));
        }

        @Test
        @DisplayName("Stops at the configured number of periods")
        void shouldStopAtConfiguredMaximum() {
            ReflectionTestUtils.setField(projectionEngine, "payoffMaxPeriods", 3);
            Installment laptop = TestDataBuilder.createLaptopInstallment();
            when(obligationService.getInstallment(laptop.getId())).thenReturn(laptop);
            when(scheduleRepository
                    .findFirstByObligationTypeAndObligationIdAndPaidAmountIsNullAndLinkedTransactionIdIsNullOrderByPaymentNumberAsc(
                            ObligationType.INSTALLMENT, laptop.getId()))
                    .thenReturn(Optional.of(TestDataBuilder.createInstallmentSchedule(laptop, 1)));

            List<PayoffPoint> points = projectionEngine.projectPayoff(laptop.getId(), LocalDate.of(2026, 1, 1));

            assertThat(points).hasSize(3);
            assertThat(points.get(2).getRemainingBalance()).isEqualByComparingTo("45000");
            verify(obligationService).getInstallment(laptop.getId());
        }
    }
}
