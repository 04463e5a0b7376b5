package com.paycycle.obligation.repository;

import com.paycycle.obligation.entity.ObligationType;
import com.paycycle.obligation.entity.PaymentSchedule;
import com.paycycle.obligation.entity.TimingBucket;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for payment schedules.
 *
 * Payment state is only written through the conditional updates below, so that two concurrent
 * writers cannot both succeed against the same schedule.
 */
@Repository
public interface PaymentScheduleRepository extends JpaRepository<PaymentSchedule, UUID> {

    List<PaymentSchedule> findByObligationTypeAndObligationIdOrderByScheduleYearAscScheduleMonthAsc(
            ObligationType obligationType, UUID obligationId);

    Optional<PaymentSchedule> findByObligationIdAndScheduleYearAndScheduleMonth(
            UUID obligationId, Integer scheduleYear, Integer scheduleMonth);

    List<PaymentSchedule> findByScheduleYearAndScheduleMonth(Integer scheduleYear, Integer scheduleMonth);

    List<PaymentSchedule> findByScheduleYearAndScheduleMonthAndTimingBucket(
            Integer scheduleYear, Integer scheduleMonth, TimingBucket timingBucket);

    Optional<PaymentSchedule> findByLinkedTransactionId(UUID linkedTransactionId);

    /**
     * Lowest-numbered installment schedule with no payment recorded
     */
    Optional<PaymentSchedule> findFirstByObligationTypeAndObligationIdAndPaidAmountIsNullAndLinkedTransactionIdIsNullOrderByPaymentNumberAsc(
            ObligationType obligationType, UUID obligationId);

    @Query("SELECT s FROM PaymentSchedule s WHERE s.paidAmount IS NULL AND s.dueDate < :asOf " +
           "ORDER BY s.dueDate ASC")
    List<PaymentSchedule> findUnpaidDueBefore(@Param("asOf") LocalDate asOf);

    @Query("SELECT COALESCE(SUM(s.paidAmount), 0) FROM PaymentSchedule s " +
           "WHERE s.obligationType = :type AND s.obligationId = :obligationId")
    BigDecimal sumPaidAmount(@Param("type") ObligationType type, @Param("obligationId") UUID obligationId);

    /**
     * Records a first payment. Matches only while no ledger entry is linked and no amount is stored.
     *
     * @return 1 when the payment was recorded, 0 when the schedule was already paid, linked or missing
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE PaymentSchedule s SET s.paidAmount = :amount, s.datePaid = :datePaid, " +
           "s.linkedAccountId = :accountId, s.linkedTransactionId = :transactionId, " +
           "s.updatedAt = :now, s.version = s.version + 1 " +
           "WHERE s.id = :scheduleId AND s.linkedTransactionId IS NULL AND s.paidAmount IS NULL")
    int markPaidIfUnlinked(@Param("scheduleId") UUID scheduleId,
                           @Param("amount") BigDecimal amount,
                           @Param("datePaid") LocalDate datePaid,
                           @Param("accountId") String accountId,
                           @Param("transactionId") UUID transactionId,
                           @Param("now") LocalDateTime now);

    /**
     * Clears payment state, but only if the schedule is still linked to the given transaction.
     * Running it twice is a no-op the second time.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE PaymentSchedule s SET s.paidAmount = NULL, s.datePaid = NULL, " +
           "s.linkedAccountId = NULL, s.linkedTransactionId = NULL, " +
           "s.updatedAt = :now, s.version = s.version + 1 " +
           "WHERE s.id = :scheduleId AND s.linkedTransactionId = :transactionId")
    int revertPayment(@Param("scheduleId") UUID scheduleId,
                      @Param("transactionId") UUID transactionId,
                      @Param("now") LocalDateTime now);

    /**
     * Replaces the expected amount of a schedule that carries no payment at all.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE PaymentSchedule s SET s.expectedAmount = :amount, s.updatedAt = :now, s.version = s.version + 1 " +
           "WHERE s.id = :scheduleId AND s.paidAmount IS NULL AND s.linkedTransactionId IS NULL")
    int updateExpectedAmountIfUnpaid(@Param("scheduleId") UUID scheduleId,
                                     @Param("amount") BigDecimal amount,
                                     @Param("now") LocalDateTime now);

    /**
     * Removes schedules from the given period onward that carry no payment at all.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM PaymentSchedule s WHERE s.obligationType = :type AND s.obligationId = :obligationId " +
           "AND s.paidAmount IS NULL AND s.linkedTransactionId IS NULL " +
           "AND (s.scheduleYear * 12 + s.scheduleMonth) >= :fromPeriodKey")
    int deleteUnpaidFrom(@Param("type") ObligationType type,
                         @Param("obligationId") UUID obligationId,
                         @Param("fromPeriodKey") int fromPeriodKey);

    long deleteByObligationTypeAndObligationId(ObligationType obligationType, UUID obligationId);

    static int periodKey(int year, int month) {
        return year * 12 + month;
    }
}
