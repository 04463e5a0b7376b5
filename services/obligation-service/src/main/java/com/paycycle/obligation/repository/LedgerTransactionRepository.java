package com.paycycle.obligation.repository;

import com.paycycle.obligation.entity.LedgerTransaction;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Repository
public interface LedgerTransactionRepository extends JpaRepository<LedgerTransaction, UUID> {

    List<LedgerTransaction> findByOccurredOnBetweenOrderByOccurredOnAsc(LocalDate from, LocalDate to);

    List<LedgerTransaction> findByAccountIdAndOccurredOnBetweenOrderByOccurredOnAsc(
            String accountId, LocalDate from, LocalDate to);

    List<LedgerTransaction> findByLinkedScheduleId(UUID linkedScheduleId);

    List<LedgerTransaction> findByOrphanedTrueOrderByCreatedAtAsc();

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE LedgerTransaction t SET t.orphaned = true, t.orphanReason = :reason, t.version = t.version + 1 " +
           "WHERE t.id = :id")
    int markOrphaned(@Param("id") UUID id, @Param("reason") String reason);

    /**
     * Links an entry to a schedule while it is still unlinked.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE LedgerTransaction t SET t.linkedScheduleId = :scheduleId, t.version = t.version + 1 " +
           "WHERE t.id = :id AND t.linkedScheduleId IS NULL")
    int linkIfUnlinked(@Param("id") UUID id, @Param("scheduleId") UUID scheduleId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE LedgerTransaction t SET t.linkedScheduleId = NULL, t.version = t.version + 1 " +
           "WHERE t.id = :id AND t.linkedScheduleId = :scheduleId")
    int unlinkIfLinkedTo(@Param("id") UUID id, @Param("scheduleId") UUID scheduleId);
}
