package com.nosota.welfare.repository;

import com.nosota.welfare.api.model.RecurringPaymentStatus;
import com.nosota.welfare.model.RecurringPayment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface RecurringPaymentRepository extends JpaRepository<RecurringPayment, UUID>,
        JpaSpecificationExecutor<RecurringPayment> {

    List<RecurringPayment> findByApplicationIdOrderByPaymentNumberAsc(UUID applicationId);

    List<RecurringPayment> findByApplicationIdAndStatusIn(UUID applicationId,
                                                          Collection<RecurringPaymentStatus> statuses);

    boolean existsByApplicationIdAndStatusIn(UUID applicationId,
                                             Collection<RecurringPaymentStatus> statuses);

    long countByApplicationIdAndStatus(UUID applicationId, RecurringPaymentStatus status);

    Optional<RecurringPayment> findFirstByApplicationIdAndStatusInOrderByScheduledDateAsc(
            UUID applicationId, Collection<RecurringPaymentStatus> statuses);

    /**
     * Promotes SCHEDULED and DUE installments whose due date has passed to OVERDUE.
     * <p>
     * The status guard in the WHERE clause makes the update idempotent: a second run
     * finds nothing left to promote and never touches final states.
     * </p>
     *
     * @param today Current date; installments due strictly before it are overdue
     * @param now   Update timestamp
     * @return Number of promoted installments
     */
    @Modifying(clearAutomatically = true)
    @Query("UPDATE RecurringPayment p " +
           "SET p.status = com.nosota.welfare.api.model.RecurringPaymentStatus.OVERDUE, " +
           "p.updatedAt = :now, p.version = p.version + 1 " +
           "WHERE p.status IN (com.nosota.welfare.api.model.RecurringPaymentStatus.SCHEDULED, " +
           "com.nosota.welfare.api.model.RecurringPaymentStatus.DUE) " +
           "AND p.dueDate < :today")
    int markOverdue(@Param("today") LocalDate today, @Param("now") LocalDateTime now);

    /**
     * Promotes SCHEDULED installments due within {@code [today, windowEnd]} to DUE.
     *
     * @param today     Current date
     * @param windowEnd Last day of the due window
     * @param now       Update timestamp
     * @return Number of promoted installments
     */
    @Modifying(clearAutomatically = true)
    @Query("UPDATE RecurringPayment p " +
           "SET p.status = com.nosota.welfare.api.model.RecurringPaymentStatus.DUE, " +
           "p.updatedAt = :now, p.version = p.version + 1 " +
           "WHERE p.status = com.nosota.welfare.api.model.RecurringPaymentStatus.SCHEDULED " +
           "AND p.dueDate >= :today " +
           "AND p.dueDate <= :windowEnd")
    int markDue(@Param("today") LocalDate today,
                @Param("windowEnd") LocalDate windowEnd,
                @Param("now") LocalDateTime now);
}
