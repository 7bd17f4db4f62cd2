package com.nosota.welfare.service;

import com.nosota.welfare.api.model.RecurringPaymentStatus;
import com.nosota.welfare.error.InvalidStateException;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static com.nosota.welfare.api.model.RecurringPaymentStatus.*;

/**
 * State machine for validating RecurringPaymentStatus transitions.
 *
 * <p>State diagram:
 * <pre>
 * SCHEDULED → DUE → OVERDUE ──────────┐
 *     │        │       │              │
 *     └────────┴───────┴→ PROCESSING ─┴→ COMPLETED | FAILED
 *
 * SKIPPED, CANCELLED reachable from SCHEDULED, DUE, OVERDUE
 * </pre>
 *
 * <p>COMPLETED, FAILED, SKIPPED and CANCELLED are final. The only backward moves are
 * explicit reschedules of a DUE or OVERDUE installment ({@link #allowsReschedule}).
 */
@Component
public class RecurringPaymentStatusStateMachine {

    private static final Set<RecurringPaymentStatus> FINAL_STATES =
            EnumSet.of(COMPLETED, FAILED, SKIPPED, CANCELLED);

    private static final Map<RecurringPaymentStatus, Set<RecurringPaymentStatus>> ALLOWED_TRANSITIONS = Map.of(
            SCHEDULED, EnumSet.of(DUE, OVERDUE, PROCESSING, COMPLETED, FAILED, SKIPPED, CANCELLED),
            DUE, EnumSet.of(OVERDUE, PROCESSING, COMPLETED, FAILED, SKIPPED, CANCELLED),
            OVERDUE, EnumSet.of(PROCESSING, COMPLETED, FAILED, SKIPPED, CANCELLED),
            PROCESSING, EnumSet.of(COMPLETED, FAILED)
    );

    private static final Map<RecurringPaymentStatus, Set<RecurringPaymentStatus>> RESCHEDULE_TRANSITIONS = Map.of(
            DUE, EnumSet.of(SCHEDULED),
            OVERDUE, EnumSet.of(SCHEDULED, DUE)
    );

    /**
     * Validates if a forward status transition is allowed. Staying in the same status
     * is not a transition.
     */
    public boolean isTransitionAllowed(RecurringPaymentStatus fromStatus, RecurringPaymentStatus toStatus) {
        if (fromStatus == null || toStatus == null) {
            return false;
        }
        return ALLOWED_TRANSITIONS.getOrDefault(fromStatus, Set.of()).contains(toStatus);
    }

    /**
     * @throws InvalidStateException if the transition is not allowed
     */
    public void validateTransition(RecurringPaymentStatus fromStatus, RecurringPaymentStatus toStatus) {
        if (!isTransitionAllowed(fromStatus, toStatus)) {
            throw new InvalidStateException(
                    String.format("Invalid recurring payment status transition: %s → %s", fromStatus, toStatus));
        }
    }

    /**
     * Whether moving the due date of a pending installment may return it to an earlier status.
     */
    public boolean allowsReschedule(RecurringPaymentStatus fromStatus, RecurringPaymentStatus toStatus) {
        if (fromStatus == null || toStatus == null) {
            return false;
        }
        return RESCHEDULE_TRANSITIONS.getOrDefault(fromStatus, Set.of()).contains(toStatus);
    }

    public boolean isFinalState(RecurringPaymentStatus status) {
        return FINAL_STATES.contains(status);
    }

    public Set<RecurringPaymentStatus> getAllowedTransitions(RecurringPaymentStatus fromStatus) {
        return ALLOWED_TRANSITIONS.getOrDefault(fromStatus, Set.of());
    }
}
