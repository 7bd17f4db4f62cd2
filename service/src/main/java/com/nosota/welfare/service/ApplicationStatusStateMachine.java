package com.nosota.welfare.service;

import com.nosota.welfare.api.model.ApplicationStatus;
import com.nosota.welfare.error.InvalidStateException;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static com.nosota.welfare.api.model.ApplicationStatus.*;

/**
 * State machine for validating ApplicationStatus transitions.
 *
 * <pre>
 * PENDING → UNDER_REVIEW ─┬→ INTERVIEW_SCHEDULED ────────┬→ APPROVED → COMPLETED
 *                         └→ PENDING_COMMITTEE_APPROVAL ─┴→ REJECTED
 * </pre>
 *
 * <p>Any non-terminal application may be CANCELLED. COMPLETED, REJECTED and
 * CANCELLED are terminal.
 */
@Component
public class ApplicationStatusStateMachine {

    private static final Map<ApplicationStatus, Set<ApplicationStatus>> ALLOWED_TRANSITIONS = Map.of(
            PENDING, EnumSet.of(UNDER_REVIEW, CANCELLED),
            UNDER_REVIEW, EnumSet.of(INTERVIEW_SCHEDULED, PENDING_COMMITTEE_APPROVAL, CANCELLED),
            INTERVIEW_SCHEDULED, EnumSet.of(APPROVED, REJECTED, CANCELLED),
            PENDING_COMMITTEE_APPROVAL, EnumSet.of(APPROVED, REJECTED, CANCELLED),
            APPROVED, EnumSet.of(COMPLETED, CANCELLED)
    );

    public boolean isTransitionAllowed(ApplicationStatus fromStatus, ApplicationStatus toStatus) {
        if (fromStatus == null || toStatus == null) {
            return false;
        }
        return ALLOWED_TRANSITIONS.getOrDefault(fromStatus, Set.of()).contains(toStatus);
    }

    /**
     * @throws InvalidStateException if the transition is not allowed
     */
    public void validateTransition(ApplicationStatus fromStatus, ApplicationStatus toStatus) {
        if (!isTransitionAllowed(fromStatus, toStatus)) {
            throw new InvalidStateException(
                    String.format("Invalid application status transition: %s → %s", fromStatus, toStatus));
        }
    }

    public boolean isTerminal(ApplicationStatus status) {
        return status == COMPLETED || status == REJECTED || status == CANCELLED;
    }
}
