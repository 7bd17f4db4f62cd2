package com.nosota.welfare.api.model;

/**
 * Status of a beneficiary's application against a scheme.
 *
 * <p>Terminal states: {@link #COMPLETED}, {@link #REJECTED}, {@link #CANCELLED}.
 */
public enum ApplicationStatus {
    PENDING,
    UNDER_REVIEW,
    INTERVIEW_SCHEDULED,
    PENDING_COMMITTEE_APPROVAL,
    APPROVED,
    REJECTED,
    COMPLETED,
    CANCELLED
}
