package com.nosota.welfare.api.model;

/**
 * Workflow step that approved an application.
 */
public enum ApprovalSource {
    /**
     * Interview marked as passed.
     */
    INTERVIEW,

    /**
     * Committee approval.
     */
    COMMITTEE
}
