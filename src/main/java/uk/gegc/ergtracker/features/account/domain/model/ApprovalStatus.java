package uk.gegc.ergtracker.features.account.domain.model;

/**
 * Lifecycle shared by accounts and society change requests.
 * PENDING may move to APPROVED or REJECTED; both are terminal.
 */
public enum ApprovalStatus {
    PENDING,
    APPROVED,
    REJECTED
}
