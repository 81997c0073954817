package com.lotledger.domain.model;

import com.lotledger.domain.enums.EditStatus;
import lombok.Getter;
import lombok.Setter;

/**
 * A proposed edit moving through PROPOSED → ACCEPTED / REJECTED.
 *
 * <p>Terminal states cannot be left: deciding an already decided proposal throws
 * {@link IllegalStateException}.
 */
@Getter
public class EditProposal {

    private final Long recordId;
    private final LedgerTransaction original;
    private final LedgerTransaction proposed;
    private final TransactionEdit edit;
    private EditStatus status;
    private EditViolation violation;

    /** Preview of what committing would change; set whether the edit is accepted or not. */
    @Setter
    private EditImpact impact;

    public EditProposal(Long recordId, LedgerTransaction original, TransactionEdit edit) {
        this.recordId = recordId;
        this.original = original;
        this.edit = edit;
        this.proposed = edit.applyTo(original);
        this.status = EditStatus.PROPOSED;
    }

    public void accept() {
        requireProposed();
        this.status = EditStatus.ACCEPTED;
    }

    public void reject(EditViolation violation) {
        requireProposed();
        this.status = EditStatus.REJECTED;
        this.violation = violation;
    }

    public boolean isAccepted() {
        return status == EditStatus.ACCEPTED;
    }

    public boolean isRejected() {
        return status == EditStatus.REJECTED;
    }

    private void requireProposed() {
        if (status.isTerminal()) {
            throw new IllegalStateException("Edit of transaction " + recordId + " already " + status);
        }
    }
}
