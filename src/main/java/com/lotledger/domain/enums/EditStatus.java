package com.lotledger.domain.enums;

/**
 * Lifecycle status of a proposed transaction edit.
 * Transitions: PROPOSED → ACCEPTED or PROPOSED → REJECTED. Both outcomes are terminal.
 */
public enum EditStatus {
    PROPOSED,
    ACCEPTED,
    REJECTED;

    public boolean isTerminal() {
        return this != PROPOSED;
    }
}
