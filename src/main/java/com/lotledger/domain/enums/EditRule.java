package com.lotledger.domain.enums;

/**
 * Rules that guard already-recorded FIFO matches against retroactive edits.
 *
 * <p>The first six are evaluated by the edit validator in declaration order (first failure wins).
 * The remaining ones are raised while committing or deleting.
 */
public enum EditRule {
    /** Acquisition quantity reduced below the quantity already consumed from it. */
    QUANTITY_BELOW_MATCHED("quantity"),

    /** Acquisition moved after a disposal that already consumed it. */
    ACQUISITION_DATE_AFTER_DISPOSAL("transactionDate"),

    /** Disposal moved before an acquisition it already consumed. */
    DISPOSAL_DATE_BEFORE_ACQUISITION("transactionDate"),

    /** Acquisition turned into a disposal without enough prior inventory. */
    INSUFFICIENT_INVENTORY_FOR_TYPE_CHANGE("transactionType"),

    /** Matched disposal turned into an acquisition. */
    MATCHED_DISPOSAL_TYPE_CHANGE("transactionType"),

    /** Matched disposal moved to another instrument. */
    MATCHED_DISPOSAL_INSTRUMENT_CHANGE("instrumentId"),

    /** Re-matching the instrument after the edit ran out of inventory for some disposal. */
    REDERIVATION_INSUFFICIENT_INVENTORY("quantity"),

    /** Disposals are never deleted. */
    DISPOSAL_DELETE("id"),

    /** Acquisitions with consumed quantity are never deleted. */
    CONSUMED_ACQUISITION_DELETE("id");

    private final String field;

    EditRule(String field) {
        this.field = field;
    }

    /** Name of the transaction field the rule is about. */
    public String getField() {
        return field;
    }
}
