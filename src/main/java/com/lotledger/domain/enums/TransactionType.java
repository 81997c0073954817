package com.lotledger.domain.enums;

/** Acquisition (BUY) or disposal (SELL) of an instrument. */
public enum TransactionType {
    BUY,
    SELL;

    /** Returns the opposite type: BUY -> SELL, SELL -> BUY. */
    public TransactionType opposite() {
        return this == BUY ? SELL : BUY;
    }
}
