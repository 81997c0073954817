package com.lotledger.exception;

/**
 * The backing store failed while an atomic ledger operation was running. The transaction has
 * been rolled back; the original cause is attached unchanged so the caller can decide on retry.
 */
public class PersistenceFailureException extends BaseException {

    public PersistenceFailureException(String operation, Throwable cause) {
        super(ErrorCode.PERSISTENCE_FAILURE, "Persistence failure during " + operation + ": " + cause.getMessage(), cause);
    }
}
