package com.lotledger.exception;

import java.math.BigDecimal;
import java.util.Map;
import lombok.Getter;

/**
 * A disposal asks for more units than the available lots hold. Carries the shortfall so the
 * caller can reduce the quantity or record the missing acquisitions first.
 */
@Getter
public class InsufficientInventoryException extends BaseException {

    private final String instrumentId;
    private final BigDecimal requested;
    private final BigDecimal available;
    private final BigDecimal shortfall;

    public InsufficientInventoryException(String instrumentId, BigDecimal requested, BigDecimal available) {
        super(
                ErrorCode.INSUFFICIENT_INVENTORY,
                String.format(
                        "Insufficient quantity for %s: requested %s, available %s, short by %s",
                        instrumentId,
                        requested.toPlainString(),
                        available.toPlainString(),
                        requested.subtract(available).toPlainString()),
                Map.of(
                        "instrumentId", instrumentId != null ? instrumentId : "",
                        "requested", requested,
                        "available", available,
                        "shortfall", requested.subtract(available)));
        this.instrumentId = instrumentId;
        this.requested = requested;
        this.available = available;
        this.shortfall = requested.subtract(available);
    }
}
