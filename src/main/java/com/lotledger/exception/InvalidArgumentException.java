package com.lotledger.exception;

import java.util.Map;
import lombok.Getter;

/**
 * Malformed quantity, price, date or identifier. Always recoverable by correcting the request.
 */
@Getter
public class InvalidArgumentException extends BaseException {

    private final String field;

    public InvalidArgumentException(String field, String message) {
        super(ErrorCode.INVALID_ARGUMENT, message, Map.of("field", field));
        this.field = field;
    }
}
