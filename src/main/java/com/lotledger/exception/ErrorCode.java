package com.lotledger.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    BAD_REQUEST("BAD_REQUEST", 400),
    INVALID_ARGUMENT("INVALID_ARGUMENT", 400),
    NOT_FOUND("NOT_FOUND", 404),
    EDIT_REJECTED("EDIT_REJECTED", 409),
    INSUFFICIENT_INVENTORY("INSUFFICIENT_INVENTORY", 422),
    INTERNAL_ERROR("INTERNAL_ERROR", 500),
    PERSISTENCE_FAILURE("PERSISTENCE_FAILURE", 500);

    private final String code;
    private final int httpStatus;
}
