package com.lotledger.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.lotledger.domain.model.EditViolation;
import com.lotledger.exception.BaseException;
import com.lotledger.exception.EditRejectedException;
import com.lotledger.exception.ErrorCode;
import com.lotledger.exception.InsufficientInventoryException;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/**
 * Error body of every failed ledger request: {@code {success: false, error: {...}}}.
 *
 * <p>Besides the code and message, ledger failures carry what the caller needs to correct the
 * request: an {@link InventoryShortfall} when a disposal asked for more than the lots hold, and
 * the {@link EditViolation} (rule and bound) when an edit or deletion was refused.
 * {@code retryable} is only set for storage failures, where nothing was written.
 */
@Getter
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiErrorResponse {

    private final boolean success = false;
    private final ErrorDetail error;

    private ApiErrorResponse(ErrorDetail error) {
        this.error = error;
    }

    /** Request-level failures raised before any ledger code ran (binding, parsing, routing). */
    public static ApiErrorResponse of(ErrorCode errorCode, String message, Map<String, Object> details, String path) {
        return new ApiErrorResponse(baseDetail(errorCode, message, details, path).build());
    }

    public static ApiErrorResponse of(BaseException ex, String path) {
        ErrorDetail.ErrorDetailBuilder detail =
                baseDetail(ex.getErrorCode(), ex.getMessage(), ex.getDetails(), path)
                        .retryable(ex.getErrorCode() == ErrorCode.PERSISTENCE_FAILURE ? Boolean.TRUE : null);
        if (ex instanceof InsufficientInventoryException) {
            detail.shortfall(InventoryShortfall.of((InsufficientInventoryException) ex));
        } else if (ex instanceof EditRejectedException) {
            detail.violation(((EditRejectedException) ex).getViolation());
        }
        return new ApiErrorResponse(detail.build());
    }

    private static ErrorDetail.ErrorDetailBuilder baseDetail(
            ErrorCode errorCode, String message, Map<String, Object> details, String path) {
        return ErrorDetail.builder()
                .code(errorCode.getCode())
                .status(errorCode.getHttpStatus())
                .message(message)
                .details(details == null || details.isEmpty() ? null : details)
                .timestamp(Instant.now())
                .path(path);
    }

    @Getter
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ErrorDetail {
        private final String code;
        private final int status;
        private final String message;
        private final Map<String, Object> details;
        private final InventoryShortfall shortfall;
        private final EditViolation violation;
        private final Boolean retryable;
        private final Instant timestamp;
        private final String path;
    }

    /** How far a disposal exceeded the lots held at its date. */
    @Getter
    @Builder
    public static class InventoryShortfall {
        private final String instrumentId;
        private final BigDecimal requested;
        private final BigDecimal available;
        private final BigDecimal shortfall;

        static InventoryShortfall of(InsufficientInventoryException ex) {
            return InventoryShortfall.builder()
                    .instrumentId(ex.getInstrumentId())
                    .requested(ex.getRequested())
                    .available(ex.getAvailable())
                    .shortfall(ex.getShortfall())
                    .build();
        }
    }
}
