package com.lotledger.api.dto.request;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.lotledger.domain.enums.TransactionType;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for modifying a recorded transaction. Omitted (null) fields stay unchanged.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EditTransactionRequest {

    @JsonFormat(pattern = "yyyy-MM-dd")
    private LocalDate transactionDate;

    @Size(max = 50)
    private String instrumentId;

    private TransactionType transactionType;

    @Positive
    private BigDecimal quantity;

    @Positive
    private BigDecimal unitPrice;

    @PositiveOrZero
    private BigDecimal charges;

    @Size(max = 500)
    private String notes;
}
