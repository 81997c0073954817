package com.lotledger.domain.model;

import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Data;

/** One changed field of one accepted edit. Append-only. */
@Data
@Builder
public class AuditEntry {

    private Long id;
    private Long recordId;
    private LocalDateTime timestamp;
    private String fieldName;
    private String oldValue;
    private String newValue;
}
