package com.lotledger.domain.model;

import java.time.LocalDateTime;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/** Condensed view of a record's audit history. */
@Data
@Builder
public class EditSummary {

    private Long recordId;
    private boolean edited;

    /** Number of distinct edits (entries sharing a timestamp belong to one edit). */
    private int editCount;

    private LocalDateTime lastModified;
    private List<String> fieldsChanged;
    private int totalChanges;
}
