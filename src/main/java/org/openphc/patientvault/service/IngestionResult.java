package org.openphc.patientvault.service;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class IngestionResult {

    int totalRows;
    int processedCount;

    @Singular
    List<RowError> errors;
}
