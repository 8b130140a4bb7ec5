package com.di.flightwarehouse.fact;

import lombok.Builder;
import lombok.Value;

/**
 * Append-only audit entry for a row that failed referential validation.
 * There is no dedup key: reprocessing a file logs its rejects again.
 */
@Value
@Builder
public class RejectedRecord {
    String source;
    String fileName;
    /** 0-based data row index within the file. */
    long rowNumber;
    /** {@code date,carrier,origin,dest} */
    String rawData;
    String rejectionReason;
}
