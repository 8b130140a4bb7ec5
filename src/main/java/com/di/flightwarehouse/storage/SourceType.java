package com.di.flightwarehouse.storage;

/** Kind of raw object found in the bucket. */
public enum SourceType {
    /** Flight on-time performance CSV; loaded into the fact table. */
    FACT,
    /** Airports reference file. */
    REFERENCE,
    UNKNOWN
}
