package com.di.flightwarehouse.fact;

import java.util.List;

/**
 * Sink for validated fact rows and their rejects.
 */
public interface FlightStore {

    /**
     * Writes one chunk in a single transaction: accepted rows are inserted with conflict = do-nothing
     * on the natural key, rejects are appended.
     *
     * @return fact rows actually inserted (accepted rows minus natural-key conflicts)
     */
    int writeChunk(List<FlightRecord> accepted, List<RejectedRecord> rejected);
}
