package com.di.flightwarehouse.storage;

import java.util.Locale;

/**
 * A raw object key together with its classification.
 *
 * @param key        full object key, e.g. {@code raw/On_Time_2024_1.csv}
 * @param fileName   last path segment; the ledger's file identity
 * @param sourceType fact, reference or unknown
 */
public record RawFile(String key, String fileName, SourceType sourceType) implements Comparable<RawFile> {

    /**
     * Classifies a key. Fact files end in {@code .csv} and do not mention "airport";
     * the configured airports key and any {@code .dat} object are reference data.
     */
    public static RawFile classify(String key, String airportsKey) {
        String fileName = key.substring(key.lastIndexOf('/') + 1);
        String lower = fileName.toLowerCase(Locale.ROOT);
        SourceType type;
        if (key.equals(airportsKey) || lower.endsWith(".dat")) {
            type = SourceType.REFERENCE;
        } else if (lower.endsWith(".csv") && !lower.contains("airport")) {
            type = SourceType.FACT;
        } else {
            type = SourceType.UNKNOWN;
        }
        return new RawFile(key, fileName, type);
    }

    public boolean isFact() {
        return sourceType == SourceType.FACT;
    }

    @Override
    public int compareTo(RawFile other) {
        return key.compareTo(other.key);
    }
}
