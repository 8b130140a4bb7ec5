package com.di.flightwarehouse.pipeline;

import java.util.Arrays;
import java.util.List;

/**
 * Stages of the ingestion DAG and their upstream dependencies.
 *
 * <pre>
 *   upload_raw_files
 *         |
 *   load_airports
 *      /       \
 *   extract_carriers   generate_date_dim
 *      \       /
 *   load_flights
 *         |
 *   load_weather
 *         |
 *   quality_checks
 * </pre>
 */
public enum PipelineStage {

    UPLOAD("upload_raw_files"),
    AIRPORTS("load_airports"),
    CARRIERS("extract_carriers"),
    DATES("generate_date_dim"),
    FLIGHTS("load_flights"),
    WEATHER("load_weather"),
    QUALITY("quality_checks");

    private final String taskId;

    PipelineStage(String taskId) {
        this.taskId = taskId;
    }

    public String taskId() {
        return taskId;
    }

    public List<PipelineStage> upstream() {
        switch (this) {
            case AIRPORTS:
                return List.of(UPLOAD);
            case CARRIERS:
            case DATES:
                return List.of(AIRPORTS);
            case FLIGHTS:
                return List.of(CARRIERS, DATES);
            case WEATHER:
                return List.of(FLIGHTS);
            case QUALITY:
                return List.of(WEATHER);
            default:
                return List.of();
        }
    }

    /** Accepts the task id ({@code load_flights}) or the constant name ({@code FLIGHTS}), case-insensitively. */
    public static PipelineStage fromName(String name) {
        for (PipelineStage stage : values()) {
            if (stage.taskId.equalsIgnoreCase(name) || stage.name().equalsIgnoreCase(name)) {
                return stage;
            }
        }
        throw new IllegalArgumentException("Unknown pipeline stage '" + name + "'; expected one of "
                + Arrays.stream(values()).map(PipelineStage::taskId).toList());
    }
}
