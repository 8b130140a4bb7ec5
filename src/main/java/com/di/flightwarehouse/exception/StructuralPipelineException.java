package com.di.flightwarehouse.exception;

import lombok.Getter;

/**
 * Unrecoverable failure of a pipeline stage: lost connectivity, a malformed source file,
 * a missing required column or a failed chunk write.
 * <p>
 * Aborts the current stage and leaves the file's ledger row incomplete. The orchestrator retries
 * the stage; earlier committed chunks stay committed and are absorbed by the fact conflict target.
 * Carries the file/chunk/row position where it was raised, when known.
 */
@Getter
public class StructuralPipelineException extends RuntimeException {

    private final String fileName;
    private final Integer chunkIndex;
    private final Long rowIndex;

    public StructuralPipelineException(String message) {
        this(message, null, null, null, null);
    }

    public StructuralPipelineException(String message, Throwable cause) {
        this(message, null, null, null, cause);
    }

    public StructuralPipelineException(String message, String fileName, Integer chunkIndex, Long rowIndex, Throwable cause) {
        super(describe(message, fileName, chunkIndex, rowIndex), cause);
        this.fileName = fileName;
        this.chunkIndex = chunkIndex;
        this.rowIndex = rowIndex;
    }

    public static StructuralPipelineException inFile(String fileName, String message, Throwable cause) {
        return new StructuralPipelineException(message, fileName, null, null, cause);
    }

    public static StructuralPipelineException inChunk(String fileName, int chunkIndex, long rowIndex, String message, Throwable cause) {
        return new StructuralPipelineException(message, fileName, chunkIndex, rowIndex, cause);
    }

    private static String describe(String message, String fileName, Integer chunkIndex, Long rowIndex) {
        StringBuilder sb = new StringBuilder(message);
        if (fileName != null) {
            sb.append(" [file=").append(fileName);
            if (chunkIndex != null) {
                sb.append(", chunk=").append(chunkIndex);
            }
            if (rowIndex != null) {
                sb.append(", row=").append(rowIndex);
            }
            sb.append(']');
        }
        return sb.toString();
    }
}
