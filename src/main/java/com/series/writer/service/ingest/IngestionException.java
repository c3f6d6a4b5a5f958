package com.series.writer.service.ingest;

/**
 * Exception thrown when a stage of the ingestion pipeline fails.
 *
 * The error code tells the REST layer and the logs which stage failed.
 */
public class IngestionException extends RuntimeException {

    public static final String DECODE_ERROR = "DECODE_ERROR";
    public static final String STAGING_FAILED = "STAGING_FAILED";
    public static final String BULK_LOAD_FAILED = "BULK_LOAD_FAILED";

    private final String entityId;
    private final String errorCode;

    public IngestionException(String message, String errorCode) {
        super(message);
        this.entityId = null;
        this.errorCode = errorCode;
    }

    public IngestionException(String message, String errorCode, Throwable cause) {
        super(message, cause);
        this.entityId = null;
        this.errorCode = errorCode;
    }

    public IngestionException(String message, String entityId, String errorCode, Throwable cause) {
        super(message, cause);
        this.entityId = entityId;
        this.errorCode = errorCode;
    }

    public String getEntityId() {
        return entityId;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
