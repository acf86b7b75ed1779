package dev.pekelund.invoicebatch.upload;

/**
 * Where in the pipeline a file failed.
 */
public enum UploadFailureKind {

    /**
     * Reading, validating or hashing the local file failed.
     */
    HASH_FAILURE,

    /**
     * The duplicate lookup failed. Never terminal: the lookup fails open.
     */
    DUPLICATE_LOOKUP_FAILURE,

    UPLOAD_TRANSPORT_FAILURE,

    EXTRACTION_FAILURE,

    PERSIST_FAILURE,

    /**
     * A network call in any stage ran into the transport timeout.
     */
    TIMEOUT_FAILURE,

    /**
     * The batch was cancelled while the file was in flight.
     */
    CANCELLED_FAILURE;

    /**
     * Failure kind attributed to an unexpected error raised while a job was in {@code stage}.
     */
    public static UploadFailureKind forStage(UploadStage stage) {
        if (stage == null) {
            return HASH_FAILURE;
        }
        return switch (stage) {
            case PREPARING, HASHING -> HASH_FAILURE;
            case PROCESSING -> EXTRACTION_FAILURE;
            default -> UPLOAD_TRANSPORT_FAILURE;
        };
    }
}
