package com.statgrid.service.core.ingest;

public class ChunkFetchException extends RuntimeException {

    public ChunkFetchException(String message) {
        super(message);
    }

    public ChunkFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
