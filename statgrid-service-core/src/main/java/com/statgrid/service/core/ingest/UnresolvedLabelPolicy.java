package com.statgrid.service.core.ingest;

/** What the ingestion driver does with a row whose dimension label did not resolve. */
public enum UnresolvedLabelPolicy {
    /** Keep the row with a null reference for that dimension. */
    STORE_NULL,
    /** Drop the row. */
    SKIP_ROW,
    /** Abort the chunk without advancing its checkpoint. */
    FAIL_CHUNK
}
