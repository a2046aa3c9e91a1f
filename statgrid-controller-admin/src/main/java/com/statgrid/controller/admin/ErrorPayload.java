package com.statgrid.controller.admin;

import java.time.Instant;

/**
 * Error body of the admin endpoints.
 *
 * @param matrixId the matrix the failure concerns, when known
 */
public record ErrorPayload(Instant timestamp, int status, String error, String message, String path, Long matrixId) {}
