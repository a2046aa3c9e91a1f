package com.statgrid.service.core.ingest;

import java.util.List;

/**
 * One row as returned by the fetch collaborator.
 *
 * @param labels one label per dimension, in the order of the matrix layout
 * @param value raw cell text: a number (decimal comma allowed), a status marker, or null
 */
public record RawRow(List<String> labels, String value) {

    public RawRow {
        labels = List.copyOf(labels);
    }
}
