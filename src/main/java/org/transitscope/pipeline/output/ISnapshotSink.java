package org.transitscope.pipeline.output;

import java.io.IOException;

/**
 * Destination of the published snapshot document.
 * <p>
 * Every call to {@link #write(String)} replaces the whole document; readers must never
 * observe a partially written one.
 */
public interface ISnapshotSink {

    /**
     * Publishes a complete snapshot document.
     *
     * @param document The encoded document.
     * @throws IOException if the document could not be published.
     */
    void write(String document) throws IOException;

    /**
     * Publishes a plain-text diagnostics report next to the snapshot.
     *
     * @param name   The report name, e.g. {@code telemetry_diag.txt}.
     * @param report The report text.
     * @throws IOException if the report could not be written.
     */
    void writeDiagnostics(String name, String report) throws IOException;
}
