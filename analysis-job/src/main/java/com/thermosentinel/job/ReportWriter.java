package com.thermosentinel.job;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Serialises an {@link AnalysisReport} to pretty-printed JSON.
 *
 * <p>
 * Timestamps are written as ISO-8601 strings, not epoch numbers.
 * </p>
 */
public class ReportWriter {

    private final ObjectMapper mapper;

    public ReportWriter() {
        this.mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        mapper.configure(SerializationFeature.INDENT_OUTPUT, true);
        mapper.configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false);
    }

    /**
     * @param report the report
     * @return the JSON document
     */
    public String toJson(AnalysisReport report) {
        Objects.requireNonNull(report, "report must not be null");
        try {
            return mapper.writeValueAsString(report);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to serialize report for " + report.getCity(), e);
        }
    }

    /**
     * Write the report to a stream. The stream is flushed, not closed.
     *
     * @param report the report
     * @param out    the target stream
     * @throws IOException if writing fails
     */
    public void write(AnalysisReport report, OutputStream out) throws IOException {
        Objects.requireNonNull(report, "report must not be null");
        mapper.writeValue(out, report);
        out.flush();
    }

    /**
     * Write the report to a file, replacing any existing content.
     *
     * @param report the report
     * @param path   the target file
     * @throws IOException if writing fails
     */
    public void write(AnalysisReport report, Path path) throws IOException {
        try (OutputStream out = Files.newOutputStream(path)) {
            write(report, out);
        }
    }
}
