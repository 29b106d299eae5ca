package io.cifxform.cli.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.PrintStream;
import java.io.UncheckedIOException;

/** Writes a {@link CommandReport} as plain text or as pretty-printed JSON. */
public final class ReportWriter {

    private static final ObjectMapper JSON_MAPPER =
            new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private final boolean json;

    public ReportWriter(boolean json) {
        this.json = json;
    }

    public void write(CommandReport report, PrintStream out) {
        out.println(render(report));
        out.flush();
    }

    /** Renders the report without writing it. */
    public String render(CommandReport report) {
        if (json) {
            try {
                return JSON_MAPPER.writeValueAsString(report);
            } catch (JsonProcessingException e) {
                throw new UncheckedIOException("Cannot serialise report for " + report.command(), e);
            }
        }
        StringBuilder sb = new StringBuilder(report.summary());
        for (String entry : report.entries()) {
            sb.append(System.lineSeparator()).append("  ").append(entry);
        }
        return sb.toString();
    }
}
