package io.cifxform.cli.report;

import java.util.List;
import java.util.Objects;

/**
 * What a command reports besides the document it writes.
 *
 * @param command the command name
 * @param summary one-line outcome
 * @param entries one line per operation, issue or finding, for text output
 * @param details structured data for JSON output, or {@code null}
 */
public record CommandReport(String command, String summary, List<String> entries, Object details) {

    public CommandReport {
        Objects.requireNonNull(command, "command must not be null");
        Objects.requireNonNull(summary, "summary must not be null");
        entries = List.copyOf(entries);
    }
}
