package io.cifxform.core.model;

/**
 * A CIF2 value-encoding problem found on one line.
 *
 * @param line 1-based line number
 * @param field the data name on that line
 * @param value the offending raw value
 * @param kind what is wrong
 */
public record ComplianceIssue(int line, String field, String value, Kind kind) {

    /** Issue categories. */
    public enum Kind {
        /** An unquoted value contains a CIF2 list/table delimiter. */
        UNQUOTED_SPECIAL_CHARS,
        /** The value contains both triple-quote sequences, so no quoting can wrap it. */
        UNQUOTABLE
    }

    /** Human-readable description of the issue. */
    public String description() {
        return switch (kind) {
            case UNQUOTED_SPECIAL_CHARS -> "Unquoted value contains CIF2 special characters [ ] { }";
            case UNQUOTABLE -> "Value contains both ''' and \"\"\" and cannot be quoted";
        };
    }
}
