package io.cifxform.core.format;

/**
 * Two-state machine that follows semicolon-delimited text blocks while a document is read line by
 * line.
 *
 * <p>A line whose first character is {@code ;} opens a block when the tracker is {@link
 * State#NORMAL} and closes it when the tracker is {@link State#IN_BLOCK}. Every other line is
 * either ordinary content or block body, depending on the current state.
 *
 * <p>Not thread-safe: one tracker per scan.
 */
public final class TextBlockTracker {

    /** Scanner state between lines. */
    public enum State {
        NORMAL,
        IN_BLOCK
    }

    /** Classification of the line just consumed. */
    public enum LineKind {
        /** An ordinary line outside any block. */
        CONTENT,
        /** The {@code ;} line that opened a block. */
        BLOCK_OPEN,
        /** A line inside a block. */
        BLOCK_BODY,
        /** The {@code ;} line that closed a block. */
        BLOCK_CLOSE
    }

    private State state = State.NORMAL;

    /**
     * Consumes one line and moves the machine.
     *
     * @param line the raw line, without its terminator
     * @return what the line was
     */
    public LineKind advance(String line) {
        boolean delimiter = isDelimiter(line);
        if (state == State.NORMAL) {
            if (delimiter) {
                state = State.IN_BLOCK;
                return LineKind.BLOCK_OPEN;
            }
            return LineKind.CONTENT;
        }
        if (delimiter) {
            state = State.NORMAL;
            return LineKind.BLOCK_CLOSE;
        }
        return LineKind.BLOCK_BODY;
    }

    public State state() {
        return state;
    }

    /** Returns {@code true} while inside a block. */
    public boolean inBlock() {
        return state == State.IN_BLOCK;
    }

    /** Returns {@code true} if {@code line} starts with a semicolon in column one. */
    public static boolean isDelimiter(String line) {
        return !line.isEmpty() && line.charAt(0) == ';';
    }

    /** Returns {@code true} if {@code line} is a semicolon with nothing else but whitespace. */
    public static boolean isLoneDelimiter(String line) {
        return ";".equals(line.strip());
    }
}
