package io.cifxform.core.format;

import io.cifxform.core.model.CifVersion;

/** Detects which CIF dialect a document is written in. */
public final class FormatAnalyzer {

    /** Magic comment that marks a CIF2 file. */
    public static final String CIF2_HEADER = "#\\#CIF_2.0";

    /** Magic comment that marks a CIF 1.1 file. */
    public static final String CIF1_HEADER = "#\\#CIF_1.1";

    private static final int HEADER_SEARCH_LINES = 5;

    private FormatAnalyzer() {}

    /**
     * Detects the dialect of a document.
     *
     * <p>A version header within the first five lines decides. Without one, the data names outside
     * semicolon blocks decide: only dotted names mean {@link CifVersion#CIF2}, only flat names
     * {@link CifVersion#CIF1}, both {@link CifVersion#MIXED}, none {@link CifVersion#UNKNOWN}.
     */
    public static CifVersion detectVersion(String content) {
        if (content == null || content.isBlank()) {
            return CifVersion.UNKNOWN;
        }
        String[] lines = content.split("\n", -1);
        for (int i = 0; i < Math.min(HEADER_SEARCH_LINES, lines.length); i++) {
            String line = lines[i].strip();
            if (line.startsWith(CIF2_HEADER)) {
                return CifVersion.CIF2;
            }
            if (line.startsWith(CIF1_HEADER)) {
                return CifVersion.CIF1;
            }
        }

        boolean dotted = false;
        boolean flat = false;
        TextBlockTracker tracker = new TextBlockTracker();
        for (String line : lines) {
            if (tracker.advance(line) != TextBlockTracker.LineKind.CONTENT) {
                continue;
            }
            String name = leadingDataName(line);
            if (name == null) {
                continue;
            }
            if (DataNames.isDotted(name)) {
                dotted = true;
            } else {
                flat = true;
            }
        }
        if (dotted && flat) {
            return CifVersion.MIXED;
        }
        if (dotted) {
            return CifVersion.CIF2;
        }
        return flat ? CifVersion.CIF1 : CifVersion.UNKNOWN;
    }

    /** Returns {@code true} if one of the first lines carries the CIF2 header. */
    public static boolean hasCif2Header(String content) {
        if (content == null) {
            return false;
        }
        String[] lines = content.split("\n", HEADER_SEARCH_LINES + 1);
        for (int i = 0; i < Math.min(HEADER_SEARCH_LINES, lines.length); i++) {
            if (lines[i].strip().startsWith(CIF2_HEADER)) {
                return true;
            }
        }
        return false;
    }

    /** The data name a line starts with, or {@code null}. */
    static String leadingDataName(String line) {
        String trimmed = line.strip();
        if (!DataNames.isDataName(trimmed)) {
            return null;
        }
        int end = 0;
        while (end < trimmed.length() && !Character.isWhitespace(trimmed.charAt(end))) {
            end++;
        }
        return trimmed.substring(0, end);
    }
}
