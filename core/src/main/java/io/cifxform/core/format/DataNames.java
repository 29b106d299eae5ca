package io.cifxform.core.format;

import java.util.regex.Pattern;

/** Helpers for recognising CIF data names at the start of a line. */
public final class DataNames {

    /** A data name: leading underscore, then any non-whitespace characters. */
    public static final Pattern DATA_NAME = Pattern.compile("_[^\\s]+");

    /** A data-name line: indent, name, then optional separator and remainder. */
    public static final Pattern DATA_LINE = Pattern.compile("^(\\s*)(_[^\\s]+)(?:(\\s+)(.*))?$");

    private DataNames() {}

    /**
     * Returns {@code true} if {@code line}, ignoring leading whitespace, starts with {@code name}
     * and the name is followed by whitespace or the end of the line.
     */
    public static boolean startsWithToken(String line, String name) {
        String trimmed = line.stripLeading();
        if (!trimmed.startsWith(name)) {
            return false;
        }
        return trimmed.length() == name.length() || Character.isWhitespace(trimmed.charAt(name.length()));
    }

    /**
     * Returns {@code true} if {@code line}, ignoring leading whitespace, starts with {@code name}.
     * Unlike {@link #startsWithToken}, {@code _a} also matches a line holding {@code _ab}.
     */
    public static boolean startsWithPrefix(String line, String name) {
        return line.stripLeading().startsWith(name);
    }

    /** Returns {@code true} if the name uses the CIF2 {@code category.attribute} form. */
    public static boolean isDotted(String name) {
        return name.indexOf('.') >= 0;
    }

    /** Returns {@code true} if {@code token} starts with the data-name sigil. */
    public static boolean isDataName(String token) {
        return token != null && token.length() > 1 && token.charAt(0) == '_';
    }
}
