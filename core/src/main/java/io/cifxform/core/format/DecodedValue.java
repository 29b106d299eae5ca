package io.cifxform.core.format;

/**
 * A value read out of CIF text.
 *
 * @param value the decoded content, without delimiters
 * @param endPosition index immediately after the closing delimiter
 */
public record DecodedValue(String value, int endPosition) {}
