package io.cifxform.core.model;

/**
 * A rewrite applied by the CIF2 compliance fixer.
 *
 * @param line 1-based line number
 * @param field the data name on that line
 * @param oldValue value before the fix
 * @param newValue value after the fix
 */
public record ComplianceFix(int line, String field, String oldValue, String newValue) {}
