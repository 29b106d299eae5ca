package io.cifxform.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Fixed document text together with the fixes applied.
 *
 * @param content the rewritten text
 * @param fixes one entry per rewritten line
 */
public record ComplianceFixResult(String content, List<ComplianceFix> fixes) {

    public ComplianceFixResult {
        Objects.requireNonNull(content, "content must not be null");
        fixes = List.copyOf(fixes);
    }
}
