package io.cifxform.core.format;

import io.cifxform.core.model.ComplianceFix;
import io.cifxform.core.model.ComplianceFixResult;
import io.cifxform.core.model.ComplianceIssue;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds and fixes single-line values that CIF2 would misread as list or table syntax.
 *
 * <p>Only {@code _name value} lines outside semicolon blocks are considered. A value is flagged
 * when it is not already quoted and contains any of {@code [ ] { }}. The fixer re-quotes such
 * values through {@link ValueFormatter}, keeping the line's indentation and the whitespace between
 * name and value, so a second pass over fixed text changes nothing.
 */
public final class Cif2ComplianceChecker {

    private static final Logger LOG = LoggerFactory.getLogger(Cif2ComplianceChecker.class);

    private Cif2ComplianceChecker() {}

    /**
     * Scans a document for unquoted values containing CIF2 special characters.
     *
     * @param content the document text
     * @return issues in line order, empty if the document is compliant
     */
    public static List<ComplianceIssue> validate(String content) {
        List<ComplianceIssue> issues = new ArrayList<>();
        scan(content, (lineNo, candidate) -> issues.add(new ComplianceIssue(
                lineNo, candidate.field(), candidate.value(), classify(candidate.value()))));
        return issues;
    }

    /**
     * Rewrites every flagged line with its value quoted. Values no CIF2 quote can wrap are left as
     * they are and produce no fix entry.
     *
     * @param content the document text
     * @return the fixed text and one entry per rewritten line
     */
    public static ComplianceFixResult fix(String content) {
        String[] lines = content.split("\n", -1);
        List<ComplianceFix> fixes = new ArrayList<>();
        scan(content, (lineNo, candidate) -> {
            if (!ValueFormatter.isQuotable(candidate.value())) {
                LOG.warn("Line {}: value of {} cannot be quoted, left unchanged", lineNo, candidate.field());
                return;
            }
            String quoted = ValueFormatter.format(candidate.value(), false);
            if (quoted.equals(candidate.value())) {
                return;
            }
            lines[lineNo - 1] = candidate.indent() + candidate.field() + candidate.separator() + quoted;
            fixes.add(new ComplianceFix(lineNo, candidate.field(), candidate.value(), quoted));
        });
        if (!fixes.isEmpty()) {
            LOG.debug("Fixed {} CIF2 compliance issue(s)", fixes.size());
        }
        return new ComplianceFixResult(String.join("\n", lines), fixes);
    }

    private static ComplianceIssue.Kind classify(String value) {
        return ValueFormatter.isQuotable(value)
                ? ComplianceIssue.Kind.UNQUOTED_SPECIAL_CHARS
                : ComplianceIssue.Kind.UNQUOTABLE;
    }

    private static void scan(String content, CandidateConsumer consumer) {
        if (content == null || content.isEmpty()) {
            return;
        }
        String[] lines = content.split("\n", -1);
        TextBlockTracker tracker = new TextBlockTracker();
        for (int i = 0; i < lines.length; i++) {
            if (tracker.advance(lines[i]) != TextBlockTracker.LineKind.CONTENT) {
                continue;
            }
            Matcher m = DataNames.DATA_LINE.matcher(lines[i]);
            if (!m.matches() || m.group(4) == null) {
                continue;
            }
            String value = m.group(4).stripTrailing();
            if (value.isEmpty() || isQuoted(value) || !ValueFormatter.containsSpecialChars(value)) {
                continue;
            }
            consumer.accept(i + 1, new Candidate(m.group(1), m.group(2), m.group(3), value));
        }
    }

    private static boolean isQuoted(String value) {
        char first = value.charAt(0);
        return first == '\'' || first == '"';
    }

    private record Candidate(String indent, String field, String separator, String value) {}

    @FunctionalInterface
    private interface CandidateConsumer {
        void accept(int lineNumber, Candidate candidate);
    }
}
