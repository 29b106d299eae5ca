package io.cifxform.core.engine;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.cifxform.core.model.ApplyResult;
import io.cifxform.core.model.CheckFinding;
import io.cifxform.core.model.FieldRule;
import io.cifxform.core.model.RuleSet;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

@DisplayName("RuleApplicationEngine")
class RuleApplicationEngineTest {

    private static final String DOCUMENT = lines(
            "data_sample",
            "_cell.length_a    5.0",
            "_cell.length_b    10.0(2)",
            "_old.name value",
            "_remove.me 1",
            "_remove.meta 2",
            "_notes",
            ";",
            "first",
            ";",
            "_pd_meas.time 120",
            "");

    private final RuleApplicationEngine engine = new RuleApplicationEngine();

    private static String lines(String... lines) {
        return String.join("\n", lines);
    }

    private static RuleSet rules(FieldRule... rules) {
        return RuleSet.of(List.of(rules));
    }

    @Nested
    @DisplayName("DELETE / EDIT / RENAME")
    class Apply {

        @Test
        @DisplayName("DELETE drops every line starting with the name")
        void deleteMatchesPrefix() {
            ApplyResult result = engine.apply(DOCUMENT, rules(new FieldRule.Delete("_remove.me", null)));

            assertThat(result.content()).doesNotContain("_remove.me 1").doesNotContain("_remove.meta 2");
            assertThat(result.operations()).containsExactly("DELETED: _remove.me");
        }

        @Test
        @DisplayName("DELETE and EDIT both match on a name prefix")
        void deleteAndEditMatchPrefix() {
            RuleSet rules = rules(
                    new FieldRule.Delete("_cell_length", null), new FieldRule.Edit("_cell_angle", "90", null));

            ApplyResult result = engine.apply("_cell_length_a 1\n  _cell_angle_alpha 80\n", rules);

            assertThat(result.content()).isEqualTo("_cell_angle    90\n");
            assertThat(result.operations()).containsExactly("DELETED: _cell_length", "EDITED: _cell_angle -> 90");
        }

        @Test
        void deleteRemovesFollowingTextBlock() {
            ApplyResult result = engine.apply(DOCUMENT, rules(new FieldRule.Delete("_notes", null)));

            assertThat(result.content())
                    .isEqualTo(lines(
                            "data_sample",
                            "_cell.length_a    5.0",
                            "_cell.length_b    10.0(2)",
                            "_old.name value",
                            "_remove.me 1",
                            "_remove.meta 2",
                            "_pd_meas.time 120",
                            ""));
        }

        @Test
        void deleteOfAbsentFieldLogsNothing() {
            ApplyResult result = engine.apply(DOCUMENT, rules(new FieldRule.Delete("_absent", null)));

            assertThat(result.content()).isEqualTo(DOCUMENT);
            assertThat(result.changed()).isFalse();
        }

        @Test
        void editReplacesValue() {
            ApplyResult result = engine.apply(DOCUMENT, rules(new FieldRule.Edit("_cell.length_a", "6.0", null)));

            assertThat(result.content()).contains("\n_cell.length_a    6.0\n");
            assertThat(result.operations()).containsExactly("EDITED: _cell.length_a -> 6.0");
        }

        @Test
        void editReplacesTextBlockValue() {
            ApplyResult result = engine.apply(DOCUMENT, rules(new FieldRule.Edit("_notes", "short", null)));

            assertThat(result.content()).contains("_notes    short\n_pd_meas.time 120").doesNotContain("first");
        }

        @Test
        void editWithEmptyValueDeletes() {
            ApplyResult result = engine.apply(DOCUMENT, rules(new FieldRule.Edit("_old.name", "", null)));

            assertThat(result.content()).doesNotContain("_old.name");
            assertThat(result.operations()).containsExactly("DELETED: _old.name");
        }

        @Test
        void renameKeepsValue() {
            ApplyResult result =
                    engine.apply(DOCUMENT, rules(new FieldRule.Rename("_old.name", "_new.name", null)));

            assertThat(result.content()).contains("\n_new.name value\n").doesNotContain("_old.name");
            assertThat(result.operations()).containsExactly("RENAMED: _old.name -> _new.name");
        }

        @Test
        @DisplayName("RENAME leaves a longer name sharing the prefix alone")
        void renameMatchesWholeTokenOnly() {
            String content = lines("_old.name 1", "_old.name_extra 2", "_old.names", "");

            ApplyResult result = engine.apply(content, rules(new FieldRule.Rename("_old.name", "_new.name", null)));

            assertThat(result.content()).isEqualTo(lines("_new.name 1", "_old.name_extra 2", "_old.names", ""));
            assertThat(result.operations()).containsExactly("RENAMED: _old.name -> _new.name");
        }

        @Test
        void renameKeepsIndentation() {
            ApplyResult result = engine.apply("loop_\n  _old.name\n  _other\n", rules(
                    new FieldRule.Rename("_old.name", "_new.name", null)));

            assertThat(result.content()).isEqualTo("loop_\n  _new.name\n  _other\n");
        }

        @Test
        @DisplayName("second pass over the output changes nothing")
        void idempotent() {
            RuleSet rules = rules(
                    new FieldRule.Delete("_remove.me", null),
                    new FieldRule.Edit("_cell.length_a", "6.0", null),
                    new FieldRule.Rename("_old.name", "_new.name", null));

            ApplyResult first = engine.apply(DOCUMENT, rules);
            ApplyResult second = engine.apply(first.content(), rules);

            assertThat(first.operations()).hasSize(3);
            assertThat(second.content()).isEqualTo(first.content());
            assertThat(second.operations()).isEmpty();
        }

        @Test
        void textBlockContentIsNeverMatched() {
            String content = lines("_notes", ";", "_old.name inside a block", ";", "");

            ApplyResult result = engine.apply(content, rules(
                    new FieldRule.Rename("_old.name", "_new.name", null), new FieldRule.Delete("_old.name", null)));

            assertThat(result.content()).isEqualTo(content);
            assertThat(result.operations()).isEmpty();
        }
    }

    @Nested
    @DisplayName("APPEND")
    class Append {

        @Test
        void insertsBeforeClosingDelimiter() {
            ApplyResult result = engine.append(DOCUMENT, rules(new FieldRule.Append("_notes", "added\ntext", null)));

            assertThat(result.content()).contains(lines("_notes", ";", "first", "", "added", "text", ";"));
            assertThat(result.operations()).containsExactly("APPENDED: _notes");
        }

        @Test
        void singleLineValueIsLeftAlone() {
            ApplyResult result = engine.append(DOCUMENT, rules(new FieldRule.Append("_old.name", "more", null)));

            assertThat(result.content()).isEqualTo(DOCUMENT);
            assertThat(result.operations()).isEmpty();
        }
    }

    @Nested
    @DisplayName("CALCULATE")
    class Calculate {

        private ListAppender<ILoggingEvent> logAppender;
        private Logger engineLogger;

        @BeforeEach
        void attachAppender() {
            engineLogger = (Logger) LoggerFactory.getLogger(RuleApplicationEngine.class);
            logAppender = new ListAppender<>();
            logAppender.start();
            engineLogger.addAppender(logAppender);
        }

        @AfterEach
        void detachAppender() {
            engineLogger.detachAppender(logAppender);
            logAppender.stop();
        }

        @Test
        void appendsNewFieldBeforeTrailingNewline() {
            ApplyResult result = engine.calculate(DOCUMENT, rules(
                    new FieldRule.Calculate("_ratio", "_cell.length_b / _cell.length_a", null)));

            assertThat(result.content()).endsWith("_pd_meas.time 120\n_ratio    2.0\n");
            assertThat(result.operations()).containsExactly("CALCULATED: _ratio = 2.0");
        }

        @Test
        void laterRulesSeeEarlierResults() {
            ApplyResult result = engine.calculate(DOCUMENT, rules(
                    new FieldRule.Calculate("_ratio", "_cell.length_b / _cell.length_a", null),
                    new FieldRule.Calculate("_double", "_ratio * 2", null)));

            assertThat(result.content()).contains("_ratio    2.0\n_double    4.0\n");
        }

        @Test
        void overwritesExistingField() {
            ApplyResult result = engine.calculate(DOCUMENT, rules(
                    new FieldRule.Calculate("_cell.length_a", "_cell.length_a * 2", null)));

            assertThat(result.content()).contains("\n_cell.length_a    10.0\n");
        }

        @Test
        void failureLeavesDocumentAndWarns() {
            ApplyResult result =
                    engine.calculate(DOCUMENT, rules(new FieldRule.Calculate("_x", "_missing + 1", null)));

            assertThat(result.content()).isEqualTo(DOCUMENT);
            assertThat(result.operations())
                    .containsExactly("CALCULATE FAILED: _x: Unresolved field reference: _missing");
            assertThat(logAppender.list)
                    .anySatisfy(event -> {
                        assertThat(event.getLevel()).isEqualTo(Level.WARN);
                        assertThat(event.getFormattedMessage()).contains("_x").contains("_missing");
                    });
        }

        @Test
        @DisplayName("a number too large for a double is ignored, not fatal")
        void overflowingValueDoesNotBreakOtherRules() {
            ApplyResult result = engine.calculate("_big 1e999\n_a 2\n", rules(
                    new FieldRule.Calculate("_r", "_a * 2", null),
                    new FieldRule.Calculate("_s", "_big + 1", null)));

            assertThat(result.content()).isEqualTo("_big 1e999\n_a 2\n_r    4.0\n");
            assertThat(result.operations())
                    .containsExactly("CALCULATED: _r = 4.0", "CALCULATE FAILED: _s: Unresolved field reference: _big");
        }
    }

    @Test
    @DisplayName("process renames before it calculates")
    void processOrder() {
        RuleSet rules = rules(
                new FieldRule.Calculate("_sum", "_new.val + 1", null),
                new FieldRule.Rename("_old.val", "_new.val", null));

        ApplyResult result = engine.process("_old.val 2\n", rules);

        assertThat(result.content()).isEqualTo("_new.val 2\n_sum    3.0\n");
        assertThat(result.operations()).containsExactly("RENAMED: _old.val -> _new.val", "CALCULATED: _sum = 3.0");
    }

    @Nested
    @DisplayName("CHECK")
    class Check {

        @Test
        void reportsPresenceAndCurrentValue() {
            String content = lines("_cell.length_a 5.0", "_space_group.name_H-M_alt 'P 1'", "_empty.field", "");
            RuleSet rules = rules(
                    new FieldRule.Check("_cell.length_a", "", "", List.of("5.0")),
                    new FieldRule.Check("_space_group.name_H-M_alt", "", "", List.of()),
                    new FieldRule.Check("_empty.field", "", "", List.of()),
                    new FieldRule.Check("_journal.name", "?", "Journal", List.of()));

            List<CheckFinding> findings = engine.check(content, rules);

            assertThat(findings).extracting(CheckFinding::present).containsExactly(true, true, true, false);
            assertThat(findings)
                    .extracting(CheckFinding::currentValue)
                    .containsExactly("5.0", "P 1", null, null);
            assertThat(findings.get(0).matchesSuggestion()).isTrue();
            assertThat(findings.get(3).description()).isEqualTo("Journal");
        }

        @Test
        void addMissingEncodesDefaults() {
            RuleSet rules = rules(
                    new FieldRule.Check("_cell.length_a", "1.0", "", List.of()),
                    new FieldRule.Check("_journal.name", "", "", List.of()),
                    new FieldRule.Check("_exptl.method", "X-ray diffraction", "", List.of()),
                    new FieldRule.Check("_exptl.notes", "line one\nline two", "", List.of()));

            ApplyResult result = engine.addMissing("_cell.length_a 5.0\n", rules);

            assertThat(result.content())
                    .isEqualTo(lines(
                            "_cell.length_a 5.0",
                            "_journal.name ?",
                            "_exptl.method 'X-ray diffraction'",
                            "_exptl.notes",
                            ";",
                            "line one",
                            "line two",
                            ";",
                            ""));
            assertThat(result.operations())
                    .startsWith("ADDED: _journal.name ?", "ADDED: _exptl.method 'X-ray diffraction'");
        }

        @Test
        void addMissingWithTripleQuotes() {
            RuleSet rules = rules(new FieldRule.Check("_exptl.notes", "a\nb", "", List.of()));

            ApplyResult result = new RuleApplicationEngine(true).addMissing("", rules);

            assertThat(result.content()).isEqualTo("_exptl.notes\n'''\na\nb\n'''\n");
        }
    }
}
