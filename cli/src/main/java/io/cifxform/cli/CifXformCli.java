package io.cifxform.cli;

import io.cifxform.cli.config.CliConfig;
import io.cifxform.cli.config.ConfigLoadException;
import io.cifxform.cli.config.ConfigLoader;
import io.cifxform.cli.logging.LogbackConfigurator;
import io.cifxform.cli.report.CommandReport;
import io.cifxform.cli.report.ReportWriter;
import io.cifxform.core.dictionary.DictionaryContext;
import io.cifxform.core.dictionary.DictionarySource;
import io.cifxform.core.dictionary.ExtensionMappings;
import io.cifxform.core.engine.FormatConverter;
import io.cifxform.core.engine.RuleApplicationEngine;
import io.cifxform.core.error.CifXformException;
import io.cifxform.core.format.Cif2ComplianceChecker;
import io.cifxform.core.format.FormatAnalyzer;
import io.cifxform.core.model.ApplyResult;
import io.cifxform.core.model.CifVersion;
import io.cifxform.core.model.ComplianceFixResult;
import io.cifxform.core.model.ComplianceIssue;
import io.cifxform.core.model.ConversionResult;
import io.cifxform.core.model.DeprecationInfo;
import io.cifxform.core.model.RuleSet;
import io.cifxform.core.rules.RuleDefinitionLoader;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command dispatcher behind {@link CifXformMain}.
 *
 * <p>Commands write the resulting document to {@code --output} or standard output. The report goes
 * to standard output when the document went to a file (or there is no document) and to standard
 * error otherwise, so a document on standard output can be piped.
 *
 * <p>Exit codes: {@value #EXIT_OK} success, {@value #EXIT_ERROR} failure, {@value #EXIT_USAGE}
 * invalid invocation, {@value #EXIT_ISSUES} compliance issues remain.
 */
public final class CifXformCli {

    private static final Logger LOG = LoggerFactory.getLogger(CifXformCli.class);

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_ISSUES = 3;

    static final String USAGE = String.join(
            System.lineSeparator(),
            "usage: cif-xform <command> [options] <args>",
            "",
            "commands:",
            "  apply --rules <file> [--add-missing] <cif>   apply a field-rules file",
            "  check [--fix] <cif>                           check CIF2 value quoting",
            "  convert --to cif1|cif2 <cif>                  convert between CIF dialects",
            "  deprecations <field>...                       show deprecation status",
            "  detect <cif>                                  detect the CIF dialect",
            "",
            "options:",
            "  --config <file>       configuration file (default: cif-xform.yaml if present)",
            "  --dictionary <file>   DDLm dictionary (overrides dictionary.path)",
            "  --output <file>       write the document to a file instead of standard output",
            "  --report text|json    report format (overrides output.report)");

    private final PrintStream out;
    private final PrintStream err;
    private final Function<String, String> envLookup;
    private final Path workingDir;
    private final boolean configureLogging;

    public CifXformCli(
            PrintStream out,
            PrintStream err,
            Function<String, String> envLookup,
            Path workingDir,
            boolean configureLogging) {
        this.out = out;
        this.err = err;
        this.envLookup = envLookup;
        this.workingDir = workingDir;
        this.configureLogging = configureLogging;
    }

    /** Runs one command and returns the process exit code. */
    public int run(String[] args) {
        CommandLine cl;
        try {
            cl = CommandLine.parse(args);
        } catch (CommandLine.UsageException e) {
            return usage(e.getMessage());
        }
        if (cl.flag("--help")) {
            out.println(USAGE);
            return EXIT_OK;
        }
        if (cl.command() == null) {
            return usage("no command given");
        }

        try {
            String configPath = cl.option("--config") != null ? resolve(cl.option("--config")).toString() : null;
            CliConfig config = withOverrides(ConfigLoader.resolve(configPath, workingDir, envLookup), cl);
            if (configureLogging) {
                LogbackConfigurator.configure(config.loggingFormat(), config.loggingLevel());
            }
            return switch (cl.command().toLowerCase(Locale.ROOT)) {
                case "apply" -> apply(cl, config);
                case "check" -> check(cl, config);
                case "convert" -> convert(cl, config);
                case "deprecations" -> deprecations(cl, config);
                case "detect" -> detect(cl, config);
                default -> usage("unknown command: " + cl.command());
            };
        } catch (CommandLine.UsageException e) {
            return usage(e.getMessage());
        } catch (ConfigLoadException | CifXformException | UncheckedIOException e) {
            LOG.error("{} failed: {}", cl.command(), e.getMessage());
            err.println("error: " + e.getMessage());
            return EXIT_ERROR;
        }
    }

    // ── Commands ──

    private int apply(CommandLine cl, CliConfig config) {
        String rulesPath = require(cl, "--rules");
        Path input = singleInput(cl);
        String content = read(input);
        RuleSet rules = new RuleDefinitionLoader().load(resolve(rulesPath));
        RuleApplicationEngine engine = new RuleApplicationEngine(config.preferTripleQuotes());

        ApplyResult result = engine.process(content, rules);
        if (cl.flag("--add-missing")) {
            result = result.then(engine.addMissing(result.content(), rules));
        }
        writeDocument(cl, result.content());

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("input", input.toString());
        details.put("rules", rulesPath);
        details.put("operations", result.operations());
        report(cl, config, new CommandReport(
                "apply",
                "Applied " + result.operations().size() + " operation(s) from " + rulesPath,
                result.operations(),
                details));
        return EXIT_OK;
    }

    private int check(CommandLine cl, CliConfig config) {
        Path input = singleInput(cl);
        String content = read(input);
        if (cl.flag("--fix")) {
            ComplianceFixResult fixed = Cif2ComplianceChecker.fix(content);
            List<ComplianceIssue> remaining = Cif2ComplianceChecker.validate(fixed.content());
            writeDocument(cl, fixed.content());
            List<String> entries = new ArrayList<>();
            fixed.fixes().forEach(f -> entries.add(
                    "line " + f.line() + ": " + f.field() + " " + f.oldValue() + " -> " + f.newValue()));
            remaining.forEach(i -> entries.add(describe(i)));
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("fixes", fixed.fixes());
            details.put("remaining", remaining);
            report(cl, config, new CommandReport(
                    "check",
                    "Fixed " + fixed.fixes().size() + " issue(s), " + remaining.size() + " remaining",
                    entries,
                    details));
            return remaining.isEmpty() ? EXIT_OK : EXIT_ISSUES;
        }

        List<ComplianceIssue> issues = Cif2ComplianceChecker.validate(content);
        report(cl, config, new CommandReport(
                "check",
                issues.isEmpty() ? input + ": CIF2 compliant" : input + ": " + issues.size() + " issue(s)",
                issues.stream().map(CifXformCli::describe).toList(),
                Map.of("issues", issues)));
        return issues.isEmpty() ? EXIT_OK : EXIT_ISSUES;
    }

    private int convert(CommandLine cl, CliConfig config) {
        String target = require(cl, "--to").toLowerCase(Locale.ROOT);
        if (!target.equals("cif1") && !target.equals("cif2")) {
            throw new CommandLine.UsageException("--to must be cif1 or cif2, got: " + target);
        }
        Path input = singleInput(cl);
        String content = read(input);
        FormatConverter converter = new FormatConverter(dictionary(config).overlay());
        ConversionResult result =
                target.equals("cif2") ? converter.convertToCif2(content) : converter.convertToCif1(content);
        writeDocument(cl, result.content());

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("target", target);
        details.put("changes", result.changes());
        details.put("unknownFields", result.unknownFields());
        report(cl, config, new CommandReport(
                "convert",
                "Converted " + input + " to " + target.toUpperCase(Locale.ROOT) + " with "
                        + result.changes().size() + " change(s)",
                result.changes(),
                details));
        return EXIT_OK;
    }

    private int deprecations(CommandLine cl, CliConfig config) {
        if (cl.arguments().isEmpty()) {
            throw new CommandLine.UsageException("deprecations needs at least one field name");
        }
        DictionaryContext context = dictionary(config);
        List<String> entries = new ArrayList<>();
        List<Map<String, Object>> details = new ArrayList<>();
        int deprecated = 0;
        for (String field : cl.arguments()) {
            Optional<DeprecationInfo> info = context.deprecations().getInfo(field);
            String status = context.overlay().getFieldStatus(field).label();
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("field", field);
            row.put("status", status);
            row.put("deprecated", info.isPresent());
            if (info.isPresent()) {
                deprecated++;
                String suggestion = context.deprecations().getMigrationSuggestion(field).orElse("");
                row.put("severity", info.get().severity().label());
                row.put("replacement", info.get().replacementField());
                row.put("reason", info.get().reason());
                row.put("suggestion", suggestion);
                entries.add(field + ": deprecated (" + info.get().severity().label() + ") " + suggestion);
            } else {
                entries.add(field + ": not deprecated [" + status + "]");
            }
            details.add(row);
        }
        report(cl, config, new CommandReport(
                "deprecations",
                deprecated + " of " + cl.arguments().size() + " field(s) deprecated",
                entries,
                details));
        return EXIT_OK;
    }

    private int detect(CommandLine cl, CliConfig config) {
        Path input = singleInput(cl);
        CifVersion version = FormatAnalyzer.detectVersion(read(input));
        report(cl, config, new CommandReport(
                "detect", input + ": " + version, List.of(), Map.of("input", input.toString(), "version", version)));
        return EXIT_OK;
    }

    // ── Helpers ──

    private static CliConfig withOverrides(CliConfig config, CommandLine cl) {
        String report = cl.option("--report");
        String dictionary = cl.option("--dictionary");
        if (report == null && dictionary == null) {
            return config;
        }
        return new CliConfig(
                dictionary != null ? dictionary : config.dictionaryPath(),
                config.extensionsPath(),
                config.preferTripleQuotes(),
                report != null ? report : config.reportFormat(),
                config.loggingFormat(),
                config.loggingLevel());
    }

    private DictionaryContext dictionary(CliConfig config) {
        if (config.dictionaryPath() == null || config.dictionaryPath().isBlank()) {
            throw new CommandLine.UsageException(
                    "no dictionary configured: set dictionary.path, CIF_DICTIONARY or --dictionary");
        }
        ExtensionMappings extensions = config.extensionsPath() != null
                ? ExtensionMappings.load(resolve(config.extensionsPath()))
                : ExtensionMappings.bundled();
        return new DictionaryContext(DictionarySource.fromPath(resolve(config.dictionaryPath())), extensions)
                .initialize();
    }

    private static String require(CommandLine cl, String option) {
        String value = cl.option(option);
        if (value == null || value.isBlank()) {
            throw new CommandLine.UsageException(cl.command() + " requires " + option);
        }
        return value;
    }

    private Path singleInput(CommandLine cl) {
        if (cl.arguments().size() != 1) {
            throw new CommandLine.UsageException(cl.command() + " takes exactly one CIF file");
        }
        return resolve(cl.arguments().get(0));
    }

    private Path resolve(String path) {
        return workingDir.resolve(path);
    }

    private static String read(Path path) {
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            throw new UncheckedIOException("File not found: " + path, e);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + path + ": " + e.getMessage(), e);
        }
    }

    private void writeDocument(CommandLine cl, String content) {
        String output = cl.option("--output");
        if (output == null) {
            out.print(content);
            if (!content.endsWith("\n")) {
                out.println();
            }
            out.flush();
            return;
        }
        Path target = resolve(output);
        try {
            Files.writeString(target, content, StandardCharsets.UTF_8);
            LOG.info("Wrote {}", target);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write " + target + ": " + e.getMessage(), e);
        }
    }

    private void report(CommandLine cl, CliConfig config, CommandReport report) {
        boolean documentOnStdout = cl.option("--output") == null && producesDocument(cl);
        new ReportWriter(config.jsonReport()).write(report, documentOnStdout ? err : out);
    }

    private static boolean producesDocument(CommandLine cl) {
        return switch (cl.command().toLowerCase(Locale.ROOT)) {
            case "apply", "convert" -> true;
            case "check" -> cl.flag("--fix");
            default -> false;
        };
    }

    private static String describe(ComplianceIssue issue) {
        return "line " + issue.line() + ": " + issue.field() + " " + issue.value() + " (" + issue.description() + ")";
    }

    private int usage(String message) {
        err.println("error: " + message);
        err.println(USAGE);
        return EXIT_USAGE;
    }
}
