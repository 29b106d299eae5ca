package io.cifxform.cli;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Parsed command-line arguments: the command name, its options and its positional arguments.
 *
 * <p>Options are {@code --name value} pairs, except the flags listed in {@link #FLAGS}, which take
 * no value. Options may appear anywhere after the command.
 */
record CommandLine(String command, Map<String, String> options, List<String> arguments) {

    /** Options that take no value. */
    static final Set<String> FLAGS = Set.of("--fix", "--add-missing", "--help");

    CommandLine {
        options = Map.copyOf(options);
        arguments = List.copyOf(arguments);
    }

    /**
     * Parses raw arguments.
     *
     * @throws UsageException if an option is missing its value
     */
    static CommandLine parse(String[] args) {
        String command = null;
        Map<String, String> options = new HashMap<>();
        List<String> arguments = new ArrayList<>();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (arg.startsWith("--")) {
                if (FLAGS.contains(arg)) {
                    options.put(arg, "true");
                    continue;
                }
                if (i + 1 >= args.length) {
                    throw new UsageException(arg + " requires a value");
                }
                options.put(arg, args[++i]);
            } else if (command == null) {
                command = arg;
            } else {
                arguments.add(arg);
            }
        }
        return new CommandLine(command, options, arguments);
    }

    String option(String name) {
        return options.get(name);
    }

    boolean flag(String name) {
        return options.containsKey(name);
    }

    /** Thrown for malformed invocations; reported with the usage text. */
    static final class UsageException extends RuntimeException {

        private static final long serialVersionUID = 1L;

        UsageException(String message) {
            super(message);
        }
    }
}
