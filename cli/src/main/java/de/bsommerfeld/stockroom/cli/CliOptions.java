package de.bsommerfeld.stockroom.cli;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Parsed command line: global options, then the command and its arguments.
 *
 * <pre>
 * stockroom [--db &lt;path&gt;] [--config &lt;file&gt;] [--verbose] &lt;command&gt; [args...]
 * </pre>
 *
 * Options are only recognized before the command; everything after it is
 * passed to the command verbatim.
 *
 * @param database   database override, {@code null} to use the configuration
 * @param configFile configuration file override, {@code null} for the default
 * @param verbose    whether debug logging is enabled
 * @param command    command name, {@code help} when none was given
 * @param arguments  command arguments
 */
public record CliOptions(
        String database,
        Path configFile,
        boolean verbose,
        String command,
        List<String> arguments) {

    public static CliOptions parse(String... args) throws UsageException {
        String database = null;
        Path configFile = null;
        boolean verbose = false;

        int i = 0;
        while (i < args.length && args[i].startsWith("--")) {
            String option = args[i++];
            switch (option) {
                case "--db" -> database = value(args, i++, option);
                case "--config" -> configFile = Paths.get(value(args, i++, option));
                case "--verbose" -> verbose = true;
                case "--help" -> {
                    return new CliOptions(database, configFile, verbose, "help", List.of());
                }
                default -> throw new UsageException("Unknown option " + option);
            }
        }

        if (i >= args.length) {
            return new CliOptions(database, configFile, verbose, "help", List.of());
        }
        String command = args[i++];
        List<String> arguments = new ArrayList<>();
        while (i < args.length) {
            arguments.add(args[i++]);
        }
        return new CliOptions(database, configFile, verbose, command, List.copyOf(arguments));
    }

    private static String value(String[] args, int index, String option) throws UsageException {
        if (index >= args.length || args[index].isBlank()) {
            throw new UsageException("Option " + option + " requires a value");
        }
        return args[index];
    }
}
