package io.surfworks.vectorforge.cli;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Parsed command-line options shared by the CLI commands.
 *
 * @param positional   arguments that are not options, in order
 * @param name         value name, or null for the configured default
 * @param littleEndian reverse bit order for forte output
 * @param inputSplits  forte input splits, or null to derive them
 * @param outputSplits forte output splits, or null to derive them
 * @param count        number of vectors to sample
 * @param seed         random seed for the example program
 * @param out          output file, or null for stdout
 * @param config       config file, or null for the default location
 * @param verbose      enable FINE logging
 */
record Options(
        List<String> positional,
        String name,
        boolean littleEndian,
        List<Integer> inputSplits,
        List<Integer> outputSplits,
        int count,
        long seed,
        Path out,
        Path config,
        boolean verbose
) {

    static final int DEFAULT_COUNT = 10;

    static Options parse(String[] args, int start) throws UsageException {
        List<String> positional = new ArrayList<>();
        String name = null;
        boolean littleEndian = false;
        List<Integer> inputSplits = null;
        List<Integer> outputSplits = null;
        int count = DEFAULT_COUNT;
        long seed = 0;
        Path out = null;
        Path config = null;
        boolean verbose = false;

        for (int i = start; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--name" -> name = value(args, ++i, arg);
                case "--little-endian" -> littleEndian = true;
                case "--big-endian" -> littleEndian = false;
                case "--input-splits" -> inputSplits = splits(value(args, ++i, arg), arg);
                case "--output-splits" -> outputSplits = splits(value(args, ++i, arg), arg);
                case "--count" -> count = count(value(args, ++i, arg), arg);
                case "--seed" -> seed = number(value(args, ++i, arg), arg);
                case "--out" -> out = Path.of(value(args, ++i, arg));
                case "--config" -> config = Path.of(value(args, ++i, arg));
                case "--verbose", "-v" -> verbose = true;
                default -> {
                    if (arg.startsWith("--")) {
                        throw new UsageException("Unknown option: " + arg);
                    }
                    positional.add(arg);
                }
            }
        }
        return new Options(List.copyOf(positional), name, littleEndian, inputSplits, outputSplits,
                count, seed, out, config, verbose);
    }

    private static String value(String[] args, int index, String option) throws UsageException {
        if (index >= args.length) {
            throw new UsageException(option + " requires a value");
        }
        return args[index];
    }

    private static long number(String text, String option) throws UsageException {
        try {
            return Long.parseLong(text.trim());
        } catch (NumberFormatException e) {
            throw new UsageException(option + " expects a number but got '" + text + "'");
        }
    }

    private static int count(String text, String option) throws UsageException {
        long n = number(text, option);
        if (n < 0 || n > Integer.MAX_VALUE) {
            throw new UsageException(option + " must be between 0 and " + Integer.MAX_VALUE);
        }
        return (int) n;
    }

    private static List<Integer> splits(String text, String option) throws UsageException {
        List<Integer> widths = new ArrayList<>();
        if (text.isBlank()) {
            return widths;
        }
        for (String part : text.split(",")) {
            long width = number(part, option);
            if (width <= 0 || width > Integer.MAX_VALUE) {
                throw new UsageException(option + " widths must be positive, got " + part.trim());
            }
            widths.add((int) width);
        }
        return widths;
    }
}
