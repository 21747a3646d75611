package com.specharvest.infrastructure.cli;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Parsed command line.
 *
 * <pre>
 *   harvest [maxBrands] [maxItemsPerBrand]
 *   brands
 *   listing &lt;slug&gt; [limit]
 *   spec &lt;detailId&gt; [detailId...]
 *   compare &lt;detailId&gt; &lt;detailId&gt;
 * </pre>
 *
 * The command name may be omitted, in which case {@code harvest} is assumed.
 * {@code --output=<file>} writes the output to a file instead of stdout and
 * {@code --format=text} prints spec and compare results as readable text
 * instead of JSON; other {@code --} options belong to Spring and are ignored here.
 */
public record HarvestArguments(Command command, List<String> positionals, String outputFile, Format format) {

    private static final String OUTPUT_OPTION = "--output=";
    private static final String FORMAT_OPTION = "--format=";

    public enum Command {
        HARVEST, BRANDS, LISTING, SPEC, COMPARE
    }

    public enum Format {
        JSON, TEXT
    }

    public static HarvestArguments parse(String... args) {
        List<String> positionals = new ArrayList<>();
        String outputFile = null;
        Format format = Format.JSON;

        for (String arg : args) {
            if (arg.startsWith(OUTPUT_OPTION)) {
                outputFile = arg.substring(OUTPUT_OPTION.length());
            } else if (arg.startsWith(FORMAT_OPTION)) {
                format = parseFormat(arg.substring(FORMAT_OPTION.length()));
            } else if (!arg.startsWith("--")) {
                positionals.add(arg);
            }
        }

        Command command = Command.HARVEST;
        if (!positionals.isEmpty() && isCommand(positionals.get(0))) {
            command = Command.valueOf(positionals.remove(0).toUpperCase(Locale.ROOT));
        }

        if ((command == Command.LISTING || command == Command.SPEC) && positionals.isEmpty()) {
            throw new IllegalArgumentException("Command " + command.name().toLowerCase(Locale.ROOT)
                + " requires an argument");
        }
        if (command == Command.COMPARE && positionals.size() != 2) {
            throw new IllegalArgumentException("Command compare requires exactly two detail ids");
        }
        return new HarvestArguments(command, List.copyOf(positionals), outputFile, format);
    }

    /**
     * Returns the positional argument at the index, or null if absent.
     */
    public String text(int index) {
        return index < positionals.size() ? positionals.get(index) : null;
    }

    /**
     * Returns the positional argument at the index as a non-negative number, or null if absent.
     */
    public Integer number(int index) {
        String value = text(index);
        if (value == null) {
            return null;
        }
        try {
            int number = Integer.parseInt(value);
            if (number < 0) {
                throw new IllegalArgumentException("Argument " + (index + 1) + " must not be negative: " + value);
            }
            return number;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Argument " + (index + 1) + " must be a number: " + value, e);
        }
    }

    private static Format parseFormat(String value) {
        for (Format format : Format.values()) {
            if (format.name().equalsIgnoreCase(value)) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unknown output format: " + value);
    }

    private static boolean isCommand(String value) {
        for (Command command : Command.values()) {
            if (command.name().equalsIgnoreCase(value)) {
                return true;
            }
        }
        return false;
    }
}
