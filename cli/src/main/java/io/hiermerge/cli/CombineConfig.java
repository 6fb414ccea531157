// file: cli/src/main/java/io/hiermerge/cli/CombineConfig.java
package io.hiermerge.cli;

import io.hiermerge.core.Fragment;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * One combine run, parsed from CLI args.
 *
 * Supports:
 *  - root:        top of the fragment hierarchy
 *  - entity:      entity directory name to combine for
 *  - filespecs:   file name globs (repeatable)
 *  - tags:        requested tags; "all" is always implied
 *  - weight:      default weight of documents without one
 *  - rulesFile:   merge-key table; null means the bundled one
 *  - varsFile:    template variables; null means none
 *  - templating:  how fragment files are rendered before parsing
 *  - output:      which tree(s) to print
 *  - format:      yaml or json
 *  - diagnostics: print merge events to stderr
 *  - help:        print usage and stop
 */
public record CombineConfig(
        Path root,
        String entity,
        List<String> filespecs,
        List<String> tags,
        int weight,
        Path rulesFile,
        Path varsFile,
        Templating templating,
        Output output,
        Format format,
        boolean diagnostics,
        boolean help
) {
    public enum Output { PLAIN, ANNOTATED, BOTH }

    public enum Format { YAML, JSON }

    public enum Templating { JINJA, PLACEHOLDER, OFF }

    static final String USAGE = """
            Usage: hiermerge --root <dir> --entity <name> --filespec <glob> [options]

            Options:
              --root,       -r   Top of the fragment hierarchy (required)
              --entity,     -e   Entity directory name (required)
              --filespec,   -f   File name glob, repeatable (required)
              --tags,       -t   Comma-separated tags (default: all)
              --weight,     -w   Default document weight (default: 1000)
              --rules            Merge-key table, YAML or JSON (default: bundled)
              --vars             Template variables, YAML or JSON (optional)
              --templating       jinja | placeholder | off (default: jinja)
              --output,     -o   plain | annotated | both (default: plain)
              --format           yaml | json (default: yaml)
              --diagnostics, -d  Print merge decisions to stderr
              --help,       -h   Show this help message
            """;

    public CombineConfig {
        filespecs = List.copyOf(filespecs);
        tags = List.copyOf(tags);
        Objects.requireNonNull(templating, "templating");
        Objects.requireNonNull(output, "output");
        Objects.requireNonNull(format, "format");
    }

    /**
     * Very small CLI parser.
     *
     * @throws UsageException on unknown flags, missing values or missing required flags
     */
    public static CombineConfig fromArgs(String[] args) {
        Path root = null;
        String entity = null;
        var filespecs = new ArrayList<String>();
        List<String> tags = List.of();
        int weight = Fragment.DEFAULT_WEIGHT;
        Path rules = null;
        Path vars = null;
        Templating templating = Templating.JINJA;
        Output output = Output.PLAIN;
        Format format = Format.YAML;
        boolean diagnostics = false;
        boolean help = false;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--help", "-h" -> help = true;

                case "--root", "-r" -> root = Path.of(valueOf(args, ++i));

                case "--entity", "-e" -> entity = valueOf(args, ++i);

                case "--filespec", "-f" -> filespecs.add(valueOf(args, ++i));

                case "--tags", "-t" -> tags = Arrays.stream(valueOf(args, ++i).split(","))
                        .map(String::trim)
                        .filter(t -> !t.isEmpty())
                        .toList();

                case "--weight", "-w" -> {
                    String raw = valueOf(args, ++i);
                    try {
                        weight = Integer.parseInt(raw);
                    } catch (NumberFormatException e) {
                        throw new UsageException("Invalid weight: " + raw);
                    }
                }

                case "--rules" -> rules = Path.of(valueOf(args, ++i));

                case "--vars" -> vars = Path.of(valueOf(args, ++i));

                case "--templating" -> templating = parseEnum(Templating.class, "templating", valueOf(args, ++i));

                case "--output", "-o" -> output = parseEnum(Output.class, "output", valueOf(args, ++i));

                case "--format" -> format = parseEnum(Format.class, "format", valueOf(args, ++i));

                case "--diagnostics", "-d" -> diagnostics = true;

                default -> throw new UsageException("Unknown option: " + args[i]);
            }
        }

        if (!help) {
            if (root == null) throw new UsageException("Missing required option: --root");
            if (entity == null || entity.isBlank()) throw new UsageException("Missing required option: --entity");
            if (filespecs.isEmpty()) throw new UsageException("Missing required option: --filespec");
        }
        return new CombineConfig(root, entity, filespecs, tags, weight, rules, vars, templating, output, format, diagnostics, help);
    }

    private static String valueOf(String[] args, int i) {
        if (i >= args.length) {
            throw new UsageException("Missing value for option: " + args[i - 1]);
        }
        return args[i];
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String option, String raw) {
        try {
            return Enum.valueOf(type, raw.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new UsageException("Invalid %s: %s".formatted(option, raw));
        }
    }
}
