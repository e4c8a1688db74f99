package io.hearthwarrio.guessrank.cli;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;

/**
 * Command line options.
 * <p>
 * Supported arguments:
 * <ul>
 *   <li>{@code --words <file>} candidate guesses, default {@code words.txt}</li>
 *   <li>{@code --targets <file>} possible solutions, default {@code targets.txt}</li>
 *   <li>{@code --count <n|all>} number of best words to show, default {@code all}</li>
 *   <li>{@code --workers <n>} scoring threads, default one per processor</li>
 *   <li>{@code --quiet} no progress output</li>
 *   <li>{@code --help}</li>
 * </ul>
 */
public final class GuessRankOptions {

    public static final String USAGE =
            "Usage: guessrank [--words <file>] [--targets <file>] [--count <n|all>] [--workers <n>] [--quiet] [--help]";

    /**
     * Value of {@link #getCount()} when all words are requested.
     */
    public static final int ALL = Integer.MAX_VALUE;

    private Path wordsFile = Paths.get("words.txt");
    private Path targetsFile = Paths.get("targets.txt");
    private int count = ALL;
    private int workers = 0;
    private boolean quiet = false;
    private boolean help = false;

    private GuessRankOptions() {
    }

    /**
     * @param args command line arguments
     * @return parsed options
     * @throws IllegalArgumentException on unknown options or bad values
     */
    public static GuessRankOptions parse(String... args) {
        Objects.requireNonNull(args, "args must not be null");

        GuessRankOptions o = new GuessRankOptions();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--words":
                    o.wordsFile = Paths.get(value(args, ++i, arg));
                    break;
                case "--targets":
                    o.targetsFile = Paths.get(value(args, ++i, arg));
                    break;
                case "--count":
                    o.count = parseCount(value(args, ++i, arg));
                    break;
                case "--workers":
                    o.workers = parseInt(value(args, ++i, arg), arg);
                    if (o.workers < 1) {
                        throw new IllegalArgumentException("--workers must be at least 1: " + o.workers);
                    }
                    break;
                case "--quiet":
                    o.quiet = true;
                    break;
                case "--help":
                case "-h":
                    o.help = true;
                    break;
                default:
                    throw new IllegalArgumentException("Unknown option: " + arg);
            }
        }
        return o;
    }

    private static String value(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new IllegalArgumentException("Missing value for " + option);
        }
        return args[index];
    }

    private static int parseCount(String v) {
        if ("all".equalsIgnoreCase(v)) {
            return ALL;
        }
        int n = parseInt(v, "--count");
        if (n < 0) {
            // negative count means everything
            return ALL;
        }
        return n;
    }

    private static int parseInt(String v, String option) {
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + option + ": '" + v + "'", e);
        }
    }

    public Path getWordsFile() {
        return wordsFile;
    }

    public Path getTargetsFile() {
        return targetsFile;
    }

    public int getCount() {
        return count;
    }

    /**
     * @return worker count, or 0 for one per processor
     */
    public int getWorkers() {
        return workers;
    }

    public boolean isQuiet() {
        return quiet;
    }

    public boolean isHelp() {
        return help;
    }

    @Override
    public String toString() {
        return "GuessRankOptions{" +
                "wordsFile=" + wordsFile +
                ", targetsFile=" + targetsFile +
                ", count=" + (count == ALL ? "all" : String.valueOf(count)) +
                ", workers=" + workers +
                ", quiet=" + quiet +
                '}';
    }
}
