package io.hearthwarrio.guessrank.cli;

import io.hearthwarrio.guessrank.core.GuessRanker;
import io.hearthwarrio.guessrank.core.RankedWord;
import io.hearthwarrio.guessrank.core.ScoringException;
import io.hearthwarrio.guessrank.core.StdOutScoringLogger;
import io.hearthwarrio.guessrank.core.Word;

import java.io.IOException;
import java.util.List;
import java.util.Objects;

/**
 * Command line entry point: loads candidate and target word lists, ranks candidates and prints the best ones.
 */
public final class GuessRankMain {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private final RankingPresenter presenter;

    public GuessRankMain() {
        this(new StdOutRankingPresenter());
    }

    public GuessRankMain(RankingPresenter presenter) {
        this.presenter = Objects.requireNonNull(presenter, "presenter must not be null");
    }

    public static void main(String[] args) {
        int status = new GuessRankMain().execute(args);
        if (status != EXIT_OK) {
            System.exit(status);
        }
    }

    /**
     * Parses arguments and runs. Errors are reported to stderr.
     *
     * @return process exit status
     */
    int execute(String... args) {
        GuessRankOptions options;
        try {
            options = GuessRankOptions.parse(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(GuessRankOptions.USAGE);
            return EXIT_USAGE;
        }

        if (options.isHelp()) {
            System.out.println(GuessRankOptions.USAGE);
            return EXIT_OK;
        }

        try {
            run(options);
            return EXIT_OK;
        } catch (IOException e) {
            System.err.println("Cannot read word list: " + e.getMessage());
            return EXIT_FAILURE;
        } catch (ScoringException e) {
            System.err.println("Scoring failed: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    /**
     * Loads both word lists, ranks and presents the result.
     *
     * @return presented ranking
     */
    public List<RankedWord> run(GuessRankOptions options) throws IOException {
        Objects.requireNonNull(options, "options must not be null");

        WordListLoader loader = new WordListLoader(!options.isQuiet());
        List<Word> candidates = loader.load(options.getWordsFile());
        List<Word> targets = loader.load(options.getTargetsFile());

        GuessRanker ranker = new GuessRanker(
                options.getWorkers(),
                options.isQuiet() ? null : new StdOutScoringLogger()
        );
        List<RankedWord> ranking = ranker.rank(candidates, targets, options.getCount());
        presenter.present(ranking, options.getCount());
        return ranking;
    }
}
