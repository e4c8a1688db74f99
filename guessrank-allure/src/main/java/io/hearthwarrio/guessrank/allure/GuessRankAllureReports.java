package io.hearthwarrio.guessrank.allure;

import io.hearthwarrio.guessrank.cli.RankingPresenter;
import io.hearthwarrio.guessrank.core.ScoringLogger;

/**
 * Factory methods for Allure-related GuessRank outputs.
 * <p>
 * This class lives in the guessrank-allure module to avoid leaking Allure
 * dependencies into guessrank-core or guessrank-cli.
 */
public final class GuessRankAllureReports {

    /**
     * Rows repeated in the step title by {@link #ranking()}.
     */
    public static final int DEFAULT_STEP_ROWS = 5;

    private GuessRankAllureReports() {
        // utility class
    }

    /**
     * Creates a presenter that summarizes the top five rows in the step title.
     */
    public static RankingPresenter ranking() {
        return new AllureRankingPresenter(DEFAULT_STEP_ROWS);
    }

    public static RankingPresenter ranking(int stepRows) {
        return new AllureRankingPresenter(stepRows);
    }

    public static ScoringLogger scoring() {
        return new AllureScoringLogger();
    }
}
