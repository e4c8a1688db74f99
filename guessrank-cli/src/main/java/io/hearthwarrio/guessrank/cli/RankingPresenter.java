package io.hearthwarrio.guessrank.cli;

import io.hearthwarrio.guessrank.core.RankedWord;

import java.util.List;

/**
 * Receives the final ranking for output.
 * <p>
 * Implementations may print to stdout, attach to Allure, write files, etc.
 */
@FunctionalInterface
public interface RankingPresenter {

    /**
     * @param ranking        ranked words, ascending by score, at most {@code requestedCount} entries
     * @param requestedCount how many entries were asked for
     */
    void present(List<RankedWord> ranking, int requestedCount);
}
