package io.hearthwarrio.guessrank.cli;

import io.hearthwarrio.guessrank.core.RankedWord;

import java.io.PrintStream;
import java.util.List;
import java.util.Objects;

/**
 * Prints one {@code word score} line per ranked word.
 */
public final class StdOutRankingPresenter implements RankingPresenter {

    private final PrintStream out;

    public StdOutRankingPresenter() {
        this(System.out);
    }

    public StdOutRankingPresenter(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out must not be null");
    }

    @Override
    public void present(List<RankedWord> ranking, int requestedCount) {
        StringBuilder sb = new StringBuilder(ranking.size() * 16);
        for (RankedWord r : ranking) {
            sb.append(r.getWord().getLetters()).append(' ').append(r.getScore()).append('\n');
        }
        out.print(sb);
        out.flush();
    }
}
