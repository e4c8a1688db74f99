package io.hearthwarrio.guessrank.allure;

import io.hearthwarrio.guessrank.cli.GuessRankOptions;
import io.hearthwarrio.guessrank.cli.RankingPresenter;
import io.hearthwarrio.guessrank.core.RankedWord;
import io.qameta.allure.Allure;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Allure presenter for rankings: one step per ranking with the table attached as text.
 * <p>
 * Lives in guessrank-allure to avoid leaking Allure dependency into core/cli.
 */
public final class AllureRankingPresenter implements RankingPresenter {

    private final int maxStepRows;

    /**
     * @param maxStepRows how many rows are repeated in the step title summary; the attachment always has all rows
     */
    public AllureRankingPresenter(int maxStepRows) {
        this.maxStepRows = Math.max(0, maxStepRows);
    }

    @Override
    public void present(List<RankedWord> ranking, int requestedCount) {
        String title = stepTitle(ranking, requestedCount, maxStepRows);

        Allure.step(title, () -> {
            byte[] txt = renderTable(ranking).getBytes(StandardCharsets.UTF_8);
            Allure.addAttachment(
                    "Ranking",
                    "text/plain",
                    new ByteArrayInputStream(txt),
                    ".txt"
            );
        });
    }

    static String stepTitle(List<RankedWord> ranking, int requestedCount, int maxRows) {
        StringBuilder sb = new StringBuilder(64);
        sb.append("GuessRank: ").append(ranking.size()).append(" word(s)");
        if (requestedCount != GuessRankOptions.ALL) {
            sb.append(" of ").append(requestedCount).append(" requested");
        }
        int shown = Math.min(maxRows, ranking.size());
        for (int i = 0; i < shown; i++) {
            RankedWord r = ranking.get(i);
            sb.append(i == 0 ? " – " : ", ").append(r.getWord().getLetters()).append('=').append(r.getScore());
        }
        return sb.toString();
    }

    static String renderTable(List<RankedWord> ranking) {
        StringBuilder sb = new StringBuilder(32 + ranking.size() * 24);
        sb.append("rank\tword\tscore\n");
        int rank = 1;
        for (RankedWord r : ranking) {
            sb.append(rank++).append('\t')
                    .append(r.getWord().getLetters()).append('\t')
                    .append(r.getScore()).append('\n');
        }
        return sb.toString();
    }
}
