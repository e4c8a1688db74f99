package io.hearthwarrio.guessrank.core;

import java.util.List;

/**
 * Picks the best scored words.
 */
public interface RankSelector {

    /**
     * Select the {@code k} lowest scored words, ordered ascending by score.
     *
     * @param words  scored words
     * @param scores scores, {@code scores[i]} belongs to {@code words.get(i)}
     * @param k      number of words to return; values above {@code words.size()} return all
     * @return {@code min(k, words.size())} ranked words, ascending by score
     * @throws IllegalArgumentException if {@code k < 0} or sizes differ
     */
    List<RankedWord> selectBest(List<Word> words, long[] scores, int k);

    /**
     * All words, ascending by score.
     */
    default List<RankedWord> selectAll(List<Word> words, long[] scores) {
        return selectBest(words, scores, words.size());
    }
}
