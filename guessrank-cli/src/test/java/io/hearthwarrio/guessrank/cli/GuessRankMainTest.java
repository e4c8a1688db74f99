package io.hearthwarrio.guessrank.cli;

import io.hearthwarrio.guessrank.core.RankedWord;
import io.hearthwarrio.guessrank.core.Word;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class GuessRankMainTest {

    @TempDir
    Path dir;

    @Test
    void ranksWordsFromFilesAndPrintsThem() throws IOException {
        Path words = write("words.txt", "[\"AAAAA\", \"ABCDE\", \"bad\"]");
        Path targets = write("targets.txt", "[\"EDCBA\"]");

        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        GuessRankMain main = new GuessRankMain(
                new StdOutRankingPresenter(new PrintStream(buffer, true, StandardCharsets.UTF_8)));

        int status = main.execute("--words", words.toString(), "--targets", targets.toString(), "--quiet");

        assertEquals(GuessRankMain.EXIT_OK, status);
        assertEquals("AAAAA 1\nABCDE 1\n", buffer.toString(StandardCharsets.UTF_8));
    }

    @Test
    void passesRequestedCountToPresenter() throws IOException {
        Path words = write("w.txt", "\"cigar\" \"zzzzz\" \"shake\"");
        Path targets = write("t.txt", "\"cigar\" \"rebut\" \"sissy\" \"humph\" \"awake\"");
        List<Integer> requested = new ArrayList<>();
        GuessRankMain main = new GuessRankMain((ranking, count) -> requested.add(count));

        List<RankedWord> ranking = main.run(GuessRankOptions.parse(
                "--words", words.toString(), "--targets", targets.toString(), "--count", "2", "--workers", "2", "--quiet"));

        assertEquals(List.of(2), requested);
        assertEquals(2, ranking.size());
        assertFalse(ranking.stream().anyMatch(r -> r.getWord().equals(Word.of("zzzzz"))));
    }

    @Test
    void missingFileFails() {
        GuessRankMain main = new GuessRankMain((ranking, count) -> fail("nothing to present"));
        int status = main.execute("--words", dir.resolve("absent.txt").toString(), "--quiet");
        assertEquals(GuessRankMain.EXIT_FAILURE, status);
    }

    @Test
    void badArgumentsAreUsageErrors() {
        GuessRankMain main = new GuessRankMain((ranking, count) -> fail("nothing to present"));
        assertEquals(GuessRankMain.EXIT_USAGE, main.execute("--count"));
        assertEquals(GuessRankMain.EXIT_OK, main.execute("--help"));
    }

    @Test
    void stdOutPresenterPrintsWordAndScore() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        new StdOutRankingPresenter(new PrintStream(buffer, true, StandardCharsets.UTF_8)).present(
                Arrays.asList(new RankedWord(Word.of("raise"), 61), new RankedWord(Word.of("arise"), 63)), 2);
        assertEquals("raise 61\narise 63\n", buffer.toString(StandardCharsets.UTF_8));
    }

    private Path write(String name, String content) throws IOException {
        Path file = dir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }
}
