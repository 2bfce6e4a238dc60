package com.portfolioscanner.common.sentiment;

import com.portfolioscanner.common.exception.LexiconLoadException;
import com.portfolioscanner.common.model.SentimentClass;
import com.portfolioscanner.common.model.SentimentResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SentimentScorerTest {

    private static final double EPS = 1e-9;

    private static final SentimentLexicon LEXICON = new SentimentLexicon(
        List.of("strong", "growth", "gain"),
        List.of("weak", "falls", "loss"),
        List.of("record high"),
        List.of("sell-off", "off now"));

    private final SentimentScorer scorer = new SentimentScorer(LEXICON);

    @Nested
    @DisplayName("score() classification")
    class Classification {

        @Test
        @DisplayName("only positive words → positive, confidence = positive score")
        void positive() {
            SentimentResult r = scorer.score("Strong growth ahead");
            assertEquals(SentimentClass.POSITIVE, r.classification());
            assertEquals(2.0 / 3, r.positiveScore(), EPS);
            assertEquals(r.positiveScore(), r.confidence(), EPS);
            assertEquals(2, r.positiveCount());
            assertEquals(0, r.negativeCount());
        }

        @Test
        @DisplayName("more negative than positive → negative")
        void negative() {
            SentimentResult r = scorer.score("weak quarter, stock falls despite gain");
            assertEquals(SentimentClass.NEGATIVE, r.classification());
            assertEquals(2.0 / 6, r.confidence(), EPS);
        }

        @Test
        @DisplayName("equal scores → neutral with confidence exactly 0.5")
        void tie() {
            SentimentResult r = scorer.score("strong but weak");
            assertEquals(SentimentClass.NEUTRAL, r.classification());
            assertEquals(0.5, r.confidence(), EPS);
            assertEquals(r.positiveScore(), r.negativeScore(), EPS);
        }

        @Test
        @DisplayName("no lexicon hits → neutral 0.5 with zero scores")
        void noHits() {
            SentimentResult r = scorer.score("markets were quiet today");
            assertEquals(SentimentClass.NEUTRAL, r.classification());
            assertEquals(0.5, r.confidence(), EPS);
            assertEquals(0.0, r.positiveScore(), EPS);
        }
    }

    @Nested
    @DisplayName("score() edge cases")
    class EdgeCases {

        @Test
        @DisplayName("empty, null or token-free text → neutral, zero scores")
        void emptyText() {
            for (String text : new String[] {"", null, "!!! ..."}) {
                SentimentResult r = scorer.score(text);
                assertEquals(SentimentClass.NEUTRAL, r.classification());
                assertEquals(0.5, r.confidence(), EPS);
                assertEquals(0.0, r.positiveScore(), EPS);
                assertEquals(0.0, r.negativeScore(), EPS);
            }
        }

        @Test
        @DisplayName("phrase adds 2, once per phrase even when repeated")
        void phraseWeight() {
            SentimentResult once = scorer.score("sell-off");
            assertEquals(2, once.negativeCount());
            SentimentResult twice = scorer.score("sell-off sell-off");
            assertEquals(2, twice.negativeCount());
            assertEquals(0.5, twice.negativeScore(), EPS);
        }

        @Test
        @DisplayName("overlapping phrases on a short text are capped at 1.0")
        void scoreCapped() {
            SentimentResult r = scorer.score("sell-off now");
            assertEquals(4, r.negativeCount());
            assertEquals(1.0, r.negativeScore(), EPS);
            assertEquals(1.0, r.confidence(), EPS);
        }

        @Test
        @DisplayName("word in both sets counts as positive only")
        void positivePrecedence() {
            SentimentScorer overlapping = new SentimentScorer(new SentimentLexicon(
                List.of("mixed"), List.of("mixed"), List.of(), List.of()));
            SentimentResult r = overlapping.score("mixed");
            assertEquals(1, r.positiveCount());
            assertEquals(0, r.negativeCount());
            assertEquals(SentimentClass.POSITIVE, r.classification());
        }

        @Test
        @DisplayName("confidence always within [0, 1]")
        void confidenceBounded() {
            for (String text : List.of("gain", "sell-off now", "record high record high gain", "loss loss")) {
                double c = scorer.score(text).confidence();
                assertTrue(c >= 0.0 && c <= 1.0, text + " → " + c);
            }
        }

        @Test
        @DisplayName("both sides past 1.0 → side with the larger raw ratio wins")
        void uncappedComparison() {
            SentimentScorer heavy = new SentimentScorer(new SentimentLexicon(
                List.of(), List.of("short", "squeeze", "rally"),
                List.of("short squeeze", "squeeze rally"), List.of()));
            SentimentResult r = heavy.score("Short squeeze rally");
            assertEquals(4, r.positiveCount());
            assertEquals(3, r.negativeCount());
            assertEquals(SentimentClass.POSITIVE, r.classification());
            assertEquals(1.0, r.positiveScore(), EPS);
            assertEquals(1.0, r.negativeScore(), EPS);
            assertEquals(1.0, r.confidence(), EPS);
        }

        @Test
        @DisplayName("accented words stay one token")
        void unicodeTokens() {
            assertEquals(List.of("naïve", "growth"), SentimentScorer.tokenize("naïve growth"));
            assertEquals(2.0 / 4, scorer.score("Société Générale growth gain").positiveScore(), EPS);
        }
    }

    @Nested
    @DisplayName("lexicon validation")
    class LexiconValidation {

        @Test
        @DisplayName("single word in a phrase list → LexiconLoadException")
        void singleWordPhrase() {
            assertThrows(LexiconLoadException.class, () -> new SentimentLexicon(
                List.of("up"), List.of("down"), List.of("rally"), List.of()));
        }

        @Test
        @DisplayName("phrase in a word list → LexiconLoadException")
        void phraseInWords() {
            assertThrows(LexiconLoadException.class, () -> new SentimentLexicon(
                List.of("bull market"), List.of("down"), List.of(), List.of()));
        }
    }

    @Nested
    @DisplayName("bundled lexicon")
    class Bundled {

        private final SentimentScorer bundled = SentimentScorer.withDefaults();

        @Test
        @DisplayName("growth headline → positive")
        void relianceHeadline() {
            SentimentResult r = bundled.score(
                "Reliance Industries reports strong Q3 results with 15% growth in revenue");
            assertEquals(SentimentClass.POSITIVE, r.classification());
            assertEquals(2.0 / 11, r.confidence(), EPS);
        }

        @Test
        @DisplayName("disappointing earnings headline → negative")
        void tcsHeadline() {
            SentimentResult r = bundled.score("TCS announces disappointing earnings, stock falls 8%");
            assertEquals(SentimentClass.NEGATIVE, r.classification());
            assertEquals(4, r.negativeCount());
            assertEquals(4.0 / 7, r.confidence(), EPS);
        }
    }
}
