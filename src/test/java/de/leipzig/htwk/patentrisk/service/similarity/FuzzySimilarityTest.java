package de.leipzig.htwk.patentrisk.service.similarity;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Locale;

import org.junit.jupiter.api.Test;

class FuzzySimilarityTest {

    @Test
    void identicalTextsScoreOne() {
        assertEquals(1.0, FuzzySimilarity.similarity("A valve with a spring", "A valve with a spring"));
    }

    @Test
    void wordOrderCaseAndPunctuationDoNotMatter() {
        assertEquals(1.0, FuzzySimilarity.similarity("Spring-loaded VALVE, housing", "housing valve loaded spring"));
    }

    @Test
    void tokenSubsetScoresOne() {
        assertEquals(1.0, FuzzySimilarity.similarity("motion vectors", "compressing video using motion vectors"));
    }

    @Test
    void emptyTextScoresZero() {
        assertEquals(0.0, FuzzySimilarity.similarity("", "anything"));
        assertEquals(0.0, FuzzySimilarity.similarity(null, "anything"));
        assertEquals(0.0, FuzzySimilarity.similarity("  ", " ,, "));
    }

    @Test
    void isSymmetric() {
        String a = "A system for compressing video using motion vectors";
        String b = "A method for compressing video streams using predicted motion vectors";
        assertEquals(FuzzySimilarity.similarity(a, b), FuzzySimilarity.similarity(b, a));
    }

    @Test
    void sharedVocabularyScoresHigherThanUnrelatedText() {
        String query = "A system for compressing video using motion vectors";
        double related = FuzzySimilarity.similarity(query, "A method for compressing video streams using predicted motion vectors");
        double unrelated = FuzzySimilarity.similarity(query, "Herbicidal composition containing glyphosate salts");

        assertTrue(related > 0.9, "related: " + related);
        assertTrue(unrelated < related);
        assertTrue(unrelated >= 0.0 && unrelated <= 1.0);
    }

    @Test
    void ratioIsNormalizedEditSimilarity() {
        assertEquals(1.0, FuzzySimilarity.ratio("", ""));
        assertEquals(0.0, FuzzySimilarity.ratio("abc", "xyz"));
        // lcs "abc" of "abcd" and "abce": 1 - 2/8
        assertEquals(0.75, FuzzySimilarity.ratio("abcd", "abce"), 1e-12);
    }

    @Test
    void tokenizeKeepsFirstOccurrenceOrder() {
        assertEquals(List.of("b", "a", "c"), List.copyOf(FuzzySimilarity.tokenize("B a, b; C")));
    }

    @Test
    void uppercaseTextNormalizesTheSameUnderTurkishLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            assertEquals(List.of("limit", "index"), List.copyOf(FuzzySimilarity.tokenize("LIMIT INDEX")));
            assertEquals(1.0, FuzzySimilarity.similarity("WIRELESS DEVICE", "wireless device"));
        } finally {
            Locale.setDefault(previous);
        }
    }
}
