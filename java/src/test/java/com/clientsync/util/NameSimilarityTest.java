package com.clientsync.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for NameSimilarity.
 */
class NameSimilarityTest {

    @Test
    void normalize_DropsCaseAndPunctuation() {
        assertThat(NameSimilarity.normalize("Acme, Corp.")).isEqualTo("acmecorp");
        assertThat(NameSimilarity.normalize(null)).isEmpty();
    }

    @Test
    void similarity_EqualAfterNormalization() {
        assertThat(NameSimilarity.similarity("Acme Corp", "ACME corp!")).isEqualTo(1.0);
    }

    @Test
    void similarity_SubstringScoresByLengthRatio() {
        // 15 of 18 characters
        assertThat(NameSimilarity.similarity("Hockey Think Tank", "Hockey Think Tank 123")).isEqualTo(0.95);
        // 4 of 8 characters
        assertThat(NameSimilarity.similarity("Acme", "Acme Corp")).isEqualTo(0.9);
    }

    @Test
    void similarity_FallsBackToEditDistance() {
        assertThat(NameSimilarity.similarity("Riverstone Media", "Rivurstame Media")).isCloseTo(0.8, within(1e-9));
        assertThat(NameSimilarity.similarity("Riverstone Media", "Rivurstamu Media")).isCloseTo(11.0 / 15, within(1e-9));
        assertThat(NameSimilarity.similarity("Acme Corp", "Zenith Labs")).isEqualTo(0.0);
    }

    @Test
    void similarity_EmptyNamesNeverMatch() {
        assertThat(NameSimilarity.similarity("", "Acme")).isEqualTo(0.0);
        assertThat(NameSimilarity.similarity("!!!", "???")).isEqualTo(0.0);
    }

    @Test
    void editDistance_Classic() {
        assertThat(NameSimilarity.editDistance("kitten", "sitting")).isEqualTo(3);
        assertThat(NameSimilarity.editDistance("", "abc")).isEqualTo(3);
        assertThat(NameSimilarity.editDistance("same", "same")).isZero();
    }

    @Test
    void baseName_StripsTrailingQualifiers() {
        assertThat(NameSimilarity.baseName("Hockey Think Tank 123")).isEqualTo("Hockey Think Tank");
        assertThat(NameSimilarity.baseName("Acme Corp - West")).isEqualTo("Acme Corp");
        assertThat(NameSimilarity.baseName("Acme Corp (UK)")).isEqualTo("Acme Corp");
        assertThat(NameSimilarity.baseName("Acme Corp")).isEqualTo("Acme Corp");
    }

    @Test
    void significantWords_KeepsWordsOfThreeOrMoreCharacters() {
        assertThat(NameSimilarity.significantWords("The Big  Co of Art big"))
                .containsExactly("the", "big", "art");
        assertThat(NameSimilarity.significantWords("A B")).isEmpty();
    }
}
