package com.cardtally.common.extraction;

import com.cardtally.common.model.Suit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ParenthesizedCardExtractorTest {

    private final ParenthesizedCardExtractor extractor = new ParenthesizedCardExtractor();

    @Test
    @DisplayName("counts suits inside the parentheses")
    void countsSuits() {
        Map<Suit, Integer> counts = extractor.extract("Win #n42 ✅ (♥️♥️♦️)").orElseThrow();

        assertEquals(Map.of(Suit.HEARTS, 2, Suit.DIAMONDS, 1), counts);
    }

    @Test
    @DisplayName("both heart glyphs are merged under HEARTS")
    void mergesHeartGlyphs() {
        Map<Suit, Integer> counts = extractor.extract("(❤️♥️❤️♠️♣️)").orElseThrow();

        assertEquals(3, counts.get(Suit.HEARTS));
        assertEquals(1, counts.get(Suit.SPADES));
        assertEquals(1, counts.get(Suit.CLUBS));
        assertFalse(counts.containsKey(Suit.DIAMONDS));
    }

    @Test
    @DisplayName("variation selector is optional")
    void bareGlyphsCount() {
        Map<Suit, Integer> counts = extractor.extract("(♠♠♦)").orElseThrow();

        assertEquals(Map.of(Suit.SPADES, 2, Suit.DIAMONDS, 1), counts);
    }

    @Test
    @DisplayName("only the first group is inspected")
    void firstGroupOnly() {
        Map<Suit, Integer> counts = extractor.extract("♣️ outside (♦️) then (♠️♠️)").orElseThrow();

        assertEquals(Map.of(Suit.DIAMONDS, 1), counts);
    }

    @Test
    @DisplayName("no parentheses → empty")
    void noGroup() {
        assertEquals(Optional.empty(), extractor.extract("✅ ♥️♦️ without brackets"));
    }

    @Test
    @DisplayName("parentheses without recognized symbols → empty")
    void groupWithoutSymbols() {
        assertEquals(Optional.empty(), extractor.extract("✅ (K Q J 10)"));
    }

    @Test
    @DisplayName("null text → empty")
    void nullText() {
        assertEquals(Optional.empty(), extractor.extract(null));
    }
}
