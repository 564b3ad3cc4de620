package com.cardtally.common.model;

import java.util.List;

/**
 * The fixed set of card symbols a channel keeps counts for.
 *
 * <p>{@link #glyphs()} lists every code point accepted on input for the suit. The emoji
 * variation selector (U+FE0F) that usually trails them is optional; {@link #symbol()} is
 * the canonical form used in rendered output.
 */
public enum Suit {

    HEARTS  ("❤️", "Hearts",   List.of("❤", "♥")),
    DIAMONDS("♦️", "Diamonds", List.of("♦")),
    CLUBS   ("♣️", "Clubs",    List.of("♣")),
    SPADES  ("♠️", "Spades",   List.of("♠"));

    private final String symbol;
    private final String displayName;
    private final List<String> glyphs;

    Suit(String symbol, String displayName, List<String> glyphs) {
        this.symbol      = symbol;
        this.displayName = displayName;
        this.glyphs      = glyphs;
    }

    public String symbol()      { return symbol; }
    public String displayName() { return displayName; }
    public List<String> glyphs() { return glyphs; }
}
