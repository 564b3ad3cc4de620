package com.cardtally.common.extraction;

import com.cardtally.common.model.Suit;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Counts suit glyphs inside the first parenthesized group of a message.
 *
 * <pre>
 *   "Win #n42 ✅ (♥️♥️♦️) (♠️)"  →  {HEARTS=2, DIAMONDS=1}
 * </pre>
 *
 * <p>Only the first {@code (...)} without nested parentheses is inspected. Both heart
 * glyphs (❤ and ♥) count towards {@link Suit#HEARTS}.
 */
public final class ParenthesizedCardExtractor implements CardExtractor {

    private static final Pattern FIRST_GROUP = Pattern.compile("\\(([^()]*)\\)");

    @Override
    public Optional<Map<Suit, Integer>> extract(String text) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher group = FIRST_GROUP.matcher(text);
        if (!group.find()) {
            return Optional.empty();
        }
        String content = group.group(1);

        EnumMap<Suit, Integer> counts = new EnumMap<>(Suit.class);
        for (Suit suit : Suit.values()) {
            int found = 0;
            for (String glyph : suit.glyphs()) {
                found += occurrences(content, glyph);
            }
            if (found > 0) {
                counts.put(suit, found);
            }
        }
        return counts.isEmpty() ? Optional.empty() : Optional.of(Collections.unmodifiableMap(counts));
    }

    private static int occurrences(String haystack, String needle) {
        int count = 0;
        int from = haystack.indexOf(needle);
        while (from >= 0) {
            count++;
            from = haystack.indexOf(needle, from + needle.length());
        }
        return count;
    }
}
