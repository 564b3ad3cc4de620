package com.cardtally.common.extraction;

import com.cardtally.common.model.Suit;

import java.util.Map;
import java.util.Optional;

/**
 * Contract for turning message text into per-suit counts.
 *
 * <p>Implementations must be:
 * <ul>
 *   <li><b>Stateless</b>: safe to call concurrently</li>
 *   <li><b>Pure</b>: no logging, no side effects</li>
 * </ul>
 *
 * <p>Current implementation: {@link ParenthesizedCardExtractor}.
 */
public interface CardExtractor {

    /**
     * @param text raw message text, may be {@code null}
     * @return counts keyed by suit containing only positive values, or empty when the text
     *         carries no recognized content
     */
    Optional<Map<Suit, Integer>> extract(String text);
}
