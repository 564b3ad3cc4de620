package com.cardtally.common.render;

/**
 * Layout selector for the reply sent after a counted message.
 */
public enum DisplayStyle {
    /** One line per suit with its name. */
    CLASSIC,
    /** All suits on a single line. */
    COMPACT,
    /** One line per suit with its share of the total, plus the total. */
    TOTALS
}
