package com.cardtally.common.render;

import com.cardtally.common.model.Suit;
import com.cardtally.common.model.TallySnapshot;

import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.StringJoiner;

/**
 * Pure text rendering of channel counters. No I/O, no clock access: callers pass the
 * report time in.
 */
public final class TallyRenderer {

    /** Reports are stamped in a fixed UTC+1 offset, independent of the host zone. */
    public static final ZoneOffset REPORT_OFFSET = ZoneOffset.ofHours(1);

    private static final DateTimeFormatter REPORT_TIME = DateTimeFormatter.ofPattern("HH:mm:ss");

    private TallyRenderer() {}

    public static String renderCounters(TallySnapshot snapshot, DisplayStyle style) {
        return switch (style) {
            case CLASSIC -> classic(snapshot);
            case COMPACT -> compact(snapshot);
            case TOTALS  -> totals(snapshot);
        };
    }

    /**
     * Renders the periodic report for the counters captured just before the reset.
     *
     * @param snapshot pre-reset counters
     * @param at       report time; converted to {@link #REPORT_OFFSET}
     */
    public static String renderAutoReport(TallySnapshot snapshot, ZonedDateTime at) {
        String time = at.withZoneSameInstant(REPORT_OFFSET).format(REPORT_TIME);
        StringBuilder sb = new StringBuilder();
        sb.append("📊 Automatic counter report\n\n");
        sb.append("🕐 Time: ").append(time).append(" (UTC+1)\n\n");
        for (Suit suit : Suit.values()) {
            sb.append(String.format("%s %s: %d ✅\n", suit.symbol(), suit.displayName(), snapshot.count(suit)));
        }
        sb.append("\n🔄 Counters reset for the next cycle");
        return sb.toString();
    }

    private static String classic(TallySnapshot snapshot) {
        StringBuilder sb = new StringBuilder("📊 Card counters\n\n");
        for (Suit suit : Suit.values()) {
            sb.append(String.format("%s %s: %d\n", suit.symbol(), suit.displayName(), snapshot.count(suit)));
        }
        return sb.toString().stripTrailing();
    }

    private static String compact(TallySnapshot snapshot) {
        StringJoiner line = new StringJoiner(" | ");
        for (Suit suit : Suit.values()) {
            line.add(suit.symbol() + " " + snapshot.count(suit));
        }
        return line.toString();
    }

    private static String totals(TallySnapshot snapshot) {
        long total = snapshot.total();
        StringBuilder sb = new StringBuilder("📊 Card counters\n\n");
        for (Suit suit : Suit.values()) {
            long count = snapshot.count(suit);
            double share = total > 0 ? (double) count / total * 100.0 : 0.0;
            sb.append(String.format("%s %s: %d (%.0f%%)\n", suit.symbol(), suit.displayName(), count, share));
        }
        sb.append("\nTotal: ").append(total);
        return sb.toString();
    }
}
