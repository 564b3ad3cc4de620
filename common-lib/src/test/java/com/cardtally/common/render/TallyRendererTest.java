package com.cardtally.common.render;

import com.cardtally.common.model.Suit;
import com.cardtally.common.model.TallySnapshot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TallyRendererTest {

    private final TallySnapshot snapshot = new TallySnapshot("c1",
        Map.of(Suit.HEARTS, 2L, Suit.DIAMONDS, 1L, Suit.SPADES, 1L));

    @Nested
    @DisplayName("renderCounters()")
    class Counters {

        @Test
        @DisplayName("CLASSIC lists every suit, zeros included")
        void classic() {
            String text = TallyRenderer.renderCounters(snapshot, DisplayStyle.CLASSIC);

            assertTrue(text.contains("❤️ Hearts: 2"));
            assertTrue(text.contains("♦️ Diamonds: 1"));
            assertTrue(text.contains("♣️ Clubs: 0"));
            assertTrue(text.contains("♠️ Spades: 1"));
        }

        @Test
        @DisplayName("COMPACT is a single line")
        void compact() {
            assertEquals("❤️ 2 | ♦️ 1 | ♣️ 0 | ♠️ 1",
                TallyRenderer.renderCounters(snapshot, DisplayStyle.COMPACT));
        }

        @Test
        @DisplayName("TOTALS adds shares and the total")
        void totals() {
            String text = TallyRenderer.renderCounters(snapshot, DisplayStyle.TOTALS);

            assertTrue(text.contains("❤️ Hearts: 2 (50%)"));
            assertTrue(text.contains("♣️ Clubs: 0 (0%)"));
            assertTrue(text.endsWith("Total: 4"));
        }

        @Test
        @DisplayName("TOTALS on empty counters does not divide by zero")
        void totalsEmpty() {
            String text = TallyRenderer.renderCounters(TallySnapshot.empty("c1"), DisplayStyle.TOTALS);

            assertTrue(text.contains("❤️ Hearts: 0 (0%)"));
            assertTrue(text.endsWith("Total: 0"));
        }

        @Test
        @DisplayName("suit lines are joined with a bare newline on every host")
        void newlines() {
            for (DisplayStyle style : DisplayStyle.values()) {
                assertFalse(TallyRenderer.renderCounters(snapshot, style).contains("\r"), style.name());
            }
            assertTrue(TallyRenderer.renderCounters(snapshot, DisplayStyle.CLASSIC)
                .contains("❤️ Hearts: 2\n♦️ Diamonds: 1\n"));
        }
    }

    @Test
    @DisplayName("auto report is stamped in UTC+1 whatever the input zone")
    void autoReportTime() {
        ZonedDateTime utc = ZonedDateTime.of(2024, 5, 1, 23, 30, 5, 0, ZoneOffset.UTC);

        String text = TallyRenderer.renderAutoReport(snapshot, utc);

        assertTrue(text.contains("00:30:05 (UTC+1)"));
        assertTrue(text.contains("❤️ Hearts: 2 ✅"));
        assertTrue(text.contains("Counters reset"));
        assertTrue(text.contains("❤️ Hearts: 2 ✅\n♦️ Diamonds: 1 ✅\n"));
        assertFalse(text.contains("\r"));
    }
}
