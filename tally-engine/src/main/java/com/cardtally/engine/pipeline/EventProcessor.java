package com.cardtally.engine.pipeline;

import com.cardtally.common.extraction.CardExtractor;
import com.cardtally.common.model.Suit;
import com.cardtally.common.model.TallySnapshot;
import com.cardtally.common.render.DisplayStyle;
import com.cardtally.common.render.TallyRenderer;
import com.cardtally.common.trace.ChannelMdc;
import com.cardtally.engine.store.CounterStore;
import com.cardtally.engine.store.DedupLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns one message text into counter increments and the reply to send back.
 *
 * <p>Gates run in order and the first failing gate ends processing with no reply:
 * <pre>
 *   confirmation marker → sequence dedup → extraction → increment → render
 * </pre>
 * Only the dedup gate and the increment step write state. Callers hold the channel's
 * lock for the whole call.
 */
public class EventProcessor {

    private static final Logger log = LoggerFactory.getLogger(EventProcessor.class);

    public static final List<String> CONFIRMATION_MARKERS = List.of("✅", "🔰");

    private static final Pattern SEQUENCE_MARKER = Pattern.compile("#n(\\d+)");

    private final CounterStore counterStore;
    private final DedupLedger dedupLedger;
    private final CardExtractor extractor;
    private final DisplayStyle displayStyle;

    public EventProcessor(CounterStore counterStore,
                          DedupLedger dedupLedger,
                          CardExtractor extractor,
                          DisplayStyle displayStyle) {
        this.counterStore = counterStore;
        this.dedupLedger  = dedupLedger;
        this.extractor    = extractor;
        this.displayStyle = displayStyle;
    }

    /**
     * @return the rendered counters after this message was applied, or empty if the
     *         message was rejected at any gate
     */
    public Optional<String> process(String channel, String text) {
        return ChannelMdc.callWithMdc(channel, () -> apply(channel, text));
    }

    private Optional<String> apply(String channel, String text) {
        if (!hasConfirmation(text)) {
            log.debug("Rejected: no confirmation marker. channel={}", channel);
            return Optional.empty();
        }

        Optional<String> sequence = sequenceDigits(text);
        if (sequence.isPresent()) {
            OptionalLong number = parseSequence(sequence.get());
            if (number.isEmpty()) {
                log.debug("Rejected: sequence number out of range. channel={} digits={}", channel, sequence.get());
                return Optional.empty();
            }
            if (!dedupLedger.tryMark(channel, number.getAsLong())) {
                log.debug("Rejected: sequence already counted. channel={} sequence={}", channel, number.getAsLong());
                return Optional.empty();
            }
        }

        Optional<Map<Suit, Integer>> extracted = extractor.extract(text);
        if (extracted.isEmpty() || extracted.get().isEmpty()) {
            log.debug("Rejected: no card symbols found. channel={}", channel);
            return Optional.empty();
        }

        TallySnapshot after = counterStore.incrementAll(channel, extracted.get());
        log.info("Cards counted. channel={} found={} totals={}", channel, extracted.get(), after.counts());
        return Optional.of(TallyRenderer.renderCounters(after, displayStyle));
    }

    static boolean hasConfirmation(String text) {
        if (text == null) {
            return false;
        }
        for (String marker : CONFIRMATION_MARKERS) {
            if (text.contains(marker)) {
                return true;
            }
        }
        return false;
    }

    /** Digits of the first {@code #n<digits>} marker, if any. */
    static Optional<String> sequenceDigits(String text) {
        Matcher m = SEQUENCE_MARKER.matcher(text);
        return m.find() ? Optional.of(m.group(1)) : Optional.empty();
    }

    private static OptionalLong parseSequence(String digits) {
        try {
            return OptionalLong.of(Long.parseLong(digits));
        } catch (NumberFormatException e) {
            return OptionalLong.empty();
        }
    }
}
