package com.cardtally.bot.message;

import com.cardtally.engine.report.AutoReportScheduler;

/**
 * Fixed user-facing texts for the channel commands.
 */
public final class BotMessages {

    public static final String RESET_CONFIRMATION =
        "✅ Reset done for this channel\n\n"
        + "📊 Counters set to zero\n"
        + "⏰ Automatic reports stopped\n"
        + "🔄 Message history cleared\n"
        + "⏳ Pending edits cancelled";

    public static final String AUTO_REPORT_USAGE =
        "⏰ /time command\n\n"
        + "Sets the interval for automatic reports.\n\n"
        + "📝 Usage: /time [minutes]\n"
        + "📊 Example: /time 15\n\n"
        + "⏱️ Allowed interval: " + AutoReportScheduler.MIN_INTERVAL_MINUTES
        + " to " + AutoReportScheduler.MAX_INTERVAL_MINUTES + " minutes\n\n"
        + "💡 The report is sent automatically and the counters are reset after each report.";

    public static final String AUTO_REPORT_CANCELLED = "⏹️ Automatic reports stopped for this channel";

    public static final String AUTO_REPORT_NOT_ACTIVE = "ℹ️ No automatic report was active for this channel";

    public static final String HELP =
        "🤖 Card Counting Bot 🃏\n\n"
        + "I count cards separately for each channel.\n\n"
        + "📝 How it works:\n"
        + "• Post a confirmed message (✅ or 🔰) with cards in parentheses\n"
        + "• Example: Draw result ✅ (❤️♦️♣️♠️)\n"
        + "• Each symbol is counted automatically\n\n"
        + "🎯 Recognized symbols:\n"
        + "❤️ Hearts • ♦️ Diamonds • ♣️ Clubs • ♠️ Spades\n\n"
        + "💡 Commands:\n"
        + "• /reset - Reset the counters\n"
        + "• /time [minutes] - Configure automatic reports ("
        + AutoReportScheduler.MIN_INTERVAL_MINUTES + "-" + AutoReportScheduler.MAX_INTERVAL_MINUTES + " min)\n\n"
        + "⚡ Active and ready to count!";

    public static final String WELCOME =
        "👋 Hello everyone! 🃏\n\n"
        + "I am the Card Counting Bot.\n\n"
        + "🎯 I count every card symbol you put between parentheses in your messages.\n\n"
        + "📋 Counters are kept separately per channel.\n\n"
        + "🃏 Recognized cards:\n"
        + "❤️ Hearts • ♦️ Diamonds • ♣️ Clubs • ♠️ Spades\n\n"
        + "💡 Commands:\n"
        + "• /reset - Reset this channel's counters\n"
        + "• /time [minutes] - Automatic reports ("
        + AutoReportScheduler.MIN_INTERVAL_MINUTES + "-" + AutoReportScheduler.MAX_INTERVAL_MINUTES + " min)\n"
        + "• /start - Show this help again";

    private BotMessages() {}

    public static String intervalOutOfRange(String requested) {
        return "❌ Interval error\n\n"
            + "The interval must be between " + AutoReportScheduler.MIN_INTERVAL_MINUTES
            + " and " + AutoReportScheduler.MAX_INTERVAL_MINUTES + " minutes.\n"
            + "You entered: " + requested + " minutes";
    }

    public static String autoReportConfigured(int minutes) {
        return "✅ Automatic report configured\n\n"
            + "⏰ Interval: " + minutes + " minutes\n"
            + "🕐 Next run: in " + minutes + " minutes\n\n"
            + "📊 The report is stamped in UTC+1, then the counters are reset.";
    }
}
