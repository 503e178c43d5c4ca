package com.marketalert.common.format;

import com.marketalert.common.model.AlertKind;
import com.marketalert.common.model.DerivativeEvent;
import com.marketalert.common.model.InsiderTrade;
import com.marketalert.common.model.InstrumentSnapshot;
import com.marketalert.common.rule.PrimaryEvaluation;

import java.util.List;
import java.util.Locale;

/**
 * Plain-text message bodies for the messaging sink. Pure string building; all numbers are
 * rendered with {@link Locale#US} so output does not depend on the host locale.
 */
public final class AlertMessageFormatter {

    static final int ERROR_DETAIL_LIMIT = 100;

    private AlertMessageFormatter() {}

    public static String bidMatch(InstrumentSnapshot s, AlertKind kind) {
        String title = kind == AlertKind.BID_MATCH_EXACT ? "EXACT BID MATCH" : "HIGH VALUE BID";
        return fmt("⚡ %s: %s%n$%,.2f with %,d shares%nPrice: $%,.2f (%+.2f%%)",
            title, s.symbol(), s.bid(), s.bidSize(), s.price(), s.changePercent());
    }

    public static String volumeSpike(PrimaryEvaluation e) {
        InstrumentSnapshot s = e.snapshot();
        return fmt("📈 VOLUME SPIKE: %s%nVolume: %,d (avg %,.0f, %dx threshold %,.0f)%nPrice: $%,.2f (%+.2f%%)",
            s.symbol(), s.volume(), e.baseline().orElse(0.0), e.multiplier(), e.spikeThreshold(),
            s.price(), s.changePercent());
    }

    public static String insiderActivity(InstrumentSnapshot s, InsiderTrade t) {
        return fmt("🕵️ UNUSUAL INSIDER ACTIVITY: %s%n%s %,d shares%s%nPrice: $%,.2f (%+.2f%%)",
            s.symbol(), t.type(), t.shares(), insiderSuffix(t), s.price(), s.changePercent());
    }

    public static String halt(InstrumentSnapshot s) {
        return fmt("⛔ TRADING HALT: %s%nLast: $%,.2f (%+.2f%%)", s.symbol(), s.price(), s.changePercent());
    }

    public static String unusualOptions(DerivativeEvent e) {
        String ratio = e.volumeToOpenInterest().isPresent()
            ? fmt("%.1fx", e.volumeToOpenInterest().getAsDouble())
            : "n/a";
        return fmt("🎯 UNUSUAL OPTIONS: %s%n%s %s strike %,.2f exp %s%nVolume: %,d | OI: %,d | Vol/OI: %s",
            e.underlying(), e.contract(), nullToDash(e.contractType()), e.strike(),
            nullToDash(e.expiration()), e.volume(), e.openInterest(), ratio);
    }

    public static String largeSale(InsiderTrade t) {
        return fmt("🔻 LARGE INSIDER SALE: %s%n%,d shares%s", t.symbol(), t.shares(), insiderSuffix(t));
    }

    public static String summary(List<InstrumentSnapshot> ranked) {
        StringBuilder sb = new StringBuilder();
        sb.append(fmt("🏆 TOP %d GAINERS:%n", ranked.size()));
        int rank = 1;
        for (InstrumentSnapshot s : ranked) {
            sb.append(fmt("%d. %s: $%,.2f (%+.2f%%)%n", rank++, s.symbol(), s.price(), s.changePercent()));
        }
        return sb.toString().stripTrailing();
    }

    public static String startup() {
        return "🤖 Market alert bot started";
    }

    public static String marketOpen(String zone, int openHour, int closeHour) {
        return fmt("🔔 Market window open (%02d:00–%02d:00 %s). Scanning started.", openHour, closeHour, zone);
    }

    public static String heartbeat(long ticks) {
        return fmt("💤 Bot alive - Market closed%nScans: %d", ticks);
    }

    public static String shutdown() {
        return "🛑 Bot stopped";
    }

    public static String error(String taskName, Throwable error) {
        String detail = String.valueOf(error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage());
        if (detail.length() > ERROR_DETAIL_LIMIT) {
            detail = detail.substring(0, ERROR_DETAIL_LIMIT);
        }
        return fmt("💥 Task %s failed: %s", taskName, detail);
    }

    // ── helpers ────────────────────────────────────────────────────────────

    private static String insiderSuffix(InsiderTrade t) {
        StringBuilder sb = new StringBuilder();
        if (t.price() > 0) {
            sb.append(fmt(" @ $%,.2f", t.price()));
        }
        if (t.insider() != null && !t.insider().isBlank()) {
            sb.append(" by ").append(t.insider());
        }
        return sb.toString();
    }

    private static String nullToDash(String value) {
        return value == null || value.isBlank() ? "-" : value;
    }

    private static String fmt(String pattern, Object... args) {
        return String.format(Locale.US, pattern, args);
    }
}
