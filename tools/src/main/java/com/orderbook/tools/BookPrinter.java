package com.orderbook.tools;

import com.orderbook.common.PriceUtil;
import com.orderbook.protocol.BookSnapshot;
import com.orderbook.protocol.LevelView;

import java.io.PrintStream;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Console rendering of a {@link BookSnapshot}: bids and asks side by side, best
 * level on the first row, followed by best bid/ask and the spread in basis points.
 */
public final class BookPrinter {

    private static final DateTimeFormatter TS =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneOffset.UTC);
    private static final String RULE = "=".repeat(64);
    private static final String ROW = "%-12s | %-12s | %-12s | %-12s%n";

    private BookPrinter() {}

    public static void print(PrintStream out, String symbol, BookSnapshot snapshot) {
        out.print(render(symbol, snapshot));
    }

    public static String render(String symbol, BookSnapshot snapshot) {
        StringBuilder sb = new StringBuilder();
        sb.append(RULE).append('\n');
        sb.append("ORDER BOOK: ").append(symbol)
          .append("  seq=").append(snapshot.sequence())
          .append("  ").append(TS.format(snapshot.timestamp())).append('\n');
        sb.append(RULE).append('\n');
        sb.append(String.format(ROW, "BID QTY", "BID PRICE", "ASK PRICE", "ASK QTY"));
        sb.append("-".repeat(64)).append('\n');

        List<LevelView> bids = snapshot.bids();
        List<LevelView> asks = snapshot.asks();
        int rows = Math.max(bids.size(), asks.size());
        for (int i = 0; i < rows; i++) {
            LevelView bid = i < bids.size() ? bids.get(i) : null;
            LevelView ask = i < asks.size() ? asks.get(i) : null;
            sb.append(String.format(ROW,
                    bid == null ? "" : Long.toString(bid.quantity()),
                    bid == null ? "" : "$" + PriceUtil.format(bid.price()),
                    ask == null ? "" : "$" + PriceUtil.format(ask.price()),
                    ask == null ? "" : Long.toString(ask.quantity())));
        }

        sb.append("-".repeat(64)).append('\n');
        sb.append("Best bid: ").append(snapshot.bestBid().isPresent() ? "$" + PriceUtil.format(snapshot.bestBid().getAsLong()) : "-");
        sb.append("  Best ask: ").append(snapshot.bestAsk().isPresent() ? "$" + PriceUtil.format(snapshot.bestAsk().getAsLong()) : "-");
        sb.append("  Spread: ").append(spreadText(snapshot)).append('\n');
        return sb.toString();
    }

    static String spreadText(BookSnapshot snapshot) {
        if (snapshot.spread().isEmpty()) return "-";
        long spread = snapshot.spread().getAsLong();
        long bid = snapshot.bestBid().getAsLong();
        long ask = snapshot.bestAsk().getAsLong();
        double mid = (bid + ask) / 2.0;
        double bps = spread / mid * 10_000.0;
        return String.format("$%s (%.2f bps)", PriceUtil.format(spread), bps);
    }
}
