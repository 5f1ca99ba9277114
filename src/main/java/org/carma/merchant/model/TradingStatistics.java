package org.carma.merchant.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Running trade totals of one merchant. Mutated only through {@link Agent}.
 */
public final class TradingStatistics {

    public static final int HISTORY_LIMIT = 100;

    private int totalTrades;
    private int profitableTrades;
    private double totalProfit;
    private double bestTrade;
    private double worstTrade;
    private final Deque<TradeRecord> tradeHistory;

    TradingStatistics() {
        this.tradeHistory = new ArrayDeque<>();
    }

    private TradingStatistics(TradingStatistics other) {
        this.totalTrades = other.totalTrades;
        this.profitableTrades = other.profitableTrades;
        this.totalProfit = other.totalProfit;
        this.bestTrade = other.bestTrade;
        this.worstTrade = other.worstTrade;
        this.tradeHistory = new ArrayDeque<>(other.tradeHistory);
    }

    TradingStatistics copy() {
        return new TradingStatistics(this);
    }

    void record(TradeRecord record) {
        totalTrades++;
        totalProfit += record.profit();
        if (record.profit() > 0) {
            profitableTrades++;
        }
        bestTrade = Math.max(bestTrade, record.profit());
        worstTrade = Math.min(worstTrade, record.profit());

        tradeHistory.addLast(record);
        while (tradeHistory.size() > HISTORY_LIMIT) {
            tradeHistory.removeFirst();
        }
    }

    public int getTotalTrades() { return totalTrades; }
    public double getTotalProfit() { return totalProfit; }
    public double getBestTrade() { return bestTrade; }
    public double getWorstTrade() { return worstTrade; }

    /**
     * Share of trades with positive profit; 0.0 before the first trade.
     */
    public double getSuccessRate() {
        return totalTrades == 0 ? 0.0 : (double) profitableTrades / totalTrades;
    }

    /** Most recent trades, oldest first. */
    public List<TradeRecord> getTradeHistory() {
        return List.copyOf(new ArrayList<>(tradeHistory));
    }

    @Override
    public String toString() {
        return String.format("TradingStatistics[trades=%d, profit=%.2f, successRate=%.2f]",
            totalTrades, totalProfit, getSuccessRate());
    }
}
