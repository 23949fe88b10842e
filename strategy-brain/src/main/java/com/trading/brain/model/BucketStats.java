package com.trading.brain.model;

/**
 * Win/loss/profit accumulator for one aggregate bucket (strategy x regime, x session, ...).
 */
public record BucketStats(int wins, int losses, double profit) {

    public static final BucketStats EMPTY = new BucketStats(0, 0, 0.0);

    public BucketStats record(boolean won, double tradeProfit) {
        return won
            ? new BucketStats(wins + 1, losses, profit + tradeProfit)
            : new BucketStats(wins, losses + 1, profit + tradeProfit);
    }

    public BucketStats plus(BucketStats other) {
        return new BucketStats(wins + other.wins, losses + other.losses, profit + other.profit);
    }

    public int total() {
        return wins + losses;
    }

    public double winRate() {
        int total = total();
        return total > 0 ? (double) wins / total : 0.0;
    }

    public double avgProfit() {
        int total = total();
        return total > 0 ? profit / total : 0.0;
    }
}
