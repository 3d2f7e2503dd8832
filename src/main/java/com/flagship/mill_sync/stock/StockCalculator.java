package com.flagship.mill_sync.stock;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Stock arithmetic shared by the ledger and the milling cost carry-over.
 */
public final class StockCalculator {

    public static final int PRICE_SCALE = 4;

    private StockCalculator() {
    }

    /**
     * Running weighted average:
     * {@code (oldQty * oldAvg + addedQty * addedPrice) / (oldQty + addedQty)}.
     * Unchanged when no price is given or nothing is on hand afterwards.
     */
    public static BigDecimal weightedAverage(BigDecimal oldQuantity, BigDecimal oldAverage,
                                             BigDecimal addedQuantity, BigDecimal addedPrice) {
        if (addedPrice == null) {
            return oldAverage;
        }
        BigDecimal total = oldQuantity.add(addedQuantity);
        if (total.signum() <= 0) {
            return oldAverage;
        }
        return oldQuantity.multiply(oldAverage)
                .add(addedQuantity.multiply(addedPrice))
                .divide(total, PRICE_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Cost per kg of an output that consumed {@code inputQuantity} at
     * {@code inputAverage}, spread over {@code outputQuantity}.
     */
    public static BigDecimal carriedCost(BigDecimal inputQuantity, BigDecimal inputAverage,
                                         BigDecimal outputQuantity) {
        if (outputQuantity.signum() <= 0) {
            return BigDecimal.ZERO.setScale(PRICE_SCALE);
        }
        return inputQuantity.multiply(inputAverage).divide(outputQuantity, PRICE_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Bags actually removed when {@code requested} bags are taken from
     * {@code onHand}. Bag counts are approximate and never go below zero.
     */
    public static int bagsRemoved(int onHand, int requested) {
        return Math.max(0, Math.min(onHand, requested));
    }
}
