package com.flagship.mill_sync.stock;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class StockCalculatorTest {

    @Test
    @DisplayName("Weighted average blends old and added stock")
    void testWeightedAverage() {
        BigDecimal average = StockCalculator.weightedAverage(
                new BigDecimal("500"), new BigDecimal("50"), new BigDecimal("500"), new BigDecimal("60"));

        assertEquals(0, new BigDecimal("55").compareTo(average));
    }

    @Test
    @DisplayName("First stock in takes the added price")
    void testWeightedAverageFromEmpty() {
        BigDecimal average = StockCalculator.weightedAverage(
                BigDecimal.ZERO, BigDecimal.ZERO, new BigDecimal("250.5"), new BigDecimal("48.25"));

        assertEquals(0, new BigDecimal("48.25").compareTo(average));
    }

    @Test
    @DisplayName("Average is unchanged without a price")
    void testWeightedAverageWithoutPrice() {
        BigDecimal old = new BigDecimal("52.1000");

        assertSame(old, StockCalculator.weightedAverage(new BigDecimal("100"), old, new BigDecimal("10"), null));
    }

    @Test
    @DisplayName("Carried cost spreads input cost over the output")
    void testCarriedCost() {
        BigDecimal cost = StockCalculator.carriedCost(new BigDecimal("1000"), new BigDecimal("50"),
                new BigDecimal("650"));

        assertEquals(new BigDecimal("76.9231"), cost);
        assertEquals(0, BigDecimal.ZERO.compareTo(
                StockCalculator.carriedCost(new BigDecimal("10"), new BigDecimal("50"), BigDecimal.ZERO)));
    }

    @Test
    @DisplayName("Bags removed never exceed what is on hand")
    void testBagsRemoved() {
        assertEquals(5, StockCalculator.bagsRemoved(10, 5));
        assertEquals(10, StockCalculator.bagsRemoved(10, 15));
        assertEquals(0, StockCalculator.bagsRemoved(0, 3));
        assertEquals(0, StockCalculator.bagsRemoved(4, -2));
    }
}
