package com.flagship.revenue_ledger.common;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MoneyAllocatorTest {

    private static BigDecimal money(String value) {
        return new BigDecimal(value);
    }

    private static BigDecimal sum(List<BigDecimal> amounts) {
        return amounts.stream().reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    @Test
    @DisplayName("Proportional split rounds half-up and puts the remainder on the last share")
    void allocateByWeights_RemainderOnLastShare() {
        List<BigDecimal> shares = MoneyAllocator.allocateByWeights(money("100.00"),
            List.of(money("1"), money("1"), money("1")));

        assertEquals(List.of(money("33.33"), money("33.33"), money("33.34")), shares);
        assertEquals(0, sum(shares).compareTo(money("100.00")));
    }

    @Test
    @DisplayName("Half a cent rounds up")
    void allocateByWeights_HalfUp() {
        // 0.05 * 1/2 = 0.025 -> 0.03, last share gets 0.02
        List<BigDecimal> shares = MoneyAllocator.allocateByWeights(money("0.05"), List.of(money("1"), money("1")));

        assertEquals(money("0.03"), shares.get(0));
        assertEquals(money("0.02"), shares.get(1));
    }

    @Test
    @DisplayName("All-zero weights fall back to an even split")
    void allocateByWeights_ZeroWeights() {
        List<BigDecimal> shares = MoneyAllocator.allocateByWeights(money("10.00"),
            List.of(BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO));

        assertEquals(List.of(money("3.33"), money("3.33"), money("3.34")), shares);
    }

    @Test
    @DisplayName("A zero-weight share receives nothing when other weights are positive")
    void allocateByWeights_ZeroWeightAmongPositive() {
        List<BigDecimal> shares = MoneyAllocator.allocateByWeights(money("90.00"),
            List.of(money("0"), money("2"), money("1")));

        assertEquals(money("0.00"), shares.get(0));
        assertEquals(money("60.00"), shares.get(1));
        assertEquals(money("30.00"), shares.get(2));
    }

    @Test
    @DisplayName("Even split puts the remainder on the last share")
    void splitEvenly_RemainderOnLast() {
        List<BigDecimal> shares = MoneyAllocator.splitEvenly(money("1000.03"), 10);

        assertEquals(10, shares.size());
        shares.subList(0, 9).forEach(share -> assertEquals(money("100.00"), share));
        assertEquals(money("100.03"), shares.get(9));
    }

    @Test
    @DisplayName("Even split rejects a non-positive number of parts")
    void splitEvenly_RejectsZeroParts() {
        assertThrows(IllegalArgumentException.class, () -> MoneyAllocator.splitEvenly(money("1.00"), 0));
    }
}
