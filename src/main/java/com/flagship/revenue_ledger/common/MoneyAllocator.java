package com.flagship.revenue_ledger.common;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Shared rounding rule for splitting money.
 *
 * Every share except the last is rounded half-up to the cent. The last share
 * receives {@code total - sum(previous shares)}, so the parts always add up to
 * the total exactly. Both the allocation engine and the schedule generator go
 * through this class.
 */
public final class MoneyAllocator {

    public static final int SCALE = 2;
    public static final RoundingMode ROUNDING = RoundingMode.HALF_UP;

    private MoneyAllocator() {
    }

    /**
     * Splits {@code total} proportionally to {@code weights}.
     * Falls back to an even split when every weight is zero.
     *
     * @param total amount to split, scale 2
     * @param weights one non-negative weight per share, in a stable order
     * @return one amount per weight, summing exactly to {@code total}
     */
    public static List<BigDecimal> allocateByWeights(BigDecimal total, List<BigDecimal> weights) {
        if (weights.isEmpty()) {
            return Collections.emptyList();
        }
        BigDecimal totalWeight = weights.stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        if (totalWeight.signum() == 0) {
            return splitEvenly(total, weights.size());
        }

        List<BigDecimal> shares = new ArrayList<>(weights.size());
        BigDecimal allocated = BigDecimal.ZERO.setScale(SCALE);
        for (int i = 0; i < weights.size() - 1; i++) {
            BigDecimal share = total.multiply(weights.get(i)).divide(totalWeight, SCALE, ROUNDING);
            shares.add(share);
            allocated = allocated.add(share);
        }
        shares.add(total.subtract(allocated).setScale(SCALE, ROUNDING));
        return shares;
    }

    /**
     * Splits {@code total} into {@code parts} equal shares; the last share
     * absorbs the rounding remainder.
     */
    public static List<BigDecimal> splitEvenly(BigDecimal total, int parts) {
        if (parts <= 0) {
            throw new IllegalArgumentException("parts must be positive: " + parts);
        }
        BigDecimal share = total.divide(BigDecimal.valueOf(parts), SCALE, ROUNDING);
        List<BigDecimal> shares = new ArrayList<>(Collections.nCopies(parts - 1, share));
        shares.add(total.subtract(share.multiply(BigDecimal.valueOf(parts - 1))).setScale(SCALE, ROUNDING));
        return shares;
    }
}
