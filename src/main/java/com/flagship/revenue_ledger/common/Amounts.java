package com.flagship.revenue_ledger.common;

import com.flagship.revenue_ledger.exception.ValidationException;

import java.math.BigDecimal;

/**
 * Input checks for monetary values. Amounts are never rounded on the way in:
 * anything that does not fit two fractional digits is rejected.
 */
public final class Amounts {

    public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(MoneyAllocator.SCALE);

    private Amounts() {
    }

    public static BigDecimal requireMoney(BigDecimal value, String field) {
        if (value == null) {
            throw new ValidationException(field + " is required");
        }
        if (value.stripTrailingZeros().scale() > MoneyAllocator.SCALE) {
            throw new ValidationException(field + " must have at most 2 decimal places: " + value.toPlainString());
        }
        return value.setScale(MoneyAllocator.SCALE);
    }

    public static BigDecimal requireNonNegative(BigDecimal value, String field) {
        BigDecimal amount = requireMoney(value, field);
        if (amount.signum() < 0) {
            throw new ValidationException(field + " must not be negative: " + amount.toPlainString());
        }
        return amount;
    }

    public static BigDecimal requirePositive(BigDecimal value, String field) {
        BigDecimal amount = requireMoney(value, field);
        if (amount.signum() <= 0) {
            throw new ValidationException(field + " must be positive: " + amount.toPlainString());
        }
        return amount;
    }

    /** Treats a missing optional amount as zero; present values pass through unchanged. */
    public static BigDecimal orZero(BigDecimal value) {
        return value == null ? ZERO : value;
    }
}
