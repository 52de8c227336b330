package com.kreasipositif.transactionservice.service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Numeric helpers shared by the statistics, customer and fraud services.
 */
public final class StatsMath {

    private StatsMath() {
    }

    /**
     * Percentile with linear interpolation between the two closest ranks: the value at
     * position {@code q * (n - 1)} of the ascending values. Computed in exact decimal arithmetic.
     *
     * @param values   amounts, in any order
     * @param quantile quantile in [0, 1], e.g. {@code 0.95}
     * @return the percentile, or empty when {@code values} is empty
     */
    public static Optional<BigDecimal> percentile(Collection<BigDecimal> values, BigDecimal quantile) {
        if (values.isEmpty()) {
            return Optional.empty();
        }
        List<BigDecimal> sorted = values.stream().sorted().toList();
        BigDecimal position = quantile.multiply(BigDecimal.valueOf(sorted.size() - 1L));
        int lower = position.intValue();
        BigDecimal lowerValue = sorted.get(lower);
        if (lower + 1 >= sorted.size()) {
            return Optional.of(lowerValue);
        }
        BigDecimal fraction = position.subtract(BigDecimal.valueOf(lower));
        BigDecimal step = sorted.get(lower + 1).subtract(lowerValue);
        return Optional.of(lowerValue.add(step.multiply(fraction, MathContext.DECIMAL64)));
    }

    /** Mean rounded half-up to cents; zero for an empty group. */
    public static BigDecimal average(BigDecimal sum, long count) {
        if (count == 0) {
            return BigDecimal.ZERO;
        }
        return sum.divide(BigDecimal.valueOf(count), 2, RoundingMode.HALF_UP);
    }

    /** {@code part / total * 100} rounded to 2 decimals; 0 when {@code total} is 0. */
    public static double percentage(long part, long total) {
        if (total == 0) {
            return 0.0;
        }
        return round2(part * 100.0 / total);
    }

    public static double round2(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
