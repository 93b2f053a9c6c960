package com.orderbook.common;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Fixed-point price helpers. Prices travel as {@code long} micros (price * SCALE)
 * so that comparisons and map keys never see floating-point rounding.
 */
public final class PriceUtil {
    private PriceUtil() {}

    public static final int DECIMALS = 6;
    public static final long SCALE = 1_000_000L;

    /** @throws IllegalArgumentException if the value has more than six decimals or overflows a long */
    public static long toFixed(BigDecimal price) {
        try {
            return price.setScale(DECIMALS, RoundingMode.UNNECESSARY).unscaledValue().longValueExact();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Price not representable in micros: " + price, e);
        }
    }

    public static long parse(String price) {
        try {
            return toFixed(new BigDecimal(price.trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not a price: " + price, e);
        }
    }

    public static BigDecimal toDecimal(long fixed) {
        return BigDecimal.valueOf(fixed, DECIMALS);
    }

    /** Two-decimal display form, e.g. 100_250_000 -> "100.25". */
    public static String format(long fixed) {
        return toDecimal(fixed).setScale(2, RoundingMode.HALF_EVEN).toPlainString();
    }

    public static long ofUnits(long units) {
        return Math.multiplyExact(units, SCALE);
    }
}
