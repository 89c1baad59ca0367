package com.snuffles.pricewatch.service;

import com.snuffles.pricewatch.service.exception.ValidationException;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Sell targets and realized profit after the sell-side fee.
 * <p>
 * Target sell price: {@code buy * (1 + p) / (1 - fee)}.
 * Current profit %: {@code (current * (1 - fee) - buy) / buy * 100}.
 */
@Component
public class ProfitCalculator {

    public static final BigDecimal DEFAULT_FEE_RATE = new BigDecimal("0.005");
    private static final int[] TARGET_PERCENTS = {5, 10, 15, 20, 30};
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final int MATH_SCALE = 10;

    public record Target(int targetPercent, BigDecimal sellPrice, BigDecimal profitAmount, BigDecimal actualMultiplier) {
    }

    public record Calculation(List<Target> targets, BigDecimal currentProfit) {
    }

    public Calculation calculate(BigDecimal buyPrice, BigDecimal currentPrice) {
        if (buyPrice == null || buyPrice.signum() <= 0) {
            throw new ValidationException("Buy price must be greater than 0");
        }
        BigDecimal current = currentPrice != null ? currentPrice : BigDecimal.ZERO;
        return new Calculation(targets(buyPrice), currentProfit(buyPrice, current));
    }

    public List<Target> targets(BigDecimal buyPrice) {
        BigDecimal keep = BigDecimal.ONE.subtract(DEFAULT_FEE_RATE);
        List<Target> results = new ArrayList<>();
        for (int percent : TARGET_PERCENTS) {
            BigDecimal rate = BigDecimal.valueOf(percent).divide(HUNDRED);
            BigDecimal sell = buyPrice.multiply(BigDecimal.ONE.add(rate)).divide(keep, MATH_SCALE, RoundingMode.HALF_UP);
            results.add(new Target(
                percent,
                sell.setScale(2, RoundingMode.HALF_UP),
                buyPrice.multiply(rate).setScale(2, RoundingMode.HALF_UP),
                sell.divide(buyPrice, 4, RoundingMode.HALF_UP)
            ));
        }
        return results;
    }

    public BigDecimal currentProfit(BigDecimal buyPrice, BigDecimal currentPrice) {
        if (buyPrice == null || buyPrice.signum() <= 0 || currentPrice == null) {
            return BigDecimal.ZERO;
        }
        BigDecimal received = currentPrice.multiply(BigDecimal.ONE.subtract(DEFAULT_FEE_RATE));
        return received.subtract(buyPrice)
            .multiply(HUNDRED)
            .divide(buyPrice, 2, RoundingMode.HALF_UP);
    }
}
