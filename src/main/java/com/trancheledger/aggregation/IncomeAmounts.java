package com.trancheledger.aggregation;

import java.math.BigDecimal;
import lombok.Value;

/** Distribution, taxable income and return of capital, summed independently. */
@Value
public class IncomeAmounts {

    public static final IncomeAmounts ZERO = new IncomeAmounts(BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO);

    BigDecimal distribution;
    BigDecimal taxableIncome;
    BigDecimal roc;

    public IncomeAmounts plus(IncomeAmounts other) {
        return new IncomeAmounts(
                distribution.add(other.distribution), taxableIncome.add(other.taxableIncome), roc.add(other.roc));
    }
}
