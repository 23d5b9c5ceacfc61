package com.trancheledger.allocation;

import com.trancheledger.domain.model.TransactionEvent;
import com.trancheledger.util.Decimals;
import java.math.BigDecimal;
import lombok.Value;

/**
 * Total, return-of-capital and taxable amounts of one dividend for a given eligible share count.
 *
 * <p>The total is the explicit figure when present, otherwise per-share amount times eligible
 * shares. ROC is the explicit amount when present, otherwise ROC percent of the total. An
 * explicit taxable figure is taken as given; otherwise taxable is total minus ROC.
 */
@Value
public class DividendAmounts {

    BigDecimal total;
    BigDecimal roc;
    BigDecimal taxable;

    /** ROC as a fraction of the total; zero for a zero total. */
    BigDecimal rocPercent;

    public static DividendAmounts resolve(TransactionEvent dividend, BigDecimal eligibleShares) {
        BigDecimal total = dividend.getDividendTotal() != null
                ? dividend.getDividendTotal()
                : Decimals.orZero(dividend.getDividendPerShare()).multiply(eligibleShares);

        BigDecimal roc;
        BigDecimal rocPercent;
        if (dividend.getRocAmount() != null) {
            roc = dividend.getRocAmount();
            rocPercent = Decimals.safeDivide(roc, total);
        } else {
            rocPercent = Decimals.orZero(dividend.getRocPercent());
            roc = rocPercent.multiply(total);
        }

        BigDecimal taxable =
                dividend.getTaxableIncome() != null ? dividend.getTaxableIncome() : total.subtract(roc);
        return new DividendAmounts(total, roc, taxable, rocPercent);
    }

    public BigDecimal perShare(BigDecimal amount, BigDecimal eligibleShares) {
        return Decimals.safeDivide(amount, eligibleShares);
    }
}
