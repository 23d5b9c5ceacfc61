package com.trancheledger.unit.normalize;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

import com.trancheledger.exception.ErrorCode;
import com.trancheledger.exception.MissingColumnException;
import com.trancheledger.normalize.TransactionField;
import com.trancheledger.normalize.TransactionHeaderMap;
import java.util.List;
import org.junit.jupiter.api.Test;

class TransactionHeaderMapTest {

    @Test
    void resolvesCanonicalHeaders() {
        TransactionHeaderMap map = TransactionHeaderMap.resolve(
                List.of("Type", "Date", "Sym", "Shr", "Price", "Dist", "RocPct", "TIDOverride"));

        assertThat(map.indexOf(TransactionField.KIND)).isEqualTo(0);
        assertThat(map.indexOf(TransactionField.DIVIDEND_TOTAL)).isEqualTo(5);
        assertThat(map.indexOf(TransactionField.LOT_ID_OVERRIDE)).isEqualTo(7);
        assertThat(map.has(TransactionField.TAXABLE_INCOME)).isFalse();
        assertThat(map.indexOf(TransactionField.TAXABLE_INCOME)).isNull();
    }

    @Test
    void matchingIgnoresCaseSpacingUnderscoresAndHyphens() {
        TransactionHeaderMap map = TransactionHeaderMap.resolve(List.of(
                " tx_type ", "TRADE DATE", "ticker", "quantity", "px", "dist-ps", "roc amount", "Tranche ID"));

        assertThat(map.indexOf(TransactionField.KIND)).isEqualTo(0);
        assertThat(map.indexOf(TransactionField.DATE)).isEqualTo(1);
        assertThat(map.indexOf(TransactionField.DIVIDEND_PER_SHARE)).isEqualTo(5);
        assertThat(map.indexOf(TransactionField.ROC_AMOUNT)).isEqualTo(6);
        assertThat(map.indexOf(TransactionField.LOT_ID_OVERRIDE)).isEqualTo(7);
        assertThat(map.headerName(TransactionField.LOT_ID_OVERRIDE)).isEqualTo("Tranche ID");
    }

    @Test
    void headerNameFallsBackToLabelForAbsentColumn() {
        TransactionHeaderMap map =
                TransactionHeaderMap.resolve(List.of("Type", "Date", "Sym", "Shr", "Price", "DistPS", "ROCAmt"));

        assertThat(map.headerName(TransactionField.TAXABLE_INCOME)).isEqualTo("Inc");
    }

    @Test
    void missingColumnsAreAllReportedTogether() {
        MissingColumnException ex = catchThrowableOfType(
                () -> TransactionHeaderMap.resolve(List.of("Type", "Date", "Price")), MissingColumnException.class);

        assertThat(ex.getErrorCode()).isEqualTo(ErrorCode.MISSING_COLUMN);
        assertThat(ex.getMissingColumns()).containsExactly("Sym", "Shr", "Dist or DistPS", "RocPct or ROCAmt");
        assertThat(ex.getMessage()).contains("Sym").contains("Found: [Type, Date, Price]");
    }

    @Test
    void eitherDividendAmountColumnSatisfiesTheRequirement() {
        TransactionHeaderMap withTotal =
                TransactionHeaderMap.resolve(List.of("Type", "Date", "Sym", "Shr", "Price", "Dist", "RocPct"));
        TransactionHeaderMap withPerShare =
                TransactionHeaderMap.resolve(List.of("Type", "Date", "Sym", "Shr", "Price", "DistPS", "ROCAmt"));

        assertThat(withTotal.has(TransactionField.DIVIDEND_PER_SHARE)).isFalse();
        assertThat(withPerShare.has(TransactionField.DIVIDEND_TOTAL)).isFalse();
    }
}
