package com.trancheledger.domain.vo;

import lombok.Value;

/** Composite key for year-to-date running totals per symbol. */
@Value
public class YearSymbolKey {

    int year;
    String symbol;
}
