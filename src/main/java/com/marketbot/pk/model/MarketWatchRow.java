package com.marketbot.pk.model;

import lombok.Builder;
import lombok.Value;

/**
 * One row of the market-watch listing. Numeric fields are null when the cell was blank.
 */
@Value
@Builder
public class MarketWatchRow {
    String symbol;
    String name;
    String sectorCode;
    String sectorName;
    String listedIn;
    Double ldcp;
    Double open;
    Double high;
    Double low;
    Double current;
    Double change;
    Double changePercent;
    Long volume;
}
