package com.productgap.engine.service;

import java.math.BigDecimal;

/**
 * Optional outside inputs to the timing score. Null fields contribute nothing.
 *
 * @param yoyGrowth   year-over-year growth in percent
 * @param searchTrend rising, stable or declining
 */
public record MarketContext(BigDecimal yoyGrowth, String searchTrend, long competitorCount, long communityEngagement) {

    public static MarketContext none() {
        return new MarketContext(null, null, 0L, 0L);
    }
}
