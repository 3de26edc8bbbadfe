package com.fincraft.etl.table;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Macro series tracked as {@code INDICATOR} entities. The entity id is the constant name.
 */
public enum IndicatorSeries {
    REAL_GDP("REAL_GDP", "quarterly", "Real GDP", null),
    REAL_GDP_PER_CAPITA("REAL_GDP_PER_CAPITA", "quarterly", "Real GDP Per Capita", null),
    TREASURY_YIELD_3MONTH("TREASURY_YIELD", "daily", "Treasury Yield 3 Month", "3month"),
    TREASURY_YIELD_2YEAR("TREASURY_YIELD", "daily", "Treasury Yield 2 Year", "2year"),
    TREASURY_YIELD_5YEAR("TREASURY_YIELD", "daily", "Treasury Yield 5 Year", "5year"),
    TREASURY_YIELD_7YEAR("TREASURY_YIELD", "daily", "Treasury Yield 7 Year", "7year"),
    TREASURY_YIELD_10YEAR("TREASURY_YIELD", "daily", "Treasury Yield 10 Year", "10year"),
    TREASURY_YIELD_30YEAR("TREASURY_YIELD", "daily", "Treasury Yield 30 Year", "30year"),
    FEDERAL_FUNDS_RATE("FEDERAL_FUNDS_RATE", "daily", "Federal Funds Rate", null),
    CPI("CPI", "monthly", "Consumer Price Index", null),
    INFLATION("INFLATION", "monthly", "Inflation Rate", null),
    RETAIL_SALES("RETAIL_SALES", "monthly", "Retail Sales", null),
    DURABLES("DURABLES", "monthly", "Durable Goods Orders", null),
    UNEMPLOYMENT("UNEMPLOYMENT", "monthly", "Unemployment Rate", null),
    NONFARM_PAYROLL("NONFARM_PAYROLL", "monthly", "Total Nonfarm Payroll", null);

    private final String function;
    private final String interval;
    private final String displayName;
    private final String maturity;

    IndicatorSeries(String function, String interval, String displayName, String maturity) {
        this.function = function;
        this.interval = interval;
        this.displayName = displayName;
        this.maturity = maturity;
    }

    public String displayName() {
        return displayName;
    }

    public Map<String, String> requestParams() {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("function", function);
        params.put("interval", interval);
        if (maturity != null) {
            params.put("maturity", maturity);
        }
        return params;
    }

    public static Optional<IndicatorSeries> find(String entityId) {
        if (entityId == null) {
            return Optional.empty();
        }
        for (IndicatorSeries series : values()) {
            if (series.name().equalsIgnoreCase(entityId.trim())) {
                return Optional.of(series);
            }
        }
        return Optional.empty();
    }
}
