package com.fincraft.etl.table;

import com.fincraft.etl.model.EntityKind;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Everything the generic extraction pipeline needs to know about one upstream table.
 */
@Getter
@Builder
public final class TableDescriptor {
    private final String tableName;
    private final String apiFunction;
    @Builder.Default
    private final EntityKind entityKind = EntityKind.SYMBOL;
    @Singular
    private final List<String> assetTypes;
    private final boolean screened;
    private final PayloadLayout layout;
    /** Section name in the payload mapped to the report type stored for its rows. */
    @Singular
    private final Map<String, String> sections;
    private final String containerKey;
    private final String periodField;
    private final String fixedReportType;
    @Singular
    private final List<FieldSpec> fields;
    @Singular
    private final Set<String> excludedFields;
    @Builder.Default
    private final ReportingLagRule lagRule = ReportingLagRule.none();
    @Singular
    private final Map<String, String> requestParams;

    public Map<String, String> requestParamsFor(String entityId) {
        Map<String, String> params = new LinkedHashMap<>();
        if (entityKind == EntityKind.INDICATOR) {
            IndicatorSeries series = IndicatorSeries.find(entityId)
                    .orElseThrow(() -> new IllegalArgumentException("unknown indicator series: " + entityId));
            params.putAll(series.requestParams());
        } else {
            params.put("function", apiFunction);
            params.put("symbol", entityId);
        }
        params.putAll(requestParams);
        return params;
    }

    /**
     * Lag rule with the configured lag applied, or the built-in one when no override is set.
     */
    public ReportingLagRule lagRule(Integer lagDaysOverride) {
        if (lagDaysOverride == null || lagRule.frequency() == ReportingLagRule.Frequency.NONE) {
            return lagRule;
        }
        return lagRule.withLagDays(lagDaysOverride);
    }
}
