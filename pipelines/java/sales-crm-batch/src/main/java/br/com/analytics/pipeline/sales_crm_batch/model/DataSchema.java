package br.com.analytics.pipeline.sales_crm_batch.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record DataSchema(
        String sourceName,
        Map<String, ColumnSpec> columns
) {

    public DataSchema {
        columns = Collections.unmodifiableMap(new LinkedHashMap<>(columns));
    }
}
