package br.com.analytics.pipeline.sales_crm_batch.model;

import org.jspecify.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record ColumnSpec(
        @Nullable ColumnType type,
        @Nullable Map<String, List<String>> valueMapping,
        @Nullable List<String> choices
) {

    public ColumnSpec {
        if (valueMapping != null) {
            Map<String, List<String>> copy = new LinkedHashMap<>();
            valueMapping.forEach((canonical, synonyms) -> copy.put(canonical, List.copyOf(synonyms)));
            valueMapping = Collections.unmodifiableMap(copy);
        }
        if (choices != null) {
            choices = List.copyOf(choices);
        }
    }

    public static ColumnSpec of(ColumnType type) {
        return new ColumnSpec(type, null, null);
    }

    public boolean hasValueMapping() {
        return valueMapping != null && !valueMapping.isEmpty();
    }

    public boolean hasChoices() {
        return choices != null && !choices.isEmpty();
    }
}
