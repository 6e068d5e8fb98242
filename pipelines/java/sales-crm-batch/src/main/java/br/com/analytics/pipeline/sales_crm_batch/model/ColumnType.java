package br.com.analytics.pipeline.sales_crm_batch.model;

import br.com.analytics.pipeline.sales_crm_batch.exception.UnsupportedTypeException;

import java.util.Locale;

public enum ColumnType {
    INTEGER("integer"),
    FLOAT("float"),
    TEXT("text"),
    DATE("date");

    private final String typeName;

    ColumnType(String typeName) {
        this.typeName = typeName;
    }

    public String typeName() {
        return typeName;
    }

    public boolean isCastable() {
        return this != DATE;
    }

    public static ColumnType fromName(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT);
            for (ColumnType type : values()) {
                if (type.typeName.equals(normalized)) {
                    return type;
                }
            }
        }
        throw new UnsupportedTypeException(name);
    }
}
