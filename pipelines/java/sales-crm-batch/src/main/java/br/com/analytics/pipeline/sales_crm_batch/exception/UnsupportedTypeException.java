package br.com.analytics.pipeline.sales_crm_batch.exception;

import org.jspecify.annotations.Nullable;

public class UnsupportedTypeException extends ValidationException {

    public UnsupportedTypeException(@Nullable String typeName) {
        super(null, "unsupported column type: " + typeName);
    }

    public UnsupportedTypeException(@Nullable String column, @Nullable String typeName, String detail) {
        super(column, "unsupported column type: " + typeName + " (" + detail + ")");
    }
}
