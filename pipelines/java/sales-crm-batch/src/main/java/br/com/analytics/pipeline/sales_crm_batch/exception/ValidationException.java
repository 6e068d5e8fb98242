package br.com.analytics.pipeline.sales_crm_batch.exception;

import org.jspecify.annotations.Nullable;

public abstract class ValidationException extends PipelineException {

    private final @Nullable String column;

    protected ValidationException(@Nullable String column, String message) {
        super(column == null ? message : "Column '" + column + "': " + message);
        this.column = column;
    }

    public @Nullable String getColumn() {
        return column;
    }
}
