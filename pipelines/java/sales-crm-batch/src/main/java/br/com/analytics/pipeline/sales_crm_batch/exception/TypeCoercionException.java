package br.com.analytics.pipeline.sales_crm_batch.exception;

import br.com.analytics.pipeline.sales_crm_batch.model.ColumnType;
import org.jspecify.annotations.Nullable;

public class TypeCoercionException extends ValidationException {

    private final transient @Nullable Object value;
    private final ColumnType targetType;

    public TypeCoercionException(@Nullable String column, @Nullable Object value, ColumnType targetType) {
        super(column, "value '" + value + "' is not a valid " + targetType.typeName());
        this.value = value;
        this.targetType = targetType;
    }

    public @Nullable Object getValue() {
        return value;
    }

    public ColumnType getTargetType() {
        return targetType;
    }
}
