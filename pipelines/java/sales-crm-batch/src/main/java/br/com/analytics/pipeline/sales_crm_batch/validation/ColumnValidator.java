package br.com.analytics.pipeline.sales_crm_batch.validation;

import java.util.List;

/**
 * Coerces one column of raw values. {@link #validate} always runs {@link #transformType} and then
 * {@link #mapValue}; any failure is thrown and no partial column is produced.
 */
public sealed interface ColumnValidator permits CastingValidator, DateValidator, ChoicesValidator {

    List<Object> transformType(String column, List<?> values);

    default List<Object> mapValue(String column, List<Object> values) {
        return values;
    }

    default List<Object> validate(String column, List<?> values) {
        return mapValue(column, transformType(column, values));
    }
}
