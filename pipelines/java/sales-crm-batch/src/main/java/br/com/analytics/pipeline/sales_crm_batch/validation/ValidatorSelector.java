package br.com.analytics.pipeline.sales_crm_batch.validation;

import br.com.analytics.pipeline.sales_crm_batch.exception.UnsupportedTypeException;
import br.com.analytics.pipeline.sales_crm_batch.model.ColumnSpec;
import br.com.analytics.pipeline.sales_crm_batch.model.ColumnType;
import org.jspecify.annotations.Nullable;

public class ValidatorSelector {

    public ColumnValidator select(ColumnSpec spec) {
        return select(null, spec);
    }

    public ColumnValidator select(@Nullable String column, ColumnSpec spec) {
        ColumnType type = spec.type();
        if (type == null) {
            throw new UnsupportedTypeException(column, null, "column specification declares no type");
        }
        if (spec.hasChoices()) {
            if (!type.isCastable()) {
                throw new UnsupportedTypeException(column, type.typeName(),
                        "choices require an integer, float or text column");
            }
            return new ChoicesValidator(column, spec);
        }
        if (type.isCastable()) {
            return new CastingValidator(column, spec);
        }
        if (type == ColumnType.DATE) {
            return new DateValidator();
        }
        throw new UnsupportedTypeException(column, type.typeName(), "no validator for this type");
    }
}
