package br.com.analytics.pipeline.sales_crm_batch.exception;

import org.jspecify.annotations.Nullable;

public class ValueMappingConflictException extends ValidationException {

    public ValueMappingConflictException(@Nullable String column, String synonym, String canonical,
                                         String otherCanonical) {
        super(column, "synonym '" + synonym + "' is mapped to both '" + canonical + "' and '" + otherCanonical + "'");
    }
}
