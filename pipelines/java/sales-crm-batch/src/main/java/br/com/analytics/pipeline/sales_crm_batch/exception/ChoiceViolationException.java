package br.com.analytics.pipeline.sales_crm_batch.exception;

import org.jspecify.annotations.Nullable;

import java.util.List;

public class ChoiceViolationException extends ValidationException {

    private final List<String> offendingValues;

    public ChoiceViolationException(@Nullable String column, List<String> offendingValues) {
        super(column, "values are not a subset of the allowed choices: " + offendingValues);
        this.offendingValues = List.copyOf(offendingValues);
    }

    public List<String> getOffendingValues() {
        return offendingValues;
    }
}
