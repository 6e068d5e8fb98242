package br.com.analytics.pipeline.sales_crm_batch.exception;

public class MissingColumnException extends ValidationException {

    public MissingColumnException(String column, String sourceName) {
        super(column, "declared by schema '" + sourceName + "' but missing from the table");
    }
}
