package br.com.analytics.pipeline.sales_crm_batch.exception;

public class SchemaLoadException extends PipelineException {

    public SchemaLoadException(String message) {
        super(message);
    }

    public SchemaLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
