package br.com.analytics.pipeline.sales_crm_batch.exception;

public class UnsupportedSourceFormatException extends PipelineException {

    public UnsupportedSourceFormatException(String message) {
        super(message);
    }

    public UnsupportedSourceFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
