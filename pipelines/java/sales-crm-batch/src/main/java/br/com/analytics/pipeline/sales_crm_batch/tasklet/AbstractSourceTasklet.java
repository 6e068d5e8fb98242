package br.com.analytics.pipeline.sales_crm_batch.tasklet;

import br.com.analytics.pipeline.sales_crm_batch.exception.PipelineException;
import br.com.analytics.pipeline.sales_crm_batch.model.DataSchema;
import br.com.analytics.pipeline.sales_crm_batch.model.DataTable;
import br.com.analytics.pipeline.sales_crm_batch.reader.TableReader;
import br.com.analytics.pipeline.sales_crm_batch.validation.TableValidator;
import org.slf4j.Logger;
import org.springframework.batch.core.step.tasklet.Tasklet;

import java.io.IOException;
import java.nio.file.Path;

public abstract class AbstractSourceTasklet implements Tasklet {

    protected final Logger log;
    private final TableReader reader;
    private final TableValidator validator;

    protected AbstractSourceTasklet(Logger log, TableReader reader, TableValidator validator) {
        this.log = log;
        this.reader = reader;
        this.validator = validator;
    }

    protected DataTable readValidated(Path file, DataSchema schema) throws IOException {
        DataTable raw;
        try {
            raw = reader.read(file);
        } catch (IOException | PipelineException e) {
            log.error("Cannot read {} file {}: {}", schema.sourceName(), file, e.getMessage());
            throw e;
        }
        try {
            DataTable validated = validator.validate(schema, raw);
            log.info("Validated {} rows of {} file {}", validated.rowCount(), schema.sourceName(), file);
            return validated;
        } catch (PipelineException e) {
            log.error("Validation of {} file {} failed: {}", schema.sourceName(), file, e.getMessage());
            throw e;
        }
    }

    protected <T extends PipelineException> T logged(T exception) {
        log.error(exception.getMessage());
        return exception;
    }
}
