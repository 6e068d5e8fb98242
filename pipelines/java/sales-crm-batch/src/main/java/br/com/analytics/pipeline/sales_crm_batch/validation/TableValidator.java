package br.com.analytics.pipeline.sales_crm_batch.validation;

import br.com.analytics.pipeline.sales_crm_batch.exception.MissingColumnException;
import br.com.analytics.pipeline.sales_crm_batch.model.ColumnSpec;
import br.com.analytics.pipeline.sales_crm_batch.model.DataSchema;
import br.com.analytics.pipeline.sales_crm_batch.model.DataTable;

import java.util.Map;

public class TableValidator {

    private final ValidatorSelector selector;

    public TableValidator(ValidatorSelector selector) {
        this.selector = selector;
    }

    public DataTable validate(DataSchema schema, DataTable table) {
        DataTable validated = table;
        for (Map.Entry<String, ColumnSpec> entry : schema.columns().entrySet()) {
            String column = entry.getKey();
            if (!table.hasColumn(column)) {
                throw new MissingColumnException(column, schema.sourceName());
            }
            ColumnValidator validator = selector.select(column, entry.getValue());
            validated = validated.withColumn(column, validator.validate(column, table.column(column)));
        }
        return validated;
    }
}
