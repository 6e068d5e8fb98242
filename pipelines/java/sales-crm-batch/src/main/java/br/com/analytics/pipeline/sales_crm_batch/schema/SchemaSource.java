package br.com.analytics.pipeline.sales_crm_batch.schema;

import br.com.analytics.pipeline.sales_crm_batch.model.DataSchema;

public interface SchemaSource {

    String SALES = "sales";
    String CRM = "crm";

    DataSchema schema(String sourceName);
}
