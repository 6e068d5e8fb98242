package br.com.analytics.pipeline.sales_crm_batch.reader;

import br.com.analytics.pipeline.sales_crm_batch.model.DataTable;

import java.io.IOException;
import java.nio.file.Path;

public interface TableReader {

    DataTable read(Path path) throws IOException;
}
