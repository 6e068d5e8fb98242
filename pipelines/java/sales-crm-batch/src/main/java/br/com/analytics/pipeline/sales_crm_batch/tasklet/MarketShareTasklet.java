package br.com.analytics.pipeline.sales_crm_batch.tasklet;

import br.com.analytics.pipeline.sales_crm_batch.config.PipelineProperties;
import br.com.analytics.pipeline.sales_crm_batch.exception.PipelineException;
import br.com.analytics.pipeline.sales_crm_batch.model.DataSchema;
import br.com.analytics.pipeline.sales_crm_batch.model.DataTable;
import br.com.analytics.pipeline.sales_crm_batch.model.MonthlySeries;
import br.com.analytics.pipeline.sales_crm_batch.processor.MarketShareProcessor;
import br.com.analytics.pipeline.sales_crm_batch.reader.SourceFileLocator;
import br.com.analytics.pipeline.sales_crm_batch.reader.TableReader;
import br.com.analytics.pipeline.sales_crm_batch.schema.SchemaSource;
import br.com.analytics.pipeline.sales_crm_batch.validation.TableValidator;
import org.slf4j.LoggerFactory;
import org.springframework.batch.core.scope.context.ChunkContext;
import org.springframework.batch.core.step.StepContribution;
import org.springframework.batch.infrastructure.repeat.RepeatStatus;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

public class MarketShareTasklet extends AbstractSourceTasklet {

    static final String SALES_EXTENSION = ".json";

    private final PipelineProperties properties;
    private final SourceFileLocator fileLocator;
    private final SchemaSource schemaSource;
    private final MarketShareProcessor processor;
    private final MonthlySeriesHolder seriesHolder;

    public MarketShareTasklet(PipelineProperties properties, SourceFileLocator fileLocator, TableReader salesReader,
                              SchemaSource schemaSource, TableValidator validator, MarketShareProcessor processor,
                              MonthlySeriesHolder seriesHolder) {
        super(LoggerFactory.getLogger(properties.name()), salesReader, validator);
        this.properties = properties;
        this.fileLocator = fileLocator;
        this.schemaSource = schemaSource;
        this.processor = processor;
        this.seriesHolder = seriesHolder;
    }

    @Override
    public RepeatStatus execute(StepContribution contribution, ChunkContext chunkContext) throws Exception {
        DataSchema schema = schemaSource.schema(SchemaSource.SALES);

        List<Path> files;
        try {
            files = fileLocator.listFiles(properties.salesDirectory(), SALES_EXTENSION);
        } catch (PipelineException e) {
            throw logged(e);
        }
        if (files.isEmpty()) {
            throw logged(new PipelineException("No sales files in " + properties.salesDirectory()));
        }

        List<DataTable> validated = new ArrayList<>(files.size());
        for (Path file : files) {
            validated.add(readValidated(file, schema));
        }
        DataTable sales = DataTable.concat(validated);

        MonthlySeries marketShare = processor.process(sales);
        seriesHolder.setMarketShare(marketShare);
        log.info("Market share computed from {} sales rows in {} files: {} dates",
                sales.rowCount(), files.size(), marketShare.size());
        return RepeatStatus.FINISHED;
    }
}
