package br.com.analytics.pipeline.sales_crm_batch.tasklet;

import br.com.analytics.pipeline.sales_crm_batch.config.PipelineProperties;
import br.com.analytics.pipeline.sales_crm_batch.exception.PipelineException;
import br.com.analytics.pipeline.sales_crm_batch.model.DataTable;
import br.com.analytics.pipeline.sales_crm_batch.model.MonthlySeries;
import br.com.analytics.pipeline.sales_crm_batch.processor.MarketEventProcessor;
import br.com.analytics.pipeline.sales_crm_batch.reader.SourceFileLocator;
import br.com.analytics.pipeline.sales_crm_batch.reader.TableReader;
import br.com.analytics.pipeline.sales_crm_batch.schema.SchemaSource;
import br.com.analytics.pipeline.sales_crm_batch.validation.TableValidator;
import org.slf4j.LoggerFactory;
import org.springframework.batch.core.scope.context.ChunkContext;
import org.springframework.batch.core.step.StepContribution;
import org.springframework.batch.infrastructure.repeat.RepeatStatus;

import java.nio.file.Path;

public class MarketEventTasklet extends AbstractSourceTasklet {

    static final String CRM_EXTENSION = ".csv";

    private final PipelineProperties properties;
    private final SourceFileLocator fileLocator;
    private final SchemaSource schemaSource;
    private final MarketEventProcessor processor;
    private final MonthlySeriesHolder seriesHolder;

    public MarketEventTasklet(PipelineProperties properties, SourceFileLocator fileLocator, TableReader crmReader,
                              SchemaSource schemaSource, TableValidator validator, MarketEventProcessor processor,
                              MonthlySeriesHolder seriesHolder) {
        super(LoggerFactory.getLogger(properties.name()), crmReader, validator);
        this.properties = properties;
        this.fileLocator = fileLocator;
        this.schemaSource = schemaSource;
        this.processor = processor;
        this.seriesHolder = seriesHolder;
    }

    @Override
    public RepeatStatus execute(StepContribution contribution, ChunkContext chunkContext) throws Exception {
        Path file;
        try {
            file = fileLocator.requireExtension(properties.crmFile(), CRM_EXTENSION);
        } catch (PipelineException e) {
            throw logged(e);
        }

        DataTable events = readValidated(file, schemaSource.schema(SchemaSource.CRM));

        MonthlySeries marketEvents = processor.process(events);
        seriesHolder.setMarketEvents(marketEvents);
        log.info("Event activity computed from {} CRM rows: {} months", events.rowCount(), marketEvents.size());
        return RepeatStatus.FINISHED;
    }
}
