package br.com.analytics.pipeline.sales_crm_batch.tasklet;

import br.com.analytics.pipeline.sales_crm_batch.config.PipelineProperties;
import br.com.analytics.pipeline.sales_crm_batch.model.MonthlySeries;
import br.com.analytics.pipeline.sales_crm_batch.writer.SeriesCsvWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.core.scope.context.ChunkContext;
import org.springframework.batch.core.step.StepContribution;
import org.springframework.batch.core.step.tasklet.Tasklet;
import org.springframework.batch.infrastructure.repeat.RepeatStatus;

public class MergeSeriesTasklet implements Tasklet {

    private final Logger log;
    private final PipelineProperties properties;
    private final MonthlySeriesHolder seriesHolder;
    private final SeriesCsvWriter writer;

    public MergeSeriesTasklet(PipelineProperties properties, MonthlySeriesHolder seriesHolder, SeriesCsvWriter writer) {
        this.log = LoggerFactory.getLogger(properties.name());
        this.properties = properties;
        this.seriesHolder = seriesHolder;
        this.writer = writer;
    }

    @Override
    public RepeatStatus execute(StepContribution contribution, ChunkContext chunkContext) throws Exception {
        MonthlySeries merged = seriesHolder.getMarketShare().outerJoin(seriesHolder.getMarketEvents());
        try {
            writer.write(merged, properties.outputFile());
        } catch (Exception e) {
            log.error("Cannot write merged series to {}: {}", properties.outputFile(), e.getMessage());
            throw e;
        }
        log.info("Wrote {} rows and {} columns to {}", merged.size(), merged.columnNames().size() + 1,
                properties.outputFile());
        return RepeatStatus.FINISHED;
    }
}
