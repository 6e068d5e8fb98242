package br.com.analytics.pipeline.sales_crm_batch.config;

import br.com.analytics.pipeline.sales_crm_batch.processor.MarketEventProcessor;
import br.com.analytics.pipeline.sales_crm_batch.processor.MarketShareProcessor;
import br.com.analytics.pipeline.sales_crm_batch.reader.CsvTableReader;
import br.com.analytics.pipeline.sales_crm_batch.reader.JsonTableReader;
import br.com.analytics.pipeline.sales_crm_batch.reader.SourceFileLocator;
import br.com.analytics.pipeline.sales_crm_batch.schema.JsonSchemaSource;
import br.com.analytics.pipeline.sales_crm_batch.schema.SchemaSource;
import br.com.analytics.pipeline.sales_crm_batch.tasklet.MarketEventTasklet;
import br.com.analytics.pipeline.sales_crm_batch.tasklet.MarketShareTasklet;
import br.com.analytics.pipeline.sales_crm_batch.tasklet.MergeSeriesTasklet;
import br.com.analytics.pipeline.sales_crm_batch.tasklet.MonthlySeriesHolder;
import br.com.analytics.pipeline.sales_crm_batch.validation.TableValidator;
import br.com.analytics.pipeline.sales_crm_batch.validation.ValidatorSelector;
import br.com.analytics.pipeline.sales_crm_batch.writer.SeriesCsvWriter;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.batch.core.job.Job;
import org.springframework.batch.core.job.builder.JobBuilder;
import org.springframework.batch.core.job.parameters.RunIdIncrementer;
import org.springframework.batch.core.repository.JobRepository;
import org.springframework.batch.core.step.Step;
import org.springframework.batch.core.step.builder.StepBuilder;
import org.springframework.batch.infrastructure.support.transaction.ResourcelessTransactionManager;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;
import org.springframework.transaction.PlatformTransactionManager;

@Configuration
@EnableConfigurationProperties(PipelineProperties.class)
public class SalesCrmBatchConfig {

    private final PipelineProperties properties;

    public SalesCrmBatchConfig(PipelineProperties properties) {
        this.properties = properties;
    }

    @Bean
    @ConditionalOnMissingBean(PlatformTransactionManager.class)
    public PlatformTransactionManager transactionManager() {
        return new ResourcelessTransactionManager();
    }

    @Bean
    public SchemaSource schemaSource(ResourceLoader resourceLoader) {
        return new JsonSchemaSource(resourceLoader.getResource(properties.schemaLocation()), new ObjectMapper());
    }

    @Bean
    public TableValidator tableValidator() {
        return new TableValidator(new ValidatorSelector());
    }

    @Bean
    public SourceFileLocator sourceFileLocator() {
        return new SourceFileLocator();
    }

    @Bean
    public MonthlySeriesHolder monthlySeriesHolder() {
        return new MonthlySeriesHolder();
    }

    @Bean
    public MarketShareProcessor marketShareProcessor() {
        return new MarketShareProcessor(properties.salesWindows(), properties.decimalDigits(), properties.trackedProduct());
    }

    @Bean
    public MarketEventProcessor marketEventProcessor() {
        return new MarketEventProcessor(properties.crmWindows(), properties.decimalDigits());
    }

    @Bean
    public SeriesCsvWriter seriesCsvWriter() {
        return new SeriesCsvWriter(properties.decimalDigits());
    }

    @Bean
    public MarketShareTasklet marketShareTasklet(SourceFileLocator fileLocator, SchemaSource schemaSource,
                                                 TableValidator validator, MarketShareProcessor processor,
                                                 MonthlySeriesHolder seriesHolder) {
        return new MarketShareTasklet(properties, fileLocator, new JsonTableReader(new ObjectMapper()),
                schemaSource, validator, processor, seriesHolder);
    }

    @Bean
    public MarketEventTasklet marketEventTasklet(SourceFileLocator fileLocator, SchemaSource schemaSource,
                                                 TableValidator validator, MarketEventProcessor processor,
                                                 MonthlySeriesHolder seriesHolder) {
        return new MarketEventTasklet(properties, fileLocator, new CsvTableReader(),
                schemaSource, validator, processor, seriesHolder);
    }

    @Bean
    public MergeSeriesTasklet mergeSeriesTasklet(MonthlySeriesHolder seriesHolder, SeriesCsvWriter writer) {
        return new MergeSeriesTasklet(properties, seriesHolder, writer);
    }

    @Bean
    public Step marketShareStep(JobRepository jobRepository, PlatformTransactionManager transactionManager,
                                MarketShareTasklet tasklet) {
        return new StepBuilder("marketShareStep", jobRepository)
                .tasklet(tasklet, transactionManager)
                .build();
    }

    @Bean
    public Step marketEventStep(JobRepository jobRepository, PlatformTransactionManager transactionManager,
                                MarketEventTasklet tasklet) {
        return new StepBuilder("marketEventStep", jobRepository)
                .tasklet(tasklet, transactionManager)
                .build();
    }

    @Bean
    public Step mergeStep(JobRepository jobRepository, PlatformTransactionManager transactionManager,
                          MergeSeriesTasklet tasklet) {
        return new StepBuilder("mergeStep", jobRepository)
                .tasklet(tasklet, transactionManager)
                .build();
    }

    @Bean
    public Job salesCrmJob(JobRepository jobRepository, Step marketShareStep, Step marketEventStep, Step mergeStep) {
        return new JobBuilder("salesCrmJob", jobRepository)
                .incrementer(new RunIdIncrementer())
                .start(marketShareStep)
                .next(marketEventStep)
                .next(mergeStep)
                .build();
    }
}
