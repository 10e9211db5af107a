package com.example.dsload.config;

import com.example.dsload.audit.AuditTrailRecorder;
import com.example.dsload.dialect.DatabaseDialect;
import com.example.dsload.dialect.H2Dialect;
import com.example.dsload.dialect.PostgresDialect;
import com.example.dsload.processor.Deduplicator;
import com.example.dsload.processor.FieldNormalizer;
import com.example.dsload.reader.DatasetReader;
import com.example.dsload.service.FileLoadService;
import com.example.dsload.source.SourceFileScanner;
import com.example.dsload.step.FileLoadTasklet;
import com.example.dsload.step.SourceCheckTasklet;
import com.example.dsload.strategy.LoadStrategySelector;
import com.example.dsload.writer.StagingUpsertEngine;
import org.springframework.batch.core.Job;
import org.springframework.batch.core.Step;
import org.springframework.batch.core.job.builder.JobBuilder;
import org.springframework.batch.core.launch.support.RunIdIncrementer;
import org.springframework.batch.core.repository.JobRepository;
import org.springframework.batch.core.step.builder.StepBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;

@Configuration
public class BatchConfig {

    public static final String JOB_NAME = "csvToDsJob";

    @Bean
    public DatabaseDialect databaseDialect(LoaderProperties properties) {
        return switch (properties.getDatabase().getType().toLowerCase()) {
            case "postgres", "postgresql" -> new PostgresDialect();
            case "h2" -> new H2Dialect();
            default -> throw new IllegalArgumentException("Unsupported app.database.type: " + properties.getDatabase().getType());
        };
    }

    @Bean
    public LoadStrategySelector loadStrategySelector(LoaderProperties properties) {
        return LoadStrategySelector.fromProperties(properties);
    }

    @Bean
    public DatasetReader datasetReader(LoaderProperties properties) {
        return new DatasetReader(properties.getEncodings());
    }

    @Bean
    public FieldNormalizer fieldNormalizer() {
        return new FieldNormalizer();
    }

    @Bean
    public Deduplicator deduplicator() {
        return new Deduplicator();
    }

    @Bean
    public StagingUpsertEngine stagingUpsertEngine(DataSource dataSource, DatabaseDialect dialect) {
        return new StagingUpsertEngine(dataSource, dialect);
    }

    @Bean
    public AuditTrailRecorder auditTrailRecorder(JdbcTemplate jdbcTemplate, PlatformTransactionManager transactionManager,
                                                 LoaderProperties properties) {
        return new AuditTrailRecorder(jdbcTemplate, transactionManager, properties.getAuditTable());
    }

    @Bean
    public FileLoadService fileLoadService(LoadStrategySelector selector, DatasetReader reader,
                                           FieldNormalizer normalizer, Deduplicator deduplicator,
                                           StagingUpsertEngine engine, AuditTrailRecorder auditTrailRecorder,
                                           PlatformTransactionManager transactionManager,
                                           LoaderProperties properties) {
        return new FileLoadService(selector, reader, normalizer, deduplicator, engine, auditTrailRecorder,
                transactionManager, properties.getJobName());
    }

    @Bean
    public SourceFileScanner sourceFileScanner(LoaderProperties properties) {
        return new SourceFileScanner(properties.getFilePattern());
    }

    @Bean
    public Job csvToDsJob(JobRepository jobRepository,
                          Step sourceCheckStep,
                          Step fileLoadStep) {
        return new JobBuilder(JOB_NAME, jobRepository)
                .incrementer(new RunIdIncrementer())
                .start(sourceCheckStep)
                .next(fileLoadStep)
                .build();
    }

    @Bean
    public Step sourceCheckStep(JobRepository jobRepository, PlatformTransactionManager transactionManager,
                                SourceFileScanner scanner, LoaderProperties properties) {
        return new StepBuilder("sourceCheckStep", jobRepository)
                .tasklet(new SourceCheckTasklet(scanner, properties.getSourceDir()), transactionManager)
                .build();
    }

    @Bean
    public Step fileLoadStep(JobRepository jobRepository, PlatformTransactionManager transactionManager,
                             FileLoadService fileLoadService) {
        return new StepBuilder("fileLoadStep", jobRepository)
                .tasklet(new FileLoadTasklet(fileLoadService), transactionManager)
                .build();
    }
}
