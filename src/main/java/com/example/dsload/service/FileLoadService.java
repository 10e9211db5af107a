package com.example.dsload.service;

import com.example.dsload.audit.AuditTrailRecorder;
import com.example.dsload.model.Dataset;
import com.example.dsload.model.FileLoadResult;
import com.example.dsload.model.LoadSpec;
import com.example.dsload.model.LoadStatistics;
import com.example.dsload.model.NormalizationReport;
import com.example.dsload.processor.Deduplicator;
import com.example.dsload.processor.FieldNormalizer;
import com.example.dsload.reader.DatasetReader;
import com.example.dsload.strategy.LoadStrategySelector;
import com.example.dsload.writer.StagingUpsertEngine;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.nio.file.Path;

/**
 * Loads one source file in its own transaction, bracketed by an audit run.
 */
@Slf4j
public class FileLoadService {

    static final String MDC_FILE = "file";
    static final String MDC_RUN_ID = "runId";

    private final LoadStrategySelector selector;
    private final DatasetReader reader;
    private final FieldNormalizer normalizer;
    private final Deduplicator deduplicator;
    private final StagingUpsertEngine engine;
    private final AuditTrailRecorder auditTrail;
    private final TransactionTemplate transactionTemplate;
    private final String jobName;

    public FileLoadService(LoadStrategySelector selector, DatasetReader reader, FieldNormalizer normalizer,
                           Deduplicator deduplicator, StagingUpsertEngine engine, AuditTrailRecorder auditTrail,
                           PlatformTransactionManager transactionManager, String jobName) {
        this.selector = selector;
        this.reader = reader;
        this.normalizer = normalizer;
        this.deduplicator = deduplicator;
        this.engine = engine;
        this.auditTrail = auditTrail;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.jobName = jobName;
    }

    public FileLoadResult process(Path file) {
        String fileName = file.getFileName().toString();
        long runId = auditTrail.start(jobName);
        MDC.put(MDC_FILE, fileName);
        MDC.put(MDC_RUN_ID, String.valueOf(runId));
        try {
            LoadStatistics statistics;
            try {
                statistics = transactionTemplate.execute(status -> load(file));
            } catch (Exception e) {
                log.warn("{}: FAIL", fileName, e);
                String message = describe(e);
                try {
                    auditTrail.error(runId, message);
                } catch (RuntimeException auditFailure) {
                    log.error("Cannot record ERROR for audit run {}", runId, auditFailure);
                }
                return FileLoadResult.builder()
                        .fileName(fileName)
                        .runId(runId)
                        .success(false)
                        .errorMessage(message)
                        .build();
            }

            // The load is committed at this point; an audit failure must not turn it into a FAIL
            try {
                auditTrail.end(runId, statistics.getRowsLoaded(), statistics.toAuditMessage());
            } catch (RuntimeException auditFailure) {
                log.error("{}: loaded, but cannot record END for audit run {}", fileName, runId, auditFailure);
            }
            log.info("{}: OK - {} rows (deduped={} date_err={})", fileName, statistics.getRowsLoaded(),
                    statistics.getRowsDeduplicated(), statistics.getDateParseErrors());
            return FileLoadResult.builder()
                    .fileName(fileName)
                    .runId(runId)
                    .success(true)
                    .statistics(statistics)
                    .build();
        } finally {
            MDC.remove(MDC_FILE);
            MDC.remove(MDC_RUN_ID);
        }
    }

    private LoadStatistics load(Path file) {
        LoadSpec spec = selector.select(file.getFileName().toString());
        Dataset dataset = reader.read(file);
        NormalizationReport report = normalizer.normalize(dataset, spec);
        int deduplicated = deduplicator.deduplicate(dataset, spec.getPrimaryKey());
        int loaded = engine.load(dataset, spec);
        return new LoadStatistics(loaded, deduplicated, report.getDateParseErrors());
    }

    static String describe(Exception e) {
        Throwable cause = NestedExceptionUtils.getMostSpecificCause(e);
        String message = cause.getMessage();
        if (message == null || message.isBlank()) {
            message = e.getMessage();
        }
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }
}
