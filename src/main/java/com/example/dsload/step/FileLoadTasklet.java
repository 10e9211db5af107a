package com.example.dsload.step;

import com.example.dsload.model.FileLoadResult;
import com.example.dsload.service.FileLoadService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.ExitStatus;
import org.springframework.batch.core.StepContribution;
import org.springframework.batch.core.StepExecution;
import org.springframework.batch.core.StepExecutionListener;
import org.springframework.batch.core.scope.context.ChunkContext;
import org.springframework.batch.core.step.tasklet.Tasklet;
import org.springframework.batch.item.ExecutionContext;
import org.springframework.batch.repeat.RepeatStatus;

import java.nio.file.Path;
import java.util.List;

/**
 * One file per iteration, so a stop request lands between files. The position survives a restart.
 */
@Slf4j
public class FileLoadTasklet implements Tasklet, StepExecutionListener {

    static final String NEXT_INDEX_KEY = "fileLoad.nextIndex";
    static final String LOADED_KEY = "fileLoad.loaded";
    static final String FAILED_KEY = "fileLoad.failed";

    private final FileLoadService fileLoadService;

    public FileLoadTasklet(FileLoadService fileLoadService) {
        this.fileLoadService = fileLoadService;
    }

    @Override
    @SuppressWarnings("unchecked")
    public RepeatStatus execute(StepContribution contribution, ChunkContext chunkContext) throws Exception {
        StepExecution stepExecution = chunkContext.getStepContext().getStepExecution();
        List<String> files = (List<String>) stepExecution.getJobExecution().getExecutionContext()
                .get(SourceCheckTasklet.SOURCE_FILES_KEY);
        if (files == null) {
            throw new IllegalStateException("Source file list not found in job ExecutionContext");
        }

        ExecutionContext context = stepExecution.getExecutionContext();
        int index = context.getInt(NEXT_INDEX_KEY, 0);
        if (index >= files.size()) {
            return RepeatStatus.FINISHED;
        }

        FileLoadResult result = fileLoadService.process(Path.of(files.get(index)));
        contribution.incrementReadCount();
        if (result.isSuccess()) {
            contribution.incrementWriteCount(result.getStatistics().getRowsLoaded());
            context.putInt(LOADED_KEY, context.getInt(LOADED_KEY, 0) + 1);
        } else {
            contribution.incrementProcessSkipCount();
            context.putInt(FAILED_KEY, context.getInt(FAILED_KEY, 0) + 1);
        }
        context.putInt(NEXT_INDEX_KEY, index + 1);

        return index + 1 < files.size() ? RepeatStatus.CONTINUABLE : RepeatStatus.FINISHED;
    }

    @Override
    public ExitStatus afterStep(StepExecution stepExecution) {
        ExecutionContext context = stepExecution.getExecutionContext();
        int loaded = context.getInt(LOADED_KEY, 0);
        int failed = context.getInt(FAILED_KEY, 0);
        String summary = "files=" + (loaded + failed) + ", loaded=" + loaded + ", failed=" + failed;
        log.info("File load finished: {}", summary);
        return stepExecution.getExitStatus().addExitDescription(summary);
    }
}
