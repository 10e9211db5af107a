package com.example.dsload.step;

import com.example.dsload.source.SourceFileScanner;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.StepContribution;
import org.springframework.batch.core.scope.context.ChunkContext;
import org.springframework.batch.core.step.tasklet.Tasklet;
import org.springframework.batch.repeat.RepeatStatus;
import org.springframework.util.StringUtils;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

@Slf4j
public class SourceCheckTasklet implements Tasklet {

    public static final String SOURCE_DIR_PARAMETER = "sourceDir";
    public static final String SOURCE_FILES_KEY = "sourceFiles";

    private final SourceFileScanner scanner;
    private final String defaultSourceDir;

    public SourceCheckTasklet(SourceFileScanner scanner, String defaultSourceDir) {
        this.scanner = scanner;
        this.defaultSourceDir = defaultSourceDir;
    }

    @Override
    public RepeatStatus execute(StepContribution contribution, ChunkContext chunkContext) throws Exception {
        String sourceDir = (String) chunkContext.getStepContext().getJobParameters().get(SOURCE_DIR_PARAMETER);
        if (!StringUtils.hasText(sourceDir)) {
            sourceDir = defaultSourceDir;
        }
        log.info("Checking source directory: {}", sourceDir);

        List<Path> files = scanner.scan(Path.of(sourceDir));
        ArrayList<String> paths = new ArrayList<>(files.size());
        for (Path file : files) {
            paths.add(file.toAbsolutePath().toString());
        }
        contribution.incrementReadCount();
        chunkContext.getStepContext().getStepExecution().getJobExecution()
                .getExecutionContext().put(SOURCE_FILES_KEY, paths);

        return RepeatStatus.FINISHED;
    }
}
