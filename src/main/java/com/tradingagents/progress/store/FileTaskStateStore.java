package com.tradingagents.progress.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradingagents.progress.dto.TaskState;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * One pretty-printed JSON file per analysis under a base directory.
 */
@Slf4j
public class FileTaskStateStore implements TaskStateStore {

    private final ObjectMapper objectMapper;
    private final Path directory;

    public FileTaskStateStore(ObjectMapper objectMapper, Path directory) {
        this.objectMapper = objectMapper;
        this.directory = directory;
        try {
            Files.createDirectories(directory);
            log.info("Task state directory: {}", directory.toAbsolutePath());
        } catch (IOException e) {
            log.error("Failed to create task state directory: {}", directory, e);
        }
    }

    @Override
    public synchronized void save(TaskState state) {
        File target = fileFor(state.getAnalysisId());
        File temp = new File(target.getPath() + ".tmp");
        try {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp, state);
            Files.move(temp.toPath(), target.toPath(), StandardCopyOption.REPLACE_EXISTING);
            log.debug("Saved task state: analysis={}, status={}", state.getAnalysisId(), state.getStatus());
        } catch (IOException e) {
            log.warn("Failed to save task state: analysis={}, error={}", state.getAnalysisId(), e.getMessage());
        }
    }

    @Override
    public synchronized Optional<TaskState> load(String analysisId) {
        File file = fileFor(analysisId);
        if (!file.exists()) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(file, TaskState.class));
        } catch (IOException e) {
            log.warn("Failed to load task state: analysis={}, error={}", analysisId, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public synchronized void delete(String analysisId) {
        try {
            Files.deleteIfExists(fileFor(analysisId).toPath());
        } catch (IOException e) {
            log.warn("Failed to delete task state: analysis={}, error={}", analysisId, e.getMessage());
        }
    }

    @Override
    public String name() {
        return "file";
    }

    private File fileFor(String analysisId) {
        return directory.resolve(analysisId + ".json").toFile();
    }
}
