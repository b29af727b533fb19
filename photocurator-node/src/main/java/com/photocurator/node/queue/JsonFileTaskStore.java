package com.photocurator.node.queue;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.photocurator.node.task.Task;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Objects;

/**
 * Persists the queue as a JSON document in a local directory.
 * Writes go to a temporary file first and are then moved over the queue file,
 * so a crash mid-write leaves the previous queue intact.
 */
public class JsonFileTaskStore implements TaskStore {

    static final String QUEUE_FILE = "task_queue.json";

    private static final TypeReference<List<Task>> TASK_LIST = new TypeReference<>() {};

    private final Path queueDirectory;
    private final ObjectMapper objectMapper;

    public JsonFileTaskStore(Path queueDirectory) {
        this.queueDirectory = Objects.requireNonNull(queueDirectory, "Queue directory cannot be null");
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Override
    public List<Task> loadQueue() {
        Path queueFile = getQueueFile();
        if (!Files.exists(queueFile)) {
            return List.of();
        }
        try {
            List<Task> tasks = objectMapper.readValue(queueFile.toFile(), TASK_LIST);
            return tasks != null ? tasks : List.of();
        } catch (IOException e) {
            throw new TaskStoreException("Failed to read task queue from " + queueFile, e);
        }
    }

    @Override
    public void saveQueue(List<Task> tasks) {
        Path queueFile = getQueueFile();
        try {
            Files.createDirectories(queueDirectory);
            Path temp = Files.createTempFile(queueDirectory, "task_queue", ".tmp");
            try {
                objectMapper.writeValue(temp.toFile(), tasks);
                move(temp, queueFile);
            } finally {
                Files.deleteIfExists(temp);
            }
        } catch (IOException e) {
            throw new TaskStoreException("Failed to write task queue to " + queueFile, e);
        }
    }

    public Path getQueueFile() {
        return queueDirectory.resolve(QUEUE_FILE);
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
