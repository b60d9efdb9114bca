package com.trafficsentinel.service.store;

import com.trafficsentinel.core.model.PhaseRecord;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

public class JsonlPhaseLogStore implements PhaseLogStore {
    private final Path file;
    private final ReentrantLock lock = new ReentrantLock();

    public JsonlPhaseLogStore(Path file) {
        this.file = file;
    }

    @Override
    public void append(PhaseRecord record) {
        lock.lock();
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (BufferedWriter writer = Files.newBufferedWriter(
                    file,
                    StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.APPEND
            )) {
                writer.write(PhaseRecordCodec.toJsonLine(record));
                writer.newLine();
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed appending phase record to " + file, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<PhaseRecord> recent(int limit) {
        List<PhaseRecord> all = readAll();
        int from = Math.max(0, all.size() - Math.max(0, limit));
        List<PhaseRecord> newestFirst = new ArrayList<>(all.subList(from, all.size()));
        Collections.reverse(newestFirst);
        return newestFirst;
    }

    @Override
    public List<PhaseRecord> since(Instant since) {
        List<PhaseRecord> matching = new ArrayList<>();
        for (PhaseRecord record : readAll()) {
            if (!record.timestamp().isBefore(since)) {
                matching.add(record);
            }
        }
        return matching;
    }

    private List<PhaseRecord> readAll() {
        lock.lock();
        try {
            if (!Files.exists(file)) {
                return List.of();
            }
            List<PhaseRecord> records = new ArrayList<>();
            int lineNumber = 0;
            for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                try {
                    records.add(PhaseRecordCodec.fromJsonLine(line));
                } catch (RuntimeException decodeError) {
                    throw new IllegalStateException("Invalid phase record at line " + lineNumber, decodeError);
                }
            }
            return records;
        } catch (IOException e) {
            throw new IllegalStateException("Failed reading phase log " + file, e);
        } finally {
            lock.unlock();
        }
    }
}
