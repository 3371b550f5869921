package org.carball.querylens.storage;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.carball.querylens.config.QueryLensConfig;
import org.carball.querylens.model.QueryRecord;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Date-partitioned query log: one JSON array per day in {@code queries-YYYY-MM-DD.json}.
 *
 * <p>Appends are a read-modify-write of the whole array, done under an in-process
 * lock plus an OS file lock on a {@code .lock} sibling, so concurrent writers in
 * this JVM and in other processes never interleave. The new content is written to
 * a temporary file and moved over the log. Once a file grows past the size limit
 * it is renamed to {@code queries-YYYY-MM-DD-<epochMillis>.json}; the next append
 * starts a fresh file.
 *
 * <p>No method throws for I/O problems; failures are logged and the operation
 * becomes a no-op.
 */
@Slf4j
public class JsonFileQueryStore {

    private static final String FILE_PREFIX = "queries-";
    private static final String FILE_SUFFIX = ".json";
    private static final String LOCK_SUFFIX = ".lock";
    private static final Pattern FILE_DATE = Pattern.compile("queries-(\\d{4}-\\d{2}-\\d{2})");
    private static final TypeReference<List<QueryRecord>> RECORD_LIST = new TypeReference<>() {};

    private static final ConcurrentMap<Path, ReentrantLock> IN_PROCESS_LOCKS = new ConcurrentHashMap<>();

    private final Path basePath;
    private final long maxFileSizeBytes;
    private final int retentionDays;
    private final Clock clock;
    private final ObjectMapper objectMapper;

    public JsonFileQueryStore(Path basePath, long maxFileSizeBytes, int retentionDays, Clock clock) {
        this.basePath = basePath;
        this.maxFileSizeBytes = maxFileSizeBytes;
        this.retentionDays = retentionDays;
        this.clock = clock;
        this.objectMapper = QueryLogJson.newMapper();
    }

    public static JsonFileQueryStore fromConfig(QueryLensConfig config, Clock clock) {
        return new JsonFileQueryStore(config.getStoragePath(), config.getMaxFileSizeBytes(),
                config.getRetentionDays(), clock);
    }

    public Path getBasePath() {
        return basePath;
    }

    public Path dailyLogPath(LocalDate date) {
        return basePath.resolve(FILE_PREFIX + date + FILE_SUFFIX);
    }

    /**
     * Appends the record to today's log and rotates the file if it outgrew the limit.
     *
     * @return whether the record was persisted
     */
    public boolean append(QueryRecord record) {
        Path logFile = dailyLogPath(LocalDate.now(clock));
        ReentrantLock lock = IN_PROCESS_LOCKS.computeIfAbsent(logFile.toAbsolutePath().normalize(),
                path -> new ReentrantLock());

        lock.lock();
        try {
            Files.createDirectories(basePath);
            Path lockFile = logFile.resolveSibling(logFile.getFileName() + LOCK_SUFFIX);

            try (FileChannel channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
                 FileLock ignored = channel.lock()) {

                List<QueryRecord> records = readExisting(logFile);
                records.add(record);
                writeAtomically(logFile, records);
                rotateIfOversized(logFile);
            }
            return true;
        } catch (IOException | UncheckedIOException e) {
            log.error("[Query Lens] Failed to write query log {}: {}", logFile, e.getMessage());
            return false;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Renames the file to a timestamped sibling once it is larger than the configured
     * limit. Called with the file lock held.
     *
     * @return the rotated path, or {@code null} when no rotation happened
     */
    Path rotateIfOversized(Path logFile) throws IOException {
        if (!Files.exists(logFile) || Files.size(logFile) <= maxFileSizeBytes) {
            return null;
        }

        String baseName = stripSuffix(logFile.getFileName().toString());
        long timestamp = clock.millis();
        Path rotated = logFile.resolveSibling(baseName + "-" + timestamp + FILE_SUFFIX);
        int attempt = 1;
        while (Files.exists(rotated)) {
            rotated = logFile.resolveSibling(baseName + "-" + timestamp + "-" + attempt++ + FILE_SUFFIX);
        }

        move(logFile, rotated);
        log.info("Rotated query log {} to {}", logFile.getFileName(), rotated.getFileName());
        return rotated;
    }

    public int cleanup() {
        return cleanup(retentionDays);
    }

    /**
     * Deletes every log file whose embedded date is strictly older than
     * {@code today - days}. Files whose names carry no date are left alone.
     *
     * @return number of log files deleted
     */
    public int cleanup(int days) {
        LocalDate cutoff = LocalDate.now(clock).minusDays(days);
        int deleted = 0;

        for (Path file : listFiles()) {
            String fileName = file.getFileName().toString();
            Matcher matcher = FILE_DATE.matcher(fileName);
            if (!matcher.find()) {
                continue;
            }

            LocalDate fileDate;
            try {
                fileDate = LocalDate.parse(matcher.group(1));
            } catch (DateTimeParseException e) {
                log.debug("Skipping file with invalid date in name: {}", fileName);
                continue;
            }
            if (!fileDate.isBefore(cutoff)) {
                continue;
            }

            try {
                Files.deleteIfExists(file);
                if (fileName.endsWith(FILE_SUFFIX)) {
                    deleted++;
                }
            } catch (IOException e) {
                log.error("[Query Lens] Failed to delete old query log {}: {}", file, e.getMessage());
            }
        }

        log.info("Deleted {} query log file(s) older than {}", deleted, cutoff);
        return deleted;
    }

    public List<QueryRecord> read(LocalDate date) {
        return read(date, null);
    }

    /**
     * Records of one day's log, optionally truncated to the first {@code limit}.
     * A missing, empty or unreadable file yields an empty list.
     */
    public List<QueryRecord> read(LocalDate date, Integer limit) {
        Path logFile = dailyLogPath(date);
        List<QueryRecord> records;
        try {
            records = readExisting(logFile);
        } catch (IOException e) {
            log.error("[Query Lens] Failed to read query log {}: {}", logFile, e.getMessage());
            return List.of();
        }

        if (limit != null && limit >= 0 && records.size() > limit) {
            return new ArrayList<>(records.subList(0, limit));
        }
        return records;
    }

    /**
     * Every query log file (current and rotated), sorted by name.
     */
    public List<Path> logFiles() {
        return listFiles().stream()
                .filter(path -> path.getFileName().toString().endsWith(FILE_SUFFIX))
                .sorted()
                .collect(Collectors.toList());
    }

    private List<QueryRecord> readExisting(Path logFile) throws IOException {
        if (!Files.exists(logFile) || Files.size(logFile) == 0) {
            return new ArrayList<>();
        }

        byte[] content = Files.readAllBytes(logFile);
        try {
            List<QueryRecord> records = objectMapper.readValue(content, RECORD_LIST);
            return records != null ? new ArrayList<>(records) : new ArrayList<>();
        } catch (IOException e) {
            log.warn("Query log {} is corrupt, treating it as empty: {}", logFile, e.getMessage());
            return new ArrayList<>();
        }
    }

    private void writeAtomically(Path logFile, List<QueryRecord> records) throws IOException {
        Path temp = Files.createTempFile(basePath, "." + logFile.getFileName(), ".tmp");
        try {
            objectMapper.writeValue(temp.toFile(), records);
            move(temp, logFile);
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private List<Path> listFiles() {
        if (!Files.isDirectory(basePath)) {
            return List.of();
        }
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(basePath, FILE_PREFIX + "*")) {
            for (Path file : stream) {
                if (Files.isRegularFile(file)) {
                    files.add(file);
                }
            }
        } catch (IOException e) {
            log.error("[Query Lens] Failed to list query logs in {}: {}", basePath, e.getMessage());
        }
        return files;
    }

    private static String stripSuffix(String fileName) {
        return fileName.endsWith(FILE_SUFFIX)
                ? fileName.substring(0, fileName.length() - FILE_SUFFIX.length())
                : fileName;
    }
}
