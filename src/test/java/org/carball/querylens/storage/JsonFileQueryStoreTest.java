package org.carball.querylens.storage;

import org.carball.querylens.model.ExecutionPlan;
import org.carball.querylens.model.Frame;
import org.carball.querylens.model.NPlusOnePattern;
import org.carball.querylens.model.QueryIssue;
import org.carball.querylens.model.QueryRecord;
import org.carball.querylens.model.RequestMetadata;
import org.carball.querylens.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;

public class JsonFileQueryStoreTest {

    private static final Instant NOW = Instant.parse("2026-03-10T09:30:00Z");
    private static final LocalDate TODAY = LocalDate.of(2026, 3, 10);

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private JsonFileQueryStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        store = new JsonFileQueryStore(tempDir, 10L * 1024 * 1024, 7, clock);
    }

    @Test
    void shouldReadBackAppendedRecordWithAllFields() {
        // Given
        QueryRecord record = fullRecord();

        // When
        boolean written = store.append(record);
        List<QueryRecord> records = store.read(TODAY);

        // Then
        assertThat(written).isTrue();
        assertThat(records).containsExactly(record);
        assertThat(store.dailyLogPath(TODAY)).hasFileName("queries-2026-03-10.json");
    }

    @Test
    void shouldWritePrettyPrintedJsonArray() throws IOException {
        // When
        store.append(simpleRecord(1));

        // Then
        String content = Files.readString(store.dailyLogPath(TODAY));
        assertThat(content).startsWith("[");
        assertThat(content).contains("\"request_id\" : \"req-1\"");
        assertThat(content).contains("\"timestamp\" : \"2026-03-10T09:30:00Z\"");
        assertThat(content).doesNotContain("\"explain\"");
    }

    @Test
    void shouldAppendInOrderAndHonourReadLimit() {
        // Given
        for (int i = 1; i <= 5; i++) {
            store.append(simpleRecord(i));
        }

        // When
        List<QueryRecord> all = store.read(TODAY);
        List<QueryRecord> limited = store.read(TODAY, 2);

        // Then
        assertThat(all).extracting(QueryRecord::requestId)
                .containsExactly("req-1", "req-2", "req-3", "req-4", "req-5");
        assertThat(limited).extracting(QueryRecord::requestId).containsExactly("req-1", "req-2");
    }

    @Test
    void shouldReturnEmptyForMissingOrEmptyFile() throws IOException {
        // Then
        assertThat(store.read(TODAY)).isEmpty();

        // Given
        Files.writeString(store.dailyLogPath(TODAY), "");

        // Then
        assertThat(store.read(TODAY)).isEmpty();
    }

    @Test
    void shouldTreatCorruptFileAsEmptyAndRecoverOnNextAppend() throws IOException {
        // Given
        Files.writeString(store.dailyLogPath(TODAY), "[{\"sql\": \"SELECT 1\", ");

        // Then
        assertThat(store.read(TODAY)).isEmpty();

        // When
        store.append(simpleRecord(9));

        // Then
        assertThat(store.read(TODAY)).extracting(QueryRecord::requestId).containsExactly("req-9");
    }

    @Test
    void shouldRotateOversizedFileWithoutLosingRecords() throws IOException {
        // Given
        JsonFileQueryStore smallStore = new JsonFileQueryStore(tempDir, 100, 7, clock);

        // When
        smallStore.append(simpleRecord(1));

        // Then
        Path rotated = tempDir.resolve("queries-2026-03-10-" + NOW.toEpochMilli() + ".json");
        assertThat(rotated).exists();
        assertThat(smallStore.dailyLogPath(TODAY)).doesNotExist();
        assertThat(Files.readString(rotated)).contains("req-1");

        // When
        clock.advanceMillis(5);
        smallStore.append(simpleRecord(2));

        // Then
        assertThat(smallStore.logFiles()).hasSize(2);
        assertThat(tempDir.resolve("queries-2026-03-10-" + (NOW.toEpochMilli() + 5) + ".json")).exists();
    }

    @Test
    void shouldNotRotateSmallFile() throws IOException {
        // Given
        store.append(simpleRecord(1));

        // When
        Path rotated = store.rotateIfOversized(store.dailyLogPath(TODAY));

        // Then
        assertThat(rotated).isNull();
        assertThat(store.dailyLogPath(TODAY)).exists();
    }

    @Test
    void shouldPickUnusedNameWhenRotationTargetExists() throws IOException {
        // Given
        JsonFileQueryStore smallStore = new JsonFileQueryStore(tempDir, 1, 7, clock);
        Path current = smallStore.dailyLogPath(TODAY);
        Files.writeString(tempDir.resolve("queries-2026-03-10-" + NOW.toEpochMilli() + ".json"), "[]");
        Files.writeString(current, "[ ]");

        // When
        Path rotated = smallStore.rotateIfOversized(current);

        // Then
        assertThat(rotated).hasFileName("queries-2026-03-10-" + NOW.toEpochMilli() + "-1.json");
        assertThat(current).doesNotExist();
    }

    @Test
    void shouldDeleteOnlyFilesStrictlyOlderThanRetention() throws IOException {
        // Given
        touch("queries-2026-03-02.json");
        touch("queries-2026-03-02-1772400000000.json");
        touch("queries-2026-03-02.json.lock");
        touch("queries-2026-03-03.json");
        touch("queries-2026-03-10.json");
        touch("queries-latest.json");
        touch("queries-2026-13-45.json");
        touch("notes.txt");

        // When
        int deleted = store.cleanup(7);

        // Then
        assertThat(deleted).isEqualTo(2);
        assertThat(tempDir.resolve("queries-2026-03-02.json")).doesNotExist();
        assertThat(tempDir.resolve("queries-2026-03-02-1772400000000.json")).doesNotExist();
        assertThat(tempDir.resolve("queries-2026-03-02.json.lock")).doesNotExist();
        assertThat(tempDir.resolve("queries-2026-03-03.json")).exists();
        assertThat(tempDir.resolve("queries-2026-03-10.json")).exists();
        assertThat(tempDir.resolve("queries-latest.json")).exists();
        assertThat(tempDir.resolve("queries-2026-13-45.json")).exists();
        assertThat(tempDir.resolve("notes.txt")).exists();
    }

    @Test
    void shouldUseConfiguredRetentionByDefault() throws IOException {
        // Given
        touch("queries-2026-03-01.json");
        touch("queries-2026-03-05.json");

        // When
        int deleted = store.cleanup();

        // Then
        assertThat(deleted).isEqualTo(1);
        assertThat(tempDir.resolve("queries-2026-03-05.json")).exists();
    }

    @Test
    void shouldReturnZeroWhenDirectoryIsMissing() {
        // Given
        JsonFileQueryStore missing = new JsonFileQueryStore(tempDir.resolve("nope"), 1024, 7, clock);

        // Then
        assertThat(missing.cleanup(0)).isZero();
        assertThat(missing.logFiles()).isEmpty();
    }

    @Test
    void shouldSerializeConcurrentAppends() throws Exception {
        // Given
        ExecutorService executor = Executors.newFixedThreadPool(8);
        List<Future<?>> futures = new ArrayList<>();

        // When
        for (int thread = 0; thread < 8; thread++) {
            int offset = thread * 25;
            futures.add(executor.submit(() -> {
                for (int i = 0; i < 25; i++) {
                    store.append(simpleRecord(offset + i));
                }
            }));
        }
        for (Future<?> future : futures) {
            future.get();
        }
        executor.shutdown();

        // Then
        assertThat(store.read(TODAY)).hasSize(200);
    }

    @Test
    void shouldSwallowWriteFailures() throws IOException {
        // Given
        Path blocker = Files.writeString(tempDir.resolve("blocker"), "not a directory");
        JsonFileQueryStore broken = new JsonFileQueryStore(blocker.resolve("logs"), 1024, 7, clock);

        // When
        boolean written = broken.append(simpleRecord(1));

        // Then
        assertThat(written).isFalse();
    }

    private void touch(String fileName) throws IOException {
        Files.writeString(tempDir.resolve(fileName), "[]");
    }

    private QueryRecord simpleRecord(int index) {
        return QueryRecord.builder()
                .timestamp(clock.instant())
                .requestId("req-" + index)
                .connection("default")
                .sql("SELECT * FROM users WHERE id = ?")
                .bindings(List.of(index))
                .timeMs(1.5)
                .build();
    }

    private QueryRecord fullRecord() {
        return QueryRecord.builder()
                .timestamp(NOW)
                .requestId("req-42")
                .connection("default")
                .sql("SELECT * FROM order_lines WHERE order_id = ? AND note = ?")
                .bindings(Arrays.asList(7, "gift", null, 2.5))
                .timeMs(123.4)
                .metadata(RequestMetadata.builder()
                        .route("/orders/{id}")
                        .method("GET")
                        .userId("u-1")
                        .ip("10.0.0.1")
                        .memoryMb(64.25)
                        .build())
                .normalizedSql("SELECT * FROM order_lines WHERE order_id = ? AND note = ?")
                .queryHash("abc123")
                .formattedSql("SELECT * FROM order_lines WHERE order_id = 7 AND note = 'gift'")
                .backtrace(List.of(new Frame("com/acme/orders/OrderLineRepository.java", 18,
                        "com.acme.orders.OrderLineRepository", "findByOrder")))
                .source("com.acme.orders.OrderLineRepository::findByOrder")
                .slowQuery(true)
                .nPlusOne(new NPlusOnePattern("SELECT * FROM order_lines WHERE order_id = ? AND note = ?", 3,
                        "/orders/{id}", "com.acme.orders.OrderLineRepository::findByOrder", "Eager load"))
                .explain(ExecutionPlan.of("table", List.of(Map.of("id", 1, "type", "ref"))))
                .explainAnalyze(ExecutionPlan.failed("not supported", "still not supported"))
                .issues(List.of(QueryIssue.SLOW_QUERY, QueryIssue.N_PLUS_ONE))
                .build();
    }
}
