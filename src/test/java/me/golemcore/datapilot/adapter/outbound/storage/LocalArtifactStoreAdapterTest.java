package me.golemcore.datapilot.adapter.outbound.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import me.golemcore.datapilot.domain.exception.ArtifactNotFoundException;
import me.golemcore.datapilot.domain.model.Artifact;
import me.golemcore.datapilot.domain.model.ArtifactKind;
import me.golemcore.datapilot.domain.model.ArtifactReference;
import me.golemcore.datapilot.infrastructure.config.DataPilotProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LocalArtifactStoreAdapterTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final byte[] CSV = "age,income\n31,\n45,5200\n".getBytes(StandardCharsets.UTF_8);

    @TempDir
    Path tempDir;

    private LocalArtifactStoreAdapter store;

    @BeforeEach
    void setUp() {
        DataPilotProperties properties = new DataPilotProperties();
        properties.getStorage().setBasePath(tempDir.toString());
        LocalStorageAdapter storage = new LocalStorageAdapter(properties);
        storage.init();

        ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());
        store = new LocalArtifactStoreAdapter(storage, objectMapper, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void shouldAssignIncreasingVersionsOnCreate() {
        Artifact first = store.create("p1", "dataset", null, "data.csv", CSV, "upload");
        Artifact second = store.create("p1", "dataset", null, "data.csv", "age\n1\n".getBytes(), "impute");

        assertEquals(1, first.getVersion());
        assertEquals(2, second.getVersion());
        assertEquals(ArtifactKind.DATASET, first.getKind());
        assertEquals(NOW, first.getCreatedAt());
        assertEquals("impute", store.latest("p1", "dataset").orElseThrow().getProducedBy());
    }

    @Test
    void shouldKeepVersionsIndependentPerProjectAndName() {
        store.create("p1", "dataset", ArtifactKind.DATASET, "data.csv", CSV, "upload");
        Artifact model = store.create("p1", "model", ArtifactKind.MODEL, "model.p", new byte[] { 7 }, "train");
        Artifact other = store.create("p2", "dataset", ArtifactKind.DATASET, "data.csv", CSV, "upload");

        assertEquals(1, model.getVersion());
        assertEquals(1, other.getVersion());
        assertEquals(List.of("dataset", "model"), store.names("p1"));
    }

    @Test
    void shouldKeepEarlierVersionsReadable() {
        store.create("p1", "dataset", null, "data.csv", CSV, "upload");
        store.create("p1", "dataset", null, "data.csv", "x\n".getBytes(), "impute");

        Artifact original = store.resolve("p1", ArtifactReference.parse("dataset@1", null));

        assertArrayEquals(CSV, store.read(original));
        assertTrue(store.verify(original));
        assertEquals(List.of(1, 2), store.versions("p1", "dataset").stream().map(Artifact::getVersion).toList());
    }

    @Test
    void shouldComputeRepeatableContentHash() {
        Artifact first = store.create("p1", "dataset", null, "data.csv", CSV, "upload");
        Artifact second = store.create("p1", "dataset", null, "data.csv", CSV.clone(), "upload");

        assertEquals(first.getContentHash(), second.getContentHash());
        assertEquals(LocalArtifactStoreAdapter.sha256(CSV), first.getContentHash());
        assertEquals(64, first.getContentHash().length());
    }

    @Test
    void shouldDetectTamperedContent() throws Exception {
        Artifact artifact = store.create("p1", "dataset", null, "data.csv", CSV, "upload");

        Files.write(Path.of(artifact.getLocation()), "tampered".getBytes(StandardCharsets.UTF_8));

        assertFalse(store.verify(artifact));
    }

    @Test
    void shouldFailToResolveMissingArtifact() {
        store.create("p1", "dataset", null, "data.csv", CSV, "upload");

        assertThrows(ArtifactNotFoundException.class,
                () -> store.resolve("p1", ArtifactReference.parse("dataset@5", null)));
        assertThrows(ArtifactNotFoundException.class,
                () -> store.resolve("p1", ArtifactReference.parse("model", null)));
    }

    @Test
    void shouldRejectInvalidNameOnCreate() {
        assertThrows(IllegalArgumentException.class,
                () -> store.create("p1", "../escape", null, "data.csv", CSV, "upload"));
    }

    @Test
    void shouldNeverShareVersionBetweenConcurrentCreates() throws Exception {
        int writers = 8;
        ExecutorService executor = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Artifact>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < writers; i++) {
                byte[] content = ("row," + i + "\n").getBytes(StandardCharsets.UTF_8);
                futures.add(executor.submit(() -> {
                    start.await();
                    return store.create("p1", "dataset", null, "data.csv", content, "writer");
                }));
            }
            start.countDown();

            Set<Integer> versions = new HashSet<>();
            for (Future<Artifact> future : futures) {
                versions.add(future.get().getVersion());
            }
            assertEquals(writers, versions.size());
            assertEquals(writers, store.latest("p1", "dataset").orElseThrow().getVersion());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void shouldRemoveEveryArtifactOnDeleteProject() {
        store.create("p1", "dataset", null, "data.csv", CSV, "upload");
        store.create("p2", "dataset", null, "data.csv", CSV, "upload");

        store.deleteProject("p1");

        assertTrue(store.names("p1").isEmpty());
        assertEquals(List.of("dataset"), store.names("p2"));
    }

    @Test
    void shouldStripDirectoriesAndUnsafeCharactersFromFileName() {
        assertEquals("passwd", LocalArtifactStoreAdapter.sanitizeFileName("../../etc/passwd"));
        assertEquals("my_data__1_.csv", LocalArtifactStoreAdapter.sanitizeFileName("my data (1).csv"));
        assertEquals("content.bin", LocalArtifactStoreAdapter.sanitizeFileName(" "));
        assertEquals("content.bin", LocalArtifactStoreAdapter.sanitizeFileName(".."));
        assertEquals("report.csv", LocalArtifactStoreAdapter.sanitizeFileName("C:\\Users\\me\\report.csv"));
    }
}
