package com.bank.governance.engine;

import com.bank.governance.config.MetricsConfig;
import com.bank.governance.config.ScannerConfig;
import com.bank.governance.exception.PatternConfigurationException;
import com.bank.governance.model.DetectionPattern;
import com.bank.governance.model.PatternSource;
import com.bank.governance.model.ThreatType;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PatternStoreTest {

    private static final int BUILT_IN_COUNT = 20;

    @TempDir
    Path tempDir;

    private ScannerConfig config;
    private PatternStore store;

    @BeforeEach
    void setUp() {
        config = new ScannerConfig();
        store = new PatternStore(config, new MetricsConfig(new SimpleMeterRegistry()));
    }

    @AfterEach
    void tearDown() {
        store.shutdown();
    }

    @Test
    void builtInPatterns_loadedInTaxonomyOrder() {
        PatternSnapshot snapshot = store.current();

        assertThat(snapshot.size()).isEqualTo(BUILT_IN_COUNT);
        assertThat(snapshot.patterns().get(0).getId()).isEqualTo("PAT-INSTRUCTION_OVERRIDE-1");
        assertThat(snapshot.patterns().get(0).getThreatType()).isEqualTo(ThreatType.INSTRUCTION_OVERRIDE);
        assertThat(snapshot.patterns().get(BUILT_IN_COUNT - 1).getThreatType()).isEqualTo(ThreatType.JAILBREAK);
        assertThat(snapshot.patterns()).allMatch(p -> p.getSource() == PatternSource.BUILT_IN);
    }

    @Test
    void init_withoutPatternFile_keepsBuiltInsOnly() {
        store.init();
        assertThat(store.current().version()).isZero();
        assertThat(store.current().size()).isEqualTo(BUILT_IN_COUNT);
    }

    @Test
    void reload_appendsFilePatternsAfterBuiltIns() throws Exception {
        config.setPatternsFile(copyFixture().toString());

        PatternSnapshot snapshot = store.reload();

        assertThat(snapshot.version()).isEqualTo(1);
        assertThat(snapshot.size()).isEqualTo(BUILT_IN_COUNT + 3);
        assertThat(snapshot.patterns().get(BUILT_IN_COUNT).getId()).isEqualTo("BANK-SWIFT-OVERRIDE");
        assertThat(snapshot.patterns().get(BUILT_IN_COUNT).getSource()).isEqualTo(PatternSource.FILE);
        assertThat(snapshot.enabledPatterns()).extracting(DetectionPattern::getId)
                .contains("BANK-LIMIT-LEAK")
                .doesNotContain("BANK-DISABLED");
    }

    @Test
    void reload_invalidRegex_keepsPreviousSnapshot() throws Exception {
        Path file = copyFixture();
        config.setPatternsFile(file.toString());
        PatternSnapshot good = store.reload();

        Files.writeString(file, """
                {"patterns": [{"id": "BROKEN", "threatType": "jailbreak", "pattern": "([unclosed"}]}
                """);

        assertThatThrownBy(() -> store.reload())
                .isInstanceOf(PatternConfigurationException.class)
                .hasMessageContaining("BROKEN");
        assertThat(store.current()).isSameAs(good);
    }

    @Test
    void reload_statFailure_keepsPreviousSnapshot() throws Exception {
        AtomicBoolean statFails = new AtomicBoolean(false);
        store = new PatternStore(config, new MetricsConfig(new SimpleMeterRegistry())) {
            @Override
            long lastModifiedMillis(Path path) throws IOException {
                if (statFails.get()) {
                    throw new IOException("stale NFS handle");
                }
                return super.lastModifiedMillis(path);
            }
        };
        config.setPatternsFile(copyFixture().toString());
        PatternSnapshot good = store.reload();

        statFails.set(true);

        assertThatThrownBy(() -> store.reload())
                .isInstanceOf(PatternConfigurationException.class)
                .hasMessageContaining("Cannot stat pattern file")
                .hasCauseInstanceOf(IOException.class);
        assertThat(store.current()).isSameAs(good);
        assertThat(store.current().version()).isEqualTo(1);

        store.reloadIfChanged();
        assertThat(store.current()).isSameAs(good);
    }

    @Test
    void reload_unknownThreatType_rejected() throws Exception {
        Path file = tempDir.resolve("bad-type.json");
        Files.writeString(file, """
                {"patterns": [{"id": "X-1", "threatType": "phishing", "pattern": "wire\\\\s+now"}]}
                """);
        config.setPatternsFile(file.toString());

        assertThatThrownBy(() -> store.reload())
                .isInstanceOf(PatternConfigurationException.class)
                .hasMessageContaining("X-1");
        assertThat(store.current().version()).isZero();
    }

    @Test
    void reload_duplicateOfBuiltInId_rejected() throws Exception {
        Path file = tempDir.resolve("dup.json");
        Files.writeString(file, """
                {"patterns": [{"id": "PAT-JAILBREAK-1", "threatType": "jailbreak", "pattern": "evil\\\\s+mode"}]}
                """);
        config.setPatternsFile(file.toString());

        assertThatThrownBy(() -> store.reload())
                .isInstanceOf(PatternConfigurationException.class)
                .hasMessageContaining("Duplicate pattern id");
    }

    @Test
    void reload_missingFile_rejected() {
        config.setPatternsFile(tempDir.resolve("absent.json").toString());

        assertThatThrownBy(() -> store.reload()).isInstanceOf(PatternConfigurationException.class);
        assertThat(store.current().size()).isEqualTo(BUILT_IN_COUNT);
    }

    @Test
    void init_withBadFile_startsWithBuiltIns() throws Exception {
        Path file = tempDir.resolve("garbage.json");
        Files.writeString(file, "not json at all");
        config.setPatternsFile(file.toString());

        store.init();

        assertThat(store.current().size()).isEqualTo(BUILT_IN_COUNT);
    }

    @Test
    void reloadIfChanged_picksUpModifiedFile() throws Exception {
        Path file = copyFixture();
        config.setPatternsFile(file.toString());
        store.reload();

        Files.writeString(file, """
                {"patterns": [{"id": "BANK-NEW", "threatType": "prompt_leak", "pattern": "dump\\\\s+config"}]}
                """);
        Files.setLastModifiedTime(file, FileTime.fromMillis(System.currentTimeMillis() + 60_000));
        store.reloadIfChanged();

        assertThat(store.current().patterns()).extracting(DetectionPattern::getId)
                .contains("BANK-NEW")
                .doesNotContain("BANK-SWIFT-OVERRIDE");
    }

    @Test
    void reloadIfChanged_unchangedFile_keepsVersion() throws Exception {
        config.setPatternsFile(copyFixture().toString());
        store.reload();
        long version = store.current().version();

        store.reloadIfChanged();

        assertThat(store.current().version()).isEqualTo(version);
    }

    @Test
    void add_appendsRuntimePatternAndBumpsVersion() {
        DetectionPattern added = store.add("transfer\\s+everything\\s+offshore", ThreatType.CUSTOM);

        assertThat(added.getId()).isEqualTo("PAT-RUNTIME-1");
        assertThat(added.getSource()).isEqualTo(PatternSource.RUNTIME);
        PatternSnapshot snapshot = store.current();
        assertThat(snapshot.version()).isEqualTo(1);
        assertThat(snapshot.patterns().get(snapshot.size() - 1)).isEqualTo(added);
        assertThat(added.matches("Please TRANSFER everything offshore")).isTrue();
    }

    @Test
    void add_survivesFileReload() throws Exception {
        DetectionPattern added = store.add("secret\\s+handshake", ThreatType.JAILBREAK);
        config.setPatternsFile(copyFixture().toString());

        PatternSnapshot snapshot = store.reload();

        List<DetectionPattern> patterns = snapshot.patterns();
        assertThat(patterns.get(patterns.size() - 1).getId()).isEqualTo(added.getId());
    }

    @Test
    void add_concurrentWithReaders_heldSnapshotsNeverChange() throws Exception {
        int writers = 4;
        int addsPerWriter = 25;
        ExecutorService pool = Executors.newFixedThreadPool(writers + 2);
        CountDownLatch start = new CountDownLatch(1);
        AtomicBoolean readerSawMutation = new AtomicBoolean(false);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int w = 0; w < writers; w++) {
                int writer = w;
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < addsPerWriter; i++) {
                        store.add("writer" + writer + "\\s+marker" + i, ThreatType.CUSTOM);
                    }
                    return null;
                }));
            }
            for (int r = 0; r < 2; r++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < 200; i++) {
                        PatternSnapshot held = store.current();
                        int size = held.size();
                        long version = held.version();
                        Thread.yield();
                        if (held.size() != size || held.version() != version
                                || held.size() != BUILT_IN_COUNT + version) {
                            readerSawMutation.set(true);
                        }
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        PatternSnapshot last = store.current();
        assertThat(readerSawMutation).isFalse();
        assertThat(last.version()).isEqualTo(writers * addsPerWriter);
        assertThat(last.size()).isEqualTo(BUILT_IN_COUNT + writers * addsPerWriter);
        assertThat(last.patterns()).extracting(DetectionPattern::getId).doesNotHaveDuplicates();
    }

    @Test
    void add_invalidRegex_leavesSnapshotUntouched() {
        PatternSnapshot before = store.current();

        assertThatThrownBy(() -> store.add("(unbalanced", ThreatType.CUSTOM))
                .isInstanceOf(PatternConfigurationException.class);
        assertThat(store.current()).isSameAs(before);
    }

    @Test
    void add_emptyMatchingRegex_rejected() {
        assertThatThrownBy(() -> store.add("x*", ThreatType.CUSTOM))
                .isInstanceOf(PatternConfigurationException.class)
                .hasMessageContaining("empty string");
    }

    @Test
    void snapshot_isImmutable() {
        PatternSnapshot snapshot = store.current();
        assertThatThrownBy(() -> snapshot.patterns().clear()).isInstanceOf(UnsupportedOperationException.class);
    }

    private Path copyFixture() throws Exception {
        Path target = tempDir.resolve("custom-patterns.json");
        try (InputStream in = getClass().getResourceAsStream("/patterns/custom-patterns.json")) {
            assertThat(in).isNotNull();
            Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
        }
        return target;
    }
}
