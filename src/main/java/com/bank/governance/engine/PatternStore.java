package com.bank.governance.engine;

import com.bank.governance.config.MetricsConfig;
import com.bank.governance.config.ScannerConfig;
import com.bank.governance.exception.PatternConfigurationException;
import com.bank.governance.model.DetectionPattern;
import com.bank.governance.model.PatternSource;
import com.bank.governance.model.ThreatType;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.Data;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.regex.PatternSyntaxException;

/**
 * Owns the detection pattern set and publishes it as immutable {@link PatternSnapshot}s.
 *
 * <p>Snapshot order is built-in patterns, then patterns from the configured file, then runtime
 * additions. Readers call {@link #current()} and never lock. Writers are serialized on this
 * object, validate the complete candidate list, and swap the reference only when it is valid,
 * so a bad file or regex leaves the last known-good snapshot in place.
 */
@Component
public class PatternStore {

    private static final Logger log = LoggerFactory.getLogger(PatternStore.class);

    private final ScannerConfig config;
    private final MetricsConfig metricsConfig;
    private final ObjectMapper objectMapper;
    private final List<DetectionPattern> builtIn;

    private final AtomicReference<PatternSnapshot> snapshot;

    // guarded by this
    private List<DetectionPattern> filePatterns = List.of();
    private final List<DetectionPattern> runtimePatterns = new ArrayList<>();
    private long runtimeSequence = 0;
    private long version = 0;
    private long fileLastModified = Long.MIN_VALUE;

    private ScheduledExecutorService scheduler;

    public PatternStore(ScannerConfig config, MetricsConfig metricsConfig) {
        this.config = config;
        this.metricsConfig = metricsConfig;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.builtIn = BuiltInPatterns.compile();
        this.snapshot = new AtomicReference<>(new PatternSnapshot(0, builtIn, Instant.now()));
    }

    @PostConstruct
    public void init() {
        if (!hasPatternFile()) {
            log.info("Pattern store initialized with {} built-in patterns", builtIn.size());
            return;
        }
        try {
            reload();
        } catch (PatternConfigurationException e) {
            log.warn("Starting with built-in patterns only; pattern file {} rejected: {}",
                    config.getPatternsFile(), e.getMessage());
        }
        startReloadCheck(config.getPatternReloadSeconds());
    }

    @PreDestroy
    public void shutdown() {
        if (scheduler != null) {
            scheduler.shutdownNow();
        }
    }

    /**
     * Start periodic change detection on the pattern file.
     */
    public void startReloadCheck(int intervalSeconds) {
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "pattern-file-watch");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleWithFixedDelay(this::reloadIfChanged, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
    }

    public PatternSnapshot current() {
        return snapshot.get();
    }

    /**
     * Reload the pattern file if its modification time changed since the last attempt.
     * Failures are logged; the active snapshot is kept.
     */
    public void reloadIfChanged() {
        try {
            Path path = patternFilePath();
            if (path == null || !Files.exists(path)) {
                return;
            }
            long modified = lastModifiedMillis(path);
            synchronized (this) {
                if (modified == fileLastModified) {
                    return;
                }
            }
            reload();
        } catch (PatternConfigurationException e) {
            log.debug("Pattern file change rejected, keeping snapshot v{}", current().version());
        } catch (IOException e) {
            log.error("Failed to stat pattern file {}", config.getPatternsFile(), e);
        }
    }

    /**
     * Re-read the pattern file and publish a new snapshot.
     *
     * @return the published snapshot
     * @throws PatternConfigurationException if the file is missing, unreadable or contains an invalid pattern
     */
    public synchronized PatternSnapshot reload() {
        if (!hasPatternFile()) {
            filePatterns = List.of();
            return publish(filePatterns, runtimePatterns, "reload");
        }
        Path path = patternFilePath();
        try {
            // recorded before parsing so an invalid file is not retried until it changes again
            try {
                fileLastModified = Files.exists(path) ? lastModifiedMillis(path) : Long.MIN_VALUE;
            } catch (IOException e) {
                throw new PatternConfigurationException("Cannot stat pattern file " + path + ": " + e.getMessage(), e);
            }
            List<DetectionPattern> parsed = readPatternFile(path);
            PatternSnapshot published = publish(parsed, runtimePatterns, "reload");
            filePatterns = parsed;
            log.info("Loaded {} patterns from {}, snapshot v{} active with {} patterns",
                    parsed.size(), path, published.version(), published.size());
            return published;
        } catch (PatternConfigurationException e) {
            metricsConfig.recordPatternReload("rejected");
            log.error("Rejected pattern file {}: {}. Keeping snapshot v{}",
                    path, e.getMessage(), current().version());
            throw e;
        }
    }

    /**
     * Append an enabled pattern at runtime. In-flight scans keep the snapshot they started with.
     *
     * @throws PatternConfigurationException if the regex is invalid
     */
    public synchronized DetectionPattern add(String regex, ThreatType threatType) {
        Set<String> taken = new HashSet<>();
        current().patterns().forEach(p -> taken.add(p.getId()));
        String id;
        do {
            id = "PAT-RUNTIME-" + (++runtimeSequence);
        } while (taken.contains(id));

        DetectionPattern pattern = compileValidated(id, threatType, regex, true, PatternSource.RUNTIME);
        List<DetectionPattern> candidate = new ArrayList<>(runtimePatterns);
        candidate.add(pattern);
        publish(filePatterns, candidate, "runtime_add");
        runtimePatterns.add(pattern);
        log.info("Added runtime pattern {} ({})", id, threatType.getValue());
        return pattern;
    }

    private PatternSnapshot publish(List<DetectionPattern> file, List<DetectionPattern> runtime, String cause) {
        List<DetectionPattern> all = new ArrayList<>(builtIn.size() + file.size() + runtime.size());
        all.addAll(builtIn);
        all.addAll(file);
        all.addAll(runtime);

        Set<String> ids = new HashSet<>();
        for (DetectionPattern pattern : all) {
            if (!ids.add(pattern.getId())) {
                throw new PatternConfigurationException("Duplicate pattern id: " + pattern.getId());
            }
        }

        PatternSnapshot next = new PatternSnapshot(++version, all, Instant.now());
        snapshot.set(next);
        metricsConfig.recordPatternReload(cause);
        return next;
    }

    private List<DetectionPattern> readPatternFile(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new PatternConfigurationException("Pattern file not found: " + path);
        }
        PatternFile file;
        try {
            file = objectMapper.readValue(path.toFile(), PatternFile.class);
        } catch (IOException e) {
            throw new PatternConfigurationException("Unparsable pattern file " + path + ": " + e.getMessage(), e);
        }
        if (file == null || file.getPatterns() == null) {
            throw new PatternConfigurationException("Pattern file " + path + " has no 'patterns' array");
        }

        List<DetectionPattern> patterns = new ArrayList<>();
        int index = 0;
        for (PatternDefinition def : file.getPatterns()) {
            index++;
            if (def.getId() == null || def.getId().isBlank()) {
                throw new PatternConfigurationException("Pattern #" + index + " has no id");
            }
            ThreatType type;
            try {
                type = ThreatType.fromValue(def.getThreatType());
            } catch (IllegalArgumentException e) {
                throw new PatternConfigurationException("Pattern " + def.getId() + ": " + e.getMessage(), e);
            }
            patterns.add(compileValidated(def.getId().trim(), type, def.getPattern(), def.isEnabled(), PatternSource.FILE));
        }
        return patterns;
    }

    static DetectionPattern compileValidated(String id, ThreatType type, String regex,
                                             boolean enabled, PatternSource source) {
        if (type == null) {
            throw new PatternConfigurationException("Pattern " + id + " has no threat type");
        }
        if (regex == null || regex.isBlank()) {
            throw new PatternConfigurationException("Pattern " + id + " has an empty regex");
        }
        DetectionPattern pattern;
        try {
            pattern = DetectionPattern.compile(id, type, regex, enabled, source);
        } catch (PatternSyntaxException e) {
            throw new PatternConfigurationException(
                    "Pattern " + id + " is not a valid regex: " + e.getDescription(), e);
        }
        // an empty match would flag every input and could never be removed by sanitize
        if (pattern.getCompiled().matcher("").matches()) {
            throw new PatternConfigurationException("Pattern " + id + " matches the empty string");
        }
        return pattern;
    }

    long lastModifiedMillis(Path path) throws IOException {
        return Files.getLastModifiedTime(path).toMillis();
    }

    private boolean hasPatternFile() {
        return config.getPatternsFile() != null && !config.getPatternsFile().isBlank();
    }

    private Path patternFilePath() {
        return hasPatternFile() ? Paths.get(config.getPatternsFile().trim()) : null;
    }

    @Data
    static class PatternFile {
        private List<PatternDefinition> patterns;
    }

    @Data
    static class PatternDefinition {
        private String id;
        private String threatType;
        private String pattern;
        private boolean enabled = true;
    }
}
