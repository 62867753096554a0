package com.tale.script.sandbox;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Properties;
import java.util.Set;

import com.tale.debug.Debug;

/**
 * Immutable engine limits. Defaults come from {@code tale.properties} on the
 * classpath; any key can be overridden with a {@code -Dtale.*} system property.
 * Tests derive variants with the {@code with...} copies.
 */
public final class TaleSettings {

    private static final String TAG = "tale.engine";
    private static final String RESOURCE = "/tale.properties";

    private final long timeoutMillis;
    private final long maxSteps;
    private final int maxCallDepth;
    private final int maxOutputChars;
    private final int maxCollectionSize;
    private final int maxTextLength;
    private final int maxFileBytes;
    private final int maxFiles;
    private final long randomSeed;
    private final Set<String> allowedModules;

    private TaleSettings(long timeoutMillis, long maxSteps, int maxCallDepth, int maxOutputChars,
                         int maxCollectionSize, int maxTextLength, int maxFileBytes, int maxFiles,
                         long randomSeed, Set<String> allowedModules) {
        this.timeoutMillis = positive("timeout-ms", timeoutMillis);
        this.maxSteps = positive("max-steps", maxSteps);
        this.maxCallDepth = (int) positive("max-call-depth", maxCallDepth);
        this.maxOutputChars = (int) positive("max-output-chars", maxOutputChars);
        this.maxCollectionSize = (int) positive("max-collection-size", maxCollectionSize);
        this.maxTextLength = (int) positive("max-text-length", maxTextLength);
        this.maxFileBytes = (int) positive("max-file-bytes", maxFileBytes);
        this.maxFiles = (int) positive("max-files", maxFiles);
        this.randomSeed = randomSeed;
        this.allowedModules = Collections.unmodifiableSet(new LinkedHashSet<>(allowedModules));
    }

    /** Built-in defaults, ignoring the classpath and system properties. */
    public static TaleSettings defaults() {
        return new TaleSettings(2000, 5_000_000, 64, 100_000, 1_000_000, 1_000_000, 1_000_000, 32, 42L,
                new LinkedHashSet<>(Arrays.asList("math", "random", "datetime", "json", "csv")));
    }

    /** Defaults, then {@code tale.properties}, then {@code -Dtale.*}. */
    public static TaleSettings load() {
        Properties props = new Properties();
        try (InputStream in = TaleSettings.class.getResourceAsStream(RESOURCE)) {
            if (in != null) props.load(in);
        } catch (IOException e) {
            Debug.get().w(TAG, "could not read " + RESOURCE + ": " + e.getMessage());
        }
        for (String key : System.getProperties().stringPropertyNames()) {
            if (key.startsWith("tale.")) props.setProperty(key, System.getProperty(key));
        }
        return fromProperties(props);
    }

    public static TaleSettings fromProperties(Properties props) {
        TaleSettings d = defaults();
        return new TaleSettings(
                longOf(props, "tale.sandbox.timeout-ms", d.timeoutMillis),
                longOf(props, "tale.sandbox.max-steps", d.maxSteps),
                (int) longOf(props, "tale.sandbox.max-call-depth", d.maxCallDepth),
                (int) longOf(props, "tale.sandbox.max-output-chars", d.maxOutputChars),
                (int) longOf(props, "tale.sandbox.max-collection-size", d.maxCollectionSize),
                (int) longOf(props, "tale.sandbox.max-text-length", d.maxTextLength),
                (int) longOf(props, "tale.files.max-bytes", d.maxFileBytes),
                (int) longOf(props, "tale.files.max-count", d.maxFiles),
                longOf(props, "tale.random.seed", d.randomSeed),
                modulesOf(props, "tale.modules.allowed", d.allowedModules));
    }

    private static long longOf(Properties props, String key, long fallback) {
        String raw = props.getProperty(key);
        if (raw == null || raw.trim().isEmpty()) return fallback;
        try {
            return Long.parseLong(raw.trim().replace("_", ""));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Setting " + key + " must be a whole number, got '" + raw + "'", e);
        }
    }

    private static Set<String> modulesOf(Properties props, String key, Set<String> fallback) {
        String raw = props.getProperty(key);
        if (raw == null) return fallback;
        Set<String> out = new LinkedHashSet<>();
        for (String m : raw.split(",")) {
            if (!m.trim().isEmpty()) out.add(m.trim());
        }
        return out;
    }

    private static long positive(String name, long v) {
        if (v <= 0) throw new IllegalArgumentException(name + " must be positive: " + v);
        return v;
    }

    public long timeoutMillis() { return timeoutMillis; }
    public long maxSteps() { return maxSteps; }
    public int maxCallDepth() { return maxCallDepth; }
    public int maxOutputChars() { return maxOutputChars; }
    public int maxCollectionSize() { return maxCollectionSize; }
    public int maxTextLength() { return maxTextLength; }
    public int maxFileBytes() { return maxFileBytes; }
    public int maxFiles() { return maxFiles; }
    public long randomSeed() { return randomSeed; }
    public Set<String> allowedModules() { return allowedModules; }

    public boolean isModuleAllowed(String name) { return allowedModules.contains(name); }

    public TaleSettings withTimeoutMillis(long v) {
        return new TaleSettings(v, maxSteps, maxCallDepth, maxOutputChars, maxCollectionSize, maxTextLength,
                maxFileBytes, maxFiles, randomSeed, allowedModules);
    }

    public TaleSettings withMaxSteps(long v) {
        return new TaleSettings(timeoutMillis, v, maxCallDepth, maxOutputChars, maxCollectionSize, maxTextLength,
                maxFileBytes, maxFiles, randomSeed, allowedModules);
    }

    public TaleSettings withMaxCallDepth(int v) {
        return new TaleSettings(timeoutMillis, maxSteps, v, maxOutputChars, maxCollectionSize, maxTextLength,
                maxFileBytes, maxFiles, randomSeed, allowedModules);
    }

    public TaleSettings withMaxOutputChars(int v) {
        return new TaleSettings(timeoutMillis, maxSteps, maxCallDepth, v, maxCollectionSize, maxTextLength,
                maxFileBytes, maxFiles, randomSeed, allowedModules);
    }

    public TaleSettings withMaxCollectionSize(int v) {
        return new TaleSettings(timeoutMillis, maxSteps, maxCallDepth, maxOutputChars, v, maxTextLength,
                maxFileBytes, maxFiles, randomSeed, allowedModules);
    }

    public TaleSettings withMaxFileBytes(int v) {
        return new TaleSettings(timeoutMillis, maxSteps, maxCallDepth, maxOutputChars, maxCollectionSize,
                maxTextLength, v, maxFiles, randomSeed, allowedModules);
    }

    public TaleSettings withRandomSeed(long v) {
        return new TaleSettings(timeoutMillis, maxSteps, maxCallDepth, maxOutputChars, maxCollectionSize,
                maxTextLength, maxFileBytes, maxFiles, v, allowedModules);
    }

    public TaleSettings withAllowedModules(String... modules) {
        return new TaleSettings(timeoutMillis, maxSteps, maxCallDepth, maxOutputChars, maxCollectionSize,
                maxTextLength, maxFileBytes, maxFiles, randomSeed, new LinkedHashSet<>(Arrays.asList(modules)));
    }

    @Override
    public String toString() {
        List<String> parts = new ArrayList<>();
        parts.add("timeoutMillis=" + timeoutMillis);
        parts.add("maxSteps=" + maxSteps);
        parts.add("maxCallDepth=" + maxCallDepth);
        parts.add("maxOutputChars=" + maxOutputChars);
        parts.add("maxCollectionSize=" + maxCollectionSize);
        parts.add("allowedModules=" + allowedModules);
        return "TaleSettings" + parts;
    }
}
