package com.tale.script.sandbox;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

import com.tale.script.diagnostics.SandboxViolationException;
import com.tale.script.diagnostics.TaleException;

/**
 * A per-run, in-memory file workspace. Nothing here reaches the host file
 * system: files exist only for the duration of one run.
 */
public final class SandboxFiles {

    private static final Pattern PATH = Pattern.compile("[A-Za-z0-9_.\\-]+(/[A-Za-z0-9_.\\-]+)*");
    private static final int MAX_PATH_LENGTH = 128;

    private final Map<String, String> files = new LinkedHashMap<>();
    private final int maxBytes;
    private final int maxFiles;

    /** An open file. Writes land in the workspace as they happen. */
    public static final class FileHandle {
        public final String path;
        public final String mode;
        private boolean closed;
        private boolean consumed;

        FileHandle(String path, String mode) {
            this.path = path;
            this.mode = mode;
        }

        public boolean isClosed() { return closed; }
    }

    public SandboxFiles(int maxBytes, int maxFiles) {
        this(maxBytes, maxFiles, null);
    }

    /** @param initial files present before the program starts; may be null */
    public SandboxFiles(int maxBytes, int maxFiles, Map<String, String> initial) {
        this.maxBytes = maxBytes;
        this.maxFiles = maxFiles;
        if (initial != null) {
            for (Map.Entry<String, String> e : initial.entrySet()) store(checkPath(e.getKey()), e.getValue());
        }
    }

    public FileHandle open(String path, String mode) {
        String p = checkPath(path);
        if (!mode.equals("r") && !mode.equals("w") && !mode.equals("a")) {
            throw new SandboxViolationException("File mode must be \"r\", \"w\" or \"a\", not \"" + mode + "\"");
        }
        if (mode.equals("r") && !files.containsKey(p)) {
            throw TaleException.runtime("File not found: " + p);
        }
        if (mode.equals("w") || (mode.equals("a") && !files.containsKey(p))) store(p, "");
        return new FileHandle(p, mode);
    }

    /** The whole file on the first read, then empty text, as with a real file. */
    public String read(FileHandle h) {
        requireOpen(h);
        if (!h.mode.equals("r")) throw TaleException.runtime("File " + h.path + " was not opened for reading");
        if (h.consumed) return "";
        h.consumed = true;
        return files.get(h.path);
    }

    public void write(FileHandle h, String text) {
        requireOpen(h);
        if (h.mode.equals("r")) throw TaleException.runtime("File " + h.path + " was opened for reading only");
        store(h.path, files.get(h.path) + text);
    }

    public void close(FileHandle h) {
        h.closed = true;
    }

    public String readAll(String path) {
        String p = checkPath(path);
        String content = files.get(p);
        if (content == null) throw TaleException.runtime("File not found: " + p);
        return content;
    }

    public void writeAll(String path, String content) {
        store(checkPath(path), content);
    }

    public boolean exists(String path) {
        return files.containsKey(checkPath(path));
    }

    public Map<String, String> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(files));
    }

    private void requireOpen(FileHandle h) {
        if (h.closed) throw TaleException.runtime("File " + h.path + " is already closed");
    }

    private void store(String path, String content) {
        if (!files.containsKey(path) && files.size() >= maxFiles) {
            throw TaleException.resourceLimit("No more than " + maxFiles + " files can be created");
        }
        long total = bytes(content);
        for (Map.Entry<String, String> e : files.entrySet()) {
            if (!e.getKey().equals(path)) total += bytes(e.getValue());
        }
        if (total > maxBytes) {
            throw TaleException.resourceLimit("Files may hold at most " + maxBytes + " bytes in total");
        }
        files.put(path, content);
    }

    private static long bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8).length;
    }

    static String checkPath(String path) {
        if (path == null || path.isEmpty()) throw new SandboxViolationException("A file name is required");
        if (path.length() > MAX_PATH_LENGTH) {
            throw new SandboxViolationException("File name is longer than " + MAX_PATH_LENGTH + " characters");
        }
        if (path.startsWith("/") || path.contains("\\") || path.contains(":")) {
            throw new SandboxViolationException("Only relative file names are allowed: " + path);
        }
        for (String part : path.split("/")) {
            if (part.equals("..") || part.equals(".")) {
                throw new SandboxViolationException("File names may not contain '.' or '..' parts: " + path);
            }
        }
        if (!PATH.matcher(path).matches()) {
            throw new SandboxViolationException("File names may only use letters, digits, '.', '-', '_' and '/': " + path);
        }
        return path;
    }
}
