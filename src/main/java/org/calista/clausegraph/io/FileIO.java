package org.calista.clausegraph.io;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.channels.FileChannel;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.zip.GZIPInputStream;

/**
 * FileIO is the single I/O entry point of the project, bound to a base directory.
 *
 * <ul>
 *   <li>traversal-safe {@link #resolve(String)} inside the base directory</li>
 *   <li>transparent gzip reading for {@code .gz}/{@code .gzip} files</li>
 *   <li>atomic writes: temp sibling, optional fsync, then move over the target</li>
 *   <li>JSONL helpers (trim + skip blank lines)</li>
 * </ul>
 */
public final class FileIO {
    private static final Logger log = LogManager.getLogger(FileIO.class);

    public static final class Options {
        public final Charset charset;
        public final boolean atomicWrites;
        public final boolean fsyncOnCommit;

        private Options(Builder b) {
            this.charset = b.charset;
            this.atomicWrites = b.atomicWrites;
            this.fsyncOnCommit = b.fsyncOnCommit;
        }

        public static Builder builder() {
            return new Builder();
        }

        public static final class Builder {
            private Charset charset = StandardCharsets.UTF_8;
            private boolean atomicWrites = true;
            private boolean fsyncOnCommit = false;

            public Builder charset(Charset v) {
                this.charset = Objects.requireNonNull(v, "charset");
                return this;
            }

            public Builder atomicWrites(boolean v) {
                this.atomicWrites = v;
                return this;
            }

            public Builder fsyncOnCommit(boolean v) {
                this.fsyncOnCommit = v;
                return this;
            }

            public Options build() {
                return new Options(this);
            }
        }
    }

    private final Path baseDir;
    private final Options opt;

    public FileIO(Path baseDir) {
        this(baseDir, Options.builder().build());
    }

    public FileIO(Path baseDir, Options options) {
        this.baseDir = Objects.requireNonNull(baseDir, "baseDir").toAbsolutePath().normalize();
        this.opt = Objects.requireNonNull(options, "options");
        try {
            ensureBaseDir();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to ensure base directory " + this.baseDir, e);
        }
        log.debug("FileIO init: baseDir={}, charset={}, atomicWrites={}, fsyncOnCommit={}",
                this.baseDir, opt.charset, opt.atomicWrites, opt.fsyncOnCommit);
    }

    public Path baseDir() {
        return baseDir;
    }

    public void ensureBaseDir() throws IOException {
        Files.createDirectories(baseDir);
    }

    /**
     * Resolves a relative path inside the base directory. Absolute paths and ".." escapes are rejected.
     */
    public Path resolve(String relative) {
        Objects.requireNonNull(relative, "relative");
        Path rel = Paths.get(relative.replace('\\', '/'));
        if (rel.isAbsolute()) {
            throw new IllegalArgumentException("resolve(relative) does not accept absolute paths: " + relative);
        }
        Path p = baseDir.resolve(rel).normalize().toAbsolutePath();
        if (!p.startsWith(baseDir)) throw new IllegalArgumentException("Path traversal detected: " + relative);
        return p;
    }

    public void ensureParentDir(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        Path parent = file.getParent();
        if (parent != null) Files.createDirectories(parent);
    }

    public boolean exists(Path file) {
        Objects.requireNonNull(file, "file");
        return Files.exists(file);
    }

    // ----------------------------
    // Text
    // ----------------------------

    public String readString(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        if (isGzip(file)) {
            try (InputStream in = openInputStream(file)) {
                return new String(in.readAllBytes(), opt.charset);
            }
        }
        return Files.readString(file, opt.charset);
    }

    public void writeString(Path file, String content) throws IOException {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(content, "content");
        ensureParentDir(file);

        if (!opt.atomicWrites) {
            Files.writeString(file, content, opt.charset,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
            return;
        }

        Path tmp = tempSibling(file);
        Files.writeString(tmp, content, opt.charset,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
        atomicCommit(tmp, file);
    }

    // ----------------------------
    // JSONL
    // ----------------------------

    /** Small JSONL files (in memory). Lines are trimmed and blank lines skipped. */
    public List<String> readJsonl(Path file) throws IOException {
        try (Stream<String> s = jsonlStream(file)) {
            List<String> out = s.collect(Collectors.toList());
            log.debug("readJsonl: {} ({} records)", file, out.size());
            return out;
        }
    }

    /** Stream of JSONL records. The stream must be closed by the caller. */
    public Stream<String> jsonlStream(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        Stream<String> base;
        if (isGzip(file)) {
            BufferedReader br = new BufferedReader(new InputStreamReader(openInputStream(file), opt.charset));
            base = br.lines().onClose(() -> {
                try {
                    br.close();
                } catch (IOException e) {
                    log.warn("Failed to close reader for {}: {}", file, e.toString());
                }
            });
        } else {
            base = Files.lines(file, opt.charset);
        }
        return base
                .map(x -> x == null ? "" : x.trim())
                .filter(x -> !x.isEmpty());
    }

    // ----------------------------
    // Streaming writer (atomic)
    // ----------------------------

    /**
     * Opens a writer for {@code file}. With atomic writes the content goes to a temp sibling and
     * only replaces the target on {@link #commit(WriterHandle)}.
     */
    public WriterHandle openWriter(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        ensureParentDir(file);

        Path target = opt.atomicWrites ? tempSibling(file) : file;
        BufferedWriter w = Files.newBufferedWriter(target, opt.charset,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
        return new WriterHandle(file, opt.atomicWrites ? target : null, w);
    }

    public void commit(WriterHandle h) throws IOException {
        Objects.requireNonNull(h, "handle");
        try {
            h.writer.close();
        } catch (IOException e) {
            log.error("commit: failed to close writer for {}", h.targetFile, e);
            throw e;
        }
        if (h.tmpFile != null) atomicCommit(h.tmpFile, h.targetFile);
    }

    public void rollback(WriterHandle h) {
        if (h == null) return;
        try {
            h.writer.close();
        } catch (IOException e) {
            log.debug("rollback: close failed for {}: {}", h.targetFile, e.toString());
        }
        if (h.tmpFile != null) {
            try {
                Files.deleteIfExists(h.tmpFile);
            } catch (IOException e) {
                log.warn("rollback: failed to delete tmp {}", h.tmpFile, e);
            }
        }
    }

    public static final class WriterHandle {
        public final Path targetFile;
        public final Path tmpFile; // null without atomic writes
        public final BufferedWriter writer;

        private WriterHandle(Path targetFile, Path tmpFile, BufferedWriter writer) {
            this.targetFile = targetFile;
            this.tmpFile = tmpFile;
            this.writer = writer;
        }
    }

    // ----------------------------
    // Internals
    // ----------------------------

    private static Path tempSibling(Path file) {
        String name = file.getFileName().toString();
        return file.resolveSibling("." + name + ".tmp-" + Long.toHexString(System.nanoTime()));
    }

    private void atomicCommit(Path tmp, Path target) throws IOException {
        if (opt.fsyncOnCommit) fsync(tmp);
        try {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.trace("atomicCommit: {} -> {} (ATOMIC)", tmp, target);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            log.trace("atomicCommit: {} -> {} (NON-ATOMIC fallback)", tmp, target);
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    private static void fsync(Path file) {
        try (FileChannel ch = FileChannel.open(file, StandardOpenOption.READ)) {
            ch.force(true);
        } catch (IOException e) {
            log.debug("fsync ignored for {}: {}", file, e.toString());
        }
    }

    private static boolean isGzip(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".gz") || name.endsWith(".gzip");
    }

    private static InputStream openInputStream(Path file) throws IOException {
        if (isGzip(file)) return new GZIPInputStream(Files.newInputStream(file));
        return Files.newInputStream(file);
    }
}
