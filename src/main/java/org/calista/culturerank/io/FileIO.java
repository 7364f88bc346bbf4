package org.calista.culturerank.io;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import java.util.Optional;

/**
 * Text file access for configuration and request/response files.
 *
 * <p>Writes go through a temp sibling followed by an atomic move when {@code atomicWrites} is
 * on, so a crashed write never leaves a half-written config behind. Unchanged content is not
 * rewritten.</p>
 */
public final class FileIO {
    private static final Logger log = LogManager.getLogger(FileIO.class);

    private final Charset charset;
    private final boolean atomicWrites;

    public FileIO() {
        this(StandardCharsets.UTF_8, true);
    }

    public FileIO(Charset charset, boolean atomicWrites) {
        this.charset = Objects.requireNonNull(charset, "charset");
        this.atomicWrites = atomicWrites;
    }

    public Charset charset() {
        return charset;
    }

    /** Throws {@link java.nio.file.NoSuchFileException} when the file is missing. */
    public String readString(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        return Files.readString(file, charset);
    }

    public Optional<String> readStringIfExists(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        if (!Files.exists(file)) return Optional.empty();
        return Optional.of(readString(file));
    }

    public void writeString(Path file, String content) throws IOException {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(content, "content");
        ensureParentDir(file);

        if (isSameContent(file, content)) {
            log.debug("writeString: skip unchanged content for {}", file);
            return;
        }

        if (!atomicWrites) {
            Files.writeString(file, content, charset, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
            return;
        }

        Path tmp = file.resolveSibling(file.getFileName().toString() + ".tmp");
        Files.writeString(tmp, content, charset, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
        try {
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.trace("atomicCommit: {} -> {} (ATOMIC)", tmp, file);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            log.trace("atomicCommit: {} -> {} (NON-ATOMIC fallback)", tmp, file);
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    public void ensureParentDir(Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
    }

    private boolean isSameContent(Path file, String content) {
        if (!Files.exists(file)) return false;
        try {
            if (Files.size(file) != content.getBytes(charset).length) return false;
            return Files.readString(file, charset).equals(content);
        } catch (IOException e) {
            log.debug("isSameContent: cannot read {} ({}), rewriting", file, e.toString());
            return false;
        }
    }
}
