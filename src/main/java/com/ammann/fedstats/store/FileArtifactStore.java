/* (C)2026 */
package com.ammann.fedstats.store;

import com.ammann.fedstats.exception.ArtifactStoreException;
import com.ammann.fedstats.model.RoundReference;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.jboss.logging.Logger;

/**
 * Directory-backed artifact store.
 *
 * <p>Layout below the root:
 * <ul>
 *   <li>{@code <run>/run.json}: run descriptor</li>
 *   <li>{@code <run>/<seq>-<round>/mid/<participant>.jsonl}: local payloads</li>
 *   <li>{@code <run>/<seq>-<round>/global.jsonl}: global payload</li>
 *   <li>{@code <run>/<seq>-<round>/closed}: round-closure marker</li>
 * </ul>
 *
 * <p>Blobs are first written to a hidden temp file in the target directory and then linked
 * into place, so a listing never returns a partially written payload. Linking fails if the
 * target exists, which makes every key write-once even between concurrent writers.
 */
public class FileArtifactStore implements ArtifactStore {

    private static final Logger LOG = Logger.getLogger(FileArtifactStore.class);

    static final String RUN_FILE = "run.json";
    static final String LOCAL_DIR = "mid";
    static final String GLOBAL_FILE = "global.jsonl";
    static final String CLOSED_MARKER = "closed";
    static final String PAYLOAD_SUFFIX = ".jsonl";
    private static final String TEMP_PREFIX = ".tmp-";

    private final Path root;

    public FileArtifactStore(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    public Path getRoot() {
        return root;
    }

    @Override
    public void write(ArtifactKey key, String blob) {
        Path target = pathOf(key);
        writeOnce(target, blob, key);
        LOG.debugf("Published artifact %s (%d bytes)", key, blob.length());
    }

    @Override
    public Optional<String> read(ArtifactKey key) {
        return readIfExists(pathOf(key));
    }

    @Override
    public List<String> listLocal(String runId, RoundReference round) {
        Path directory = roundDirectory(runId, round).resolve(LOCAL_DIR);
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*" + PAYLOAD_SUFFIX)) {
            for (Path path : stream) {
                if (!path.getFileName().toString().startsWith(TEMP_PREFIX)) {
                    files.add(path);
                }
            }
        } catch (IOException e) {
            throw new ArtifactStoreException("Cannot list local payloads in " + directory, e);
        }
        files.sort(null);

        List<String> blobs = new ArrayList<>(files.size());
        for (Path file : files) {
            readIfExists(file).ifPresent(blobs::add);
        }
        return blobs;
    }

    @Override
    public void close(String runId, RoundReference round) {
        Path marker = roundDirectory(runId, round).resolve(CLOSED_MARKER);
        try {
            Files.createDirectories(marker.getParent());
            Files.createFile(marker);
            LOG.infof("Closed round %s of run %s", round, runId);
        } catch (FileAlreadyExistsException e) {
            LOG.debugf("Round %s of run %s was already closed", round, runId);
        } catch (IOException e) {
            throw new ArtifactStoreException("Cannot close round " + round + " of run " + runId, e);
        }
    }

    @Override
    public boolean isClosed(String runId, RoundReference round) {
        return Files.exists(roundDirectory(runId, round).resolve(CLOSED_MARKER));
    }

    @Override
    public void writeRun(String runId, String descriptor) {
        writeOnce(runDirectory(runId).resolve(RUN_FILE), descriptor, runId + "/" + RUN_FILE);
    }

    @Override
    public Optional<String> readRun(String runId) {
        return readIfExists(runDirectory(runId).resolve(RUN_FILE));
    }

    @Override
    public boolean isWritable() {
        try {
            Files.createDirectories(root);
            return Files.isWritable(root);
        } catch (IOException e) {
            LOG.warnf("Artifact store root %s is not usable: %s", root, e.getMessage());
            return false;
        }
    }

    Path pathOf(ArtifactKey key) {
        Path roundDirectory = roundDirectory(key.runId(), key.round());
        if (key.isGlobal()) {
            return roundDirectory.resolve(GLOBAL_FILE);
        }
        return roundDirectory.resolve(LOCAL_DIR).resolve(key.participant() + PAYLOAD_SUFFIX);
    }

    private Path runDirectory(String runId) {
        Path directory = root.resolve(runId).normalize();
        if (!directory.getParent().equals(root)) {
            throw new ArtifactStoreException("Run id escapes the store root: " + runId);
        }
        return directory;
    }

    private Path roundDirectory(String runId, RoundReference round) {
        return runDirectory(runId).resolve(round.sequence() + "-" + round.round());
    }

    private void writeOnce(Path target, String content, Object key) {
        if (Files.exists(target)) {
            throw ArtifactStoreException.alreadyPublished(key);
        }
        Path temp = null;
        try {
            Files.createDirectories(target.getParent());
            temp = target.resolveSibling(TEMP_PREFIX + UUID.randomUUID());
            Files.writeString(temp, content, StandardCharsets.UTF_8);
            linkIntoPlace(temp, target);
        } catch (FileAlreadyExistsException e) {
            throw ArtifactStoreException.alreadyPublished(key);
        } catch (IOException e) {
            throw new ArtifactStoreException("Cannot write artifact " + key, e);
        } finally {
            deleteQuietly(temp);
        }
    }

    private void linkIntoPlace(Path temp, Path target) throws IOException {
        try {
            // link(2) fails with EEXIST, so the existence check and the publish are one step
            Files.createLink(target, temp);
        } catch (UnsupportedOperationException e) {
            LOG.debugf("Hard links unsupported for %s, falling back to plain move", target);
            Files.move(temp, target);
        }
    }

    private Optional<String> readIfExists(Path file) {
        try {
            return Optional.of(Files.readString(file, StandardCharsets.UTF_8));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new ArtifactStoreException("Cannot read artifact " + file, e);
        }
    }

    private void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            LOG.warnf("Could not remove temp file %s: %s", temp, e.getMessage());
        }
    }
}
