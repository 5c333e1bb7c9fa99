package fr.lapetina.hotswap.infrastructure.storage;

import fr.lapetina.hotswap.domain.model.ArtifactVersion;
import fr.lapetina.hotswap.domain.model.SlotId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.security.DigestInputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileSystemException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Versioned on-disk storage of uploaded model artifacts.
 *
 * Layout:
 * <pre>
 * root/
 *   greeter/
 *     versions/
 *       1-3f2a9c0d1e4b/model.tar.gz
 *       1-3f2a9c0d1e4b/.sha256
 *       2-77aa01bc9e0f/model.tar.gz
 *       2-77aa01bc9e0f/.sha256
 *     endpoint
 *     slots/
 *       a/current -> ../../versions/2-77aa01bc9e0f/model.tar.gz
 *       b/current
 * </pre>
 *
 * Workers started for a slot load the artifact found at {@code slots/<slot>/current}.
 * {@code .sha256} holds the full hash and size written at store time. {@code endpoint}
 * holds the worker port index of a model without configured URLs.
 */
public final class ArtifactStore {

    private static final Logger log = LoggerFactory.getLogger(ArtifactStore.class);

    private static final Pattern MODEL_NAME = Pattern.compile("[A-Za-z0-9_-][A-Za-z0-9._-]{0,63}");
    private static final Pattern VERSION_DIR = Pattern.compile("(\\d+)-([0-9a-f]{12})");
    private static final String VERSIONS = "versions";
    private static final String SLOTS = "slots";
    private static final String CURRENT = "current";
    private static final String HASH_FILE = ".sha256";
    private static final String ENDPOINT_FILE = "endpoint";
    private static final String DEFAULT_FILE_NAME = "model.tar.gz";

    private final Path root;

    public ArtifactStore(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    public Path getRoot() {
        return root;
    }

    /**
     * Returns true if the name can be used as a model name (and directory name).
     */
    public static boolean isValidModelName(String name) {
        return name != null && MODEL_NAME.matcher(name).matches();
    }

    /**
     * Stores an uploaded artifact.
     *
     * @return the new version, or the latest one if its content is byte-identical
     */
    public synchronized StoreResult store(String modelName, String fileName, byte[] content) {
        requireValidName(modelName);
        String safeFileName = sanitizeFileName(fileName);
        String hash = sha256(content);

        Optional<ArtifactVersion> latest = latest(modelName);
        if (latest.isPresent() && latest.get().contentHash().equals(hash)) {
            log.info("Artifact unchanged: model={}, version={}", modelName, latest.get().label());
            return new StoreResult(latest.get(), false);
        }

        // Numbered past corrupted directories too, so none is ever reused
        long next = versionDirectories(modelName).keySet().stream().mapToLong(Long::longValue).max().orElse(0L) + 1;
        Path versionDir = root.resolve(modelName).resolve(VERSIONS).resolve(next + "-" + hash.substring(0, 12));
        Path target = versionDir.resolve(safeFileName);
        try {
            Files.createDirectories(versionDir);
            Path temp = Files.createTempFile(versionDir, ".upload", ".tmp");
            Files.write(temp, content);
            moveAtomically(temp, target);
            Files.writeString(versionDir.resolve(HASH_FILE), hash + " " + content.length);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to store artifact for model " + modelName, e);
        }

        ArtifactVersion version = new ArtifactVersion(modelName, next, hash, target, Instant.now());
        log.info("Artifact stored: model={}, version={}, bytes={}, path={}",
                modelName, version.label(), content.length, target);
        return new StoreResult(version, true);
    }

    /**
     * Returns the highest stored version of a model.
     */
    public Optional<ArtifactVersion> latest(String modelName) {
        return versions(modelName).stream().max(Comparator.comparingLong(ArtifactVersion::version));
    }

    /**
     * Lists all stored versions of a model, oldest first.
     *
     * The newest readable version is fully re-hashed. Older versions are checked
     * against their recorded hash and size only.
     */
    public List<ArtifactVersion> versions(String modelName) {
        requireValidName(modelName);
        TreeMap<Long, Path> candidates = versionDirectories(modelName);
        List<ArtifactVersion> result = new ArrayList<>();
        for (Map.Entry<Long, Path> candidate : candidates.descendingMap().entrySet()) {
            try {
                readVersion(modelName, candidate.getKey(), candidate.getValue(), result.isEmpty())
                        .ifPresent(result::add);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read " + candidate.getValue(), e);
            }
        }
        result.sort(Comparator.comparingLong(ArtifactVersion::version));
        return result;
    }

    private TreeMap<Long, Path> versionDirectories(String modelName) {
        Path versionsDir = root.resolve(modelName).resolve(VERSIONS);
        TreeMap<Long, Path> dirsByNumber = new TreeMap<>();
        if (!Files.isDirectory(versionsDir)) {
            return dirsByNumber;
        }
        try (Stream<Path> dirs = Files.list(versionsDir)) {
            for (Path dir : (Iterable<Path>) dirs::iterator) {
                Matcher matcher = VERSION_DIR.matcher(dir.getFileName().toString());
                if (Files.isDirectory(dir) && matcher.matches()) {
                    dirsByNumber.put(Long.parseLong(matcher.group(1)), dir);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list versions of model " + modelName, e);
        }
        return dirsByNumber;
    }

    private Optional<ArtifactVersion> readVersion(String modelName, long number, Path dir, boolean verify)
            throws IOException {
        Optional<Path> file = firstArtifactFile(dir);
        if (file.isEmpty()) {
            return Optional.empty();
        }
        String dirName = dir.getFileName().toString();
        String prefix = dirName.substring(dirName.indexOf('-') + 1);

        String hash = verify ? null : recordedHash(dir.resolve(HASH_FILE), Files.size(file.get()));
        if (hash == null) {
            hash = sha256(file.get());
        }
        if (!hash.startsWith(prefix)) {
            log.warn("Skipping corrupted artifact: model={}, dir={}", modelName, dir);
            return Optional.empty();
        }
        return Optional.of(new ArtifactVersion(
                modelName,
                number,
                hash,
                file.get(),
                Files.getLastModifiedTime(file.get()).toInstant()
        ));
    }

    /**
     * Lists the model names that have at least one stored artifact.
     */
    public List<String> listModels() {
        if (!Files.isDirectory(root)) {
            return List.of();
        }
        try (Stream<Path> dirs = Files.list(root)) {
            return dirs.filter(Files::isDirectory)
                    .map(dir -> dir.getFileName().toString())
                    .filter(ArtifactStore::isValidModelName)
                    .filter(name -> latest(name).isPresent())
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list models under " + root, e);
        }
    }

    /**
     * Points a slot's {@code current} entry at the given artifact.
     * Uses a symbolic link, falling back to a copy where links are unsupported.
     *
     * @return the path the slot's worker loads
     */
    public Path bind(SlotId slotId, ArtifactVersion version) {
        Path slotDir = slotDirectory(version.modelName(), slotId);
        Path current = slotDir.resolve(CURRENT);
        try {
            Files.createDirectories(slotDir);
            Path staged = slotDir.resolve(CURRENT + ".next");
            Files.deleteIfExists(staged);
            try {
                Files.createSymbolicLink(staged, version.storagePath());
            } catch (UnsupportedOperationException | FileSystemException e) {
                log.debug("Symbolic links unavailable, copying artifact: model={}, slot={}",
                        version.modelName(), slotId);
                Files.copy(version.storagePath(), staged, StandardCopyOption.REPLACE_EXISTING);
            }
            moveAtomically(staged, current);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to bind " + version.label() + " to slot " + slotId, e);
        }
        log.info("Artifact bound: model={}, slot={}, version={}", version.modelName(), slotId, version.label());
        return current;
    }

    /**
     * Returns the worker port index recorded for a model, if any.
     */
    public Optional<Integer> endpointIndex(String modelName) {
        requireValidName(modelName);
        Path file = root.resolve(modelName).resolve(ENDPOINT_FILE);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Integer.parseInt(Files.readString(file).trim()));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read endpoint index of model " + modelName, e);
        } catch (NumberFormatException e) {
            log.warn("Ignoring malformed endpoint index: model={}, file={}", modelName, file);
            return Optional.empty();
        }
    }

    /**
     * Records the worker port index of a model so it survives restarts.
     */
    public void saveEndpointIndex(String modelName, int index) {
        requireValidName(modelName);
        Path modelDir = root.resolve(modelName);
        try {
            Files.createDirectories(modelDir);
            Path staged = modelDir.resolve(ENDPOINT_FILE + ".next");
            Files.writeString(staged, Integer.toString(index));
            moveAtomically(staged, modelDir.resolve(ENDPOINT_FILE));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to record endpoint index of model " + modelName, e);
        }
        log.info("Endpoint index recorded: model={}, index={}", modelName, index);
    }

    /**
     * Returns every recorded worker port index, keyed by model name.
     */
    public Map<String, Integer> endpointIndexes() {
        if (!Files.isDirectory(root)) {
            return Map.of();
        }
        Map<String, Integer> indexes = new TreeMap<>();
        try (Stream<Path> dirs = Files.list(root)) {
            dirs.filter(Files::isDirectory)
                    .map(dir -> dir.getFileName().toString())
                    .filter(ArtifactStore::isValidModelName)
                    .forEach(name -> endpointIndex(name).ifPresent(index -> indexes.put(name, index)));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list models under " + root, e);
        }
        return indexes;
    }

    public Path slotDirectory(String modelName, SlotId slotId) {
        requireValidName(modelName);
        return root.resolve(modelName).resolve(SLOTS).resolve(slotId.label());
    }

    private static Optional<Path> firstArtifactFile(Path versionDir) throws IOException {
        try (Stream<Path> files = Files.list(versionDir)) {
            return files.filter(Files::isRegularFile)
                    .filter(f -> !f.getFileName().toString().startsWith("."))
                    .findFirst();
        }
    }

    private static void moveAtomically(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void requireValidName(String modelName) {
        if (!isValidModelName(modelName)) {
            throw new IllegalArgumentException("Invalid model name: " + modelName);
        }
    }

    private static String sanitizeFileName(String fileName) {
        if (fileName == null || fileName.isBlank()) {
            return DEFAULT_FILE_NAME;
        }
        String name = fileName.substring(Math.max(fileName.lastIndexOf('/'), fileName.lastIndexOf('\\')) + 1);
        // Same character rules as model names: no separators, no leading dot
        return isValidModelName(name) ? name : DEFAULT_FILE_NAME;
    }

    /**
     * Returns the hash recorded at store time, or null if it is missing or its size disagrees.
     */
    private static String recordedHash(Path hashFile, long actualSize) throws IOException {
        if (!Files.isRegularFile(hashFile)) {
            return null;
        }
        String[] recorded = Files.readString(hashFile).trim().split(" ");
        if (recorded.length != 2 || !recorded[1].equals(Long.toString(actualSize))) {
            return null;
        }
        return recorded[0];
    }

    static String sha256(byte[] content) {
        return HexFormat.of().formatHex(sha256Digest().digest(content));
    }

    static String sha256(Path file) throws IOException {
        MessageDigest digest = sha256Digest();
        try (InputStream in = new DigestInputStream(Files.newInputStream(file), digest)) {
            in.transferTo(OutputStream.nullOutputStream());
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    private static MessageDigest sha256Digest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Outcome of {@link #store}.
     *
     * @param created false when the upload matched the latest stored content
     */
    public record StoreResult(ArtifactVersion version, boolean created) {
    }
}
