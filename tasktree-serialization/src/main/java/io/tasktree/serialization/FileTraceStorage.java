package io.tasktree.serialization;

import io.tasktree.core.trace.TraceNode;
import io.tasktree.core.trace.TraceStorage;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/// {@link TraceStorage} writing one JSON file per run into a directory.
///
/// A trace saved under id `x` lives in `<directory>/x.json`. The directory is
/// created on first save.
///
/// @implNote Thread-safe. Every save writes a fresh file; ids are random UUIDs.
public class FileTraceStorage implements TraceStorage {

    private static final Logger logger = Logger.getLogger(FileTraceStorage.class.getName());

    private static final String EXTENSION = ".json";

    private final Path directory;

    /// @param directory directory holding the trace files, not null
    public FileTraceStorage(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory must not be null");
    }

    public Path getDirectory() {
        return directory;
    }

    /// @throws UncheckedIOException if the file cannot be written
    @Override
    public String save(TraceNode root) {
        Objects.requireNonNull(root, "root must not be null");
        String id = UUID.randomUUID().toString();
        String json = TraceSerializer.toJson(root);
        try {
            Files.createDirectories(directory);
            Files.writeString(fileOf(id), json, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write trace " + id + " to " + directory, e);
        }
        logger.info("Saved trace of " + root.getFullName() + " to " + fileOf(id));
        return id;
    }

    /// @throws UncheckedIOException if the file exists but cannot be read
    /// @throws IllegalArgumentException if the id is malformed or the file is not a trace
    @Override
    public Optional<Map<String, Object>> query(String id) {
        return read(id).map(TraceSerializer::recordFromJson);
    }

    /// Loads a stored trace as a typed view.
    ///
    /// @param id identifier returned by {@link #save(TraceNode)}, not null
    /// @return the root span, or empty if nothing is stored under the id
    /// @throws UncheckedIOException if the file exists but cannot be read
    public Optional<TraceRecord> load(String id) {
        return read(id).map(TraceSerializer::fromJson);
    }

    /// Lists the ids of all stored traces, sorted.
    ///
    /// @return ids, never null (empty when the directory does not exist)
    /// @throws UncheckedIOException if the directory cannot be listed
    public List<String> list() {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(directory)) {
            return files.map(path -> path.getFileName().toString())
                    .filter(name -> name.endsWith(EXTENSION))
                    .map(name -> name.substring(0, name.length() - EXTENSION.length()))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list traces in " + directory, e);
        }
    }

    private Optional<String> read(String id) {
        Objects.requireNonNull(id, "id must not be null");
        try {
            return Optional.of(Files.readString(fileOf(id), StandardCharsets.UTF_8));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read trace " + id, e);
        }
    }

    private Path fileOf(String id) {
        if (id.isEmpty() || id.contains("/") || id.contains("\\") || id.contains("..")) {
            throw new IllegalArgumentException("Invalid trace id: " + id);
        }
        return directory.resolve(id + EXTENSION);
    }
}
