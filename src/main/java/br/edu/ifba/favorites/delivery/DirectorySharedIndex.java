package br.edu.ifba.favorites.delivery;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.jboss.logging.Logger;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.io.OutputStream;
import java.net.URI;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Shared index kept in a directory tree.
 *
 * <p>Entries are stored under {@code <root>/<relativePath>/<displayName>} and
 * recorded in {@code <root>/index.json}. When the display name is taken, a
 * numbered suffix is added, e.g. {@code export (1).csv}.</p>
 */
public class DirectorySharedIndex implements SharedIndexRegistrar {

    private static final Logger LOG = Logger.getLogger(DirectorySharedIndex.class);
    private static final String INDEX_FILE = "index.json";
    private static final int MAX_NAME_ATTEMPTS = 1000;

    private final Path root;
    private final ObjectMapper objectMapper;

    public DirectorySharedIndex(@NotNull Path root) {
        this.root = Objects.requireNonNull(root, "root must not be null").toAbsolutePath().normalize();
        this.objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    @NotNull
    public synchronized URI register(@NotNull SharedIndexEntry entry) throws IOException {
        Path collection = resolveInsideRoot(root.resolve(entry.relativePath()));
        Files.createDirectories(collection);

        Path file = reserve(collection, entry.displayName());
        List<SharedIndexEntry> entries = readIndex();
        entries.add(new SharedIndexEntry(file.getFileName().toString(), entry.mimeType(), entry.relativePath()));
        objectMapper.writeValue(root.resolve(INDEX_FILE).toFile(), entries);

        LOG.debugf("Registered %s in shared index %s", file, root);
        return file.toUri();
    }

    @Override
    @NotNull
    public OutputStream openOutputStream(@NotNull URI location) throws IOException {
        Path file = resolveInsideRoot(Path.of(location));
        if (!Files.exists(file)) {
            throw new IOException("Unknown shared index entry: " + location);
        }
        return Files.newOutputStream(file);
    }

    /**
     * @return all registered entries, in registration order
     */
    @NotNull
    public synchronized List<SharedIndexEntry> entries() throws IOException {
        return List.copyOf(readIndex());
    }

    @NotNull
    public Path getRoot() {
        return root;
    }

    private Path reserve(Path collection, String displayName) throws IOException {
        int dot = displayName.lastIndexOf('.');
        String stem = dot > 0 ? displayName.substring(0, dot) : displayName;
        String extension = dot > 0 ? displayName.substring(dot) : "";

        for (int attempt = 0; attempt < MAX_NAME_ATTEMPTS; attempt++) {
            String name = attempt == 0 ? displayName : stem + " (" + attempt + ")" + extension;
            Path candidate = resolveInsideRoot(collection.resolve(name));
            try {
                return Files.createFile(candidate);
            } catch (FileAlreadyExistsException e) {
                LOG.debugf("Shared index name %s is taken", name);
            }
        }
        throw new IOException("No free name for " + displayName + " in " + collection);
    }

    private List<SharedIndexEntry> readIndex() throws IOException {
        Path index = root.resolve(INDEX_FILE);
        if (!Files.exists(index)) {
            return new ArrayList<>();
        }
        return new ArrayList<>(objectMapper.readValue(index.toFile(), new TypeReference<List<SharedIndexEntry>>() {}));
    }

    private Path resolveInsideRoot(Path path) throws IOException {
        Path normalized = path.toAbsolutePath().normalize();
        if (!normalized.startsWith(root)) {
            throw new IOException("Path escapes shared index root: " + path);
        }
        return normalized;
    }
}
