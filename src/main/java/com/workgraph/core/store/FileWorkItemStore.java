package com.workgraph.core.store;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.workgraph.core.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * {@link WorkItemStore} that keeps each work item as a JSON file named {@code <id>.json}.
 * <p>
 * Writes go to a hidden temp file in the same directory and are then moved over the
 * target, so a document is replaced atomically. Deleted ids leave a marker under
 * {@code .deleted/} and are refused on re-creation.
 */
public class FileWorkItemStore implements WorkItemStore {

    private static final Logger log = LoggerFactory.getLogger(FileWorkItemStore.class);

    private static final String SUFFIX = ".json";
    private static final String TOMBSTONE_DIR = ".deleted";
    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]*");

    private final Path directory;
    private final Path tombstones;
    private final ObjectMapper objectMapper;

    public FileWorkItemStore(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory must not be null");
        this.tombstones = directory.resolve(TOMBSTONE_DIR);
        this.objectMapper = JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT)
                .build();
        try {
            Files.createDirectories(tombstones);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot create store directory " + directory, e);
        }
        log.info("Work item store at {}", directory.toAbsolutePath());
    }

    @Override
    public Optional<WorkItemDocument> load(String id) {
        Path file = documentPath(id);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        return Optional.of(read(file));
    }

    @Override
    public List<WorkItemDocument> loadAll() {
        var documents = new ArrayList<WorkItemDocument>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*" + SUFFIX)) {
            for (Path file : stream) {
                if (file.getFileName().toString().startsWith(".")) {
                    continue;
                }
                documents.add(read(file));
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to scan store directory " + directory, e);
        }
        documents.sort(Comparator.comparing(WorkItemDocument::id));
        log.debug("Loaded {} documents from {}", documents.size(), directory);
        return documents;
    }

    @Override
    public void save(WorkItemDocument document) {
        Path target = documentPath(document.id());
        Path temp = null;
        try {
            temp = Files.createTempFile(directory, ".tmp-", SUFFIX);
            objectMapper.writeValue(temp.toFile(), document);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move unsupported in {}, falling back to replace", directory);
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("Saved document {}", document.id());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write document " + document.id(), e);
        } finally {
            deleteQuietly(temp);
        }
    }

    @Override
    public void delete(String id) {
        Path file = documentPath(id);
        try {
            Files.writeString(tombstones.resolve(id), id);
            Files.deleteIfExists(file);
            log.debug("Deleted document {}", id);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to delete document " + id, e);
        }
    }

    @Override
    public boolean exists(String id) {
        return Files.exists(documentPath(id));
    }

    @Override
    public boolean wasDeleted(String id) {
        return Files.exists(tombstones.resolve(checkedId(id)));
    }

    @Override
    public String describe() {
        return directory.toAbsolutePath().toString();
    }

    public Path getDirectory() {
        return directory;
    }

    private Path documentPath(String id) {
        return directory.resolve(checkedId(id) + SUFFIX);
    }

    private static String checkedId(String id) {
        if (id == null || !SAFE_ID.matcher(id).matches()) {
            throw new ValidationException("Invalid work item id: " + id);
        }
        return id;
    }

    private WorkItemDocument read(Path file) {
        WorkItemDocument document;
        try {
            document = objectMapper.readValue(file.toFile(), WorkItemDocument.class);
        } catch (IOException e) {
            throw new ValidationException("Malformed document " + file.getFileName() + ": " + e.getMessage(), e);
        }
        String name = file.getFileName().toString();
        String expectedId = name.substring(0, name.length() - SUFFIX.length());
        if (!expectedId.equals(document.id())) {
            throw new ValidationException("Document " + file.getFileName() + " declares id " + document.id());
        }
        // Validate eagerly so a bad document is reported where it was read.
        document.toWorkItem();
        document.outgoingEdges();
        return document;
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Could not remove temp file {}: {}", temp, e.getMessage());
        }
    }
}
