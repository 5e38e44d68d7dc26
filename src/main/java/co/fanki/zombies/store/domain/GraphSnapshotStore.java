package co.fanki.zombies.store.domain;

import co.fanki.zombies.graph.domain.DependencyGraph;
import co.fanki.zombies.shared.DomainException;
import co.fanki.zombies.shared.Preconditions;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.smile.SmileFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Reads and writes graph snapshots in Jackson Smile binary format.
 *
 * <p>Writes go to a temporary file in the target directory that is then
 * renamed over the snapshot, so a reader sees either the previous snapshot
 * or the new one. The header is checked before the body is read; a
 * different format tag or schema version is reported as
 * {@code SNAPSHOT_VERSION_MISMATCH} and the caller rebuilds from source
 * facts.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class GraphSnapshotStore {

    private static final Logger LOG = LoggerFactory.getLogger(
            GraphSnapshotStore.class);

    /** Format tag written in every header. */
    public static final String FORMAT = "czi-graph";

    /** Current schema version. */
    public static final int SCHEMA_VERSION = 1;

    private final Path path;
    private final ObjectMapper mapper;
    private final String format;
    private final int schemaVersion;

    /**
     * Creates a store writing the current format.
     *
     * @param thePath the snapshot file
     */
    public GraphSnapshotStore(final Path thePath) {
        this(thePath, FORMAT, SCHEMA_VERSION);
    }

    /**
     * Creates a store for an explicit format and version.
     *
     * @param thePath the snapshot file
     * @param theFormat the format tag
     * @param theSchemaVersion the schema version
     */
    GraphSnapshotStore(final Path thePath, final String theFormat,
            final int theSchemaVersion) {
        this.path = Preconditions.requireNonNull(thePath,
                "Snapshot path is required").toAbsolutePath();
        this.format = Preconditions.requireNonBlank(theFormat,
                "Format is required");
        this.schemaVersion = theSchemaVersion;
        final SmileFactory factory = new SmileFactory();
        factory.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
        factory.disable(JsonParser.Feature.AUTO_CLOSE_SOURCE);
        this.mapper = new ObjectMapper(factory);
    }

    /** @return the snapshot file */
    public Path path() {
        return path;
    }

    /** @return true if a snapshot file exists */
    public boolean exists() {
        return Files.isRegularFile(path);
    }

    /**
     * Writes a graph, replacing any previous snapshot.
     *
     * @param graph the graph
     * @throws DomainException with code {@code SNAPSHOT_IO} on failure
     */
    public void save(final DependencyGraph graph) {
        Preconditions.requireNonNull(graph, "Graph is required");
        Path temp = null;
        try {
            final Path directory = path.getParent();
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory,
                    path.getFileName().toString(), ".tmp");
            try (OutputStream out = Files.newOutputStream(temp);
                    JsonGenerator generator = mapper.getFactory()
                            .createGenerator(out)) {
                mapper.writeValue(generator,
                        GraphSnapshot.headerOf(graph, format, schemaVersion));
                mapper.writeValue(generator, GraphSnapshot.of(graph));
            }
            moveIntoPlace(temp);
            LOG.info("Saved snapshot of generation {} to {}",
                    graph.generation(), path);
        } catch (IOException e) {
            throw new DomainException("Cannot write snapshot " + path,
                    "SNAPSHOT_IO", e);
        } finally {
            deleteQuietly(temp);
        }
    }

    /**
     * Reads the snapshot.
     *
     * @return the graph, empty if no snapshot exists
     * @throws DomainException with code {@code SNAPSHOT_VERSION_MISMATCH}
     *         if the header does not match, {@code SNAPSHOT_CORRUPT} if the
     *         body cannot be decoded, or {@code SNAPSHOT_IO}
     */
    public Optional<DependencyGraph> load() {
        if (!exists()) {
            LOG.debug("No snapshot at {}", path);
            return Optional.empty();
        }
        try (InputStream in = Files.newInputStream(path);
                JsonParser parser = mapper.getFactory().createParser(in)) {
            final GraphSnapshot.Header header = readHeader(parser);
            final GraphSnapshot body;
            try {
                parser.nextToken();
                body = mapper.readValue(parser, GraphSnapshot.class);
            } catch (JsonProcessingException e) {
                throw new DomainException("Snapshot body cannot be decoded: "
                        + e.getOriginalMessage(), "SNAPSHOT_CORRUPT", e);
            }
            if (body == null || body.nodes() == null || body.edges() == null
                    || body.nodes().size() != header.nodeCount()
                    || body.edges().size() != header.edgeCount()) {
                throw new DomainException("Snapshot body does not match its"
                        + " header", "SNAPSHOT_CORRUPT");
            }
            final DependencyGraph graph = body.toGraph(header);
            LOG.info("Loaded snapshot of generation {} ({} nodes, {} edges)",
                    graph.generation(), graph.nodeCount(), graph.edgeCount());
            return Optional.of(graph);
        } catch (JsonProcessingException e) {
            throw new DomainException(path + " is not a graph snapshot: "
                    + e.getOriginalMessage(), "SNAPSHOT_VERSION_MISMATCH", e);
        } catch (IOException e) {
            throw new DomainException("Cannot read snapshot " + path,
                    "SNAPSHOT_IO", e);
        }
    }

    private GraphSnapshot.Header readHeader(final JsonParser parser)
            throws IOException {
        final GraphSnapshot.Header header;
        try {
            parser.nextToken();
            header = mapper.readValue(parser, GraphSnapshot.Header.class);
        } catch (JsonProcessingException e) {
            throw new DomainException("Unrecognised snapshot header in "
                    + path, "SNAPSHOT_VERSION_MISMATCH", e);
        }
        if (header == null || !format.equals(header.format())
                || header.schemaVersion() != schemaVersion) {
            throw new DomainException("Snapshot " + path + " has format "
                    + (header == null ? null : header.format()) + " v"
                    + (header == null ? null : header.schemaVersion())
                    + ", expected " + format + " v" + schemaVersion,
                    "SNAPSHOT_VERSION_MISMATCH");
        }
        return header;
    }

    private void moveIntoPlace(final Path temp) throws IOException {
        try {
            Files.move(temp, path, StandardCopyOption.ATOMIC_MOVE,
                    StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            LOG.warn("Atomic rename not supported for {}, replacing in place",
                    path);
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(final Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            LOG.warn("Cannot delete temporary snapshot {}: {}", temp,
                    e.getMessage());
        }
    }

}
