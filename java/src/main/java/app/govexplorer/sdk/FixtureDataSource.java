package app.govexplorer.sdk;

import app.govexplorer.sdk.internal.DocumentReader;
import app.govexplorer.sdk.internal.Json;
import app.govexplorer.sdk.model.AuditEvent;
import app.govexplorer.sdk.model.AuditEventPage;
import app.govexplorer.sdk.model.AuditEventQuery;
import app.govexplorer.sdk.model.Bundle;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Offline data source reading captured API responses from a directory.
 *
 * <p>
 * {@value #BUNDLES_FILE} holds a bundles response ({@code {"data": [...]}}) and {@value #EVENTS_FILE} an audit events
 * response ({@code {"events": [...], "estimatedMatches": n}}). Events are returned as captured: the query only caps
 * their number. A missing file is read as an empty document set.
 * </p>
 */
public final class FixtureDataSource implements GovernanceDataSource {

    private static final Logger LOGGER = Logger.getLogger(FixtureDataSource.class.getName());

    public static final String BUNDLES_FILE = "sample_bundles.json";
    public static final String EVENTS_FILE = "sample_events.json";

    private final Path directory;

    public FixtureDataSource(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory");
    }

    public Path getDirectory() {
        return directory;
    }

    @Override
    public List<Bundle> listBundles(int limit) throws GovernanceException {
        JsonNode root = read(BUNDLES_FILE);
        List<Bundle> bundles = DocumentReader.readList(root.path("data"), Bundle.class);
        if (limit > 0 && bundles.size() > limit) {
            bundles = bundles.subList(0, limit);
        }
        int count = bundles.size();
        LOGGER.info(() -> String.format(Locale.ROOT,
            "[governance-explorer] loaded %d bundles from %s", count, directory.resolve(BUNDLES_FILE)));
        return bundles;
    }

    @Override
    public AuditEventPage listAuditEvents(AuditEventQuery query) throws GovernanceException {
        Objects.requireNonNull(query, "query");
        JsonNode root = read(EVENTS_FILE);
        List<AuditEvent> events = DocumentReader.readList(root.path("events"), AuditEvent.class);
        int estimatedMatches = root.path("estimatedMatches").asInt(events.size());
        if (events.size() > query.getLimit()) {
            events = events.subList(0, query.getLimit());
        }
        int count = events.size();
        LOGGER.info(() -> String.format(Locale.ROOT,
            "[governance-explorer] loaded %d events from %s", count, directory.resolve(EVENTS_FILE)));
        return new AuditEventPage(events, estimatedMatches);
    }

    private JsonNode read(String fileName) throws GovernanceException {
        Path file = directory.resolve(fileName);
        if (!Files.isRegularFile(file)) {
            LOGGER.warning(() -> "[governance-explorer] fixture " + file + " not found; returning no documents");
            return Json.mapper().missingNode();
        }
        try (InputStream stream = Files.newInputStream(file)) {
            JsonNode root = Json.mapper().readTree(stream);
            return root == null ? Json.mapper().missingNode() : root;
        } catch (IOException ex) {
            throw new GovernanceException("read fixture " + file + ": " + ex.getMessage(), ex);
        }
    }
}
