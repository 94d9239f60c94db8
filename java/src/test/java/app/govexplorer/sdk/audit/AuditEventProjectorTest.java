package app.govexplorer.sdk.audit;

import app.govexplorer.sdk.internal.Json;
import app.govexplorer.sdk.model.AuditEvent;
import app.govexplorer.sdk.model.EventAction;
import app.govexplorer.sdk.model.NamedEntity;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AuditEventProjectorTest {

    @Test
    void affectedStagePrefersRelatedStageEntity() throws Exception {
        AuditEvent event = event("{\"affecting\":[{\"entityType\":\"governanceBundle\",\"name\":\"b\"},"
            + "{\"entityType\":\"governancePolicyStage\",\"name\":\"Validation\"}],"
            + "\"targets\":[{\"fieldChanges\":[{\"fieldName\":\"stage\",\"before\":\"A\",\"after\":\"B\"}]}]}");

        assertEquals("Validation", AuditEventProjector.affectedStageName(event));
    }

    @Test
    void affectedStageFallsBackToStageTransition() throws Exception {
        AuditEvent event = event("{\"affecting\":[{\"entityType\":\"governancePolicyStage\",\"name\":\"\"}],"
            + "\"targets\":[{\"fieldChanges\":[{\"fieldName\":\"state\",\"before\":\"x\",\"after\":\"y\"}]},"
            + "{\"fieldChanges\":[{\"fieldName\":\"stage\",\"after\":\"Approval\"}]}]}");

        assertEquals(" → Approval", AuditEventProjector.affectedStageName(event));
        assertEquals("", AuditEventProjector.affectedStageName(event("{}")));
    }

    @Test
    void dominantChangeIsEmptyWithoutFieldChanges() throws Exception {
        assertEquals(FieldChangeSummary.NONE, AuditEventProjector.dominantFieldChange(event("{}")));
        assertEquals(FieldChangeSummary.NONE, AuditEventProjector.dominantFieldChange(
            event("{\"targets\":[{\"fieldChanges\":[]},{\"fieldChanges\":[{\"fieldName\":\"description\",\"before\":\"a\",\"after\":\"b\"}]}]}")));
    }

    @Test
    void dominantChangeReadsAssigneeFromAddedAndRemoved() throws Exception {
        AuditEvent event = event("{\"targets\":[{\"fieldChanges\":[{\"fieldName\":\"assignee\","
            + "\"added\":[{\"id\":\"u2\",\"name\":\"Bob\"}],\"removed\":[],\"before\":\"ignored\"}]}]}");

        assertEquals(new FieldChangeSummary("Unassigned", "Bob", "assignee"),
            AuditEventProjector.dominantFieldChange(event));
    }

    @Test
    void dominantChangeTreatsMissingAssigneeSidesAsUnassigned() throws Exception {
        AuditEvent event = event("{\"targets\":[{\"fieldChanges\":[{\"fieldName\":\"assignee\","
            + "\"removed\":[{\"name\":\"Alice\"}],\"added\":[{\"id\":\"u3\"}]}]}]}");

        assertEquals(new FieldChangeSummary("Alice", "Unassigned", "assignee"),
            AuditEventProjector.dominantFieldChange(event));
    }

    @Test
    void dominantChangeIsFirstRecognisedInDocumentOrder() throws Exception {
        AuditEvent assigneeFirst = event("{\"targets\":["
            + "{\"fieldChanges\":[{\"fieldName\":\"note\",\"before\":\"n1\",\"after\":\"n2\"},"
            + "{\"fieldName\":\"assignee\",\"added\":[{\"name\":\"Bob\"}],\"removed\":[{\"name\":\"Alice\"}]}]},"
            + "{\"fieldChanges\":[{\"fieldName\":\"stage\",\"before\":\"Dev\",\"after\":\"Review\"}]}]}");
        AuditEvent stateFirst = event("{\"targets\":[{\"fieldChanges\":["
            + "{\"fieldName\":\"state\",\"before\":\"Active\",\"after\":\"Complete\"},"
            + "{\"fieldName\":\"stage\",\"before\":\"Dev\",\"after\":\"Review\"}]}]}");

        assertEquals(new FieldChangeSummary("Alice", "Bob", "assignee"), AuditEventProjector.dominantFieldChange(assigneeFirst));
        assertEquals(new FieldChangeSummary("Active", "Complete", "state"), AuditEventProjector.dominantFieldChange(stateFirst));
    }

    @Test
    void dominantChangeRendersNonTextValues() throws Exception {
        AuditEvent event = event("{\"targets\":[{\"fieldChanges\":[{\"fieldName\":\"stage\","
            + "\"before\":null,\"after\":{\"name\":\"Review\"}}]}]}");

        FieldChangeSummary summary = AuditEventProjector.dominantFieldChange(event);
        assertEquals("", summary.before());
        assertEquals("{\"name\":\"Review\"}", summary.after());
        assertTrue(summary.isPresent());
    }

    @Test
    void filterEventsAppliesOptionalFiltersTogether() {
        AuditEvent a = event("X", "p1");
        AuditEvent b = event("Y", "p1");
        AuditEvent c = event("X", "p2");
        List<AuditEvent> events = List.of(a, b, c);

        assertEquals(List.of(a, c), AuditEventProjector.filterEvents(events, List.of("X"), List.of()));
        assertEquals(List.of(a, b), AuditEventProjector.filterEvents(events, null, List.of("p1")));
        assertEquals(List.of(a), AuditEventProjector.filterEvents(events, List.of("X"), List.of("p1")));
        assertEquals(events, AuditEventProjector.filterEvents(events, List.of(), null));
        assertEquals(List.of(), AuditEventProjector.filterEvents(events, List.of("Z"), List.of()));
        assertEquals(List.of(), AuditEventProjector.filterEvents(List.of(), List.of("X"), List.of()));
    }

    @Test
    void bundleNameComesFromLastNamedBundleTarget() throws Exception {
        AuditEvent event = event("{\"targets\":["
            + "{\"entity\":{\"entityType\":\"governanceBundle\",\"name\":\"first\"}},"
            + "{\"entity\":{\"entityType\":\"project\",\"name\":\"proj\"}},"
            + "{\"entity\":{\"entityType\":\"governanceBundle\",\"name\":\"second\"}},"
            + "{\"entity\":{\"entityType\":\"governanceBundle\"}}]}");

        assertEquals("second", AuditEventProjector.bundleName(event));
        assertEquals("", AuditEventProjector.bundleName(event("{}")));
    }

    @Test
    void rawFieldChangesListsEachTargetsChanges() throws Exception {
        AuditEvent event = event("{\"targets\":["
            + "{\"fieldChanges\":[{\"fieldName\":\"stage\",\"before\":\"Dev\",\"after\":\"Review\"}]},"
            + "{\"fieldChanges\":[]}]}");

        JsonNode raw = Json.mapper().readTree(AuditEventProjector.rawFieldChanges(event));
        assertTrue(raw.isArray());
        assertEquals(2, raw.size());
        assertEquals("stage", raw.get(0).get(0).path("fieldName").asText());
        assertEquals("Review", raw.get(0).get(0).path("after").asText());
        assertFalse(raw.get(0).get(0).has("added"));
        assertEquals(0, raw.get(1).size());
    }

    private static AuditEvent event(String json) throws Exception {
        return Json.mapper().readValue(json, AuditEvent.class);
    }

    private static AuditEvent event(String actionName, String projectName) {
        return new AuditEvent("2024-01-01T00:00:00Z", new EventAction(actionName), NamedEntity.named("user"),
            NamedEntity.named(projectName), List.of(), List.of());
    }
}
