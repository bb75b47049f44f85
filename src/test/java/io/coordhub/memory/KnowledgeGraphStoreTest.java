package io.coordhub.memory;

import io.coordhub.MutableClock;
import io.coordhub.error.CoordinationException;
import io.coordhub.error.ErrorKind;
import io.coordhub.model.MemoryEntity;
import io.coordhub.model.MemoryRelation;
import io.coordhub.model.RelationType;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.assertFalse;

class KnowledgeGraphStoreTest {
    private final KnowledgeGraphStore store = new KnowledgeGraphStore(MutableClock.atEpochSecond(1_000L));

    @Test
    void createEntityTwiceFailsWithConflict() {
        store.createEntity("X", "Component", List.of(), null);
        CoordinationException error = assertThrows(CoordinationException.class,
                () -> store.createEntity("X", "Service", List.of("other"), null));
        assertEquals(ErrorKind.CONFLICT, error.kind());
        assertEquals("Component", store.getEntity("X").entity().entityType());
    }

    @Test
    void updateEntityAppendsObservationsOnceAndBumpsVersion() {
        store.createEntity("X", "Component", List.of("o0"), Map.of("owner", "team-a"));
        store.updateEntity("X", List.of("o1", "o1"), null);
        MemoryEntity updated = store.updateEntity("X", List.of("o1", "o0"), Map.of("tier", 2));

        assertEquals(List.of("o0", "o1"), updated.observations());
        assertEquals(3L, updated.version());
        assertEquals("team-a", updated.metadata().get("owner"));
        assertEquals(2, updated.metadata().get("tier"));
    }

    @Test
    void updateMissingEntityFailsWithNotFound() {
        CoordinationException error = assertThrows(CoordinationException.class,
                () -> store.updateEntity("nope", List.of("x"), null));
        assertEquals(ErrorKind.NOT_FOUND, error.kind());
    }

    @Test
    void relationRequiresBothEndpointsAndClampsStrength() {
        store.createEntity("A", "Component", List.of(), null);
        store.createEntity("B", "Component", List.of(), null);

        assertEquals(ErrorKind.NOT_FOUND, assertThrows(CoordinationException.class,
                () -> store.createRelation("A", "missing", RelationType.DEPENDS_ON, null, null)).kind());
        assertEquals(0, store.relationCount());

        assertEquals(1.0d, store.createRelation("A", "B", RelationType.SUPPORTS, 1.5d, null).strength());
        assertEquals(0.0d, store.createRelation("B", "A", RelationType.CONTRADICTS, -0.3d, null).strength());
        assertEquals(MemoryRelation.DEFAULT_STRENGTH, store.createRelation("A", "B", RelationType.ENABLES, null, null).strength());
    }

    @Test
    void deleteEntityCascadesToRelations() {
        store.createEntity("X", "Component", List.of(), null);
        store.createEntity("Y", "Component", List.of(), null);
        store.createEntity("Z", "Component", List.of(), null);
        store.createRelation("X", "Y", RelationType.RELATES_TO, null, null);
        store.createRelation("Y", "X", RelationType.CAUSED_BY, null, null);
        store.createRelation("Y", "Z", RelationType.IMPLEMENTS, null, null);

        assertTrue(store.deleteEntity("X"));
        assertFalse(store.deleteEntity("X"));

        KnowledgeGraphStore.EntityView y = store.getEntity("Y");
        assertEquals(1, y.relations().size());
        assertEquals("Z", y.relations().get(0).to());
        assertNull(store.getEntity("X").entity());
        assertTrue(store.getEntity("X").relations().isEmpty());
    }

    @Test
    void searchTypeIsExactAndNameIsCaseInsensitive() {
        store.createEntity("UserService", "Component", List.of("Handles login"), null);
        store.createEntity("user-db", "component", List.of(), null);
        store.createEntity("Billing", "Component", List.of("Talks to the USER service"), null);

        KnowledgeGraphStore.SearchOutcome byType = store.search(new MemoryQuery(null, "Component", null, 50));
        assertEquals(List.of("UserService", "Billing"), byType.entities().stream().map(MemoryEntity::name).toList());

        KnowledgeGraphStore.SearchOutcome byName = store.search(new MemoryQuery("user", null, null, 50));
        assertEquals(List.of("UserService", "user-db"), byName.entities().stream().map(MemoryEntity::name).toList());

        KnowledgeGraphStore.SearchOutcome byObservation = store.search(new MemoryQuery(null, null, "user SERVICE", 50));
        assertEquals("Billing", byObservation.entities().get(0).name());
    }

    @Test
    void searchTruncatesAfterFilteringAndReportsTruncatedCount() {
        for (int i = 0; i < 5; i++) {
            store.createEntity("node-" + i, "Node", List.of(), null);
        }
        store.createEntity("other", "Other", List.of(), null);
        store.createRelation("node-0", "other", RelationType.RELATES_TO, null, null);
        store.createRelation("node-4", "other", RelationType.RELATES_TO, null, null);

        KnowledgeGraphStore.SearchOutcome out = store.search(new MemoryQuery(null, "Node", null, 2));

        assertEquals(2, out.entities().size());
        assertEquals(2, out.totalResults());
        assertEquals(1, out.relations().size());
        assertEquals("node-0", out.relations().get(0).from());
    }
}
