package org.clipcrawl;

import org.clipcrawl.db.CommitBatch;
import org.clipcrawl.db.CommitResult;
import org.clipcrawl.db.EntityReference;
import org.clipcrawl.db.FrontierTarget;
import org.clipcrawl.model.*;
import org.clipcrawl.portal.CrawlTarget;
import org.clipcrawl.portal.PageKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(InMemoryDatabaseTestExtension.class)
class DatabaseTest {
    private static final Instant FETCHED = Instant.parse("2024-03-01T10:00:00Z");
    private final Database database;

    DatabaseTest(Database database) {
        this.database = database;
    }

    @BeforeEach
    void setUp() {
        InMemoryDatabaseTestExtension.clear(database);
    }

    @Test
    void commitWritesEntitiesAndAdvancesCheckpoint() throws Exception {
        var seed = CrawlTarget.of(PageKind.COURSES, "institution", "97747");
        database.frontier().insertIfAbsent(seed.key(), seed.kind(), null, 1, FETCHED);
        ReconciledEntity course = entity(EntityKind.COURSE, "11", "Engenharia Informática", Map.of());
        var discovered = seed.child(PageKind.CURRICULAR_PLANS, "course", "11");

        CommitResult result = database.commit(new CommitBatch(1, List.of(course), List.of(), List.of(),
                List.of(discovered), List.of(CommitBatch.TargetOutcome.completed(seed))));

        assertEquals(1, result.checkpoint().commitSeq());
        assertEquals(seed.key(), result.checkpoint().lastTarget());
        assertEquals(FrontierTarget.State.COMPLETED, database.frontier().find(seed.key()).state());
        FrontierTarget child = database.frontier().find(discovered.key());
        assertEquals(FrontierTarget.State.PENDING, child.state());
        assertEquals(seed.key(), child.via());

        ReconciledEntity stored = database.findByNaturalKey(EntityKind.COURSE, "11").orElseThrow();
        assertEquals(course.id(), stored.id());
        assertEquals("Engenharia Informática", stored.name());
        assertEquals(course.fields(), stored.fields());
    }

    @Test
    void forwardReferencesResolveOnceTargetIsCommitted() throws Exception {
        var department = new NaturalKey(EntityKind.DEPARTMENT, "42");
        ReconciledEntity teacher = entity(EntityKind.TEACHER, "1001", "Ana Lopes", Map.of("department", department));
        database.commit(batch(teacher));

        List<EntityReference> refs = database.references(teacher.id());
        assertEquals(1, refs.size());
        assertFalse(refs.get(0).resolved());
        assertEquals(1, database.references().countUnresolved());

        ReconciledEntity dept = entity(EntityKind.DEPARTMENT, "42", "Departamento de Informática", Map.of());
        database.commit(batch(dept));

        EntityReference ref = database.references(teacher.id()).get(0);
        assertEquals(dept.id(), ref.targetId());
        assertEquals(0, database.references().countUnresolved());
    }

    @Test
    void searchIgnoresCaseAndTreatsWildcardsLiterally() throws Exception {
        database.commit(batch(
                entity(EntityKind.STUDENT, "1", "John Smith", Map.of()),
                entity(EntityKind.TEACHER, "2", "Mary Johnson", Map.of()),
                entity(EntityKind.CLASS, "3:1", "100% Practical", Map.of()),
                entity(EntityKind.CLASS, "3:2", "1000 Practical", Map.of())));

        assertEquals(List.of("John Smith", "Mary Johnson"), names(database.search("john", null, 10)));
        assertEquals(List.of("John Smith"), names(database.search("JOHN", EntityKind.STUDENT, 10)));
        assertEquals(List.of("100% Practical"), names(database.search("0%", null, 10)));
        assertEquals(List.of(), names(database.search("_", null, 10)));
        assertEquals(1, database.search("o", null, 1).size());
    }

    @Test
    void conflictsAreRecorded() throws Exception {
        ReconciledEntity student = entity(EntityKind.STUDENT, "7", "John Smith", Map.of());
        var kept = new FieldValue(16, FETCHED.plusSeconds(60), "CLASS_RESULTS", true);
        var discarded = new FieldValue(15, FETCHED, "CLASS_RESULTS", true);
        database.commit(new CommitBatch(1, List.of(student),
                List.of(new MergeConflict(student.id(), "grade", kept, discarded, true)),
                List.of(), List.of(), List.of()));

        assertEquals(List.of("15"), database.conflicts().discardedValues(student.id(), "grade"));
    }

    @Test
    void replacedBlobReferenceIsReportedOrphaned() throws Exception {
        database.blobs().insertIfAbsent("aa", 3, FETCHED);
        database.blobs().insertIfAbsent("bb", 4, FETCHED);
        database.commit(new CommitBatch(1, List.of(), List.of(),
                List.of(new CommitBatch.BlobReference("aa", "file-1", null)), List.of(), List.of()));
        assertEquals(1, database.blobs().find("aa").refs());

        CommitResult result = database.commit(new CommitBatch(1, List.of(), List.of(),
                List.of(new CommitBatch.BlobReference("bb", "file-1", "aa")), List.of(), List.of()));

        assertEquals(List.of("aa"), result.orphanedBlobs());
        assertNull(database.blobs().find("aa"));
        assertEquals(1, database.blobs().find("bb").refs());
    }

    private CommitBatch batch(ReconciledEntity... entities) {
        return new CommitBatch(1, List.of(entities), List.of(), List.of(), List.of(), List.of());
    }

    private ReconciledEntity entity(EntityKind kind, String key, String name, Map<String, NaturalKey> references) {
        UUID id = UUID.randomUUID();
        database.identities().insertIfAbsent(id, kind, key, FETCHED);
        var fields = new FieldSet(Map.of("name", new FieldValue(name, FETCHED, "TEST", true)));
        return new ReconciledEntity(id, kind, key, fields, references, FETCHED);
    }

    private static List<String> names(List<ReconciledEntity> entities) {
        return entities.stream().map(ReconciledEntity::name).toList();
    }
}
