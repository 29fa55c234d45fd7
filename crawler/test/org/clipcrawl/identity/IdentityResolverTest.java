package org.clipcrawl.identity;

import org.clipcrawl.Database;
import org.clipcrawl.InMemoryDatabaseTestExtension;
import org.clipcrawl.db.CommitBatch;
import org.clipcrawl.model.*;
import org.clipcrawl.portal.PageKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(InMemoryDatabaseTestExtension.class)
class IdentityResolverTest {
    private static final Instant T0 = Instant.parse("2024-01-10T09:00:00Z");
    private static final Instant T1 = T0.plusSeconds(3600);
    private final Database database;
    private IdentityResolver resolver;

    IdentityResolverTest(Database database) {
        this.database = database;
    }

    @BeforeEach
    void setUp() {
        InMemoryDatabaseTestExtension.clear(database);
        resolver = new IdentityResolver(database);
    }

    @Test
    void laterAuthoritativeGradeSupersedesEarlierOne() {
        var identity = resolver.resolve(new NaturalKey(EntityKind.ENROLLMENT, "7@1:2/2023/s1"));
        resolver.merge(identity, StructuredRecord.builder(identity.key())
                .field("name", "John Smith")
                .source(PageKind.CLASS_ENROLLED, T0).build());
        resolver.merge(identity, grade(identity, 15, T0));
        ReconciledEntity entity = resolver.merge(identity, grade(identity, 16, T1));

        assertEquals("John Smith", entity.name());
        assertEquals(16, entity.value("grade"));
        assertEquals(T1, entity.updatedAt());
        List<MergeConflict> conflicts = resolver.pending(identity.id()).conflicts();
        assertEquals(1, conflicts.size());
        assertTrue(conflicts.get(0).superseded());
        assertEquals(15, conflicts.get(0).discarded().value());
        assertEquals(16, conflicts.get(0).kept().value());
    }

    @Test
    void staleAuthoritativeValueIsRejected() {
        var identity = resolver.resolve(new NaturalKey(EntityKind.ENROLLMENT, "7@1:2/2023/s1"));
        resolver.merge(identity, grade(identity, 16, T1));
        ReconciledEntity entity = resolver.merge(identity, grade(identity, 15, T0));

        assertEquals(16, entity.value("grade"));
        MergeConflict conflict = resolver.pending(identity.id()).conflicts().get(0);
        assertFalse(conflict.superseded());
        assertEquals(15, conflict.discarded().value());
    }

    @Test
    void nonAuthoritativeValueNeverReplacesAnotherValue() {
        var identity = resolver.resolve(new NaturalKey(EntityKind.STUDENT, "7"));
        resolver.merge(identity, StructuredRecord.builder(identity.key())
                .authoritativeField("name", "John Smith")
                .source(PageKind.CLASS_ENROLLED, T0).build());
        ReconciledEntity entity = resolver.merge(identity, StructuredRecord.builder(identity.key())
                .field("name", "JOHN SMITH")
                .source(PageKind.ADMITTED, T1).build());

        assertEquals("John Smith", entity.name());
        assertTrue(resolver.pending(identity.id()).conflicts().isEmpty());
    }

    @Test
    void yearRangeOnlyWidens() {
        var identity = resolver.resolve(new NaturalKey(EntityKind.TEACHER, "1001"));
        resolver.merge(identity, seen(identity, 2015, T0));
        resolver.merge(identity, seen(identity, 2012, T1));
        ReconciledEntity entity = resolver.merge(identity, seen(identity, 2014, T1));

        assertEquals(2012, entity.value(StructuredRecord.FIRST_YEAR));
        assertEquals(2015, entity.value(StructuredRecord.LAST_YEAR));
        assertTrue(resolver.pending(identity.id()).conflicts().isEmpty());
    }

    @Test
    void mergingTheSameRecordTwiceChangesNothing() {
        var identity = resolver.resolve(new NaturalKey(EntityKind.DEPARTMENT, "42"));
        var record = StructuredRecord.builder(identity.key())
                .authoritativeField("name", "Informática")
                .reference("institution", new NaturalKey(EntityKind.DEPARTMENT, "1"))
                .source(PageKind.DEPARTMENTS, T0).build();
        ReconciledEntity first = resolver.merge(identity, record);
        ReconciledEntity second = resolver.merge(identity, record);

        assertSame(first, second);
    }

    @Test
    void mergeContinuesFromCommittedEntity() throws Exception {
        var identity = resolver.resolve(new NaturalKey(EntityKind.ENROLLMENT, "7@1:2/2023/s1"));
        resolver.merge(identity, grade(identity, 15, T0));
        commitPending(identity);
        assertEquals(0, resolver.pendingCount());

        var fresh = new IdentityResolver(database);
        var again = fresh.resolve(identity.key());
        assertEquals(identity.id(), again.id());
        ReconciledEntity entity = fresh.merge(again, grade(again, 16, T1));
        assertEquals(16, entity.value("grade"));
        assertEquals(1, fresh.pending(identity.id()).conflicts().size());
    }

    @Test
    void recordForAnotherKeyIsRefused() {
        var identity = resolver.resolve(new NaturalKey(EntityKind.STUDENT, "7"));
        var other = StructuredRecord.builder(EntityKind.STUDENT, "8").field("name", "x")
                .source(PageKind.ADMITTED, T0).build();
        assertThrows(IllegalArgumentException.class, () -> resolver.merge(identity, other));
    }

    @Test
    void concurrentResolversAllocateOneIdentity() throws Exception {
        var key = new NaturalKey(EntityKind.COURSE, "11");
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Callable<SurrogateIdentity>> tasks = new ArrayList<>();
            for (int i = 0; i < 16; i++) {
                var own = new IdentityResolver(database);
                tasks.add(() -> own.resolve(key));
            }
            var ids = new HashSet<>();
            for (Future<SurrogateIdentity> future : executor.invokeAll(tasks)) {
                ids.add(future.get().id());
            }
            assertEquals(1, ids.size());
            assertEquals(1, database.identities().count(EntityKind.COURSE));
        } finally {
            executor.shutdownNow();
        }
    }

    private void commitPending(SurrogateIdentity identity) throws Exception {
        var snapshot = resolver.pending(identity.id());
        database.commit(new CommitBatch(1, List.of(snapshot.entity()), snapshot.conflicts(),
                List.of(), List.of(), List.of()));
        resolver.committed(List.of(snapshot));
    }

    private static StructuredRecord grade(SurrogateIdentity identity, int grade, Instant fetchedAt) {
        return StructuredRecord.builder(identity.key())
                .authoritativeField("grade", grade)
                .source(PageKind.CLASS_RESULTS, fetchedAt).build();
    }

    private static StructuredRecord seen(SurrogateIdentity identity, int year, Instant fetchedAt) {
        return StructuredRecord.builder(identity.key())
                .seenIn(year)
                .source(PageKind.DEPARTMENT_TEACHERS, fetchedAt).build();
    }
}
