package notestore.jdbc.service;

import notestore.ValidationException;
import notestore.domain.Attachment;
import notestore.domain.Note;
import notestore.domain.SetList;
import notestore.jdbc.Fixtures;
import notestore.jdbc.NoteStore;
import notestore.jdbc.TestDataSources;
import notestore.organize.BulkOperationResult;
import notestore.organize.ContentOrganizationService;
import notestore.organize.CsvExportType;
import notestore.organize.DuplicateGroup;
import notestore.organize.DurationGroups;
import notestore.organize.ExportSnapshot;
import notestore.organize.ImportOptions;
import notestore.organize.ImportResult;
import notestore.service.Result;
import notestore.util.JsonCodec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ContentOrganizationServiceIntegrationTest extends AbstractNoteStoreIntegrationTest {

    private ContentOrganizationService organizer;

    @BeforeEach
    void setUpOrganizer() {
        organizer = new ContentOrganizationService(services(), JsonCodec.getDefault(), clock);
    }

    @Test
    void exportSnapshotHoldsEveryCollection() {
        seedLibrary();

        ExportSnapshot snapshot = organizer.exportToJson();

        assertEquals(2, snapshot.notes().size());
        assertEquals(1, snapshot.setlists().size());
        assertEquals(1, snapshot.venues().size());
        assertEquals(1, snapshot.contacts().size());
        assertEquals(T0, snapshot.exportedAt());
        assertEquals(ExportSnapshot.FORMAT_VERSION, snapshot.version());
        assertEquals(snapshot, organizer.readJson(organizer.writeJson(snapshot)));
    }

    @Test
    void importIntoEmptyStoreAssignsFreshIds() {
        seedLibrary();
        ExportSnapshot snapshot = organizer.exportToJson();

        try (NoteStore target = NoteStore.builder().dataSource(TestDataSources.h2()).build()) {
            ContentOrganizationService importer = new ContentOrganizationService(target.services());

            ImportResult result = importer.importFromJson(snapshot, ImportOptions.all());

            assertTrue(result.success());
            assertEquals(new ImportResult.Counts(2, 1, 1, 1), result.imported());
            assertEquals(0, result.duplicatesFound());
            Note imported = target.services().notes().search("airport", null).get(0);
            assertNotEquals(snapshot.notes().stream()
                    .filter(n -> n.content().equals(imported.content())).findFirst().orElseThrow().id(),
                    imported.id());
            SetList setList = target.services().setLists().list().get(0);
            assertEquals(75, setList.totalDuration());
        }
    }

    @Test
    void importSkipsRowsAlreadyPresent() {
        seedLibrary();
        ExportSnapshot snapshot = organizer.exportToJson();

        ImportResult result = organizer.importFromJson(snapshot, ImportOptions.skippingDuplicates());

        assertTrue(result.success());
        assertEquals(new ImportResult.Counts(0, 0, 0, 0), result.imported());
        assertEquals(5, result.duplicatesFound());
        assertEquals(2, services().notes().list().size());
    }

    @Test
    void importSkipsOnlyRowsAboveThreshold() {
        services().notes().create(Fixtures.note("apple banana cherry", 10)).orElseThrow();
        ExportSnapshot snapshot = new ExportSnapshot(List.of(
                Fixtures.embeddedNote("zebra walrus yak", 10),
                Fixtures.embeddedNote("apple banana cherry", 10)), null, null, null, T0,
                ExportSnapshot.FORMAT_VERSION);

        ImportResult unrelated = organizer.importFromJson(snapshot, new ImportOptions(true, 0.0));

        assertEquals(1, unrelated.imported().notes());
        assertEquals(1, unrelated.duplicatesFound());
    }

    @Test
    void identicalRowAtFullThresholdIsImported() {
        services().notes().create(Fixtures.note("apple banana cherry", 10)).orElseThrow();
        ExportSnapshot snapshot = new ExportSnapshot(List.of(
                Fixtures.embeddedNote("apple banana cherry", 10)), null, null, null, T0,
                ExportSnapshot.FORMAT_VERSION);

        ImportResult result = organizer.importFromJson(snapshot, new ImportOptions(true, 1.0));

        assertEquals(1, result.imported().notes());
        assertEquals(0, result.duplicatesFound());
        assertEquals(2, services().notes().list().size());
    }

    @Test
    void importWithoutSkippingDuplicatesCopiesEverything() {
        seedLibrary();

        ImportResult result = organizer.importFromJson(organizer.exportToJson(), ImportOptions.all());

        assertEquals(new ImportResult.Counts(2, 1, 1, 1), result.imported());
        assertEquals(4, services().notes().list().size());
    }

    @Test
    void invalidRowsAreReportedAndOthersImported() {
        Note valid = Fixtures.embeddedNote("Fine bit", 10);
        Note invalid = Fixtures.embeddedNote("x", 10).toBuilder().content("").build();
        ExportSnapshot snapshot = new ExportSnapshot(List.of(valid, invalid), null, null, null, T0,
                ExportSnapshot.FORMAT_VERSION);

        ImportResult result = organizer.importFromJson(snapshot, ImportOptions.all());

        assertFalse(result.success());
        assertEquals(1, result.imported().notes());
        assertEquals(1, result.errors().size());
        assertTrue(result.errors().get(0).startsWith("Failed to import note"));
    }

    @Test
    void readJsonRejectsMalformedInput() {
        assertThrows(ValidationException.class, () -> organizer.readJson("{not json"));
    }

    @Test
    void notesCsvStartsWithHeaderAndQuotesCommas() {
        services().notes().create(Fixtures.note("Hello, airport").toBuilder()
                .tags(List.of("travel", "crowd")).estimatedDuration(90.0).build());

        String[] lines = organizer.exportToCsv(CsvExportType.NOTES).split("\n");

        assertEquals(String.join(",", CsvExportType.NOTES.headers()), lines[0]);
        assertEquals(2, lines.length);
        assertTrue(lines[1].contains(",\"Hello, airport\",text,\"travel, crowd\",,,90,"), lines[1]);
    }

    @Test
    void contactsCsvIncludesEmail() {
        services().contacts().create(Fixtures.contact("Dana", "booker", "dana@example.com"));

        String csv = organizer.exportToCsv(CsvExportType.CONTACTS);

        assertTrue(csv.startsWith("ID,Name,Role,Venue,Email,Phone,Created At\n"));
        assertTrue(csv.contains(",Dana,booker,,dana@example.com,," + T0));
    }

    @Test
    void detectDuplicatesGroupsSimilarNotes() {
        services().notes().create(Fixtures.note("The airport security line is endless")
                .toBuilder().tags(List.of("travel")).build());
        services().notes().create(Fixtures.note("The airport security line is endless")
                .toBuilder().tags(List.of("travel")).build());
        services().notes().create(Fixtures.note("Cats knock everything off tables"));

        List<DuplicateGroup> groups = organizer.detectDuplicates();

        assertEquals(1, groups.size());
        assertEquals(1, groups.get(0).duplicates().size());
        DuplicateGroup.Match match = groups.get(0).duplicates().get(0);
        assertEquals(1.0, match.similarity(), 1e-9);
        assertTrue(match.reasons().contains("Similar content (100% match)"));
        assertTrue(match.reasons().contains("Created within 24 hours"));
    }

    @Test
    void mergeFoldsDuplicatesIntoOriginal() {
        Note original = services().notes().create(Fixtures.note("Airport security bit")
                .toBuilder().tags(List.of("travel")).build()).orElseThrow();
        Note duplicate = services().notes().create(Fixtures.note("Completely different tangent about luggage")
                .toBuilder().tags(List.of("luggage")).build()).orElseThrow();
        Attachment attachment = services().notes()
                .attachAudio(duplicate.id(), new byte[] {7}, "audio/m4a", "memo.m4a").orElseThrow()
                .attachments().get(0);

        Note merged = organizer.mergeDuplicateNotes(original.id(), List.of(duplicate.id())).orElseThrow();

        assertEquals(List.of("travel", "luggage"), merged.tags());
        assertTrue(merged.content().startsWith("Airport security bit"));
        assertTrue(merged.content().contains("--- Merged from duplicate ---"));
        assertTrue(merged.content().endsWith(duplicate.content()));
        assertEquals(List.of(attachment), merged.attachments());
        assertTrue(services().notes().get(duplicate.id()).isEmpty());
        assertTrue(store.blobs().get(attachment.blobKey()).isPresent());
    }

    @Test
    void mergeIntoMissingOriginalReportsNotFound() {
        Result<Note> result = organizer.mergeDuplicateNotes(UUID.randomUUID().toString(), List.of());

        assertEquals(new Result.NotFound<Note>("Original note not found"), result);
    }

    @Test
    void bulkTagEditsSkipMissingNotes() {
        Note a = services().notes().create(Fixtures.note("a bit").toBuilder().tags(List.of("old")).build())
                .orElseThrow();
        Note b = services().notes().create(Fixtures.note("b bit")).orElseThrow();

        BulkOperationResult added = organizer.bulkAddTags(
                List.of(a.id(), b.id(), UUID.randomUUID().toString()), List.of("new", "old"));

        assertTrue(added.success());
        assertEquals(2, added.processedCount());
        assertEquals(List.of("old", "new"), services().notes().get(a.id()).orElseThrow().tags());
        assertEquals(List.of("new", "old"), services().notes().get(b.id()).orElseThrow().tags());

        BulkOperationResult removed = organizer.bulkRemoveTags(List.of(a.id()), List.of("old"));

        assertEquals(1, removed.processedCount());
        assertEquals(List.of("new"), services().notes().get(a.id()).orElseThrow().tags());
    }

    @Test
    void bulkDeleteRemovesNotesAndBlobs() {
        Note a = services().notes().create(Fixtures.note("a bit")).orElseThrow();
        services().notes().attachAudio(a.id(), new byte[] {1}, "audio/m4a", "a.m4a");

        BulkOperationResult result = organizer.bulkDeleteNotes(List.of(a.id()));

        assertTrue(result.success());
        assertEquals(1, result.processedCount());
        assertTrue(services().notes().list().isEmpty());
        assertTrue(store.blobs().keys().isEmpty());
    }

    @Test
    void categorizeByDurationUsesEstimatedDurationOrWordCount() {
        services().notes().create(Fixtures.note("quick one"));
        services().notes().create(Fixtures.note("medium").toBuilder().estimatedDuration(200.0).build());
        services().notes().create(Fixtures.note("long").toBuilder().estimatedDuration(600.0).build());

        DurationGroups groups = organizer.categorizeByDuration();

        assertEquals(List.of("quick one"), groups.shortNotes().stream().map(Note::content).toList());
        assertEquals(List.of("medium"), groups.mediumNotes().stream().map(Note::content).toList());
        assertEquals(List.of("long"), groups.longNotes().stream().map(Note::content).toList());
    }

    private void seedLibrary() {
        services().notes().create(Fixtures.note("Airport security bit").toBuilder().tags(List.of("travel")).build());
        services().notes().create(Fixtures.note("Dating app horror stories"));
        services().setLists().create(Fixtures.setList("Friday late").toBuilder()
                .notes(List.of(Fixtures.embeddedNote("Opener", 30), Fixtures.embeddedNote("Closer", 45)))
                .build());
        services().venues().create(Fixtures.venue("Comedy Cellar", "New York"));
        services().contacts().create(Fixtures.contact("Dana", "booker", "dana@example.com"));
    }
}
