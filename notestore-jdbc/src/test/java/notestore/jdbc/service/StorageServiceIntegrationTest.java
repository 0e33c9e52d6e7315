package notestore.jdbc.service;

import notestore.Patch;
import notestore.domain.Attachment;
import notestore.domain.Contact;
import notestore.domain.Interaction;
import notestore.domain.MaterialFeedback;
import notestore.domain.Note;
import notestore.domain.Performance;
import notestore.domain.PerformanceFeedback;
import notestore.domain.PerformanceStatus;
import notestore.domain.RehearsalSession;
import notestore.domain.Reminder;
import notestore.domain.SetList;
import notestore.domain.Venue;
import notestore.jdbc.Fixtures;
import notestore.model.SyncOperation;
import notestore.model.SyncOperationType;
import notestore.service.GlobalSearchResult;
import notestore.service.PerformanceStats;
import notestore.service.Result;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StorageServiceIntegrationTest extends AbstractNoteStoreIntegrationTest {

    @Test
    void deletingNoteRemovesAllAttachmentBlobs() {
        Note note = services().notes().create(Fixtures.note("Voice memo about airports")).orElseThrow();
        services().notes().attachAudio(note.id(), new byte[] {1, 2, 3}, "audio/m4a", "take1.m4a").orElseThrow();
        services().notes().attachAudio(note.id(), new byte[] {4, 5}, "audio/m4a", "take2.m4a").orElseThrow();
        Note withImage = services().notes().attachImage(note.id(), png(64, 48), "page.png").orElseThrow();

        assertEquals(3, withImage.attachments().size());
        assertEquals(3, store.blobs().keys().size());
        for (Attachment attachment : withImage.attachments()) {
            assertTrue(store.blobs().get(attachment.blobKey()).isPresent());
        }

        services().notes().delete(note.id());

        assertTrue(services().notes().get(note.id()).isEmpty());
        assertTrue(store.blobs().keys().isEmpty());
    }

    @Test
    void attachedImageIsStoredAsJpeg() {
        Note note = services().notes().create(Fixtures.note("Photographed page")).orElseThrow();

        Attachment attachment = services().notes()
                .attachImage(note.id(), png(32, 32), "page.png").orElseThrow()
                .attachments().get(0);

        assertEquals(Attachment.Type.IMAGE, attachment.type());
        assertEquals("image/jpeg", attachment.mimeType());
        byte[] stored = store.blobs().get(attachment.blobKey()).orElseThrow();
        assertEquals((byte) 0xFF, stored[0]);
        assertEquals((byte) 0xD8, stored[1]);
        assertEquals(stored.length, attachment.size());
    }

    @Test
    void attachingToMissingNoteLeavesNoBlob() {
        Result<Note> result = services().notes()
                .attachAudio(UUID.randomUUID().toString(), new byte[] {1}, "audio/m4a", "x.m4a");

        assertInstanceOf(Result.NotFound.class, result);
        assertTrue(store.blobs().keys().isEmpty());
    }

    @Test
    void deleteManyCascadesToBlobs() {
        Note a = services().notes().create(Fixtures.note("a bit")).orElseThrow();
        Note b = services().notes().create(Fixtures.note("b bit")).orElseThrow();
        Note c = services().notes().create(Fixtures.note("c bit")).orElseThrow();
        services().notes().attachAudio(a.id(), new byte[] {1}, "audio/m4a", "a.m4a");
        services().notes().attachAudio(b.id(), new byte[] {2}, "audio/m4a", "b.m4a");

        services().notes().deleteMany(List.of(a.id(), b.id()));

        assertEquals(List.of(c), services().notes().list());
        assertTrue(store.blobs().keys().isEmpty());
    }

    @Test
    void invalidNoteIsReportedNotThrown() {
        Result<Note> result = services().notes().create(Fixtures.note(""));

        Result.Invalid<Note> invalid = assertInstanceOf(Result.Invalid.class, result);
        assertTrue(invalid.violations().stream().anyMatch(v -> v.path().equals("content")));
    }

    @Test
    void setListTotalDurationFollowsItsNotes() {
        Note opener = Fixtures.embeddedNote("Opener", 30);
        Note closer = Fixtures.embeddedNote("Closer", 45);

        SetList created = services().setLists()
                .create(Fixtures.setList("Friday").toBuilder().notes(List.of(opener, closer)).build())
                .orElseThrow();
        assertEquals(75, created.totalDuration());

        SetList afterRemove = services().setLists().removeNote(created.id(), closer.id()).orElseThrow();
        assertEquals(30, afterRemove.totalDuration());
        assertEquals(List.of(opener.id()), afterRemove.notes().stream().map(Note::id).collect(Collectors.toList()));

        SetList afterAdd = services().setLists().addNote(created.id(), Fixtures.embeddedNote("Tag", 20)).orElseThrow();
        assertEquals(50, afterAdd.totalDuration());
        assertEquals(50, services().setLists().get(created.id()).orElseThrow().totalDuration());
    }

    @Test
    void setListTotalCannotBePatchedDirectly() {
        SetList created = services().setLists()
                .create(Fixtures.setList("Sunday").toBuilder().note(Fixtures.embeddedNote("Bit", 60)).build())
                .orElseThrow();

        SetList updated = services().setLists().update(created.id(),
                Patch.builder().set("totalDuration", 999).set("name", "Sunday late").build()).orElseThrow();

        assertEquals(60, updated.totalDuration());
        assertEquals("Sunday late", updated.name());
    }

    @Test
    void setListOperationsOnMissingSetListReportNotFound() {
        String missing = UUID.randomUUID().toString();

        Result<SetList> result = services().setLists().addNote(missing, Fixtures.embeddedNote("x", 1));

        assertEquals(new Result.NotFound<SetList>("Set list not found"), result);
    }

    @Test
    void sequentialInteractionsAreAllKeptInOrder() {
        Contact contact = services().contacts()
                .create(Fixtures.contact("Dana", "booker", "dana@example.com")).orElseThrow();

        services().contacts().addInteraction(contact.id(), interaction("First call"));
        clock.advance(Duration.ofMinutes(1));
        Contact updated = services().contacts().addInteraction(contact.id(), interaction("Follow-up")).orElseThrow();

        assertEquals(List.of("First call", "Follow-up"),
                updated.interactions().stream().map(Interaction::subject).collect(Collectors.toList()));
        assertNotNull(updated.interactions().get(0).id());
        assertEquals(T0, updated.interactions().get(0).createdAt());
    }

    @Test
    void concurrentInteractionsMayLoseAnUpdate() throws Exception {
        Contact contact = services().contacts().create(Fixtures.contact("Lee", "promoter")).orElseThrow();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            List<Future<Result<Contact>>> futures = new ArrayList<>();
            for (String subject : List.of("Email A", "Email B")) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return services().contacts().addInteraction(contact.id(), interaction(subject));
                }));
            }
            start.countDown();
            for (Future<Result<Contact>> future : futures) {
                assertTrue(future.get(10, TimeUnit.SECONDS).isOk());
            }
        } finally {
            pool.shutdownNow();
        }

        int kept = services().contacts().get(contact.id()).orElseThrow().interactions().size();
        assertTrue(kept == 1 || kept == 2, "kept " + kept);
    }

    @Test
    void remindersCanBeCompleted() {
        Contact contact = services().contacts().create(Fixtures.contact("Sam", "agent")).orElseThrow();
        Reminder reminder = services().contacts().addReminder(contact.id(), new Reminder(null, "Send tape", null,
                T0.plus(Duration.ofDays(3)), false, null, Reminder.Priority.HIGH, null, null))
                .orElseThrow().reminders().get(0);
        clock.advance(Duration.ofDays(1));

        Reminder completed = services().contacts().completeReminder(contact.id(), reminder.id())
                .orElseThrow().reminders().get(0);

        assertTrue(completed.completed());
        assertEquals(T0.plus(Duration.ofDays(1)), completed.completedAt());
        assertEquals(new Result.NotFound<Contact>("Reminder not found"),
                services().contacts().completeReminder(contact.id(), UUID.randomUUID().toString()));
        assertEquals(new Result.NotFound<Contact>("Contact not found"),
                services().contacts().addReminder(UUID.randomUUID().toString(), reminder));
    }

    @Test
    void contactsListByNameAndByVenue() {
        Venue venue = services().venues().create(Fixtures.venue("Cellar", "NYC")).orElseThrow();
        services().contacts().create(Fixtures.contact("Zoe", "host").toBuilder().venue(venue.id()).build());
        services().contacts().create(Fixtures.contact("Abe", "booker").toBuilder().venue(venue.id()).build());
        services().contacts().create(Fixtures.contact("Max", "agent"));

        assertEquals(List.of("Abe", "Max", "Zoe"), names(services().contacts().list()));
        assertEquals(List.of("Abe", "Zoe"), names(services().contacts().listByVenue(venue.id())));
    }

    @Test
    void venueHistoryLinksEachPerformanceOnce() {
        Venue venue = services().venues().create(Fixtures.venue("The Stand", "NYC")).orElseThrow();
        SetList setList = services().setLists().create(Fixtures.setList("Main")).orElseThrow();
        Performance performance = services().performances().create(Fixtures.performance(setList.id(), venue.id(), T0)
                .toBuilder().actualDuration(1500.0).build()).orElseThrow();

        services().venues().linkPerformance(performance.id(), venue.id()).orElseThrow();
        Venue linked = services().venues().linkPerformance(performance.id(), venue.id()).orElseThrow();

        assertEquals(1, linked.performanceHistory().size());
        assertEquals(performance.id(), linked.performanceHistory().get(0).id());
        assertEquals(1500, linked.performanceHistory().get(0).duration());

        Venue unlinked = services().venues().unlinkPerformance(performance.id(), venue.id()).orElseThrow();
        assertTrue(unlinked.performanceHistory().isEmpty());
        assertEquals(new Result.NotFound<Venue>("Performance or venue not found"),
                services().venues().linkPerformance(UUID.randomUUID().toString(), venue.id()));
    }

    @Test
    void performanceStatsSummariseCompletedShows() {
        Venue cellar = services().venues().create(Fixtures.venue("Cellar", "NYC")).orElseThrow();
        Venue stand = services().venues().create(Fixtures.venue("Stand", "NYC")).orElseThrow();
        Note bit = Fixtures.embeddedNote("Airport bit", 120);
        SetList setList = services().setLists()
                .create(Fixtures.setList("Tour").toBuilder().note(bit).build()).orElseThrow();

        completed(setList, cellar, Instant.parse("2024-03-02T21:00:00Z"), 4,
                List.of(new MaterialFeedback(bit.id(), 5, null)));
        completed(setList, cellar, Instant.parse("2024-03-09T21:00:00Z"), 5,
                List.of(new MaterialFeedback(bit.id(), 3, null)));
        completed(setList, stand, Instant.parse("2024-04-01T21:00:00Z"), 3, List.of());
        services().performances().create(Fixtures.performance(setList.id(), stand.id(), T0));

        PerformanceStats stats = services().performances().stats();

        assertEquals(3, stats.totalPerformances());
        assertEquals(4.0, stats.averageRating(), 1e-9);
        assertEquals(5400, stats.totalStageTime(), 1e-9);
        assertEquals(cellar.id(), stats.bestVenue().venueId());
        assertEquals("Cellar", stats.bestVenue().venueName());
        assertEquals(2, stats.bestVenue().performanceCount());
        assertEquals(1, stats.topMaterial().size());
        assertEquals(2, stats.topMaterial().get(0).timesPerformed());
        assertEquals(4.0, stats.topMaterial().get(0).averageRating(), 1e-9);
        assertEquals(PerformanceStats.Direction.STABLE, stats.recentTrend().direction());
        assertEquals(List.of("2024-03", "2024-04"), stats.monthlyBreakdown().stream()
                .map(PerformanceStats.MonthlyStat::month).collect(Collectors.toList()));
        assertEquals(1, services().performances().listByStatus(PerformanceStatus.SCHEDULED).size());
    }

    @Test
    void statsAreEmptyWithoutCompletedPerformances() {
        PerformanceStats stats = services().performances().stats();

        assertEquals(0, stats.totalPerformances());
        assertTrue(stats.topMaterial().isEmpty());
    }

    @Test
    void rehearsalsListLatestStartFirst() {
        SetList setList = services().setLists().create(Fixtures.setList("Practice")).orElseThrow();
        RehearsalSession early = services().rehearsals().create(RehearsalSession.builder()
                .setListId(setList.id()).startTime(T0).build()).orElseThrow();
        RehearsalSession late = services().rehearsals().create(RehearsalSession.builder()
                .setListId(setList.id()).startTime(T0.plus(Duration.ofDays(1))).build()).orElseThrow();
        services().rehearsals().create(RehearsalSession.builder()
                .setListId(UUID.randomUUID().toString()).startTime(T0).build());

        assertEquals(List.of(late, early), services().rehearsals().listForSetList(setList.id()));
        assertEquals(3, services().rehearsals().list().size());
    }

    @Test
    void globalSearchCoversEveryCollection() {
        Venue venue = services().venues().create(Fixtures.venue("Laugh Factory", "Airport Road")).orElseThrow();
        SetList setList = services().setLists().create(Fixtures.setList("Airport set")).orElseThrow();
        services().notes().create(Fixtures.note("Airport security bit"));
        services().notes().create(Fixtures.note("Cats"));
        services().contacts().create(Fixtures.contact("Ray", "AIRPORT lounge promoter"));
        services().performances().create(Fixtures.performance(setList.id(), venue.id(), T0)
                .toBuilder().notes("Airport crowd was tired").build());

        GlobalSearchResult result = services().globalSearch("airport", null);

        assertEquals(1, result.notes().size());
        assertEquals(1, result.setlists().size());
        assertEquals(1, result.venues().size());
        assertEquals(1, result.contacts().size());
        assertEquals(1, result.performances().size());
        assertEquals(5, result.total());
    }

    @Test
    void globalSearchLimitAppliesPerCollection() {
        for (int i = 0; i < 3; i++) {
            services().notes().create(Fixtures.note("Travel bit " + i));
            services().contacts().create(Fixtures.contact("Travel agent " + i, "agent"));
        }

        GlobalSearchResult result = services().globalSearch("travel", 2);

        assertEquals(2, result.notes().size());
        assertEquals(2, result.contacts().size());
    }

    @Test
    void syncQueueCanBeAcknowledgedAndCleared() {
        Note note = services().notes().create(Fixtures.note("bit")).orElseThrow();
        services().notes().update(note.id(), Patch.of("content", "better bit"));

        List<SyncOperation> pending = services().getSyncQueue();
        assertEquals(List.of(SyncOperationType.CREATE, SyncOperationType.UPDATE),
                pending.stream().map(SyncOperation::type).collect(Collectors.toList()));

        services().removeSyncOperation(pending.get(0).id());
        assertEquals(List.of(pending.get(1)), services().getSyncQueue());

        services().clearSyncQueue();
        assertTrue(services().getSyncQueue().isEmpty());
    }

    @Test
    void clearAllDataWipesEverything() {
        Note note = services().notes().create(Fixtures.note("bit")).orElseThrow();
        services().notes().attachAudio(note.id(), new byte[] {1}, "audio/m4a", "a.m4a");
        services().venues().create(Fixtures.venue("Club", "LA"));

        services().clearAllData();

        assertTrue(services().notes().list().isEmpty());
        assertTrue(services().venues().list().isEmpty());
        assertTrue(store.blobs().keys().isEmpty());
        assertTrue(services().getSyncQueue().isEmpty());
    }

    private static Interaction interaction(String subject) {
        return new Interaction(null, Interaction.Type.EMAIL, subject, null, T0, null);
    }

    private void completed(SetList setList, Venue venue, Instant date, double rating,
                           List<MaterialFeedback> material) {
        services().performances().create(Fixtures.performance(setList.id(), venue.id(), date).toBuilder()
                .status(PerformanceStatus.COMPLETED)
                .actualDuration(1800.0)
                .feedback(PerformanceFeedback.rated(rating, material))
                .build()).orElseThrow();
    }

    private static List<String> names(List<Contact> contacts) {
        return contacts.stream().map(Contact::name).collect(Collectors.toList());
    }
}
