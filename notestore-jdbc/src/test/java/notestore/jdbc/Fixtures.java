package notestore.jdbc;

import notestore.domain.Contact;
import notestore.domain.ContactInfo;
import notestore.domain.Note;
import notestore.domain.Performance;
import notestore.domain.PerformanceStatus;
import notestore.domain.SetList;
import notestore.domain.Venue;

import java.time.Instant;
import java.util.UUID;

/**
 * Minimal valid domain objects, without ids or timestamps so the store assigns them.
 */
public final class Fixtures {

    private Fixtures() {}

    public static Note note(String content) {
        return Note.builder().content(content).build();
    }

    public static Note note(String content, double seconds) {
        return Note.builder().content(content).duration(seconds).build();
    }

    /** A note as embedded in a set list, which carries its own id and timestamps. */
    public static Note embeddedNote(String content, double seconds) {
        Instant at = Instant.parse("2024-01-01T00:00:00Z");
        return Note.builder()
                .id(UUID.randomUUID().toString())
                .content(content)
                .duration(seconds)
                .createdAt(at)
                .updatedAt(at)
                .build();
    }

    public static SetList setList(String name) {
        return SetList.builder().name(name).build();
    }

    public static Venue venue(String name, String location) {
        return Venue.builder().name(name).location(location).build();
    }

    public static Contact contact(String name, String role) {
        return Contact.builder().name(name).role(role).build();
    }

    public static Contact contact(String name, String role, String email) {
        return Contact.builder().name(name).role(role).contactInfo(ContactInfo.email(email)).build();
    }

    public static Performance performance(String setListId, String venueId, Instant date) {
        return Performance.builder()
                .setListId(setListId)
                .venueId(venueId)
                .date(date)
                .status(PerformanceStatus.SCHEDULED)
                .build();
    }
}
