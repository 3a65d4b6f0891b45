package org.ohnlp.cdm.timeline.ehr;

import org.joda.time.DateTime;
import org.joda.time.DateTimeZone;
import org.junit.jupiter.api.Test;
import org.ohnlp.cdm.timeline.structs.DischargeStatus;
import org.ohnlp.cdm.timeline.structs.Episode;
import org.ohnlp.cdm.timeline.structs.Event;
import org.ohnlp.cdm.timeline.structs.Person;
import org.ohnlp.cdm.timeline.structs.Timeline;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class EventAttacherTest {

    private static final DateTime T0 = new DateTime(2020, 1, 1, 0, 0, DateTimeZone.UTC);

    private static Timeline timeline() {
        Person person = new Person("P1", T0.minusYears(40), null, "8507", "8527");
        person.addEpisode(new Episode("V1", "P1", T0, T0.plusDays(4), DischargeStatus.ALIVE));
        Timeline timeline = new Timeline();
        timeline.addPerson(person);
        return timeline;
    }

    private static Event event(String code, String personId, String episodeId, DateTime timestamp) {
        return new Event(code, "ICD9", "condition_occurrence", episodeId, personId, timestamp);
    }

    @Test
    public void testAttach_DropsAndCountsOrphans() {
        Timeline timeline = timeline();
        Map<String, List<Event>> events = new LinkedHashMap<>();
        events.put("P1", List.of(event("C1", "P1", "V1", T0.plusDays(1)), event("C2", "P1", "V8", T0)));
        events.put("P9", List.of(event("C3", "P9", "V7", T0), event("C4", "P9", "V1", T0)));

        EventAttacher.AttachmentReport report = new EventAttacher().attach(timeline, "condition_occurrence", events);

        assertEquals("condition_occurrence", report.getTable());
        assertEquals(1, report.getAttached());
        assertEquals(2, report.getDroppedUnknownPerson());
        assertEquals(1, report.getDroppedUnknownEpisode());
        assertEquals(3, report.getDropped());
        assertEquals(List.of("C1"), codes(timeline.getPerson("P1").getEpisode("V1")));
    }

    @Test
    public void testAttach_SortsStably() {
        Timeline timeline = timeline();
        Map<String, List<Event>> events = new LinkedHashMap<>();
        events.put("P1", List.of(
                event("late", "P1", "V1", T0.plusDays(2)),
                event("first", "P1", "V1", T0.plusDays(1)),
                event("untimed", "P1", "V1", null),
                event("second", "P1", "V1", T0.plusDays(1))));

        new EventAttacher().attach(timeline, "condition_occurrence", events);

        assertEquals(List.of("first", "second", "late", "untimed"),
                codes(timeline.getPerson("P1").getEpisode("V1")));
    }

    private static List<String> codes(Episode episode) {
        return episode.getEvents("condition_occurrence").stream().map(Event::getCode).collect(Collectors.toList());
    }
}
