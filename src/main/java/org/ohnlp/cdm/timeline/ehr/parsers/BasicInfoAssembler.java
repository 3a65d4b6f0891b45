package org.ohnlp.cdm.timeline.ehr.parsers;

import org.apache.beam.sdk.values.Row;
import org.joda.time.DateTime;
import org.joda.time.DateTimeZone;
import org.joda.time.IllegalFieldValueException;
import org.ohnlp.cdm.timeline.concurrent.PartitionResult;
import org.ohnlp.cdm.timeline.concurrent.PersonPartitionExecutor;
import org.ohnlp.cdm.timeline.ehr.tables.CdmTables;
import org.ohnlp.cdm.timeline.ehr.tables.RowValues;
import org.ohnlp.cdm.timeline.exceptions.RecordParseException;
import org.ohnlp.cdm.timeline.structs.DischargeStatus;
import org.ohnlp.cdm.timeline.structs.Episode;
import org.ohnlp.cdm.timeline.structs.Person;
import org.ohnlp.cdm.timeline.structs.Timeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the skeleton timeline from the person, visit_occurrence and death tables: one {@link Person} per person
 * row and one {@link Episode} per visit, with no events yet.
 * <p>
 * Docs:
 * <ul>
 *     <li>person: http://ohdsi.github.io/CommonDataModel/cdm53.html#PERSON</li>
 *     <li>visit_occurrence: http://ohdsi.github.io/CommonDataModel/cdm53.html#VISIT_OCCURRENCE</li>
 *     <li>death: http://ohdsi.github.io/CommonDataModel/cdm53.html#DEATH</li>
 * </ul>
 */
public class BasicInfoAssembler {
    private static final Logger LOG = LoggerFactory.getLogger(BasicInfoAssembler.class);

    private static final Comparator<Episode> BY_ENCOUNTER_TIME = Comparator
            .comparing(Episode::getEncounterTime, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(Episode::getEpisodeId);

    /**
     * @param context The run's reader and worker pool
     * @param personRowLimit Cap on person rows read, bounding the cohort in development mode; null for none
     */
    public Timeline assemble(ParseContext context, Integer personRowLimit) {
        List<Row> persons = context.getReader().read(CdmTables.PERSON, personRowLimit);
        List<Row> visits = context.getReader().read(CdmTables.VISIT_OCCURRENCE);
        List<Row> deaths = context.getReader().read(CdmTables.DEATH);

        // person ⟕ visit_occurrence ⟕ death on person_id. Lookups are read-only once units start.
        Map<String, List<Row>> visitsByPerson = PersonPartitionExecutor.partition(visits, CdmTables.PERSON_ID);
        Map<String, DateTime> deathByPerson = new HashMap<>();
        for (Row death : deaths) {
            DateTime deathDate = RowValues.dateTime(death, "death_date");
            if (deathDate != null) {
                deathByPerson.putIfAbsent(death.getString(CdmTables.PERSON_ID), deathDate);
            }
        }

        PartitionResult<Person> result = context.getExecutor().run(
                CdmTables.PERSON.getName(), persons, CdmTables.PERSON_ID,
                personRows -> {
                    String personId = personRows.get(0).getString(CdmTables.PERSON_ID);
                    return buildPerson(personRows.get(0),
                            visitsByPerson.getOrDefault(personId, Collections.emptyList()),
                            deathByPerson.get(personId));
                });
        context.recordFailures(result.getFailures());

        // Single threaded merge after the barrier
        Timeline timeline = new Timeline();
        for (Person person : result.getResults().values()) {
            for (Episode episode : person.getEpisodes()) {
                String owner = timeline.getPersonIdForEpisode(episode.getEpisodeId());
                if (owner != null) {
                    throw new RecordParseException(CdmTables.VISIT_OCCURRENCE.getName(),
                            CdmTables.VISIT_OCCURRENCE_ID, "Visit " + episode.getEpisodeId() + " of person "
                            + person.getPersonId() + " is already recorded for person " + owner);
                }
            }
            timeline.addPerson(person);
        }
        LOG.debug("Assembled {} persons with {} episodes", timeline.size(), timeline.getEpisodeCount());
        return timeline;
    }

    Person buildPerson(Row personRow, List<Row> visitRows, DateTime deathDate) {
        String personId = personRow.getString(CdmTables.PERSON_ID);
        Person person = new Person(
                personId,
                birthDatetime(personRow),
                deathDate,
                personRow.getString("gender_concept_id"),
                personRow.getString("race_concept_id"));

        List<Episode> episodes = new ArrayList<>();
        PersonPartitionExecutor.partition(visitRows, CdmTables.VISIT_OCCURRENCE_ID).forEach((visitId, rows) -> {
            Row visit = rows.get(0);
            DateTime encounterTime = RowValues.firstDateTime(visit, "visit_start_datetime", "visit_start_date");
            DateTime dischargeTime = RowValues.dateTime(visit, "visit_end_date");
            episodes.add(new Episode(visitId, personId, encounterTime, dischargeTime,
                    dischargeStatus(deathDate, dischargeTime)));
        });
        episodes.sort(BY_ENCOUNTER_TIME);
        episodes.forEach(person::addEpisode);
        return person;
    }

    /**
     * Alive when no death is recorded or the death date is strictly after the end of the episode, deceased
     * otherwise, including a death on the discharge date itself.
     */
    static DischargeStatus dischargeStatus(DateTime deathDate, DateTime episodeEnd) {
        if (deathDate == null) {
            return DischargeStatus.ALIVE;
        }
        if (episodeEnd != null && deathDate.isAfter(episodeEnd)) {
            return DischargeStatus.ALIVE;
        }
        return DischargeStatus.DECEASED;
    }

    // No exact time is recorded, births are placed at 00:00:00
    private static DateTime birthDatetime(Row personRow) {
        Integer year = personRow.getInt32("year_of_birth");
        Integer month = personRow.getInt32("month_of_birth");
        Integer day = personRow.getInt32("day_of_birth");
        String personId = personRow.getString(CdmTables.PERSON_ID);
        if (year == null || month == null || day == null) {
            throw new RecordParseException(CdmTables.PERSON.getName(), "year_of_birth",
                    "Incomplete birth date " + year + "-" + month + "-" + day + " for person " + personId);
        }
        try {
            return new DateTime(year, month, day, 0, 0, DateTimeZone.UTC);
        } catch (IllegalFieldValueException e) {
            throw new RecordParseException(CdmTables.PERSON.getName(), e.getFieldName(),
                    "Invalid birth date " + year + "-" + month + "-" + day + " for person " + personId, e);
        }
    }
}
