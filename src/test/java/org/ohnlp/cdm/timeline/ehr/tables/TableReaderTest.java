package org.ohnlp.cdm.timeline.ehr.tables;

import org.apache.beam.sdk.values.Row;
import org.joda.time.DateTime;
import org.joda.time.DateTimeZone;
import org.junit.jupiter.api.Test;
import org.ohnlp.cdm.timeline.Fixtures;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class TableReaderTest {

    private final TableReader reader = new TableReader(Fixtures.basicConnection());

    @Test
    public void testRead_DropsRowsMissingIdentifiers() {
        List<Row> visits = reader.read(CdmTables.VISIT_OCCURRENCE);
        assertEquals(3, visits.size());
        assertTrue(visits.stream().noneMatch(r -> "V9".equals(r.getString(CdmTables.VISIT_OCCURRENCE_ID))));
    }

    @Test
    public void testRead_DropsRowsMissingCode() {
        List<Row> conditions = reader.read(CdmTables.CONDITION_OCCURRENCE);
        assertEquals(5, conditions.size());
        assertTrue(conditions.stream().allMatch(r -> r.getString("condition_concept_id") != null));
    }

    @Test
    public void testRead_SortedByPersonEpisodeTimestamp() {
        List<String> codes = reader.read(CdmTables.CONDITION_OCCURRENCE).stream()
                .map(r -> r.getString("condition_concept_id"))
                .collect(Collectors.toList());
        // P1/V1, P1/V8, P2/V2 by time, P9/V7
        assertEquals(List.of("C1", "C5", "C3", "C2", "C4"), codes);
    }

    @Test
    public void testRead_RowLimit() {
        assertEquals(2, reader.read(CdmTables.PERSON, 2).size());
    }

    @Test
    public void testDateTime_Fallback() {
        List<Row> visits = reader.read(CdmTables.VISIT_OCCURRENCE);
        Row v3 = visits.stream().filter(r -> "V3".equals(r.getString(CdmTables.VISIT_OCCURRENCE_ID)))
                .findFirst().orElseThrow();
        assertNull(RowValues.dateTime(v3, "visit_start_datetime"));
        assertEquals("2019-03-10T00:00:00.000Z",
                RowValues.firstDateTime(v3, "visit_start_datetime", "visit_start_date").toString());
    }

    private static Row visit(String personId, String visitId, DateTime start) {
        return Row.withSchema(CdmTables.VISIT_OCCURRENCE.getSchema())
                .addValues(personId, visitId, start, start, start)
                .build();
    }

    @Test
    public void testOrdering_IdsCompareAsText() {
        DateTime t0 = new DateTime(2020, 1, 1, 0, 0, DateTimeZone.UTC);
        List<Row> visits = new ArrayList<>(Arrays.asList(
                visit("10", "V1", t0),
                visit("007", "V2", t0),
                visit("0042", "V3", t0),
                visit("007", "V4", null),
                visit("007", "V4", t0.minusDays(1))));
        visits.sort(TableReader.ordering(CdmTables.VISIT_OCCURRENCE));
        assertEquals(List.of("0042", "007", "007", "007", "10"), visits.stream()
                .map(r -> r.getString(CdmTables.PERSON_ID)).collect(Collectors.toList()));
        // Within one person and visit, earlier starts first and missing starts last
        assertEquals(t0.minusDays(1), RowValues.dateTime(visits.get(2), "visit_start_datetime"));
        assertNull(RowValues.dateTime(visits.get(3), "visit_start_datetime"));
    }
}
