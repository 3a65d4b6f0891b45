package org.ohnlp.cdm.timeline.connections;

import org.apache.beam.sdk.schemas.Schema;
import org.joda.time.DateTime;
import org.joda.time.DateTimeZone;
import org.junit.jupiter.api.Test;
import org.ohnlp.cdm.timeline.exceptions.RecordParseException;

import static org.junit.jupiter.api.Assertions.*;

public class CellValuesTest {

    @Test
    public void testParseDateTime_AcceptedForms() {
        DateTime day = new DateTime(2020, 1, 2, 0, 0, DateTimeZone.UTC);
        assertEquals(day.getMillis(), CellValues.parseDateTime("2020-01-02").getMillis());
        assertEquals(day.plusHours(8).getMillis(), CellValues.parseDateTime("2020-01-02T08:00:00").getMillis());
        assertEquals(day.plusHours(8).plusMinutes(30).getMillis(),
                CellValues.parseDateTime("2020-01-02 08:30").getMillis());
        assertEquals(day.plusHours(8).plusSeconds(5).getMillis(),
                CellValues.parseDateTime(" 2020-01-02 08:00:05 ").getMillis());
        assertEquals(day.plusMillis(250).getMillis(),
                CellValues.parseDateTime("2020-01-02 00:00:00.250").getMillis());
    }

    @Test
    public void testCoerce_BlankIsNull() {
        Schema.Field field = Schema.Field.of("year_of_birth", Schema.FieldType.INT32);
        assertNull(CellValues.coerce("person", field, "", 1));
        assertNull(CellValues.coerce("person", field, "   ", 1));
        assertNull(CellValues.coerce("person", field, null, 1));
    }

    @Test
    public void testCoerce_Types() {
        assertEquals("C1", CellValues.coerce("t", Schema.Field.of("c", Schema.FieldType.STRING), " C1 ", 1));
        assertEquals(1980, CellValues.coerce("t", Schema.Field.of("c", Schema.FieldType.INT32), "1980", 1));
        assertEquals(1980, CellValues.coerce("t", Schema.Field.of("c", Schema.FieldType.INT32), "1980.0", 1));
        assertEquals(12L, CellValues.coerce("t", Schema.Field.of("c", Schema.FieldType.INT64), "12", 1));
        assertEquals(1.5d, CellValues.coerce("t", Schema.Field.of("c", Schema.FieldType.DOUBLE), "1.5", 1));
        Object ts = CellValues.coerce("t", Schema.Field.of("c", Schema.FieldType.DATETIME), "2020-01-02", 1);
        assertTrue(ts instanceof DateTime);
    }

    @Test
    public void testCoerce_Malformed() {
        RecordParseException e = assertThrows(RecordParseException.class, () ->
                CellValues.coerce("person", Schema.Field.of("month_of_birth", Schema.FieldType.INT32), "1.5", 7));
        assertEquals("person", e.getTable());
        assertEquals("month_of_birth", e.getColumn());
        assertThrows(RecordParseException.class, () ->
                CellValues.coerce("death", Schema.Field.of("death_date", Schema.FieldType.DATETIME), "yesterday", 1));
    }
}
