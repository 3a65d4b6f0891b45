package org.ohnlp.cdm.timeline.ehr.parsers;

import org.apache.beam.sdk.values.Row;
import org.ohnlp.cdm.timeline.concurrent.PartitionResult;
import org.ohnlp.cdm.timeline.ehr.tables.CdmTables;
import org.ohnlp.cdm.timeline.ehr.tables.RowValues;
import org.ohnlp.cdm.timeline.ehr.tables.TableDefinition;
import org.ohnlp.cdm.timeline.structs.Event;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses a visit-level clinical table with one concept code and one timestamp per row.
 */
public class ClinicalEventParser implements TableParser {
    private static final Logger LOG = LoggerFactory.getLogger(ClinicalEventParser.class);

    private final TableDefinition table;
    private final String codeColumn;
    private final String timestampColumn;
    private final String vocabulary;
    private final List<String> attributeColumns;

    public ClinicalEventParser(TableDefinition table, String codeColumn, String timestampColumn, String vocabulary,
                               String... attributeColumns) {
        this.table = table;
        this.codeColumn = codeColumn;
        this.timestampColumn = timestampColumn;
        this.vocabulary = vocabulary;
        this.attributeColumns = Collections.unmodifiableList(Arrays.asList(attributeColumns));
    }

    public static ClinicalEventParser conditionOccurrence() {
        return new ClinicalEventParser(CdmTables.CONDITION_OCCURRENCE, "condition_concept_id",
                "condition_start_datetime", "CONDITION_CONCEPT_ID", "condition_type_concept_id");
    }

    public static ClinicalEventParser procedureOccurrence() {
        return new ClinicalEventParser(CdmTables.PROCEDURE_OCCURRENCE, "procedure_concept_id",
                "procedure_datetime", "PROCEDURE_CONCEPT_ID", "procedure_type_concept_id");
    }

    public static ClinicalEventParser drugExposure() {
        return new ClinicalEventParser(CdmTables.DRUG_EXPOSURE, "drug_concept_id",
                "drug_exposure_start_datetime", "DRUG_CONCEPT_ID", "quantity", "days_supply");
    }

    public static ClinicalEventParser measurement() {
        return new ClinicalEventParser(CdmTables.MEASUREMENT, "measurement_concept_id",
                "measurement_datetime", "MEASUREMENT_CONCEPT_ID", "value_as_number", "unit_concept_id");
    }

    @Override
    public String getTable() {
        return table.getName();
    }

    @Override
    public String getVocabulary() {
        return vocabulary;
    }

    @Override
    public Map<String, List<Event>> parse(ParseContext context) {
        List<Row> rows = context.getReader().read(table);
        PartitionResult<List<Event>> result = context.getExecutor().run(
                table.getName(), rows, CdmTables.PERSON_ID, this::toEvents);
        context.recordFailures(result.getFailures());
        context.getRegistry().register(table.getName(), vocabulary);
        LOG.debug("Parsed {} rows of {} for {} persons", rows.size(), table.getName(), result.getResults().size());
        return new LinkedHashMap<>(result.getResults());
    }

    // Unit of work for a single person; rows arrive sorted by episode id then timestamp
    List<Event> toEvents(List<Row> personRows) {
        List<Event> events = new ArrayList<>(personRows.size());
        for (Row row : personRows) {
            Map<String, String> attributes = new LinkedHashMap<>();
            for (String column : attributeColumns) {
                Object value = row.getValue(column);
                if (value != null) {
                    attributes.put(column, value.toString());
                }
            }
            events.add(new Event(
                    row.getString(codeColumn),
                    vocabulary,
                    table.getName(),
                    row.getString(CdmTables.VISIT_OCCURRENCE_ID),
                    row.getString(CdmTables.PERSON_ID),
                    RowValues.dateTime(row, timestampColumn),
                    attributes));
        }
        return events;
    }
}
