package org.ohnlp.cdm.timeline.ehr.parsers;

import org.ohnlp.cdm.timeline.ehr.tables.CdmTables;
import org.ohnlp.cdm.timeline.exceptions.ConfigurationException;
import org.ohnlp.cdm.timeline.exceptions.MissingTableParserException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Table id to parser lookup. Table ids are matched case-insensitively.
 */
public class TableParserRegistry {
    private final Map<String, TableParser> parsers = new LinkedHashMap<>();

    /**
     * @return a registry holding the condition_occurrence, procedure_occurrence, drug_exposure and measurement parsers
     */
    public static TableParserRegistry defaults() {
        return new TableParserRegistry()
                .register(ClinicalEventParser.conditionOccurrence())
                .register(ClinicalEventParser.procedureOccurrence())
                .register(ClinicalEventParser.drugExposure())
                .register(ClinicalEventParser.measurement());
    }

    public TableParserRegistry register(TableParser parser) {
        parsers.put(key(parser.getTable()), parser);
        return this;
    }

    public TableParser get(String table) {
        TableParser parser = parsers.get(key(table));
        if (parser == null) {
            throw new MissingTableParserException(table);
        }
        return parser;
    }

    public boolean contains(String table) {
        return parsers.containsKey(key(table));
    }

    /**
     * Checks a whole table request up front so that no work starts for a request that would fail part way.
     * @return the parsers for the requested tables, in request order
     * @throws ConfigurationException if a basic table is requested explicitly
     * @throws MissingTableParserException if a table has no parser
     */
    public List<TableParser> resolve(Collection<String> tables) {
        for (String table : tables) {
            if (CdmTables.BASIC_TABLES.contains(key(table))) {
                throw new ConfigurationException("Basic tables are parsed by default and do not need to be "
                        + "explicitly selected, got " + table + ". Basic tables: " + CdmTables.BASIC_TABLES);
            }
        }
        List<TableParser> ret = new ArrayList<>();
        for (String table : tables) {
            ret.add(get(table));
        }
        return ret;
    }

    private static String key(String table) {
        return table.toLowerCase(Locale.ROOT);
    }
}
