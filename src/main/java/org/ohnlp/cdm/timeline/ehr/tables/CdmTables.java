package org.ohnlp.cdm.timeline.ehr.tables;

import org.apache.beam.sdk.schemas.Schema;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * OMOP CDM table layouts.
 * <p>
 * See http://ohdsi.github.io/CommonDataModel/cdm53.html
 */
public final class CdmTables {
    public static final String PERSON_ID = "person_id";
    public static final String VISIT_OCCURRENCE_ID = "visit_occurrence_id";

    public static final TableDefinition PERSON = TableDefinition.builder("person")
            .required(PERSON_ID, Schema.FieldType.STRING)
            .required("year_of_birth", Schema.FieldType.INT32)
            .required("month_of_birth", Schema.FieldType.INT32)
            .required("day_of_birth", Schema.FieldType.INT32)
            .required("gender_concept_id", Schema.FieldType.STRING)
            .required("race_concept_id", Schema.FieldType.STRING)
            .nonNull(PERSON_ID)
            .sortedBy(PERSON_ID)
            .build();

    public static final TableDefinition VISIT_OCCURRENCE = TableDefinition.builder("visit_occurrence")
            .required(PERSON_ID, Schema.FieldType.STRING)
            .required(VISIT_OCCURRENCE_ID, Schema.FieldType.STRING)
            .required("visit_start_datetime", Schema.FieldType.DATETIME)
            .required("visit_start_date", Schema.FieldType.DATETIME)
            .required("visit_end_date", Schema.FieldType.DATETIME)
            .nonNull(PERSON_ID, VISIT_OCCURRENCE_ID)
            .sortedBy(PERSON_ID, VISIT_OCCURRENCE_ID, "visit_start_datetime")
            .build();

    public static final TableDefinition DEATH = TableDefinition.builder("death")
            .required(PERSON_ID, Schema.FieldType.STRING)
            .required("death_date", Schema.FieldType.DATETIME)
            .nonNull(PERSON_ID)
            .sortedBy(PERSON_ID)
            .build();

    public static final TableDefinition CONDITION_OCCURRENCE = TableDefinition.builder("condition_occurrence")
            .required(PERSON_ID, Schema.FieldType.STRING)
            .required(VISIT_OCCURRENCE_ID, Schema.FieldType.STRING)
            .required("condition_concept_id", Schema.FieldType.STRING)
            .required("condition_start_datetime", Schema.FieldType.DATETIME)
            .optional("condition_type_concept_id", Schema.FieldType.STRING)
            .nonNull(PERSON_ID, VISIT_OCCURRENCE_ID, "condition_concept_id")
            .sortedBy(PERSON_ID, VISIT_OCCURRENCE_ID, "condition_start_datetime")
            .build();

    public static final TableDefinition PROCEDURE_OCCURRENCE = TableDefinition.builder("procedure_occurrence")
            .required(PERSON_ID, Schema.FieldType.STRING)
            .required(VISIT_OCCURRENCE_ID, Schema.FieldType.STRING)
            .required("procedure_concept_id", Schema.FieldType.STRING)
            .required("procedure_datetime", Schema.FieldType.DATETIME)
            .optional("procedure_type_concept_id", Schema.FieldType.STRING)
            .nonNull(PERSON_ID, VISIT_OCCURRENCE_ID, "procedure_concept_id")
            .sortedBy(PERSON_ID, VISIT_OCCURRENCE_ID, "procedure_datetime")
            .build();

    public static final TableDefinition DRUG_EXPOSURE = TableDefinition.builder("drug_exposure")
            .required(PERSON_ID, Schema.FieldType.STRING)
            .required(VISIT_OCCURRENCE_ID, Schema.FieldType.STRING)
            .required("drug_concept_id", Schema.FieldType.STRING)
            .required("drug_exposure_start_datetime", Schema.FieldType.DATETIME)
            .optional("quantity", Schema.FieldType.STRING)
            .optional("days_supply", Schema.FieldType.STRING)
            .nonNull(PERSON_ID, VISIT_OCCURRENCE_ID, "drug_concept_id")
            .sortedBy(PERSON_ID, VISIT_OCCURRENCE_ID, "drug_exposure_start_datetime")
            .build();

    public static final TableDefinition MEASUREMENT = TableDefinition.builder("measurement")
            .required(PERSON_ID, Schema.FieldType.STRING)
            .required(VISIT_OCCURRENCE_ID, Schema.FieldType.STRING)
            .required("measurement_concept_id", Schema.FieldType.STRING)
            .required("measurement_datetime", Schema.FieldType.DATETIME)
            .optional("value_as_number", Schema.FieldType.STRING)
            .optional("unit_concept_id", Schema.FieldType.STRING)
            .nonNull(PERSON_ID, VISIT_OCCURRENCE_ID, "measurement_concept_id")
            .sortedBy(PERSON_ID, VISIT_OCCURRENCE_ID, "measurement_datetime")
            .build();

    /**
     * Tables every run loads to build persons and episodes. They cannot be requested explicitly.
     */
    public static final List<String> BASIC_TABLES = Collections.unmodifiableList(Arrays.asList(
            PERSON.getName(), VISIT_OCCURRENCE.getName(), DEATH.getName()));

    private CdmTables() {}
}
