package org.ohnlp.cdm.timeline.ehr.tables;

import org.apache.beam.sdk.schemas.Schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Describes how one CDM table is read: its columns, which of them must exist, which must be populated for a row
 * to be kept, and the ordering rows are returned in.
 */
public class TableDefinition {
    private final String name;
    private final Schema schema;
    private final Set<String> requiredColumns;
    private final List<String> nonNullColumns;
    private final List<String> sortColumns;

    private TableDefinition(Builder builder) {
        this.name = builder.name;
        this.schema = builder.schema.build();
        this.requiredColumns = Collections.unmodifiableSet(new LinkedHashSet<>(builder.requiredColumns));
        this.nonNullColumns = Collections.unmodifiableList(new ArrayList<>(builder.nonNullColumns));
        this.sortColumns = Collections.unmodifiableList(new ArrayList<>(builder.sortColumns));
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String getName() {
        return name;
    }

    public Schema getSchema() {
        return schema;
    }

    public Set<String> getRequiredColumns() {
        return requiredColumns;
    }

    public List<String> getNonNullColumns() {
        return nonNullColumns;
    }

    public List<String> getSortColumns() {
        return sortColumns;
    }

    @Override
    public String toString() {
        return name;
    }

    public static class Builder {
        private final String name;
        private final Schema.Builder schema = Schema.builder();
        private final List<String> requiredColumns = new ArrayList<>();
        private final List<String> nonNullColumns = new ArrayList<>();
        private final List<String> sortColumns = new ArrayList<>();

        private Builder(String name) {
            this.name = name;
        }

        /**
         * Adds a column that must be present in the source.
         */
        public Builder required(String column, Schema.FieldType type) {
            schema.addNullableField(column, type);
            requiredColumns.add(column);
            return this;
        }

        /**
         * Adds a column read when present; rows get null otherwise.
         */
        public Builder optional(String column, Schema.FieldType type) {
            schema.addNullableField(column, type);
            return this;
        }

        /**
         * Rows with a null in any of these columns are dropped.
         */
        public Builder nonNull(String... columns) {
            Collections.addAll(nonNullColumns, columns);
            return this;
        }

        public Builder sortedBy(String... columns) {
            Collections.addAll(sortColumns, columns);
            return this;
        }

        public TableDefinition build() {
            return new TableDefinition(this);
        }
    }
}
