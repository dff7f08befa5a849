package com.rms.cdc.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * =====================================================================
 * Change
 * =====================================================================
 *
 * PURPOSE
 * -------
 * A decoded row-level mutation as produced by the logical replication
 * decoder. It is the single input type of both delivery paths.
 *
 * SHAPE
 * -----
 * One type, tagged by {@link ChangeAction}:
 *
 *   insert : record (post-image)
 *   update : record (post-image), oldRecord only with prior-value tracking
 *   delete : oldRecord (pre-image)
 *
 * The builder rejects a variant that lacks the image it requires, so the
 * rest of the core can dispatch on {@link #action()} without null checks.
 *
 * IMMUTABILITY
 * ------------
 * Collections are copied on construction and exposed read-only. The core
 * never mutates a change; filter evaluation works on {@link #fields()} as is.
 */
public final class Change {

    private final long tableOid;
    private final String schema;
    private final String table;
    private final ChangeAction action;
    private final List<Field> fields;
    private final List<Object> identifierColumnValues;
    private final Instant commitTimestamp;
    private final Map<String, Object> record;
    private final Map<String, Object> oldRecord;

    private Change(Builder b) {
        this.tableOid = b.tableOid;
        this.schema = requireName(b.schema, "schema");
        this.table = requireName(b.table, "table");
        this.action = Objects.requireNonNull(b.action, "action");
        this.commitTimestamp = Objects.requireNonNull(b.commitTimestamp, "commitTimestamp");
        this.fields = Collections.unmodifiableList(new ArrayList<>(b.fields));
        this.identifierColumnValues = Collections.unmodifiableList(new ArrayList<>(b.identifierColumnValues));
        this.record = copyOrNull(b.record);
        this.oldRecord = copyOrNull(b.oldRecord);

        switch (action) {
            case insert, update -> {
                if (record == null) {
                    throw new IllegalArgumentException(action + " change requires a record (post-image)");
                }
            }
            case delete -> {
                if (oldRecord == null) {
                    throw new IllegalArgumentException("delete change requires an oldRecord (pre-image)");
                }
                if (record != null) {
                    throw new IllegalArgumentException("delete change must not carry a record");
                }
            }
        }
        if (action == ChangeAction.insert && oldRecord != null) {
            throw new IllegalArgumentException("insert change must not carry an oldRecord");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Commit position of the source transaction: commit time as microseconds
     * since the epoch. Monotonic with commit order for a single source database.
     */
    public long commitLsn() {
        long micros = Math.multiplyExact(commitTimestamp.getEpochSecond(), 1_000_000L);
        return Math.addExact(micros, commitTimestamp.getNano() / 1_000);
    }

    /** Primary-key values coerced to strings, in key column order. */
    public List<String> recordPks() {
        List<String> out = new ArrayList<>(identifierColumnValues.size());
        for (Object v : identifierColumnValues) {
            out.add(String.valueOf(v));
        }
        return out;
    }

    /** Row image to deliver: pre-image for deletes, post-image otherwise. */
    public Map<String, Object> image() {
        return action == ChangeAction.delete ? oldRecord : record;
    }

    /**
     * Prior values of the columns an update modified, keyed by column name.
     *
     * <p>Returns {@code null} for inserts, deletes and for updates decoded
     * without prior-value tracking.</p>
     */
    public Map<String, Object> changes() {
        if (action != ChangeAction.update || oldRecord == null) {
            return null;
        }
        Map<String, Object> diff = new LinkedHashMap<>();
        for (Map.Entry<String, Object> e : record.entrySet()) {
            String column = e.getKey();
            if (oldRecord.containsKey(column) && !Objects.equals(oldRecord.get(column), e.getValue())) {
                diff.put(column, oldRecord.get(column));
            }
        }
        return Collections.unmodifiableMap(diff);
    }

    public long tableOid() {
        return tableOid;
    }

    public String schema() {
        return schema;
    }

    public String table() {
        return table;
    }

    public ChangeAction action() {
        return action;
    }

    public List<Field> fields() {
        return fields;
    }

    public List<Object> identifierColumnValues() {
        return identifierColumnValues;
    }

    public Instant commitTimestamp() {
        return commitTimestamp;
    }

    public Map<String, Object> record() {
        return record;
    }

    public Map<String, Object> oldRecord() {
        return oldRecord;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Change other)) return false;
        return tableOid == other.tableOid
                && schema.equals(other.schema)
                && table.equals(other.table)
                && action == other.action
                && fields.equals(other.fields)
                && identifierColumnValues.equals(other.identifierColumnValues)
                && commitTimestamp.equals(other.commitTimestamp)
                && Objects.equals(record, other.record)
                && Objects.equals(oldRecord, other.oldRecord);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tableOid, schema, table, action, fields, identifierColumnValues, commitTimestamp,
                record, oldRecord);
    }

    @Override
    public String toString() {
        return "Change{" + "tableOid=" + tableOid + ", schema='" + schema + '\'' + ", table='" + table + '\''
                + ", action=" + action + ", pks=" + identifierColumnValues + ", commitTimestamp=" + commitTimestamp
                + '}';
    }

    private static String requireName(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
        return value;
    }

    private static Map<String, Object> copyOrNull(Map<String, Object> m) {
        return m == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(m));
    }

    /**
     * Builder for {@link Change}; validation happens in {@link #build()}.
     */
    public static final class Builder {

        private long tableOid;
        private String schema;
        private String table;
        private ChangeAction action;
        private List<Field> fields = List.of();
        private List<Object> identifierColumnValues = List.of();
        private Instant commitTimestamp;
        private Map<String, Object> record;
        private Map<String, Object> oldRecord;

        public Builder tableOid(long tableOid) {
            this.tableOid = tableOid;
            return this;
        }

        public Builder schema(String schema) {
            this.schema = schema;
            return this;
        }

        public Builder table(String table) {
            this.table = table;
            return this;
        }

        public Builder action(ChangeAction action) {
            this.action = action;
            return this;
        }

        public Builder fields(List<Field> fields) {
            this.fields = fields == null ? List.of() : fields;
            return this;
        }

        public Builder identifierColumnValues(List<?> values) {
            this.identifierColumnValues = values == null ? List.of() : new ArrayList<>(values);
            return this;
        }

        public Builder commitTimestamp(Instant commitTimestamp) {
            this.commitTimestamp = commitTimestamp;
            return this;
        }

        public Builder record(Map<String, Object> record) {
            this.record = record;
            return this;
        }

        public Builder oldRecord(Map<String, Object> oldRecord) {
            this.oldRecord = oldRecord;
            return this;
        }

        public Change build() {
            return new Change(this);
        }
    }
}
