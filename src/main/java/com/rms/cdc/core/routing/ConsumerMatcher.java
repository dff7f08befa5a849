package com.rms.cdc.core.routing;

import java.util.Objects;

import com.rms.cdc.core.filter.ColumnFilterEvaluator;
import com.rms.cdc.core.model.Change;
import com.rms.cdc.core.model.ColumnFilter;
import com.rms.cdc.core.model.Consumer;
import com.rms.cdc.core.model.SourceTable;

/**
 * Decides whether a consumer's subscription covers a change.
 *
 * <p>The consumer's {@link SourceTable} for the change's table oid is looked
 * up first; a consumer that does not subscribe to the table never matches.
 * A source table without filters matches every change on the table,
 * otherwise every filter must pass.</p>
 *
 * <p>Only one source table per oid is expected on a consumer. If the stored
 * configuration nevertheless holds several, the first one in configuration
 * order decides.</p>
 */
public final class ConsumerMatcher {

    private final ColumnFilterEvaluator evaluator;

    public ConsumerMatcher(ColumnFilterEvaluator evaluator) {
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
    }

    public boolean matches(Consumer consumer, Change change) {
        SourceTable sourceTable = sourceTableFor(consumer, change.tableOid());
        if (sourceTable == null) {
            return false;
        }
        for (ColumnFilter filter : sourceTable.columnFilters()) {
            if (!evaluator.evaluate(filter, change.fields())) {
                return false;
            }
        }
        return true;
    }

    private static SourceTable sourceTableFor(Consumer consumer, long tableOid) {
        for (SourceTable st : consumer.sourceTables()) {
            if (st.oid() == tableOid) {
                return st;
            }
        }
        return null;
    }
}
