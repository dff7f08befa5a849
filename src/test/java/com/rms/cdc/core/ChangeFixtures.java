package com.rms.cdc.core;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.rms.cdc.core.model.Change;
import com.rms.cdc.core.model.ChangeAction;
import com.rms.cdc.core.model.ColumnFilter;
import com.rms.cdc.core.model.Consumer;
import com.rms.cdc.core.model.Field;
import com.rms.cdc.core.model.FilterOperator;
import com.rms.cdc.core.model.FilterValue;
import com.rms.cdc.core.model.MessageKind;
import com.rms.cdc.core.model.SourceTable;

/**
 * Builders for the rows used across the core tests: table "public.orders"
 * with columns id (attnum 1), name (2) and amount (3).
 */
public final class ChangeFixtures {

    public static final long ORDERS_OID = 16384L;

    public static final long ITEMS_OID = 16402L;

    public static final Instant COMMITTED_AT = Instant.parse("2024-05-01T10:15:30.123456Z");

    private ChangeFixtures() {
    }

    public static Map<String, Object> row(Object id, String name, Object amount) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("id", id);
        row.put("name", name);
        row.put("amount", amount);
        return row;
    }

    public static List<Field> fields(Map<String, Object> row) {
        return List.of(
                new Field(1, "id", row.get("id")),
                new Field(2, "name", row.get("name")),
                new Field(3, "amount", row.get("amount")));
    }

    public static Change insert(Object id, String name) {
        Map<String, Object> row = row(id, name, 10);
        return base(ChangeAction.insert, id, row).record(row).build();
    }

    public static Change update(Object id, Map<String, Object> oldRow, Map<String, Object> newRow) {
        return base(ChangeAction.update, id, newRow).record(newRow).oldRecord(oldRow).build();
    }

    public static Change delete(Object id, String name) {
        Map<String, Object> row = row(id, name, 10);
        return base(ChangeAction.delete, id, row).oldRecord(row).build();
    }

    public static Change insertItem(Object id, String name) {
        Map<String, Object> row = row(id, name, 1);
        return base(ChangeAction.insert, id, row).tableOid(ITEMS_OID).table("items").record(row).build();
    }

    private static Change.Builder base(ChangeAction action, Object id, Map<String, Object> image) {
        return Change.builder()
                .tableOid(ORDERS_OID)
                .schema("public")
                .table("orders")
                .action(action)
                .fields(fields(image))
                .identifierColumnValues(List.of(id))
                .commitTimestamp(COMMITTED_AT);
    }

    public static Consumer consumer(MessageKind kind, SourceTable... tables) {
        return new Consumer(UUID.randomUUID(), "consumer-" + kind, kind, List.of(tables));
    }

    public static SourceTable nameEquals(String value) {
        return new SourceTable(ORDERS_OID,
                List.of(new ColumnFilter(2, FilterOperator.EQ, FilterValue.string(value))));
    }
}
