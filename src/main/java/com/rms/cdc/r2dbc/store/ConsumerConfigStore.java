package com.rms.cdc.r2dbc.store;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rms.cdc.core.model.ColumnFilter;
import com.rms.cdc.core.model.Consumer;
import com.rms.cdc.core.model.FilterOperator;
import com.rms.cdc.core.model.FilterValue;
import com.rms.cdc.core.model.MessageKind;
import com.rms.cdc.core.model.SourceTable;
import com.rms.cdc.core.model.ValueType;

import reactor.core.publisher.Flux;

/**
 * Read access to the consumers table.
 *
 * source_tables is JSONB, read as text and decoded here:
 *
 * <pre>
 * [{"oid": 16384,
 *   "column_filters": [{"column_attnum": 2, "operator": "==",
 *                       "value": {"__type__": "string", "value": "test"}}]}]
 * </pre>
 */
@Repository
public class ConsumerConfigStore {

	private static final Logger log = LoggerFactory.getLogger(ConsumerConfigStore.class);

	static final String TYPE_TAG = "__type__";

	private final DatabaseClient db;
	private final ObjectMapper mapper;

	public ConsumerConfigStore(DatabaseClient db, ObjectMapper mapper) {
		this.db = db;
		this.mapper = mapper;
	}

	/**
	 * Loads every consumer with status 'active'. A row whose source_tables
	 * cannot be decoded fails the whole load.
	 */
	public Flux<Consumer> findActive() {
		String sql = "SELECT id, name, message_kind, source_tables::text AS source_tables "
				+ "FROM consumers WHERE status = 'active' ORDER BY name ASC";

		return db.sql(sql).map((row, meta) -> new Consumer(
				row.get("id", UUID.class),
				row.get("name", String.class),
				MessageKind.fromValue(row.get("message_kind", String.class)),
				parseSourceTables(row.get("source_tables", String.class))))
				.all()
				.doOnComplete(() -> log.debug("Loaded active consumers"));
	}

	List<SourceTable> parseSourceTables(String json) {
		if (json == null || json.isBlank()) {
			return List.of();
		}
		try {
			JsonNode root = mapper.readTree(json);
			List<SourceTable> tables = new ArrayList<>();
			for (JsonNode t : root) {
				List<ColumnFilter> filters = new ArrayList<>();
				for (JsonNode f : t.path("column_filters")) {
					filters.add(new ColumnFilter(
							f.path("column_attnum").asInt(),
							FilterOperator.fromSymbol(f.path("operator").asText()),
							parseValue(f.get("value"))));
				}
				tables.add(new SourceTable(t.path("oid").asLong(), filters));
			}
			return tables;
		} catch (Exception e) {
			throw new IllegalArgumentException("Invalid source_tables JSON: " + json, e);
		}
	}

	static FilterValue parseValue(JsonNode node) {
		if (node == null || node.isNull()) {
			return FilterValue.nullValue();
		}
		if (!node.has(TYPE_TAG)) {
			return untyped(node);
		}

		ValueType type = ValueType.fromTag(node.path(TYPE_TAG).asText());
		JsonNode v = node.get("value");
		return switch (type) {
			case STRING -> FilterValue.string(v.asText());
			case NUMBER -> FilterValue.number(v.isNumber() ? v.decimalValue() : new BigDecimal(v.asText()));
			case BOOLEAN -> FilterValue.bool(v.isBoolean() ? v.booleanValue() : Boolean.parseBoolean(v.asText()));
			case DATETIME -> FilterValue.datetime(Instant.parse(v.asText()));
			case LIST -> {
				List<FilterValue> elements = new ArrayList<>();
				for (JsonNode element : v) {
					elements.add(parseValue(element));
				}
				yield FilterValue.list(elements);
			}
			case NULL -> FilterValue.nullValue();
		};
	}

	// plain JSON scalars inside list literals
	private static FilterValue untyped(JsonNode node) {
		if (node.isNumber()) {
			return FilterValue.number(node.decimalValue());
		}
		if (node.isBoolean()) {
			return FilterValue.bool(node.booleanValue());
		}
		if (node.isTextual()) {
			return FilterValue.string(node.textValue());
		}
		throw new IllegalArgumentException("Unsupported filter value: " + node);
	}
}
