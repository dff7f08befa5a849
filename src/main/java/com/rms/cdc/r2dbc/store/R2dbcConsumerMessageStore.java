package com.rms.cdc.r2dbc.store;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.function.IntFunction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.reactive.TransactionalOperator;

import com.rms.cdc.core.envelope.EnvelopeCodec;
import com.rms.cdc.core.model.ConsumerEvent;
import com.rms.cdc.core.model.ConsumerRecord;
import com.rms.cdc.core.model.ConsumerRecordState;
import com.rms.cdc.core.store.ConsumerMessageStore;
import com.rms.cdc.r2dbc.entity.ConsumerEventEntity;
import com.rms.cdc.r2dbc.entity.ConsumerRecordEntity;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Database access for the consumer_events and consumer_records tables.
 *
 * Each insert is a multi-row statement. Row values are bound by
 * position-suffixed names (:consumer_id_0, :consumer_id_1, ...). JSONB is
 * bound and read as String to avoid driver-specific Json codec types.
 *
 * Postgres caps a statement at 65,535 bind parameters and every row takes
 * five, so a list is written in statements of at most
 * {@value #DEFAULT_ROWS_PER_STATEMENT} rows. A batch costs
 * ceil(rows / {@value #DEFAULT_ROWS_PER_STATEMENT}) round trips per kind.
 * Statements run one after the other on the caller's connection, so inside
 * {@link #atomically} they commit or roll back together.
 */
@Repository
public class R2dbcConsumerMessageStore implements ConsumerMessageStore {

	private static final Logger log = LoggerFactory.getLogger(R2dbcConsumerMessageStore.class);

	static final String INSERT_EVENTS = "INSERT INTO consumer_events "
			+ "(consumer_id, table_oid, commit_lsn, record_pks, data, inserted_at) VALUES ";

	static final String INSERT_RECORDS = "INSERT INTO consumer_records "
			+ "(consumer_id, table_oid, commit_lsn, record_pks, state, inserted_at) VALUES ";

	static final int MAX_BIND_PARAMETERS = 65_535;

	static final int BINDS_PER_ROW = 5;

	static final int DEFAULT_ROWS_PER_STATEMENT = 10_000;

	private final DatabaseClient db;
	private final EnvelopeCodec codec;
	private final TransactionalOperator tx;
	private final int rowsPerStatement;

	@Autowired
	public R2dbcConsumerMessageStore(DatabaseClient db, EnvelopeCodec codec, TransactionalOperator tx) {
		this(db, codec, tx, DEFAULT_ROWS_PER_STATEMENT);
	}

	R2dbcConsumerMessageStore(DatabaseClient db, EnvelopeCodec codec, TransactionalOperator tx, int rowsPerStatement) {
		if (rowsPerStatement < 1 || rowsPerStatement * BINDS_PER_ROW > MAX_BIND_PARAMETERS) {
			throw new IllegalArgumentException("rowsPerStatement out of range: " + rowsPerStatement);
		}
		this.db = Objects.requireNonNull(db, "db");
		this.codec = Objects.requireNonNull(codec, "codec");
		this.tx = Objects.requireNonNull(tx, "tx");
		this.rowsPerStatement = rowsPerStatement;
	}

	@Override
	public Mono<Long> insertConsumerEvents(List<ConsumerEvent> events) {
		if (events == null || events.isEmpty()) {
			return Mono.just(0L);
		}
		return Flux.fromIterable(chunks(events, rowsPerStatement))
				.concatMap(this::insertEventChunk)
				.reduce(0L, Long::sum)
				.doOnSuccess(n -> log.debug("Inserted consumer_events rows={}", n));
	}

	private Mono<Long> insertEventChunk(List<ConsumerEvent> events) {
		String sql = INSERT_EVENTS + values(events.size(),
				i -> "(:consumer_id_" + i + ", :table_oid_" + i + ", :commit_lsn_" + i + ", :record_pks_" + i
						+ ", :data_" + i + "::jsonb, now())");

		DatabaseClient.GenericExecuteSpec spec = db.sql(sql);
		for (int i = 0; i < events.size(); i++) {
			ConsumerEvent e = events.get(i);
			spec = spec.bind("consumer_id_" + i, e.consumerId())
					.bind("table_oid_" + i, e.tableOid())
					.bind("commit_lsn_" + i, e.commitLsn())
					.bind("record_pks_" + i, e.recordPks().toArray(String[]::new))
					.bind("data_" + i, codec.encodeEventData(e.data()));
		}

		return spec.fetch().rowsUpdated();
	}

	@Override
	public Mono<Long> insertConsumerRecords(List<ConsumerRecord> records) {
		if (records == null || records.isEmpty()) {
			return Mono.just(0L);
		}
		return Flux.fromIterable(chunks(records, rowsPerStatement))
				.concatMap(this::insertRecordChunk)
				.reduce(0L, Long::sum)
				.doOnSuccess(n -> log.debug("Inserted consumer_records rows={}", n));
	}

	private Mono<Long> insertRecordChunk(List<ConsumerRecord> records) {
		String sql = INSERT_RECORDS + values(records.size(),
				i -> "(:consumer_id_" + i + ", :table_oid_" + i + ", :commit_lsn_" + i + ", :record_pks_" + i
						+ ", :state_" + i + ", now())");

		DatabaseClient.GenericExecuteSpec spec = db.sql(sql);
		for (int i = 0; i < records.size(); i++) {
			ConsumerRecord r = records.get(i);
			spec = spec.bind("consumer_id_" + i, r.consumerId())
					.bind("table_oid_" + i, r.tableOid())
					.bind("commit_lsn_" + i, r.commitLsn())
					.bind("record_pks_" + i, r.recordPks().toArray(String[]::new))
					.bind("state_" + i, r.state().name());
		}

		return spec.fetch().rowsUpdated();
	}

	@Override
	public <T> Mono<T> atomically(Mono<T> work) {
		return tx.transactional(work);
	}

	public Flux<ConsumerEvent> listConsumerEvents(UUID consumerId) {
		String sql = "SELECT ack_id, consumer_id, table_oid, commit_lsn, record_pks, data::text AS data "
				+ "FROM consumer_events WHERE consumer_id = :consumer_id ORDER BY id ASC";

		return db.sql(sql).bind("consumer_id", consumerId).map((row, meta) -> {
			ConsumerEventEntity e = new ConsumerEventEntity();
			e.setAckId(row.get("ack_id", UUID.class));
			e.setConsumerId(row.get("consumer_id", UUID.class));
			e.setTableOid(row.get("table_oid", Long.class));
			e.setCommitLsn(row.get("commit_lsn", Long.class));
			e.setRecordPks(row.get("record_pks", String[].class));
			e.setDataText(row.get("data", String.class));
			return toModel(e);
		}).all();
	}

	public Flux<ConsumerRecord> listConsumerRecords(UUID consumerId) {
		String sql = "SELECT ack_id, consumer_id, table_oid, commit_lsn, record_pks, state "
				+ "FROM consumer_records WHERE consumer_id = :consumer_id ORDER BY id ASC";

		return db.sql(sql).bind("consumer_id", consumerId).map((row, meta) -> {
			ConsumerRecordEntity e = new ConsumerRecordEntity();
			e.setAckId(row.get("ack_id", UUID.class));
			e.setConsumerId(row.get("consumer_id", UUID.class));
			e.setTableOid(row.get("table_oid", Long.class));
			e.setCommitLsn(row.get("commit_lsn", Long.class));
			e.setRecordPks(row.get("record_pks", String[].class));
			e.setState(row.get("state", String.class));
			return toModel(e);
		}).all();
	}

	private ConsumerEvent toModel(ConsumerEventEntity e) {
		return new ConsumerEvent(e.getConsumerId(), orZero(e.getTableOid()), orZero(e.getCommitLsn()),
				pks(e.getRecordPks()), codec.decodeEventData(e.getDataText()), e.getAckId());
	}

	private ConsumerRecord toModel(ConsumerRecordEntity e) {
		return new ConsumerRecord(e.getConsumerId(), orZero(e.getTableOid()), orZero(e.getCommitLsn()),
				pks(e.getRecordPks()), ConsumerRecordState.valueOf(e.getState()), e.getAckId());
	}

	static String values(int rows, IntFunction<String> tuple) {
		StringBuilder sb = new StringBuilder();
		for (int i = 0; i < rows; i++) {
			if (i > 0)
				sb.append(", ");
			sb.append(tuple.apply(i));
		}
		return sb.toString();
	}

	static <T> List<List<T>> chunks(List<T> rows, int size) {
		List<List<T>> chunks = new ArrayList<>((rows.size() + size - 1) / size);
		for (int from = 0; from < rows.size(); from += size) {
			chunks.add(rows.subList(from, Math.min(rows.size(), from + size)));
		}
		return chunks;
	}

	private static List<String> pks(String[] pks) {
		return pks == null ? List.of() : Arrays.asList(pks);
	}

	private static long orZero(Long v) {
		return v == null ? 0L : v;
	}
}
