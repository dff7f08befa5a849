package com.rms.cdc.r2dbc.entity;

import java.time.Instant;
import java.util.UUID;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

@Table("consumer_records")
public class ConsumerRecordEntity {

    @Id
    private Long id;

    @Column("ack_id")
    private UUID ackId;

    @Column("consumer_id")
    private UUID consumerId;

    @Column("table_oid")
    private Long tableOid;

    @Column("commit_lsn")
    private Long commitLsn;

    @Column("record_pks")
    private String[] recordPks;

    // available | delivered | pending_redelivery
    @Column("state")
    private String state;

    @Column("inserted_at")
    private Instant insertedAt;

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public UUID getAckId() { return ackId; }
    public void setAckId(UUID ackId) { this.ackId = ackId; }

    public UUID getConsumerId() { return consumerId; }
    public void setConsumerId(UUID consumerId) { this.consumerId = consumerId; }

    public Long getTableOid() { return tableOid; }
    public void setTableOid(Long tableOid) { this.tableOid = tableOid; }

    public Long getCommitLsn() { return commitLsn; }
    public void setCommitLsn(Long commitLsn) { this.commitLsn = commitLsn; }

    public String[] getRecordPks() { return recordPks; }
    public void setRecordPks(String[] recordPks) { this.recordPks = recordPks; }

    public String getState() { return state; }
    public void setState(String state) { this.state = state; }

    public Instant getInsertedAt() { return insertedAt; }
    public void setInsertedAt(Instant insertedAt) { this.insertedAt = insertedAt; }
}
