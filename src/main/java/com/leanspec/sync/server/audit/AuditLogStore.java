package com.leanspec.sync.server.audit;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;

import com.leanspec.sync.core.model.AuditLogEntry;

import io.r2dbc.spi.Row;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Database access helper for the sync_audit_log table.
 *
 * Rows are only ever inserted. Timestamps are bound as UTC {@link OffsetDateTime} so the
 * column type stays portable across R2DBC drivers.
 */
@Repository
public class AuditLogStore {

	private final DatabaseClient db;

	public AuditLogStore(DatabaseClient db) {
		this.db = db;
	}

	public Mono<Void> append(AuditLogEntry entry) {
		String sql = "INSERT INTO sync_audit_log (id, machine_id, project_id, spec_name, action, status, message, created_at) "
				+ "VALUES (:id, :machine_id, :project_id, :spec_name, :action, :status, :message, :created_at)";

		DatabaseClient.GenericExecuteSpec spec = db.sql(sql).bind("id", entry.id())
				.bind("machine_id", entry.machineId()).bind("action", entry.action())
				.bind("status", entry.status())
				.bind("created_at", entry.createdAt().atOffset(ZoneOffset.UTC));

		spec = bindNullable(spec, "project_id", entry.projectId());
		spec = bindNullable(spec, "spec_name", entry.specName());
		spec = bindNullable(spec, "message", entry.message());

		return spec.fetch().rowsUpdated().then();
	}

	/** Newest first. */
	public Flux<AuditLogEntry> findByMachine(String machineId, int limit) {
		String sql = "SELECT id, machine_id, project_id, spec_name, action, status, message, created_at "
				+ "FROM sync_audit_log WHERE machine_id = :machine_id ORDER BY created_at DESC, seq DESC LIMIT :limit";

		return db.sql(sql).bind("machine_id", machineId).bind("limit", limit)
				.map((row, meta) -> toModel(row)).all();
	}

	private static AuditLogEntry toModel(Row row) {
		OffsetDateTime createdAt = row.get("created_at", OffsetDateTime.class);
		Instant created = createdAt == null ? null : createdAt.toInstant();
		return new AuditLogEntry(row.get("id", String.class), row.get("machine_id", String.class),
				row.get("project_id", String.class), row.get("spec_name", String.class),
				row.get("action", String.class), row.get("status", String.class),
				row.get("message", String.class), created);
	}

	private static DatabaseClient.GenericExecuteSpec bindNullable(DatabaseClient.GenericExecuteSpec spec,
			String name, String value) {
		return value == null ? spec.bindNull(name, String.class) : spec.bind(name, value);
	}
}
