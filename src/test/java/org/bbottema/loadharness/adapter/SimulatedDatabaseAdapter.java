package org.bbottema.loadharness.adapter;

import lombok.Getter;
import lombok.Setter;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory backend with switches to make it misbehave: refuse connections, fail statements, report connections dead, slow down or
 * hand back data other than what was written.
 */
public class SimulatedDatabaseAdapter implements DatabaseAdapter<SimulatedDatabaseAdapter.SimulatedConnection> {

	@Setter private volatile boolean failOpens;
	@Setter private volatile boolean failExecutes;
	@Setter private volatile boolean reportDead;
	@Setter private volatile boolean corruptReads;
	@Setter private volatile boolean failLivenessChecks;
	@Setter private volatile long executeLatencyMs;

	@Getter private final AtomicInteger openCount = new AtomicInteger();
	@Getter private final AtomicInteger openFailures = new AtomicInteger();
	@Getter private final AtomicInteger closeCount = new AtomicInteger();
	@Getter private final AtomicInteger commitCount = new AtomicInteger();
	@Getter private final AtomicInteger rollbackCount = new AtomicInteger();
	private final AtomicLong recordSequence = new AtomicLong();
	private final Map<Long, String> records = new ConcurrentHashMap<>();
	private final Map<String, AtomicInteger> insertsByWorker = new ConcurrentHashMap<>();

	/**
	 * Backend unreachable: no new connections, every statement fails and existing connections test dead.
	 */
	public void setOutage(boolean outage) {
		failOpens = outage;
		failExecutes = outage;
		reportDead = outage;
	}

	public int getOpenConnections() {
		return openCount.get() - closeCount.get();
	}

	public int getRecordCount() {
		return records.size();
	}

	public int getInsertsBy(@NotNull String workerName) {
		final AtomicInteger inserts = insertsByWorker.get(workerName);
		return inserts != null ? inserts.get() : 0;
	}

	@NotNull
	@Override
	public SimulatedConnection open() throws IOException {
		if (failOpens) {
			openFailures.incrementAndGet();
			throw new IOException("simulated backend unavailable");
		}
		return new SimulatedConnection(openCount.incrementAndGet());
	}

	@Override
	public boolean isAlive(@NotNull SimulatedConnection connection) {
		if (failLivenessChecks) {
			throw new IllegalStateException("simulated socket reset during liveness check");
		}
		return !connection.closed && !reportDead;
	}

	@NotNull
	@Override
	public OperationResult execute(@NotNull SimulatedConnection connection, @NotNull OperationKind kind, @NotNull Payload payload) throws Exception {
		if (connection.closed) {
			throw new IllegalStateException("connection " + connection.id + " is closed");
		}
		if (failExecutes) {
			throw new IOException("simulated statement failure");
		}
		if (executeLatencyMs > 0) {
			Thread.sleep(executeLatencyMs);
		}
		final Long recordId = payload.getRecordId();
		switch (kind) {
			case INSERT:
				final long id = recordSequence.incrementAndGet();
				records.put(id, payload.getData());
				insertsByWorker.computeIfAbsent(payload.getWorkerName(), name -> new AtomicInteger()).incrementAndGet();
				return OperationResult.inserted(id);
			case SELECT:
				final String data = recordId != null ? records.get(recordId) : null;
				if (data == null) {
					return OperationResult.notFound();
				}
				return OperationResult.selected(recordId, corruptReads ? data + "-corrupted" : data);
			case UPDATE:
				return OperationResult.affected(recordId, recordId != null && records.replace(recordId, payload.getData()) != null ? 1 : 0);
			case DELETE:
				return OperationResult.affected(recordId, recordId != null && records.remove(recordId) != null ? 1 : 0);
			default:
				throw new IllegalArgumentException("unsupported kind " + kind);
		}
	}

	@Override
	public void commit(@NotNull SimulatedConnection connection) {
		commitCount.incrementAndGet();
	}

	@Override
	public void rollback(@NotNull SimulatedConnection connection) {
		rollbackCount.incrementAndGet();
	}

	@Override
	public void close(@NotNull SimulatedConnection connection) {
		if (!connection.closed) {
			connection.closed = true;
			closeCount.incrementAndGet();
		}
	}

	public static class SimulatedConnection {
		@Getter private final int id;
		private volatile boolean closed;

		SimulatedConnection(int id) {
			this.id = id;
		}

		public boolean isClosed() {
			return closed;
		}
	}
}
