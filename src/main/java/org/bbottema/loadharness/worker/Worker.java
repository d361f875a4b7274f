/*
 * Copyright (C) 2019 Benny Bottema (benny@bennybottema.com)
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *         http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.bbottema.loadharness.worker;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.bbottema.loadharness.adapter.DatabaseAdapter;
import org.bbottema.loadharness.adapter.OperationKind;
import org.bbottema.loadharness.adapter.OperationResult;
import org.bbottema.loadharness.adapter.Payload;
import org.bbottema.loadharness.pool.ConnectionPool;
import org.bbottema.loadharness.pool.PoolException;
import org.bbottema.loadharness.pool.PooledConnection;
import org.bbottema.loadharness.stats.StatsAggregator;
import org.bbottema.loadharness.util.StopSignal;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One slot of concurrency: takes a rate limiter token, borrows a connection, runs one transaction, returns the connection and records
 * the outcome, until the stop signal fires.
 * <p>
 * Failing to get a connection is governed by this worker's own {@link WorkerBackoff}, on top of the bounded retries inside
 * {@link ConnectionPool#acquire()}. A failing transaction is counted and never retried.
 */
@Slf4j
public class Worker<C> implements Runnable {

	@NotNull @Getter private final String name;
	@NotNull private final WorkerContext<C> context;
	@NotNull private final ConnectionPool<C> pool;
	@NotNull private final DatabaseAdapter<C> adapter;
	@NotNull private final StatsAggregator stats;
	@NotNull private final StopSignal stopSignal;
	@NotNull @Getter private final WorkerBackoff backoff;

	@NotNull private volatile WorkerState state = WorkerState.WAITING_TO_START;
	@NotNull private final AtomicLong transactionCount = new AtomicLong();

	private boolean poolClosed;
	private long lastErrorLogMs;
	private int suppressedErrors;

	public Worker(@NotNull String name, @NotNull WorkerContext<C> context) {
		this.name = name;
		this.context = context;
		this.pool = context.getPool();
		this.adapter = context.getPool().getAdapter();
		this.stats = context.getStats();
		this.stopSignal = context.getStopSignal();
		this.backoff = context.newBackoff();
	}

	/**
	 * @return {@code Worker-0001} for index 0 and so on.
	 */
	@NotNull
	public static String nameFor(int index) {
		return String.format("Worker-%04d", index + 1);
	}

	@Override
	public void run() {
		state = WorkerState.RUNNING;
		log.debug("{} started in {} mode", name, context.getMode().getLabel());
		try {
			while (!isStopRequested()) {
				if (!context.getRateLimiter().acquireToken(stopSignal)) {
					break;
				}
				final PooledConnection<C> pooledConnection = acquireConnection();
				if (pooledConnection != null) {
					try {
						runTransaction(pooledConnection);
					} catch (IllegalStateException e) {
						if (!pool.isShuttingDown()) {
							throw e;
						}
						log.debug("{} lost its connection to the pool shutdown", name);
						poolClosed = true;
					}
				}
			}
		} finally {
			state = WorkerState.STOPPED;
			log.debug("{} stopped after {} transactions", name, transactionCount.get());
		}
	}

	/**
	 * @return null if no connection could be had, after pausing per the backoff (or because the test is stopping)
	 */
	@Nullable
	private PooledConnection<C> acquireConnection() {
		try {
			final PooledConnection<C> pooledConnection = pool.acquire(pool.getPoolConfig().getAcquireTimeout(), stopSignal);
			backoff.onSuccess();
			return pooledConnection;
		} catch (PoolException e) {
			if (isStopRequested()) {
				return null;
			}
			final long delayMs = backoff.onFailure();
			logThrottled(String.format("could not get a connection (%d consecutive failures), retrying in %dms",
					backoff.getConsecutiveFailures(), delayMs), e);
			stopSignal.awaitStopMs(delayMs);
			return null;
		} catch (IllegalStateException e) {
			if (!pool.isShuttingDown()) {
				throw e;
			}
			log.debug("{} found the pool shut down", name);
			poolClosed = true;
			return null;
		}
	}

	/**
	 * The connection always goes back to the pool: released when it's still usable, invalidated otherwise.
	 */
	private void runTransaction(@NotNull PooledConnection<C> pooledConnection) {
		final C connection = pooledConnection.getConnection();
		final long startNanos = System.nanoTime();
		boolean reusable = false;
		try {
			final List<OperationKind> executed = executeMode(connection);
			final long latencyNanos = System.nanoTime() - startNanos;
			reusable = true;
			if (executed != null) {
				stats.recordTransaction(executed, latencyNanos);
				transactionCount.incrementAndGet();
			}
		} catch (Exception e) {
			stats.recordError();
			logThrottled("transaction failed", e);
			rollbackQuietly(connection);
			reusable = isAlive(connection);
		} finally {
			if (reusable) {
				pooledConnection.release();
			} else {
				log.debug("{} discarding broken connection {}", name, pooledConnection.getId());
				pooledConnection.invalidate();
				stats.recordConnectionRecreate();
			}
		}
	}

	/**
	 * @return the statements executed, or null when full mode read back something other than what it wrote
	 */
	@Nullable
	private List<OperationKind> executeMode(@NotNull C connection) throws Exception {
		switch (context.getMode()) {
			case FULL:
				return executeFull(connection);
			case INSERT_ONLY:
				return executeCommitted(connection, OperationKind.INSERT);
			case SELECT_ONLY:
				return executeCommitted(connection, OperationKind.SELECT);
			case UPDATE_ONLY:
				return executeCommitted(connection, OperationKind.UPDATE);
			case DELETE_ONLY:
				return executeCommitted(connection, OperationKind.DELETE);
			case MIXED:
				return executeCommitted(connection, pickMixedKind());
			default:
				throw new IllegalStateException("unsupported mode " + context.getMode());
		}
	}

	/**
	 * Inserts write {@code batchSize} records before the single commit; other kinds execute one statement.
	 */
	@NotNull
	private List<OperationKind> executeCommitted(@NotNull C connection, @NotNull OperationKind kind) throws Exception {
		final int statements = kind == OperationKind.INSERT ? context.getBatchSize() : 1;
		for (int i = 0; i < statements; i++) {
			adapter.execute(connection, kind, context.getPayloadGenerator().next(kind, name));
		}
		adapter.commit(connection);
		return Collections.nCopies(statements, kind);
	}

	@Nullable
	private List<OperationKind> executeFull(@NotNull C connection) throws Exception {
		final Payload written = context.getPayloadGenerator().next(OperationKind.INSERT, name);
		final OperationResult inserted = adapter.execute(connection, OperationKind.INSERT, written);
		adapter.commit(connection);

		final Long recordId = inserted.getRecordId();
		if (recordId == null) {
			stats.recordOperation(OperationKind.INSERT);
			failVerification("insert reported no record id");
			return null;
		}
		final OperationResult read = adapter.execute(connection, OperationKind.SELECT, written.forRecord(recordId));
		if (!recordId.equals(read.getRecordId()) || !Objects.equals(written.getData(), read.getData())) {
			stats.recordOperation(OperationKind.INSERT);
			stats.recordOperation(OperationKind.SELECT);
			failVerification(String.format("record %d read back differently than written", recordId));
			return null;
		}
		return Arrays.asList(OperationKind.INSERT, OperationKind.SELECT);
	}

	private void failVerification(@NotNull String reason) {
		stats.recordVerificationFailure();
		log.warn("{} verification failed: {}", name, reason);
	}

	@NotNull
	private static OperationKind pickMixedKind() {
		final int roll = ThreadLocalRandom.current().nextInt(10);
		if (roll < 6) {
			return OperationKind.INSERT;
		}
		return roll < 9 ? OperationKind.UPDATE : OperationKind.DELETE;
	}

	/**
	 * A liveness check that throws counts as a dead connection.
	 */
	private boolean isAlive(@NotNull C connection) {
		try {
			return adapter.isAlive(connection);
		} catch (RuntimeException e) {
			log.debug("{} liveness check failed, treating the connection as dead", name, e);
			return false;
		}
	}

	private void rollbackQuietly(@NotNull C connection) {
		try {
			adapter.rollback(connection);
		} catch (Exception e) {
			log.debug("{} rollback failed as well", name, e);
		}
	}

	private void logThrottled(@NotNull String message, @NotNull Exception e) {
		final long now = System.currentTimeMillis();
		if (now - lastErrorLogMs >= context.getErrorLogIntervalMs()) {
			if (suppressedErrors > 0) {
				log.warn("{} {} ({} similar errors since the last report): {}", name, message, suppressedErrors, e.toString());
			} else {
				log.warn("{} {}: {}", name, message, e.toString());
			}
			lastErrorLogMs = now;
			suppressedErrors = 0;
		} else {
			suppressedErrors++;
			log.debug("{} {}", name, message, e);
		}
	}

	private boolean isStopRequested() {
		if (poolClosed || stopSignal.isStopped() || Thread.currentThread().isInterrupted()) {
			if (state == WorkerState.RUNNING) {
				state = WorkerState.STOPPING;
			}
			return true;
		}
		return false;
	}

	@NotNull
	public WorkerState getState() {
		return state;
	}

	public long getTransactionCount() {
		return transactionCount.get();
	}
}
