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
package org.bbottema.loadharness.pool;

import lombok.Getter;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.bbottema.loadharness.adapter.DatabaseAdapter;
import org.bbottema.loadharness.util.ExponentialBackoff;
import org.bbottema.loadharness.util.StopSignal;
import org.bbottema.loadharness.util.Timeout;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static java.util.concurrent.TimeUnit.NANOSECONDS;

/**
 * Self-healing pool of backend connections.
 * <p>
 * All set membership (idle, active, pending slots) is guarded by a single lock, while every call into the {@link DatabaseAdapter}
 * (open, validate, close) happens outside of it. A slot is reserved under the lock before a connection is created, so idle plus
 * active never exceeds the max size, not even while connections are being opened concurrently.
 *
 * @param <C> the raw connection type
 */
@Slf4j
public class ConnectionPool<C> {

	/**
	 * Upper bound on how long a blocked acquire takes to notice a stop signal.
	 */
	private static final long CANCELLATION_CHECK_INTERVAL_MS = 50;

	@NotNull private final Lock lock = new ReentrantLock();
	@NotNull private final Condition connectionReturned = lock.newCondition();
	@NotNull private final Deque<PooledConnection<C>> idle = new ArrayDeque<>();
	@NotNull private final Map<Long, PooledConnection<C>> active = new LinkedHashMap<>();
	private int pending;
	private int waiting;

	@NotNull @Getter private final PoolConfig<C> poolConfig;
	@NotNull @Getter private final DatabaseAdapter<C> adapter;

	@NotNull private final StopSignal shutdownSignal = new StopSignal();
	@Nullable private final ScheduledExecutorService healthChecker;

	@NotNull private final AtomicLong totalCreated = new AtomicLong();
	@NotNull private final AtomicLong totalRecycled = new AtomicLong();
	@NotNull private final AtomicLong totalRemoved = new AtomicLong();
	@NotNull private final AtomicLong totalInvalidated = new AtomicLong();
	@NotNull private final AtomicLong totalAcquired = new AtomicLong();
	@NotNull private final AtomicLong leakWarnings = new AtomicLong();

	public ConnectionPool(@NotNull final PoolConfig<C> poolConfig, @NotNull final DatabaseAdapter<C> adapter) {
		this.poolConfig = poolConfig;
		this.adapter = adapter;
		final long interval = poolConfig.getHealthCheckIntervalMs();
		if (interval > 0) {
			healthChecker = Executors.newSingleThreadScheduledExecutor(poolConfig.getThreadFactory());
			healthChecker.scheduleWithFixedDelay(new HealthCheckCycle(), interval, interval, MILLISECONDS);
		} else {
			healthChecker = null;
		}
		log.info("connection pool initialized (min={}, max={}, leakDetectionThreshold={}ms, healthCheckInterval={}ms)",
				poolConfig.getMinSize(), poolConfig.getMaxSize(), poolConfig.getLeakDetectionThresholdMs(), interval);
	}

	/**
	 * Delegates to {@link #warmUp(int)} with the configured min size.
	 */
	public int warmUp() {
		return warmUp(poolConfig.getMinSize());
	}

	/**
	 * Synchronously creates up to {@code count} idle connections. A connection that can't be created, even after retrying, is
	 * skipped rather than aborting the warm-up.
	 *
	 * @return how many connections were actually created
	 */
	public int warmUp(final int count) {
		log.info("warming up pool, creating {} connections...", count);
		int created = 0;
		for (int i = 0; i < count && !isShuttingDown(); i++) {
			if (!reserveSlot()) {
				log.warn("pool reached its max size of {} during warm-up", poolConfig.getMaxSize());
				break;
			}
			try {
				addToIdle(createConnection());
				created++;
			} catch (ConnectionCreationFailedException e) {
				releaseSlot();
				log.warn("warm-up connection {}/{} could not be created, skipping it", i + 1, count, e);
			}
		}
		log.info("pool warm-up completed, created {}/{} connections", created, count);
		return created;
	}

	/**
	 * Delegates to {@link #acquire(Timeout)} with the configured acquire timeout.
	 */
	@NotNull
	public PooledConnection<C> acquire() throws PoolExhaustedException {
		return acquire(poolConfig.getAcquireTimeout());
	}

	/**
	 * Delegates to {@link #acquire(Timeout, StopSignal)} without a caller side stop signal.
	 */
	@NotNull
	public PooledConnection<C> acquire(@NotNull final Timeout timeout) throws PoolExhaustedException {
		return acquire(timeout, null);
	}

	/**
	 * Hands out an idle connection, creates a new one if there is room to grow the pool, or else waits for one to be returned.
	 * Waiting happens in a bounded number of attempts of {@code timeout} each, with exponential backoff in between.
	 *
	 * @param stopSignal when it fires, a waiting acquire gives up right away instead of sitting out its timeout
	 * @throws PoolExhaustedException if no connection became available (or the wait got cancelled)
	 * @throws IllegalStateException  if the pool has been shut down
	 */
	@NotNull
	public PooledConnection<C> acquire(@NotNull final Timeout timeout, @Nullable final StopSignal stopSignal) throws PoolExhaustedException {
		ensureNotShuttingDown();
		final String holder = Thread.currentThread().getName();

		boolean slotReserved = false;
		lock.lock();
		try {
			final PooledConnection<C> idleConnection = checkOutIdle(holder);
			if (idleConnection != null) {
				return idleConnection;
			}
			slotReserved = tryReserveSlot();
		} finally {
			lock.unlock();
		}

		ConnectionCreationFailedException creationFailure = null;
		if (slotReserved) {
			try {
				return checkOutNew(createConnection(), holder);
			} catch (ConnectionCreationFailedException e) {
				releaseSlot();
				creationFailure = e;
			}
		}

		final ExponentialBackoff backoff = new ExponentialBackoff(poolConfig.getAcquireBackoffFloorMs(), poolConfig.getAcquireBackoffCeilingMs());
		final int attempts = poolConfig.getAcquireAttempts();
		for (int attempt = 1; attempt <= attempts; attempt++) {
			final PooledConnection<C> returned = awaitIdleConnection(timeout, holder, stopSignal);
			if (returned != null) {
				return returned;
			}
			if (isCancelled(stopSignal)) {
				break;
			}
			if (attempt < attempts) {
				final long delayMs = backoff.nextDelayMs();
				log.debug("no connection available (attempt {}/{}), retrying in {}ms", attempt, attempts, delayMs);
				if (pause(delayMs, stopSignal)) {
					break;
				}
			}
		}
		ensureNotShuttingDown();
		throw new PoolExhaustedException(attempts, poolConfig.getMaxSize(), countActive(), creationFailure);
	}

	/**
	 * Returns a checked out connection to the idle set. A connection past its max lifetime is closed instead.
	 *
	 * @throws IllegalStateException if the connection isn't checked out from this pool, which means it was released twice
	 */
	public void release(@NotNull final PooledConnection<C> pooledConnection) {
		boolean retire = false;
		lock.lock();
		try {
			if (!removeFromActive(pooledConnection)) {
				return;
			}
			pooledConnection.markReleased();
			if (poolConfig.getExpirationPolicy().hasExpired(pooledConnection)) {
				retire = true;
			} else {
				pooledConnection.setCurrentPoolStatus(PooledConnection.PoolStatus.IDLE);
				idle.addLast(pooledConnection);
				connectionReturned.signal();
			}
		} finally {
			lock.unlock();
		}
		if (retire) {
			totalRecycled.incrementAndGet();
			log.debug("connection {} exceeded its max lifetime, closing it instead of returning it", pooledConnection.getId());
			destroy(pooledConnection);
		}
	}

	/**
	 * Takes a checked out connection out of circulation and closes it. Its slot becomes available for a new connection.
	 *
	 * @throws IllegalStateException if the connection isn't checked out from this pool
	 */
	public void invalidate(@NotNull final PooledConnection<C> pooledConnection) {
		lock.lock();
		try {
			if (!removeFromActive(pooledConnection)) {
				return;
			}
		} finally {
			lock.unlock();
		}
		totalInvalidated.incrementAndGet();
		destroy(pooledConnection);
	}

	/**
	 * @return false if the connection was already closed by a pool shutdown, in which case there's nothing left to do
	 */
	private boolean removeFromActive(@NotNull final PooledConnection<C> pooledConnection) {
		if (active.get(pooledConnection.getId()) != pooledConnection) {
			if (isShuttingDown()) {
				log.debug("connection {} handed back after pool shutdown, it was closed already", pooledConnection.getId());
				return false;
			}
			throw new IllegalStateException("Connection " + pooledConnection.getId() + " is not checked out from this pool (released twice?)");
		}
		active.remove(pooledConnection.getId());
		return true;
	}

	/**
	 * Runs one health check cycle:
	 * <ol>
	 *     <li>closes idle connections past their max lifetime (they are not recreated right away, the next acquire does that lazily)</li>
	 *     <li>closes idle connections past their idle timeout, as long as the pool stays above its min size</li>
	 *     <li>validates the remaining idle connections and closes the dead ones</li>
	 *     <li>logs a warning for every checked out connection held longer than the leak detection threshold</li>
	 * </ol>
	 * Idle connections are moved out of the idle set while being checked, so no worker can get hold of one mid-validation.
	 */
	@NotNull
	public HealthCheckReport runHealthCheck() {
		final List<PooledConnection<C>> candidates;
		lock.lock();
		try {
			if (isShuttingDown()) {
				return HealthCheckReport.NOTHING_CHECKED;
			}
			candidates = new ArrayList<>(idle);
			idle.clear();
			pending += candidates.size();
			for (PooledConnection<C> candidate : candidates) {
				candidate.setCurrentPoolStatus(PooledConnection.PoolStatus.MAINTENANCE);
			}
		} finally {
			lock.unlock();
		}

		int removed = 0;
		int recycled = 0;
		final List<PooledConnection<C>> healthy = new ArrayList<>();
		for (PooledConnection<C> candidate : candidates) {
			if (poolConfig.getExpirationPolicy().hasExpired(candidate)) {
				destroyFromMaintenance(candidate);
				recycled++;
			} else if (poolConfig.getIdleExpirationPolicy().hasExpired(candidate) && isAboveMinSize()) {
				destroyFromMaintenance(candidate);
				removed++;
			} else if (poolConfig.isValidateIdleConnections() && !isAlive(candidate)) {
				destroyFromMaintenance(candidate);
				removed++;
			} else {
				healthy.add(candidate);
			}
		}
		returnFromMaintenance(healthy);
		totalRecycled.addAndGet(recycled);
		totalRemoved.addAndGet(removed);

		final HealthCheckReport report = new HealthCheckReport(candidates.size(), removed, recycled, detectLeaks());
		if (removed > 0 || recycled > 0) {
			log.info("health check: checked {}, removed {}, recycled {}", report.getChecked(), removed, recycled);
		} else {
			log.debug("health check: checked {}, nothing removed", report.getChecked());
		}
		return report;
	}

	/**
	 * Warns once per call for every connection currently over the threshold, so a connection that stays leaked is reported again
	 * on every health check cycle. The connection itself is left alone.
	 */
	private int detectLeaks() {
		final long thresholdMs = poolConfig.getLeakDetectionThresholdMs();
		if (thresholdMs <= 0) {
			return 0;
		}
		final List<LeakSuspect> suspects = new ArrayList<>();
		lock.lock();
		try {
			for (PooledConnection<C> checkedOut : active.values()) {
				final long heldMs = checkedOut.checkoutDurationMs();
				if (heldMs > thresholdMs) {
					suspects.add(new LeakSuspect(checkedOut.getId(), checkedOut.getHolder(), heldMs));
				}
			}
		} finally {
			lock.unlock();
		}
		for (LeakSuspect suspect : suspects) {
			leakWarnings.incrementAndGet();
			log.warn("possible connection leak: connection {} held for {}ms by thread '{}' (threshold: {}ms)",
					suspect.getConnectionId(), suspect.getHeldMs(), suspect.getHolder(), thresholdMs);
		}
		return suspects.size();
	}

	/**
	 * Stops the health check and closes every connection, idle or checked out. Waiting acquirers are woken up and fail. Calling it
	 * again is harmless.
	 *
	 * @return the final pool counters
	 */
	@NotNull
	public PoolMetrics shutdown() {
		final List<PooledConnection<C>> toClose = new ArrayList<>();
		boolean firstShutdown = false;
		lock.lock();
		try {
			if (!isShuttingDown()) {
				firstShutdown = true;
				shutdownSignal.stop();
				toClose.addAll(idle);
				toClose.addAll(active.values());
				idle.clear();
				active.clear();
				connectionReturned.signalAll();
			}
		} finally {
			lock.unlock();
		}
		if (healthChecker != null) {
			healthChecker.shutdownNow();
		}
		for (PooledConnection<C> pooledConnection : toClose) {
			destroy(pooledConnection);
		}
		if (firstShutdown) {
			log.info("connection pool shutdown complete, closed {} connections", toClose.size());
		}
		return getPoolMetrics();
	}

	public boolean isShuttingDown() {
		return shutdownSignal.isStopped();
	}

	/**
	 * @see PoolMetrics
	 */
	@NotNull
	public PoolMetrics getPoolMetrics() {
		lock.lock();
		try {
			return new PoolMetrics(
					idle.size(),
					active.size(),
					pending,
					waiting,
					poolConfig.getMinSize(),
					poolConfig.getMaxSize(),
					totalCreated.get(),
					totalRecycled.get(),
					totalRemoved.get(),
					totalInvalidated.get(),
					totalAcquired.get(),
					leakWarnings.get());
		} finally {
			lock.unlock();
		}
	}

	/**
	 * Opens a new connection through the adapter, retrying with exponential backoff between attempts. The result is not part of
	 * either set yet: the caller must have reserved a slot for it.
	 *
	 * @throws ConnectionCreationFailedException once all attempts failed, with the last failure as cause
	 */
	@NotNull
	PooledConnection<C> createConnection() throws ConnectionCreationFailedException {
		final ExponentialBackoff backoff = new ExponentialBackoff(poolConfig.getCreationBackoffFloorMs(), poolConfig.getCreationBackoffCeilingMs());
		final int maxAttempts = poolConfig.getCreationAttempts();
		Exception lastFailure = null;
		int attempt = 0;
		while (attempt < maxAttempts) {
			attempt++;
			try {
				final PooledConnection<C> created = new PooledConnection<>(this, adapter.open());
				totalCreated.incrementAndGet();
				return created;
			} catch (Exception e) {
				lastFailure = e;
				if (attempt < maxAttempts) {
					final long delayMs = backoff.nextDelayMs();
					log.warn("connection creation attempt {}/{} failed, retrying in {}ms: {}", attempt, maxAttempts, delayMs, e.toString());
					if (shutdownSignal.awaitStopMs(delayMs)) {
						break;
					}
				}
			}
		}
		log.error("connection creation failed after {} attempt(s)", attempt, lastFailure);
		throw new ConnectionCreationFailedException(attempt, lastFailure);
	}

	@Nullable
	private PooledConnection<C> checkOutIdle(@NotNull final String holder) {
		final PooledConnection<C> idleConnection = idle.pollFirst();
		if (idleConnection != null) {
			checkOut(idleConnection, holder);
		}
		return idleConnection;
	}

	@NotNull
	private PooledConnection<C> checkOutNew(@NotNull final PooledConnection<C> created, @NotNull final String holder) {
		lock.lock();
		try {
			pending--;
			if (!isShuttingDown()) {
				checkOut(created, holder);
				return created;
			}
		} finally {
			lock.unlock();
		}
		destroy(created);
		throw new IllegalStateException("Pool has been shutdown");
	}

	private void checkOut(@NotNull final PooledConnection<C> pooledConnection, @NotNull final String holder) {
		pooledConnection.markCheckedOut(holder);
		pooledConnection.setCurrentPoolStatus(PooledConnection.PoolStatus.ACTIVE);
		active.put(pooledConnection.getId(), pooledConnection);
		totalAcquired.incrementAndGet();
	}

	/**
	 * Waits up to the given timeout for a connection to be returned, checking for cancellation every so often.
	 *
	 * @return the claimed connection, or null on timeout or cancellation
	 */
	@Nullable
	private PooledConnection<C> awaitIdleConnection(@NotNull final Timeout timeout, @NotNull final String holder, @Nullable final StopSignal stopSignal) {
		final long deadline = System.nanoTime() + timeout.toNanos();
		lock.lock();
		waiting++;
		try {
			while (!isCancelled(stopSignal)) {
				final PooledConnection<C> claimed = checkOutIdle(holder);
				if (claimed != null) {
					return claimed;
				}
				final long remainingNanos = deadline - System.nanoTime();
				if (remainingNanos <= 0) {
					return null;
				}
				connectionReturned.awaitNanos(Math.min(remainingNanos, MILLISECONDS.toNanos(CANCELLATION_CHECK_INTERVAL_MS)));
			}
			return null;
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			return null;
		} finally {
			waiting--;
			lock.unlock();
		}
	}

	/**
	 * @return true if the pause was cut short by a stop signal, pool shutdown or interrupt
	 */
	private boolean pause(final long delayMs, @Nullable final StopSignal stopSignal) {
		final long deadline = System.nanoTime() + MILLISECONDS.toNanos(delayMs);
		long remainingMs;
		while ((remainingMs = NANOSECONDS.toMillis(deadline - System.nanoTime())) > 0) {
			if (isCancelled(stopSignal) || shutdownSignal.awaitStopMs(Math.min(remainingMs, CANCELLATION_CHECK_INTERVAL_MS))) {
				return true;
			}
		}
		return isCancelled(stopSignal);
	}

	private boolean isCancelled(@Nullable final StopSignal stopSignal) {
		return isShuttingDown() || (stopSignal != null && stopSignal.isStopped()) || Thread.currentThread().isInterrupted();
	}

	private void ensureNotShuttingDown() {
		if (isShuttingDown()) {
			throw new IllegalStateException("Pool has been shutdown");
		}
	}

	private boolean reserveSlot() {
		lock.lock();
		try {
			return tryReserveSlot();
		} finally {
			lock.unlock();
		}
	}

	private boolean tryReserveSlot() {
		if (idle.size() + active.size() + pending < poolConfig.getMaxSize()) {
			pending++;
			return true;
		}
		return false;
	}

	private void releaseSlot() {
		lock.lock();
		try {
			pending--;
		} finally {
			lock.unlock();
		}
	}

	private void addToIdle(@NotNull final PooledConnection<C> created) {
		lock.lock();
		try {
			pending--;
			if (!isShuttingDown()) {
				idle.addLast(created);
				connectionReturned.signal();
				return;
			}
		} finally {
			lock.unlock();
		}
		destroy(created);
	}

	private boolean isAboveMinSize() {
		lock.lock();
		try {
			return idle.size() + active.size() + pending > poolConfig.getMinSize();
		} finally {
			lock.unlock();
		}
	}

	private void destroyFromMaintenance(@NotNull final PooledConnection<C> pooledConnection) {
		releaseSlot();
		destroy(pooledConnection);
	}

	private void returnFromMaintenance(@NotNull final List<PooledConnection<C>> healthy) {
		lock.lock();
		try {
			pending -= healthy.size();
			if (!isShuttingDown()) {
				for (PooledConnection<C> pooledConnection : healthy) {
					pooledConnection.setCurrentPoolStatus(PooledConnection.PoolStatus.IDLE);
					idle.addLast(pooledConnection);
				}
				connectionReturned.signalAll();
				return;
			}
		} finally {
			lock.unlock();
		}
		for (PooledConnection<C> pooledConnection : healthy) {
			destroy(pooledConnection);
		}
	}

	private int countActive() {
		lock.lock();
		try {
			return active.size();
		} finally {
			lock.unlock();
		}
	}

	private boolean isAlive(@NotNull final PooledConnection<C> pooledConnection) {
		try {
			return adapter.isAlive(pooledConnection.rawConnection());
		} catch (RuntimeException e) {
			log.debug("validation of connection {} failed", pooledConnection.getId(), e);
			return false;
		}
	}

	private void destroy(@NotNull final PooledConnection<C> pooledConnection) {
		pooledConnection.setCurrentPoolStatus(PooledConnection.PoolStatus.DESTROYED);
		try {
			adapter.close(pooledConnection.rawConnection());
		} catch (Exception e) {
			log.error("error closing connection {} already removed from the pool, ignoring it from now on...", pooledConnection.getId(), e);
		}
	}

	@Value
	private static class LeakSuspect {
		private final long connectionId;
		@Nullable private final String holder;
		private final long heldMs;
	}

	private class HealthCheckCycle implements Runnable {
		@Override
		public void run() {
			try {
				runHealthCheck();
			} catch (RuntimeException e) {
				// a scheduled task that throws is never run again
				log.error("health check cycle failed, will retry next cycle", e);
			}
		}
	}
}
