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

import org.bbottema.loadharness.adapter.SimulatedDatabaseAdapter;
import org.bbottema.loadharness.adapter.SimulatedDatabaseAdapter.SimulatedConnection;
import org.bbottema.loadharness.pool.expirypolicies.TimeoutSinceCreationExpirationPolicy;
import org.bbottema.loadharness.pool.expirypolicies.TimeoutSinceLastUseExpirationPolicy;
import org.bbottema.loadharness.util.StopSignal;
import org.bbottema.loadharness.util.Timeout;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ConnectionPoolTest {

	private SimulatedDatabaseAdapter adapter;
	private ConnectionPool<SimulatedConnection> pool;

	@Before
	public void setup() {
		adapter = new SimulatedDatabaseAdapter();
	}

	@After
	public void tearDown() {
		if (pool != null) {
			pool.shutdown();
		}
	}

	private ConnectionPool<SimulatedConnection> createPool(PoolConfig.PoolConfigBuilder<SimulatedConnection> builder) {
		pool = new ConnectionPool<>(builder.build(), adapter);
		return pool;
	}

	private static PoolConfig.PoolConfigBuilder<SimulatedConnection> config(int minSize, int maxSize) {
		return PoolConfig.<SimulatedConnection>builder()
				.minSize(minSize)
				.maxSize(maxSize)
				.creationBackoffFloorMs(1)
				.creationBackoffCeilingMs(5)
				.acquireBackoffFloorMs(1)
				.acquireBackoffCeilingMs(5)
				.acquireTimeout(Timeout.ofMillis(50));
	}

	@Test
	public void testWarmUpFillsIdleSet() {
		createPool(config(5, 10));

		assertThat(pool.warmUp()).isEqualTo(5);

		final PoolMetrics metrics = pool.getPoolMetrics();
		assertThat(metrics.getIdle()).isEqualTo(5);
		assertThat(metrics.getActive()).isZero();
		assertThat(metrics.getTotalCreated()).isEqualTo(5);
		assertThat(adapter.getOpenConnections()).isEqualTo(5);
	}

	@Test
	public void testWarmUpSkipsConnectionsThatCannotBeCreated() {
		createPool(config(3, 3));
		adapter.setFailOpens(true);

		assertThat(pool.warmUp()).isZero();
		assertThat(adapter.getOpenFailures().get()).isEqualTo(3 * PoolConfig.DEFAULT_CREATION_ATTEMPTS);
		assertThat(pool.getPoolMetrics().getTotal()).isZero();
		assertThat(pool.getPoolMetrics().getPending()).isZero();
	}

	@Test
	public void testAcquirePrefersIdleConnection() throws Exception {
		createPool(config(1, 2));
		pool.warmUp();

		final PooledConnection<SimulatedConnection> connection = pool.acquire();

		assertThat(connection.isCheckedOut()).isTrue();
		assertThat(connection.getHolder()).isEqualTo(Thread.currentThread().getName());
		assertThat(pool.getPoolMetrics().getTotalCreated()).isEqualTo(1);
		assertThat(pool.getPoolMetrics().getActive()).isEqualTo(1);
		assertThat(pool.getPoolMetrics().getIdle()).isZero();
	}

	@Test
	public void testAcquireGrowsPoolLazily() throws Exception {
		createPool(config(0, 3));

		final PooledConnection<SimulatedConnection> first = pool.acquire();
		final PooledConnection<SimulatedConnection> second = pool.acquire();

		assertThat(first.getId()).isNotEqualTo(second.getId());
		assertThat(pool.getPoolMetrics().getActive()).isEqualTo(2);
		assertThat(pool.getPoolMetrics().getTotalCreated()).isEqualTo(2);
	}

	@Test
	public void testAcquireAtCapacityFailsWithPoolExhausted() throws Exception {
		createPool(config(0, 1));
		pool.acquire();

		assertThatThrownBy(() -> pool.acquire())
				.isInstanceOfSatisfying(PoolExhaustedException.class, e -> {
					assertThat(e.getAttempts()).isEqualTo(PoolConfig.DEFAULT_ACQUIRE_ATTEMPTS);
					assertThat(e.getMaxSize()).isEqualTo(1);
					assertThat(e.getActiveConnections()).isEqualTo(1);
					assertThat(e.getCause()).isNull();
				});
	}

	@Test
	public void testAcquireCarriesCreationFailure() {
		createPool(config(0, 1));
		adapter.setFailOpens(true);

		assertThatThrownBy(() -> pool.acquire())
				.isInstanceOf(PoolExhaustedException.class)
				.hasCauseInstanceOf(ConnectionCreationFailedException.class);
		assertThat(pool.getPoolMetrics().getTotal()).isZero();
		assertThat(pool.getPoolMetrics().getPending()).isZero();
	}

	@Test
	public void testWaitingAcquireGetsReleasedConnection() throws Exception {
		createPool(config(0, 1).acquireTimeout(Timeout.ofMillis(2000)));
		final PooledConnection<SimulatedConnection> held = pool.acquire();
		final ExecutorService executor = Executors.newSingleThreadExecutor();
		try {
			final Future<PooledConnection<SimulatedConnection>> waiter = executor.submit(() -> pool.acquire());
			Thread.sleep(100);
			held.release();

			assertThat(waiter.get(2, TimeUnit.SECONDS).getId()).isEqualTo(held.getId());
		} finally {
			executor.shutdownNow();
		}
	}

	@Test
	public void testDoubleReleaseIsRejected() throws Exception {
		createPool(config(0, 2));
		final PooledConnection<SimulatedConnection> connection = pool.acquire();
		connection.release();

		assertThatThrownBy(connection::release).isInstanceOf(IllegalStateException.class);

		final PoolMetrics metrics = pool.getPoolMetrics();
		assertThat(metrics.getIdle()).isEqualTo(1);
		assertThat(metrics.getActive()).isZero();
		assertThat(connection.getUseCount()).isEqualTo(1);
		assertThat(pool.acquire().getId()).isEqualTo(connection.getId());
	}

	@Test
	public void testReleaseOfForeignConnectionIsRejected() throws Exception {
		final ConnectionPool<SimulatedConnection> other = new ConnectionPool<>(config(0, 1).build(), adapter);
		try {
			createPool(config(0, 1));
			final PooledConnection<SimulatedConnection> foreign = other.acquire();

			assertThatThrownBy(() -> pool.release(foreign)).isInstanceOf(IllegalStateException.class);
			assertThat(pool.getPoolMetrics().getTotal()).isZero();
		} finally {
			other.shutdown();
		}
	}

	@Test
	public void testInvalidateFreesSlot() throws Exception {
		createPool(config(0, 1));
		final PooledConnection<SimulatedConnection> connection = pool.acquire();
		final SimulatedConnection raw = connection.getConnection();

		connection.invalidate();

		assertThat(raw.isClosed()).isTrue();
		assertThatThrownBy(connection::getConnection).isInstanceOf(IllegalStateException.class);
		assertThat(pool.getPoolMetrics().getTotalInvalidated()).isEqualTo(1);
		assertThat(pool.acquire().getId()).isNotEqualTo(connection.getId());
	}

	@Test
	public void testSizeNeverExceedsMaximumUnderConcurrentUse() throws Exception {
		final int maxSize = 5;
		createPool(config(0, maxSize).acquireTimeout(Timeout.ofMillis(20)));
		final int threadCount = 20;
		final AtomicBoolean violated = new AtomicBoolean();
		final AtomicReference<Throwable> unexpected = new AtomicReference<>();
		final CountDownLatch done = new CountDownLatch(threadCount);
		final ExecutorService executor = Executors.newFixedThreadPool(threadCount);
		try {
			for (int i = 0; i < threadCount; i++) {
				executor.submit(() -> {
					try {
						for (int round = 0; round < 100; round++) {
							try {
								final PooledConnection<SimulatedConnection> connection = pool.acquire();
								if (pool.getPoolMetrics().getTotal() > maxSize) {
									violated.set(true);
								}
								Thread.sleep(ThreadLocalRandom.current().nextInt(3));
								if (ThreadLocalRandom.current().nextInt(10) == 0) {
									connection.invalidate();
								} else {
									connection.release();
								}
							} catch (PoolExhaustedException e) {
								// expected once in a while with more threads than connections
							}
						}
					} catch (Throwable t) {
						unexpected.set(t);
					} finally {
						done.countDown();
					}
				});
			}
			while (!done.await(1, MILLISECONDS)) {
				final PoolMetrics metrics = pool.getPoolMetrics();
				if (metrics.getTotal() + metrics.getPending() > maxSize) {
					violated.set(true);
				}
			}
		} finally {
			executor.shutdownNow();
		}

		assertThat(unexpected.get()).isNull();
		assertThat(violated.get()).isFalse();
		final PoolMetrics metrics = pool.getPoolMetrics();
		assertThat(metrics.getActive()).isZero();
		assertThat(metrics.getTotal()).isLessThanOrEqualTo(maxSize);
		assertThat(adapter.getOpenConnections()).isEqualTo(metrics.getIdle());
	}

	@Test
	public void testHealthCheckRecyclesConnectionsPastMaxLifetime() throws Exception {
		createPool(config(2, 2).expirationPolicy(new TimeoutSinceCreationExpirationPolicy<>(50, MILLISECONDS)));
		pool.warmUp();
		Thread.sleep(80);

		final HealthCheckReport report = pool.runHealthCheck();

		assertThat(report.getChecked()).isEqualTo(2);
		assertThat(report.getRecycled()).isEqualTo(2);
		assertThat(pool.getPoolMetrics().getTotal()).isZero();
		assertThat(pool.getPoolMetrics().getTotalRecycled()).isEqualTo(2);
		assertThat(adapter.getOpenConnections()).isZero();
	}

	@Test
	public void testReleaseRetiresConnectionPastMaxLifetime() throws Exception {
		createPool(config(0, 1).expirationPolicy(new TimeoutSinceCreationExpirationPolicy<>(50, MILLISECONDS)));
		final PooledConnection<SimulatedConnection> connection = pool.acquire();
		final SimulatedConnection raw = connection.getConnection();
		Thread.sleep(80);

		connection.release();

		assertThat(raw.isClosed()).isTrue();
		assertThat(pool.getPoolMetrics().getTotal()).isZero();
		assertThat(pool.getPoolMetrics().getTotalRecycled()).isEqualTo(1);
	}

	@Test
	public void testIdleTimeoutKeepsMinimumSize() throws Exception {
		createPool(config(1, 3).idleExpirationPolicy(new TimeoutSinceLastUseExpirationPolicy<>(50, MILLISECONDS)));
		final List<PooledConnection<SimulatedConnection>> connections = new ArrayList<>();
		for (int i = 0; i < 3; i++) {
			connections.add(pool.acquire());
		}
		connections.forEach(PooledConnection::release);
		Thread.sleep(80);

		final HealthCheckReport report = pool.runHealthCheck();

		assertThat(report.getRemoved()).isEqualTo(2);
		assertThat(pool.getPoolMetrics().getIdle()).isEqualTo(1);
	}

	@Test
	public void testHealthCheckRemovesDeadConnections() {
		createPool(config(3, 3));
		pool.warmUp();
		adapter.setReportDead(true);

		final HealthCheckReport report = pool.runHealthCheck();

		assertThat(report.getRemoved()).isEqualTo(3);
		assertThat(pool.getPoolMetrics().getTotal()).isZero();
		assertThat(pool.getPoolMetrics().getTotalRemoved()).isEqualTo(3);
	}

	@Test
	public void testHealthCheckKeepsHealthyConnections() {
		createPool(config(3, 3));
		pool.warmUp();

		final HealthCheckReport report = pool.runHealthCheck();

		assertThat(report.getChecked()).isEqualTo(3);
		assertThat(report.getRemoved()).isZero();
		assertThat(pool.getPoolMetrics().getIdle()).isEqualTo(3);
		assertThat(pool.getPoolMetrics().getPending()).isZero();
	}

	@Test
	public void testLeakWarningRepeatsEveryCycleWithoutTouchingTheConnection() throws Exception {
		createPool(config(0, 2).leakDetectionThresholdMs(30));
		final PooledConnection<SimulatedConnection> leaked = pool.acquire();
		final PooledConnection<SimulatedConnection> returnedInTime = pool.acquire();
		returnedInTime.release();

		assertThat(pool.runHealthCheck().getLeaks()).isZero();
		Thread.sleep(60);

		assertThat(pool.runHealthCheck().getLeaks()).isEqualTo(1);
		assertThat(pool.runHealthCheck().getLeaks()).isEqualTo(1);
		assertThat(pool.getPoolMetrics().getLeakWarnings()).isEqualTo(2);

		assertThat(leaked.isCheckedOut()).isTrue();
		assertThat(leaked.getConnection().isClosed()).isFalse();
		leaked.release();
		assertThat(pool.runHealthCheck().getLeaks()).isZero();
		assertThat(pool.getPoolMetrics().getLeakWarnings()).isEqualTo(2);
	}

	@Test
	public void testBackgroundHealthCheckRuns() throws Exception {
		createPool(config(2, 2).healthCheckIntervalMs(20));
		pool.warmUp();
		adapter.setReportDead(true);

		final long deadline = System.currentTimeMillis() + 2000;
		while (pool.getPoolMetrics().getTotalRemoved() < 2 && System.currentTimeMillis() < deadline) {
			Thread.sleep(10);
		}
		assertThat(pool.getPoolMetrics().getTotalRemoved()).isEqualTo(2);
	}

	@Test
	public void testShutdownClosesEverything() throws Exception {
		createPool(config(2, 3));
		pool.warmUp();
		final PooledConnection<SimulatedConnection> inUse = pool.acquire();
		pool.acquire();
		pool.acquire();

		final PoolMetrics metrics = pool.shutdown();

		assertThat(metrics.getTotal()).isZero();
		assertThat(adapter.getOpenConnections()).isZero();
		assertThat(pool.isShuttingDown()).isTrue();
		assertThatThrownBy(inUse::getConnection).isInstanceOf(IllegalStateException.class);
		assertThatThrownBy(() -> pool.acquire()).isInstanceOf(IllegalStateException.class);
		// handing back after shutdown is harmless
		inUse.release();
		assertThat(pool.shutdown().getTotal()).isZero();
	}

	@Test
	public void testStopSignalCutsAcquireWaitShort() throws Exception {
		createPool(config(0, 1).acquireTimeout(Timeout.ofMillis(10_000)));
		pool.acquire();
		final StopSignal stopSignal = new StopSignal();
		final ExecutorService executor = Executors.newSingleThreadExecutor();
		try {
			final Future<?> waiter = executor.submit(() -> {
				assertThatThrownBy(() -> pool.acquire(Timeout.ofMillis(10_000), stopSignal)).isInstanceOf(PoolExhaustedException.class);
				return null;
			});
			Thread.sleep(100);
			final long stoppedAt = System.nanoTime();
			stopSignal.stop();

			waiter.get(2, TimeUnit.SECONDS);
			assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - stoppedAt)).isLessThan(1000);
		} finally {
			executor.shutdownNow();
		}
	}

	@Test
	public void testShutdownWakesWaitingAcquire() throws Exception {
		createPool(config(0, 1).acquireTimeout(Timeout.ofMillis(10_000)));
		pool.acquire();
		final ExecutorService executor = Executors.newSingleThreadExecutor();
		try {
			final Future<?> waiter = executor.submit(() -> {
				assertThatThrownBy(() -> pool.acquire()).isInstanceOf(IllegalStateException.class);
				return null;
			});
			Thread.sleep(100);
			pool.shutdown();

			waiter.get(2, TimeUnit.SECONDS);
		} finally {
			executor.shutdownNow();
		}
	}

	@Test
	public void testCreationRetriesBeforeGivingUp() {
		createPool(config(0, 1).creationAttempts(4));
		adapter.setFailOpens(true);

		assertThatThrownBy(() -> pool.createConnection())
				.isInstanceOfSatisfying(ConnectionCreationFailedException.class, e -> assertThat(e.getAttempts()).isEqualTo(4))
				.hasRootCauseMessage("simulated backend unavailable");
		assertThat(adapter.getOpenFailures().get()).isEqualTo(4);
	}
}
