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
package org.bbottema.loadharness;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.bbottema.loadharness.adapter.DatabaseAdapter;
import org.bbottema.loadharness.pool.ConnectionPool;
import org.bbottema.loadharness.pool.PoolConfig;
import org.bbottema.loadharness.pool.PoolMetrics;
import org.bbottema.loadharness.pool.expirypolicies.TimeoutSinceCreationExpirationPolicy;
import org.bbottema.loadharness.pool.expirypolicies.TimeoutSinceLastUseExpirationPolicy;
import org.bbottema.loadharness.report.StatsListener;
import org.bbottema.loadharness.report.StatsReporter;
import org.bbottema.loadharness.stats.StatsAggregator;
import org.bbottema.loadharness.stats.StatsSnapshot;
import org.bbottema.loadharness.util.StopSignal;
import org.bbottema.loadharness.worker.RateLimiter;
import org.bbottema.loadharness.worker.Worker;
import org.bbottema.loadharness.worker.WorkerContext;
import org.bbottema.loadharness.worker.WorkerState;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static java.util.concurrent.TimeUnit.MILLISECONDS;

/**
 * Runs one load test: warms up the pool, starts the workers (staggered over the ramp-up window), resets the statistics when the
 * warm-up ends, stops everything when the duration is over or {@link #requestStop()} is called, and drains the workers before closing
 * the pool.
 * <p>
 * A controller runs once.
 *
 * @param <C> the raw connection type of the adapter
 */
@Slf4j
public class LoadTestController<C> {

	/**
	 * Extra time an interrupted worker gets to exit after the drain timeout.
	 */
	private static final long INTERRUPT_GRACE_MS = 1000;

	@NotNull @Getter private final LoadTestConfig config;
	@NotNull private final DatabaseAdapter<C> adapter;
	@NotNull @Getter private final StatsAggregator stats;
	@NotNull private final StopSignal stopSignal = new StopSignal();
	@NotNull private final AtomicBoolean started = new AtomicBoolean();
	@NotNull private final AtomicBoolean stopRequested = new AtomicBoolean();
	@NotNull private final List<StatsListener> listeners = new CopyOnWriteArrayList<>();
	@NotNull private final List<Worker<C>> workers = new CopyOnWriteArrayList<>();

	public LoadTestController(@NotNull LoadTestConfig config, @NotNull DatabaseAdapter<C> adapter) {
		this.config = config;
		this.adapter = adapter;
		this.stats = new StatsAggregator(config.getLatencySampleCapacity(), config.getSubSecondWindowMs(), config.getSubSecondBucketCount());
	}

	/**
	 * Registers a listener for the periodic reports; must happen before {@link #run()}.
	 */
	public void addListener(@NotNull StatsListener listener) {
		listeners.add(listener);
	}

	/**
	 * Ends the test as soon as the workers finished their current transaction. Safe to call from any thread, at any time, e.g. from a
	 * shutdown hook.
	 */
	public void requestStop() {
		if (!stopSignal.isStopped() && stopRequested.compareAndSet(false, true)) {
			log.info("stop requested, ending the load test");
		}
		stopSignal.stop();
	}

	/**
	 * @return the current state of every worker, in start order; workers not yet admitted by the ramp-up are
	 * {@link WorkerState#WAITING_TO_START}. Empty before {@link #run()} created them.
	 */
	@NotNull
	public Map<String, WorkerState> getWorkerStates() {
		final Map<String, WorkerState> states = new LinkedHashMap<>();
		for (Worker<C> worker : workers) {
			states.put(worker.getName(), worker.getState());
		}
		return states;
	}

	public boolean isStopped() {
		return stopSignal.isStopped();
	}

	/**
	 * Runs the test on the calling thread and blocks until it's over.
	 *
	 * @throws LoadTestAbortedException if not a single connection could be made at the start
	 * @throws IllegalStateException    when called a second time
	 */
	@NotNull
	public LoadTestResult run() {
		if (!started.compareAndSet(false, true)) {
			throw new IllegalStateException("A load test controller can only run once");
		}
		final ConnectionPool<C> pool = new ConnectionPool<>(createPoolConfig(), adapter);
		final int created = warmUpPool(pool);

		final StatsReporter reporter = new StatsReporter(stats, pool, config.getReportIntervalMs(), daemonThreads("stats-reporter"));
		listeners.forEach(reporter::addListener);
		final ScheduledExecutorService phaseTimer = Executors.newSingleThreadScheduledExecutor(daemonThreads("load-test-timer"));
		final List<Thread> threads = new ArrayList<>();
		try {
			createWorkers(pool);
			schedulePhases(phaseTimer);
			reporter.start();
			startWorkers(threads);
			final boolean interrupted = awaitStop();
			drain(threads);
			if (interrupted) {
				Thread.currentThread().interrupt();
			}
		} finally {
			stopSignal.stop();
			phaseTimer.shutdownNow();
			reporter.stop();
		}

		reporter.report();
		final PoolMetrics poolMetrics = pool.shutdown();
		final StatsSnapshot finalStats = stats.snapshot();
		logSummary(finalStats, poolMetrics);

		final Map<String, Long> workerTransactions = new LinkedHashMap<>();
		for (Worker<C> worker : workers) {
			if (worker.getState() != WorkerState.WAITING_TO_START) {
				workerTransactions.put(worker.getName(), worker.getTransactionCount());
			}
		}
		return new LoadTestResult(finalStats, poolMetrics, created, config.getMinPoolSize(), workerTransactions, getWorkerStates(),
				reporter.getTimeSeries(), stopRequested.get());
	}

	@NotNull
	private PoolConfig<C> createPoolConfig() {
		return PoolConfig.<C>builder()
				.minSize(config.getMinPoolSize())
				.maxSize(config.getMaxPoolSize())
				.expirationPolicy(config.getMaxLifetimeMs() > 0
						? new TimeoutSinceCreationExpirationPolicy<C>(config.getMaxLifetimeMs(), MILLISECONDS)
						: null)
				.idleExpirationPolicy(config.getIdleTimeoutMs() > 0
						? new TimeoutSinceLastUseExpirationPolicy<C>(config.getIdleTimeoutMs(), MILLISECONDS)
						: null)
				.leakDetectionThresholdMs(config.getLeakDetectionThresholdMs())
				.healthCheckIntervalMs(config.getIdleCheckIntervalMs())
				.acquireTimeout(config.getAcquireTimeout())
				.threadFactory(daemonThreads("pool-health-check"))
				.build();
	}

	/**
	 * A pool that came up short is fine; one that couldn't open anything at all gets one more try before the test is called off.
	 */
	private int warmUpPool(@NotNull ConnectionPool<C> pool) {
		final int requested = config.getMinPoolSize();
		final int created = pool.warmUp();
		if (created == 0 && requested > 0) {
			log.warn("warm-up could not create any of the {} connections, trying once more", requested);
			if (pool.warmUp(1) == 0) {
				pool.shutdown();
				throw new LoadTestAbortedException("Could not open a single connection to the backend, aborting the load test", null);
			}
			return 1;
		}
		return created;
	}

	private void schedulePhases(@NotNull ScheduledExecutorService phaseTimer) {
		final long warmUpMs = config.getWarmUpDurationMs();
		if (warmUpMs > 0) {
			log.info("warm-up phase of {}ms started", warmUpMs);
			phaseTimer.schedule(stats::resetForMeasurement, warmUpMs, MILLISECONDS);
		} else {
			stats.resetForMeasurement();
		}
		if (config.getDurationMs() > 0) {
			phaseTimer.schedule(this::endOfTest, warmUpMs + config.getDurationMs(), MILLISECONDS);
		}
	}

	private void endOfTest() {
		log.info("test duration reached");
		stopSignal.stop();
	}

	private void createWorkers(@NotNull ConnectionPool<C> pool) {
		final WorkerContext<C> context = WorkerContext.<C>builder()
				.pool(pool)
				.stats(stats)
				.rateLimiter(new RateLimiter(config.getTargetTps()))
				.payloadGenerator(config.getPayloadGenerator())
				.mode(config.getMode())
				.stopSignal(stopSignal)
				.backoffFloorMs(config.getWorkerBackoffFloorMs())
				.backoffCeilingMs(config.getWorkerBackoffCeilingMs())
				.firstFailureDelayMs(config.getFirstFailureDelayMs())
				.errorLogIntervalMs(config.getErrorLogIntervalMs())
				.batchSize(config.getBatchSize())
				.build();
		for (int i = 0; i < config.getWorkerCount(); i++) {
			workers.add(new Worker<>(Worker.nameFor(i), context));
		}
	}

	/**
	 * Admits the workers at a linear pace over the ramp-up window. Workers not admitted before the stop signal never start.
	 */
	private void startWorkers(@NotNull List<Thread> threads) {
		final int count = config.getWorkerCount();
		final long rampUpMs = config.getRampUpDurationMs();
		final long startMs = System.currentTimeMillis();
		log.info("starting {} workers in {} mode{}", count, config.getMode().getLabel(),
				rampUpMs > 0 ? " over " + rampUpMs + "ms" : "");
		for (int i = 0; i < count; i++) {
			final long admitAtMs = startMs + rampUpMs * i / count;
			final long delayMs = admitAtMs - System.currentTimeMillis();
			if (delayMs > 0 && stopSignal.awaitStopMs(delayMs) || stopSignal.isStopped()) {
				log.info("stop signal during ramp-up, {} of {} workers were started", i, count);
				return;
			}
			final Worker<C> worker = workers.get(i);
			final Thread thread = new Thread(worker, worker.getName());
			thread.setDaemon(true);
			threads.add(thread);
			thread.start();
		}
	}

	/**
	 * An interrupt of the controller thread counts as a stop request. The interrupt flag is cleared so the workers still get their
	 * drain time.
	 *
	 * @return whether the controller thread was interrupted
	 */
	private boolean awaitStop() {
		while (!stopSignal.isStopped()) {
			if (stopSignal.awaitStop(1, TimeUnit.HOURS) && Thread.interrupted()) {
				requestStop();
				return true;
			}
		}
		return false;
	}

	/**
	 * Gives the workers {@code drainTimeout} to finish their current transaction, then interrupts the ones still busy.
	 */
	private void drain(@NotNull List<Thread> threads) {
		final long deadline = System.currentTimeMillis() + config.getDrainTimeoutMs();
		boolean interrupted = false;
		for (Thread thread : threads) {
			try {
				thread.join(Math.max(1, deadline - System.currentTimeMillis()));
			} catch (InterruptedException e) {
				interrupted = true;
				break;
			}
		}
		final List<Thread> stragglers = new ArrayList<>();
		for (Thread thread : threads) {
			if (thread.isAlive()) {
				thread.interrupt();
				stragglers.add(thread);
			}
		}
		if (!stragglers.isEmpty()) {
			log.warn("{} workers did not finish within {}ms, interrupted them", stragglers.size(), config.getDrainTimeoutMs());
			for (Thread thread : stragglers) {
				try {
					thread.join(INTERRUPT_GRACE_MS);
				} catch (InterruptedException e) {
					interrupted = true;
					break;
				}
			}
		}
		if (interrupted) {
			Thread.currentThread().interrupt();
		}
	}

	private static void logSummary(@NotNull StatsSnapshot finalStats, @NotNull PoolMetrics poolMetrics) {
		log.info("load test finished: {} transactions in {}ms ({} TPS), {} errors, {} verification failures, {} connection recreates",
				finalStats.getTransactions(), finalStats.getElapsedMs(), String.format("%.1f", finalStats.getAverageTps()),
				finalStats.getErrors(), finalStats.getVerificationFailures(), finalStats.getConnectionRecreates());
		log.info("latency avg {}ms, p50 {}ms, p95 {}ms, p99 {}ms; pool created {} connections, recycled {}, removed {}, {} leak warnings",
				String.format("%.1f", finalStats.getLatency().getAverageMs()), String.format("%.1f", finalStats.getLatency().getP50Ms()),
				String.format("%.1f", finalStats.getLatency().getP95Ms()), String.format("%.1f", finalStats.getLatency().getP99Ms()),
				poolMetrics.getTotalCreated(), poolMetrics.getTotalRecycled(), poolMetrics.getTotalRemoved(), poolMetrics.getLeakWarnings());
	}

	@NotNull
	private static ThreadFactory daemonThreads(@NotNull String name) {
		return runnable -> {
			final Thread thread = new Thread(runnable, name);
			thread.setDaemon(true);
			return thread;
		};
	}
}
