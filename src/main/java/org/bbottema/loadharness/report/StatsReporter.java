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
package org.bbottema.loadharness.report;

import lombok.extern.slf4j.Slf4j;
import org.bbottema.loadharness.pool.ConnectionPool;
import org.bbottema.loadharness.pool.PoolMetrics;
import org.bbottema.loadharness.stats.IntervalStats;
import org.bbottema.loadharness.stats.LatencyStats;
import org.bbottema.loadharness.stats.StatsAggregator;
import org.bbottema.loadharness.stats.StatsSnapshot;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;

import static java.lang.String.format;
import static java.util.concurrent.TimeUnit.MILLISECONDS;

/**
 * Takes a statistics snapshot at a fixed interval on its own thread, logs a one line summary, hands it to the registered listeners and
 * keeps it in a time series.
 */
@Slf4j
public class StatsReporter {

	@NotNull private final StatsAggregator stats;
	@NotNull private final ConnectionPool<?> pool;
	private final long intervalMs;
	@NotNull private final ThreadFactory threadFactory;
	@NotNull private final List<StatsListener> listeners = new CopyOnWriteArrayList<>();
	@NotNull private final List<TimeSeriesPoint> timeSeries = new ArrayList<>();

	@Nullable private ScheduledExecutorService scheduler;
	@NotNull private StatsSnapshot previous;

	public StatsReporter(@NotNull StatsAggregator stats, @NotNull ConnectionPool<?> pool, long intervalMs, @NotNull ThreadFactory threadFactory) {
		if (intervalMs < 1) {
			throw new IllegalArgumentException("Report interval should be at least 1ms");
		}
		this.stats = stats;
		this.pool = pool;
		this.intervalMs = intervalMs;
		this.threadFactory = threadFactory;
		this.previous = stats.snapshot();
	}

	public void addListener(@NotNull StatsListener listener) {
		listeners.add(listener);
	}

	public synchronized void start() {
		if (scheduler != null) {
			throw new IllegalStateException("Reporter already started");
		}
		scheduler = Executors.newSingleThreadScheduledExecutor(threadFactory);
		scheduler.scheduleAtFixedRate(new ReportCycle(), intervalMs, intervalMs, MILLISECONDS);
	}

	/**
	 * Stops the periodic reports. The final report is up to the caller, through {@link #report()}.
	 */
	public synchronized void stop() {
		if (scheduler != null) {
			scheduler.shutdownNow();
		}
	}

	/**
	 * Produces one report right away.
	 */
	@NotNull
	public TimeSeriesPoint report() {
		final TimeSeriesPoint point;
		synchronized (this) {
			final StatsSnapshot current = stats.snapshot();
			point = new TimeSeriesPoint(current, IntervalStats.between(previous, current), pool.getPoolMetrics());
			previous = current;
			timeSeries.add(point);
		}
		log.info(describe(point));
		for (StatsListener listener : listeners) {
			try {
				listener.onReport(point);
			} catch (RuntimeException e) {
				log.error("stats listener failed, continuing with the remaining listeners", e);
			}
		}
		return point;
	}

	@NotNull
	public synchronized List<TimeSeriesPoint> getTimeSeries() {
		return new ArrayList<>(timeSeries);
	}

	@NotNull
	static String describe(@NotNull TimeSeriesPoint point) {
		final StatsSnapshot snapshot = point.getSnapshot();
		final IntervalStats interval = point.getInterval();
		final LatencyStats latency = snapshot.getLatency();
		final PoolMetrics poolMetrics = point.getPoolMetrics();
		return format("[%s] txn %d (+%d) | ins %d sel %d upd %d del %d | err %d (+%d) | TPS avg %.1f, interval %.1f, realtime %.1f"
						+ " | latency p50 %.1fms p95 %.1fms p99 %.1fms | pool %d active / %d total",
				point.isWarmUp() ? "WARMUP" : "RUNNING",
				snapshot.getTransactions(), interval.getTransactions(),
				snapshot.getInserts(), snapshot.getSelects(), snapshot.getUpdates(), snapshot.getDeletes(),
				snapshot.getErrors(), interval.getErrors(),
				snapshot.getAverageTps(), interval.getTps(), snapshot.getRealtimeTps(),
				latency.getP50Ms(), latency.getP95Ms(), latency.getP99Ms(),
				poolMetrics.getActive(), poolMetrics.getTotal());
	}

	private class ReportCycle implements Runnable {
		@Override
		public void run() {
			try {
				report();
			} catch (RuntimeException e) {
				// a scheduled task that throws is never run again
				log.error("stats report failed, will retry next interval", e);
			}
		}
	}
}
