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
package org.bbottema.loadharness.stats;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.bbottema.loadharness.adapter.OperationKind;
import org.jetbrains.annotations.NotNull;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.LongSupplier;

/**
 * Thread-safe statistics shared by all workers.
 * <p>
 * Counters are {@link LongAdder}s grouped with the latency samples in one {@link Counters} generation. Resetting at the warm-up
 * boundary swaps in a fresh generation with a single atomic reference update, so no reader ever sees half of the counters zeroed. A
 * transaction racing with the swap lands entirely in the discarded generation, i.e. it's counted as warm-up.
 */
@Slf4j
public class StatsAggregator {

	public static final int DEFAULT_LATENCY_SAMPLE_CAPACITY = 10_000;
	public static final long DEFAULT_BUCKET_MS = 100;
	public static final int DEFAULT_BUCKET_COUNT = 10;

	@NotNull private final LongSupplier clockMs;
	@NotNull private final AtomicReference<Counters> counters;
	@NotNull private final AtomicBoolean measurementStarted = new AtomicBoolean();
	private final int latencySampleCapacity;
	@NotNull private final RollingWindowCounter rollingWindow;
	@Getter private final long startedAtMs;

	public StatsAggregator() {
		this(DEFAULT_LATENCY_SAMPLE_CAPACITY, DEFAULT_BUCKET_MS, DEFAULT_BUCKET_COUNT);
	}

	public StatsAggregator(int latencySampleCapacity, long bucketMs, int bucketCount) {
		this(latencySampleCapacity, bucketMs, bucketCount, System::currentTimeMillis);
	}

	StatsAggregator(int latencySampleCapacity, long bucketMs, int bucketCount, @NotNull LongSupplier clockMs) {
		this.clockMs = clockMs;
		this.startedAtMs = clockMs.getAsLong();
		this.latencySampleCapacity = latencySampleCapacity;
		this.counters = new AtomicReference<>(new Counters(startedAtMs, latencySampleCapacity));
		this.rollingWindow = new RollingWindowCounter(bucketMs, bucketCount, startedAtMs);
	}

	/**
	 * Records one successful transaction consisting of a single statement.
	 */
	public void recordTransaction(@NotNull OperationKind kind, long latencyNanos) {
		recordTransaction(kind, 1, latencyNanos);
	}

	/**
	 * Records one successful transaction of {@code statements} statements of the same kind, e.g. a batch insert.
	 */
	public void recordTransaction(@NotNull OperationKind kind, int statements, long latencyNanos) {
		final Counters current = counters.get();
		current.operations.get(kind).add(statements);
		completeTransaction(current, latencyNanos);
	}

	/**
	 * Records one successful transaction made up of several statements, e.g. insert followed by select-back.
	 */
	public void recordTransaction(@NotNull List<OperationKind> kinds, long latencyNanos) {
		final Counters current = counters.get();
		for (OperationKind kind : kinds) {
			current.operations.get(kind).increment();
		}
		completeTransaction(current, latencyNanos);
	}

	private void completeTransaction(@NotNull Counters current, long latencyNanos) {
		current.transactions.increment();
		current.latency.record(latencyNanos);
		rollingWindow.record(clockMs.getAsLong());
	}

	/**
	 * Counts statements that did complete as part of a transaction that didn't, without counting a transaction or a latency sample.
	 */
	public void recordOperation(@NotNull OperationKind kind) {
		counters.get().operations.get(kind).increment();
	}

	public void recordError() {
		counters.get().errors.increment();
	}

	public void recordVerificationFailure() {
		counters.get().verificationFailures.increment();
	}

	public void recordConnectionRecreate() {
		counters.get().connectionRecreates.increment();
	}

	/**
	 * Zeroes the lifetime counters and latency samples at the end of the warm-up. Only the first call has any effect; the rolling
	 * window is left alone.
	 *
	 * @return whether this call did the reset
	 */
	public boolean resetForMeasurement() {
		if (!measurementStarted.compareAndSet(false, true)) {
			return false;
		}
		counters.set(new Counters(clockMs.getAsLong(), latencySampleCapacity));
		log.info("warm-up finished, statistics reset for the measurement phase");
		return true;
	}

	public boolean isMeasurementPhase() {
		return measurementStarted.get();
	}

	/**
	 * Throughput over the most recent {@code windowMs}, at most the rolling window's horizon.
	 */
	public double windowedTps(long windowMs) {
		return rollingWindow.ratePerSecond(windowMs, clockMs.getAsLong());
	}

	@NotNull
	public StatsSnapshot snapshot() {
		final long nowMs = clockMs.getAsLong();
		final Counters current = counters.get();
		final long elapsedMs = Math.max(0, nowMs - current.sinceMs);
		final long transactions = current.transactions.sum();
		return new StatsSnapshot(
				nowMs,
				elapsedMs,
				measurementStarted.get(),
				transactions,
				current.operations.get(OperationKind.INSERT).sum(),
				current.operations.get(OperationKind.SELECT).sum(),
				current.operations.get(OperationKind.UPDATE).sum(),
				current.operations.get(OperationKind.DELETE).sum(),
				current.errors.sum(),
				current.verificationFailures.sum(),
				current.connectionRecreates.sum(),
				elapsedMs > 0 ? transactions * 1000.0 / elapsedMs : 0,
				rollingWindow.ratePerSecond(nowMs),
				current.latency.computeStats());
	}

	private static final class Counters {
		private final long sinceMs;
		private final LongAdder transactions = new LongAdder();
		private final LongAdder errors = new LongAdder();
		private final LongAdder verificationFailures = new LongAdder();
		private final LongAdder connectionRecreates = new LongAdder();
		private final Map<OperationKind, LongAdder> operations = new EnumMap<>(OperationKind.class);
		private final LatencyRecorder latency;

		private Counters(long sinceMs, int latencySampleCapacity) {
			this.sinceMs = sinceMs;
			this.latency = new LatencyRecorder(latencySampleCapacity);
			for (OperationKind kind : OperationKind.values()) {
				operations.put(kind, new LongAdder());
			}
		}
	}
}
