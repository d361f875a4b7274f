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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import lombok.Builder;
import lombok.Value;
import lombok.experimental.NonFinal;
import org.bbottema.loadharness.adapter.PayloadGenerator;
import org.bbottema.loadharness.adapter.RandomPayloadGenerator;
import org.bbottema.loadharness.pool.PoolConfig;
import org.bbottema.loadharness.stats.StatsAggregator;
import org.bbottema.loadharness.util.Timeout;
import org.bbottema.loadharness.worker.OperationMode;
import org.bbottema.loadharness.worker.WorkerBackoff;
import org.bbottema.loadharness.worker.WorkerContext;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Everything a {@link LoadTestController} needs to know, as handed over by the driver program. Durations are in milliseconds; zero
 * or negative values fall back to the defaults unless documented otherwise.
 */
@NonFinal@Value
@SuppressFBWarnings(value = "RCN_REDUNDANT_NULLCHECK_OF_NONNULL_VALUE", justification = "Generated code")
public class LoadTestConfig {

	public static final long DEFAULT_IDLE_CHECK_INTERVAL_MS = 30_000;
	public static final long DEFAULT_REPORT_INTERVAL_MS = 10_000;
	public static final long DEFAULT_DRAIN_TIMEOUT_MS = 10_000;

	private final int workerCount;
	/**
	 * Defaults to {@link #workerCount}.
	 */
	private final int minPoolSize;
	/**
	 * Defaults to {@link #workerCount}, or {@link #minPoolSize} when that's bigger.
	 */
	private final int maxPoolSize;
	/**
	 * Zero means connections live forever.
	 */
	private final long maxLifetimeMs;
	/**
	 * Zero means idle connections are never closed for being idle.
	 */
	private final long idleTimeoutMs;
	/**
	 * Zero disables leak detection.
	 */
	private final long leakDetectionThresholdMs;
	private final long idleCheckIntervalMs;
	@NotNull private final Timeout acquireTimeout;
	/**
	 * Length of the measurement phase. Zero runs until {@link LoadTestController#requestStop()}.
	 */
	private final long durationMs;
	/**
	 * Load runs during the warm-up too, but its statistics are thrown away when it ends. Zero means no warm-up.
	 */
	private final long warmUpDurationMs;
	/**
	 * Window over which workers are started one by one at a linear pace. Zero starts them all at once.
	 */
	private final long rampUpDurationMs;
	/**
	 * Transactions per second over all workers together. Zero means unlimited.
	 */
	private final double targetTps;
	@NotNull private final OperationMode mode;
	@NotNull private final PayloadGenerator payloadGenerator;
	private final long reportIntervalMs;
	private final long subSecondWindowMs;
	private final int subSecondBucketCount;
	private final int latencySampleCapacity;
	/**
	 * How long workers get to finish their current transaction after the stop signal, before they are interrupted.
	 */
	private final long drainTimeoutMs;
	private final long workerBackoffFloorMs;
	private final long workerBackoffCeilingMs;
	private final long firstFailureDelayMs;
	private final long errorLogIntervalMs;
	/**
	 * Records written per insert transaction, in insert-only mode and for the inserts of mixed mode. Defaults to 1.
	 */
	private final int batchSize;

	@Builder
	@SuppressWarnings("unused")
	private LoadTestConfig(int workerCount, int minPoolSize, int maxPoolSize,
			long maxLifetimeMs, long idleTimeoutMs, long leakDetectionThresholdMs, long idleCheckIntervalMs,
			@Nullable Timeout acquireTimeout,
			long durationMs, long warmUpDurationMs, long rampUpDurationMs, double targetTps,
			@Nullable OperationMode mode,
			@Nullable PayloadGenerator payloadGenerator,
			long reportIntervalMs, long subSecondWindowMs, int subSecondBucketCount, int latencySampleCapacity,
			long drainTimeoutMs, long workerBackoffFloorMs, long workerBackoffCeilingMs, long firstFailureDelayMs,
			long errorLogIntervalMs, int batchSize) {
		if (workerCount < 1) {
			throw new IllegalArgumentException("At least one worker is needed");
		}
		if (minPoolSize < 0 || maxPoolSize < 0) {
			throw new IllegalArgumentException("Pool sizes cannot be negative");
		}
		if (maxLifetimeMs < 0 || idleTimeoutMs < 0 || leakDetectionThresholdMs < 0) {
			throw new IllegalArgumentException("Max lifetime, idle timeout and leak detection threshold cannot be negative");
		}
		if (batchSize < 0) {
			throw new IllegalArgumentException("Batch size cannot be negative");
		}
		if (durationMs < 0 || warmUpDurationMs < 0 || rampUpDurationMs < 0 || targetTps < 0) {
			throw new IllegalArgumentException("Durations and target TPS cannot be negative");
		}
		this.workerCount = workerCount;
		this.minPoolSize = minPoolSize > 0 ? minPoolSize : workerCount;
		this.maxPoolSize = maxPoolSize > 0 ? maxPoolSize : Math.max(workerCount, this.minPoolSize);
		this.maxLifetimeMs = maxLifetimeMs;
		this.idleTimeoutMs = idleTimeoutMs;
		this.leakDetectionThresholdMs = leakDetectionThresholdMs;
		this.idleCheckIntervalMs = idleCheckIntervalMs > 0 ? idleCheckIntervalMs : DEFAULT_IDLE_CHECK_INTERVAL_MS;
		this.acquireTimeout = acquireTimeout != null ? acquireTimeout : PoolConfig.DEFAULT_ACQUIRE_TIMEOUT;
		this.durationMs = durationMs;
		this.warmUpDurationMs = warmUpDurationMs;
		this.rampUpDurationMs = rampUpDurationMs;
		this.targetTps = targetTps;
		this.mode = mode != null ? mode : OperationMode.FULL;
		this.payloadGenerator = payloadGenerator != null ? payloadGenerator : new RandomPayloadGenerator();
		this.reportIntervalMs = reportIntervalMs > 0 ? reportIntervalMs : DEFAULT_REPORT_INTERVAL_MS;
		this.subSecondWindowMs = subSecondWindowMs > 0 ? subSecondWindowMs : StatsAggregator.DEFAULT_BUCKET_MS;
		this.subSecondBucketCount = subSecondBucketCount > 0 ? subSecondBucketCount : StatsAggregator.DEFAULT_BUCKET_COUNT;
		this.latencySampleCapacity = latencySampleCapacity > 0 ? latencySampleCapacity : StatsAggregator.DEFAULT_LATENCY_SAMPLE_CAPACITY;
		this.drainTimeoutMs = drainTimeoutMs > 0 ? drainTimeoutMs : DEFAULT_DRAIN_TIMEOUT_MS;
		this.workerBackoffFloorMs = workerBackoffFloorMs > 0 ? workerBackoffFloorMs : WorkerBackoff.DEFAULT_FLOOR_MS;
		this.workerBackoffCeilingMs = workerBackoffCeilingMs > 0 ? workerBackoffCeilingMs : WorkerBackoff.DEFAULT_CEILING_MS;
		this.firstFailureDelayMs = firstFailureDelayMs > 0 ? firstFailureDelayMs : WorkerBackoff.DEFAULT_FIRST_FAILURE_DELAY_MS;
		this.errorLogIntervalMs = errorLogIntervalMs > 0 ? errorLogIntervalMs : WorkerContext.DEFAULT_ERROR_LOG_INTERVAL_MS;
		this.batchSize = batchSize > 0 ? batchSize : 1;

		if (this.minPoolSize > this.maxPoolSize) {
			throw new IllegalArgumentException("Pool min size cannot be bigger than the pool's max size");
		}
		if (this.workerBackoffCeilingMs < this.workerBackoffFloorMs) {
			throw new IllegalArgumentException("Worker backoff ceiling cannot be lower than its floor");
		}
	}
}
