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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import lombok.Builder;
import lombok.Value;
import org.bbottema.loadharness.adapter.PayloadGenerator;
import org.bbottema.loadharness.adapter.RandomPayloadGenerator;
import org.bbottema.loadharness.pool.ConnectionPool;
import org.bbottema.loadharness.stats.StatsAggregator;
import org.bbottema.loadharness.util.StopSignal;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Everything the workers of one load test share.
 */
@Value
@SuppressFBWarnings(value = "RCN_REDUNDANT_NULLCHECK_OF_NONNULL_VALUE", justification = "Generated code")
public class WorkerContext<C> {

	public static final long DEFAULT_ERROR_LOG_INTERVAL_MS = 10_000;

	@NotNull private final ConnectionPool<C> pool;
	@NotNull private final StatsAggregator stats;
	@NotNull private final RateLimiter rateLimiter;
	@NotNull private final PayloadGenerator payloadGenerator;
	@NotNull private final OperationMode mode;
	@NotNull private final StopSignal stopSignal;
	private final long backoffFloorMs;
	private final long backoffCeilingMs;
	private final long firstFailureDelayMs;
	/**
	 * Minimum time between two error lines of the same worker. Errors in between are only logged at debug level.
	 */
	private final long errorLogIntervalMs;
	/**
	 * Number of records one insert transaction writes before committing.
	 */
	private final int batchSize;

	@Builder
	@SuppressWarnings("unused")
	private WorkerContext(@NotNull ConnectionPool<C> pool, @NotNull StatsAggregator stats,
			@Nullable RateLimiter rateLimiter,
			@Nullable PayloadGenerator payloadGenerator,
			@Nullable OperationMode mode,
			@Nullable StopSignal stopSignal,
			long backoffFloorMs, long backoffCeilingMs, long firstFailureDelayMs,
			long errorLogIntervalMs, int batchSize) {
		this.pool = pool;
		this.stats = stats;
		this.rateLimiter = rateLimiter != null ? rateLimiter : RateLimiter.unlimited();
		this.payloadGenerator = payloadGenerator != null ? payloadGenerator : new RandomPayloadGenerator();
		this.mode = mode != null ? mode : OperationMode.FULL;
		this.stopSignal = stopSignal != null ? stopSignal : new StopSignal();
		this.backoffFloorMs = backoffFloorMs > 0 ? backoffFloorMs : WorkerBackoff.DEFAULT_FLOOR_MS;
		this.backoffCeilingMs = backoffCeilingMs > 0 ? backoffCeilingMs : WorkerBackoff.DEFAULT_CEILING_MS;
		this.firstFailureDelayMs = firstFailureDelayMs > 0 ? firstFailureDelayMs : WorkerBackoff.DEFAULT_FIRST_FAILURE_DELAY_MS;
		this.errorLogIntervalMs = errorLogIntervalMs > 0 ? errorLogIntervalMs : DEFAULT_ERROR_LOG_INTERVAL_MS;
		this.batchSize = batchSize > 0 ? batchSize : 1;

		if (batchSize < 0) {
			throw new IllegalArgumentException("Batch size cannot be negative");
		}
		if (this.backoffCeilingMs < this.backoffFloorMs) {
			throw new IllegalArgumentException("Worker backoff ceiling cannot be lower than its floor");
		}
	}

	@NotNull
	WorkerBackoff newBackoff() {
		return new WorkerBackoff(backoffFloorMs, backoffCeilingMs, firstFailureDelayMs);
	}
}
