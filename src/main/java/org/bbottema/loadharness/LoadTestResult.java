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
import lombok.Value;
import org.bbottema.loadharness.pool.PoolMetrics;
import org.bbottema.loadharness.report.TimeSeriesPoint;
import org.bbottema.loadharness.stats.StatsSnapshot;
import org.bbottema.loadharness.worker.WorkerState;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Map;

@Value
@SuppressFBWarnings(value = "RCN_REDUNDANT_NULLCHECK_OF_NONNULL_VALUE", justification = "Generated code")
public class LoadTestResult {
	@NotNull private final StatsSnapshot finalStats;
	@NotNull private final PoolMetrics finalPoolMetrics;
	private final int warmUpConnectionsCreated;
	private final int warmUpConnectionsRequested;
	/**
	 * Successful transactions per worker name, in start order. Includes warm-up transactions.
	 */
	@NotNull private final Map<String, Long> workerTransactions;
	/**
	 * Final state of every worker, including the ones the ramp-up never got to start.
	 */
	@NotNull private final Map<String, WorkerState> workerStates;
	@NotNull private final List<TimeSeriesPoint> timeSeries;
	/**
	 * True if {@link LoadTestController#requestStop()} ended the test before its configured duration.
	 */
	private final boolean stoppedEarly;
}
