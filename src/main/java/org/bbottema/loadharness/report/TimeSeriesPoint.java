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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import lombok.Value;
import org.bbottema.loadharness.pool.PoolMetrics;
import org.bbottema.loadharness.stats.IntervalStats;
import org.bbottema.loadharness.stats.StatsSnapshot;
import org.jetbrains.annotations.NotNull;

/**
 * One reporting tick, kept for export once the test is over.
 */
@Value
@SuppressFBWarnings(value = "RCN_REDUNDANT_NULLCHECK_OF_NONNULL_VALUE", justification = "Generated code")
public class TimeSeriesPoint {
	@NotNull private final StatsSnapshot snapshot;
	@NotNull private final IntervalStats interval;
	@NotNull private final PoolMetrics poolMetrics;

	public boolean isWarmUp() {
		return !snapshot.isMeasurementPhase();
	}
}
