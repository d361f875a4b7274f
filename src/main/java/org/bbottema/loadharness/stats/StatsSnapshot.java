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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import lombok.Value;
import org.jetbrains.annotations.NotNull;

/**
 * Read-only view of the statistics at one moment. Counters and latency samples are read one after the other without a common lock,
 * so under load they can be a few transactions apart.
 */
@Value
@SuppressFBWarnings(value = "RCN_REDUNDANT_NULLCHECK_OF_NONNULL_VALUE", justification = "Generated code")
public class StatsSnapshot {
	private final long timestampMs;
	/**
	 * Time since the statistics started counting: the start of the test, or the end of the warm-up once the counters were reset.
	 */
	private final long elapsedMs;
	private final boolean measurementPhase;
	private final long transactions;
	private final long inserts;
	private final long selects;
	private final long updates;
	private final long deletes;
	private final long errors;
	private final long verificationFailures;
	private final long connectionRecreates;
	/**
	 * Lifetime average: transactions divided by {@link #elapsedMs}.
	 */
	private final double averageTps;
	/**
	 * Throughput over the rolling window only.
	 */
	private final double realtimeTps;
	@NotNull private final LatencyStats latency;
}
