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

import lombok.Value;
import org.jetbrains.annotations.NotNull;

/**
 * What happened between two snapshots.
 */
@Value
public class IntervalStats {
	private final long intervalMs;
	private final long transactions;
	private final long inserts;
	private final long selects;
	private final long updates;
	private final long deletes;
	private final long errors;
	private final double tps;

	/**
	 * When the counters were reset in between (end of warm-up), the interval is measured against zero.
	 */
	@NotNull
	public static IntervalStats between(@NotNull StatsSnapshot previous, @NotNull StatsSnapshot current) {
		final StatsSnapshot base = previous.isMeasurementPhase() == current.isMeasurementPhase() ? previous : null;
		final long intervalMs = Math.max(0, current.getTimestampMs() - previous.getTimestampMs());
		final long transactions = current.getTransactions() - (base != null ? base.getTransactions() : 0);
		return new IntervalStats(
				intervalMs,
				transactions,
				current.getInserts() - (base != null ? base.getInserts() : 0),
				current.getSelects() - (base != null ? base.getSelects() : 0),
				current.getUpdates() - (base != null ? base.getUpdates() : 0),
				current.getDeletes() - (base != null ? base.getDeletes() : 0),
				current.getErrors() - (base != null ? base.getErrors() : 0),
				intervalMs > 0 ? transactions * 1000.0 / intervalMs : 0);
	}
}
