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

import java.util.concurrent.TimeUnit;

/**
 * Latency distribution over the retained samples, in milliseconds. Percentiles use the nearest-rank method.
 */
@Value
public class LatencyStats {
	public static final LatencyStats EMPTY = new LatencyStats(0, 0, 0, 0, 0, 0, 0);

	private final int sampleCount;
	private final double averageMs;
	private final double minMs;
	private final double maxMs;
	private final double p50Ms;
	private final double p95Ms;
	private final double p99Ms;

	/**
	 * @param sortedNanos samples in ascending order
	 */
	@NotNull
	static LatencyStats fromSorted(@NotNull long[] sortedNanos) {
		final int n = sortedNanos.length;
		if (n == 0) {
			return EMPTY;
		}
		double sum = 0;
		for (long sample : sortedNanos) {
			sum += sample;
		}
		return new LatencyStats(n,
				toMs(sum / n),
				toMs(sortedNanos[0]),
				toMs(sortedNanos[n - 1]),
				toMs(percentile(sortedNanos, 50)),
				toMs(percentile(sortedNanos, 95)),
				toMs(percentile(sortedNanos, 99)));
	}

	static long percentile(@NotNull long[] sorted, double percentile) {
		final int rank = (int) Math.ceil(percentile / 100.0 * sorted.length);
		return sorted[Math.max(0, Math.min(sorted.length - 1, rank - 1))];
	}

	private static double toMs(double nanos) {
		return nanos / TimeUnit.MILLISECONDS.toNanos(1);
	}
}
