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

import org.jetbrains.annotations.NotNull;

import java.util.Arrays;

/**
 * Fixed size ring buffer of the most recent latency samples. Once full, every new sample overwrites the oldest one, which bounds
 * memory however long a test runs. Reading never evicts.
 */
class LatencyRecorder {

	private final long[] samplesNanos;
	private int next;
	private int size;

	LatencyRecorder(int capacity) {
		if (capacity < 1) {
			throw new IllegalArgumentException("Latency sample capacity should be at least one");
		}
		this.samplesNanos = new long[capacity];
	}

	synchronized void record(long latencyNanos) {
		samplesNanos[next] = latencyNanos;
		next = (next + 1) % samplesNanos.length;
		if (size < samplesNanos.length) {
			size++;
		}
	}

	@NotNull
	LatencyStats computeStats() {
		final long[] copy;
		synchronized (this) {
			copy = Arrays.copyOf(samplesNanos, size);
		}
		Arrays.sort(copy);
		return LatencyStats.fromSorted(copy);
	}
}
