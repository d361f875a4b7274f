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
import org.jetbrains.annotations.NotNull;

import java.util.concurrent.atomic.AtomicReferenceArray;
import java.util.concurrent.atomic.LongAdder;

/**
 * Transaction counts in fixed time buckets (100ms by default) covering a short rolling horizon, for an instantaneous throughput
 * figure that reacts much faster than the lifetime average. Buckets expire on their own as time moves on, so this never needs to be
 * reset.
 * <p>
 * Lock-free: a stale bucket is swapped for a fresh one with a compare-and-set, increments go to a {@link LongAdder}.
 */
class RollingWindowCounter {

	@Getter private final long bucketMs;
	@Getter private final int bucketCount;
	private final long createdAtMs;
	private final AtomicReferenceArray<Bucket> buckets;

	RollingWindowCounter(long bucketMs, int bucketCount, long nowMs) {
		if (bucketMs < 1 || bucketCount < 1) {
			throw new IllegalArgumentException("Rolling window needs at least one bucket of at least one millisecond");
		}
		this.bucketMs = bucketMs;
		this.bucketCount = bucketCount;
		this.createdAtMs = nowMs;
		this.buckets = new AtomicReferenceArray<>(bucketCount);
	}

	void record(long nowMs) {
		final long index = nowMs / bucketMs;
		final int slot = (int) (index % bucketCount);
		while (true) {
			final Bucket bucket = buckets.get(slot);
			if (bucket != null && bucket.index == index) {
				bucket.count.increment();
				return;
			}
			if (bucket != null && bucket.index > index) {
				// clock went backwards for this caller, the sample belongs to a bucket that's already gone
				return;
			}
			buckets.compareAndSet(slot, bucket, new Bucket(index));
		}
	}

	/**
	 * Throughput over the whole horizon.
	 */
	double ratePerSecond(long nowMs) {
		return ratePerSecond(bucketCount * bucketMs, nowMs);
	}

	/**
	 * Throughput over the most recent {@code windowMs}, rounded up to whole buckets and capped at the horizon. The current bucket
	 * only counts for the part that has elapsed.
	 */
	double ratePerSecond(long windowMs, long nowMs) {
		final int windowBuckets = (int) Math.max(1, Math.min(bucketCount, (windowMs + bucketMs - 1) / bucketMs));
		final long currentIndex = nowMs / bucketMs;
		long count = 0;
		for (int i = 0; i < bucketCount; i++) {
			final Bucket bucket = buckets.get(i);
			if (bucket != null && bucket.index <= currentIndex && bucket.index > currentIndex - windowBuckets) {
				count += bucket.count.sum();
			}
		}
		final long windowStartMs = Math.max(createdAtMs, (currentIndex - windowBuckets + 1) * bucketMs);
		final long spanMs = Math.max(1, nowMs - windowStartMs);
		return count * 1000.0 / spanMs;
	}

	private static final class Bucket {
		private final long index;
		@NotNull private final LongAdder count = new LongAdder();

		private Bucket(long index) {
			this.index = index;
		}
	}
}
