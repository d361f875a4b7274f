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

import lombok.Getter;
import org.bbottema.loadharness.util.ExponentialBackoff;

/**
 * How long a worker waits before asking the pool for a connection again after failing to get one.
 * <p>
 * The first failure of a streak gets a fixed short pause and leaves the backoff alone. From the second consecutive failure on, the
 * pause is the current backoff, which then doubles up to the ceiling. A single success drops the streak and the backoff back to the
 * floor.
 * <p>
 * Owned by one worker, not thread-safe.
 */
public class WorkerBackoff {

	public static final long DEFAULT_FLOOR_MS = 100;
	public static final long DEFAULT_CEILING_MS = 5000;
	public static final long DEFAULT_FIRST_FAILURE_DELAY_MS = 1000;

	private final ExponentialBackoff backoff;
	@Getter private final long firstFailureDelayMs;
	@Getter private int consecutiveFailures;

	public WorkerBackoff() {
		this(DEFAULT_FLOOR_MS, DEFAULT_CEILING_MS, DEFAULT_FIRST_FAILURE_DELAY_MS);
	}

	public WorkerBackoff(long floorMs, long ceilingMs, long firstFailureDelayMs) {
		if (firstFailureDelayMs < 0) {
			throw new IllegalArgumentException("First failure delay cannot be negative");
		}
		this.backoff = new ExponentialBackoff(floorMs, ceilingMs);
		this.firstFailureDelayMs = firstFailureDelayMs;
	}

	/**
	 * @return how long to pause before the next attempt.
	 */
	public long onFailure() {
		consecutiveFailures++;
		return consecutiveFailures >= 2 ? backoff.nextDelayMs() : firstFailureDelayMs;
	}

	public void onSuccess() {
		consecutiveFailures = 0;
		backoff.reset();
	}

	/**
	 * @return the pause the next backoff-governed failure would get.
	 */
	public long getCurrentBackoffMs() {
		return backoff.getCurrentMs();
	}

	public long getFloorMs() {
		return backoff.getFloorMs();
	}
}
