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
package org.bbottema.loadharness.util;

import lombok.Getter;

/**
 * Doubling delay between a floor and a ceiling. Each call to {@link #nextDelayMs()} hands out the current delay and doubles it for the
 * next call; {@link #reset()} drops it back to the floor.
 * <p>
 * Not thread-safe: every retry loop owns its own instance.
 */
public class ExponentialBackoff {

	@Getter private final long floorMs;
	@Getter private final long ceilingMs;
	@Getter private long currentMs;

	public ExponentialBackoff(long floorMs, long ceilingMs) {
		if (floorMs < 1) {
			throw new IllegalArgumentException("Backoff floor cannot be less than 1ms");
		}
		if (ceilingMs < floorMs) {
			throw new IllegalArgumentException("Backoff ceiling cannot be lower than its floor");
		}
		this.floorMs = floorMs;
		this.ceilingMs = ceilingMs;
		this.currentMs = floorMs;
	}

	public long nextDelayMs() {
		final long delay = currentMs;
		currentMs = Math.min(currentMs * 2, ceilingMs);
		return delay;
	}

	public void reset() {
		currentMs = floorMs;
	}
}
