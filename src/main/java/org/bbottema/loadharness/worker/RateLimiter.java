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
import org.bbottema.loadharness.util.StopSignal;
import org.jetbrains.annotations.NotNull;

import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Token bucket shared by all workers. Holds at most {@code max(rate, 1)} tokens and refills continuously, so a fraction of a token
 * accumulates between calls instead of the whole second's budget arriving at once.
 * <p>
 * The bucket starts with a single token: a test doesn't open with a burst of a full second's worth of transactions.
 */
public class RateLimiter {

	private static final long NANOS_PER_SECOND = TimeUnit.SECONDS.toNanos(1);
	/**
	 * Upper bound on a single wait before the bucket is looked at again.
	 */
	private static final long MAX_WAIT_NANOS = TimeUnit.MILLISECONDS.toNanos(50);

	@Getter private final double ratePerSecond;
	private final double capacity;
	private final LongSupplier nanoClock;

	private double tokens;
	private long lastRefillNanos;

	/**
	 * @param ratePerSecond target rate; zero or less gives a limiter that never blocks.
	 */
	public RateLimiter(double ratePerSecond) {
		this(ratePerSecond, System::nanoTime);
	}

	RateLimiter(double ratePerSecond, @NotNull LongSupplier nanoClock) {
		this.ratePerSecond = ratePerSecond;
		this.capacity = Math.max(ratePerSecond, 1);
		this.nanoClock = nanoClock;
		this.tokens = 1;
		this.lastRefillNanos = nanoClock.getAsLong();
	}

	@NotNull
	public static RateLimiter unlimited() {
		return new RateLimiter(0);
	}

	public boolean isLimiting() {
		return ratePerSecond > 0;
	}

	/**
	 * Blocks until a token could be taken or the stop signal fired.
	 *
	 * @return true if a token was taken, false if the wait was cut short by the stop signal or an interrupt
	 */
	public boolean acquireToken(@NotNull StopSignal stopSignal) {
		if (!isLimiting()) {
			return !stopSignal.isStopped();
		}
		while (!stopSignal.isStopped()) {
			final long waitNanos = tryConsume();
			if (waitNanos == 0) {
				return true;
			}
			if (stopSignal.awaitStop(Math.min(waitNanos, MAX_WAIT_NANOS), TimeUnit.NANOSECONDS)) {
				return false;
			}
		}
		return false;
	}

	/**
	 * @return zero if a token was taken, otherwise the time until one will be available.
	 */
	synchronized long tryConsume() {
		refill();
		if (tokens >= 1) {
			tokens -= 1;
			return 0;
		}
		return Math.max(1, (long) Math.ceil((1 - tokens) * NANOS_PER_SECOND / ratePerSecond));
	}

	synchronized double availableTokens() {
		refill();
		return tokens;
	}

	private void refill() {
		final long now = nanoClock.getAsLong();
		final long elapsed = now - lastRefillNanos;
		if (elapsed > 0) {
			tokens = Math.min(capacity, tokens + elapsed * ratePerSecond / NANOS_PER_SECOND);
			lastRefillNanos = now;
		}
	}
}
