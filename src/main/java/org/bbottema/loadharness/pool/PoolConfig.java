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
package org.bbottema.loadharness.pool;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import lombok.Builder;
import lombok.Value;
import lombok.experimental.NonFinal;
import org.bbottema.loadharness.util.Timeout;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;

@NonFinal@Value
@SuppressFBWarnings(value = "RCN_REDUNDANT_NULLCHECK_OF_NONNULL_VALUE", justification = "Generated code")
public class PoolConfig<C> {

	public static final int DEFAULT_CREATION_ATTEMPTS = 3;
	public static final long DEFAULT_CREATION_BACKOFF_FLOOR_MS = 100;
	public static final long DEFAULT_CREATION_BACKOFF_CEILING_MS = 2000;
	public static final int DEFAULT_ACQUIRE_ATTEMPTS = 3;
	public static final long DEFAULT_ACQUIRE_BACKOFF_FLOOR_MS = 100;
	public static final long DEFAULT_ACQUIRE_BACKOFF_CEILING_MS = 5000;
	public static final Timeout DEFAULT_ACQUIRE_TIMEOUT = Timeout.ofMillis(1000);

	/**
	 * Number of connections {@link ConnectionPool#warmUp()} creates up front, and the floor below which idle timeouts won't shrink
	 * the pool.
	 */
	private final int minSize;
	/**
	 * Upper bound for idle plus checked out connections, including connections still being created.
	 */
	private final int maxSize;
	/**
	 * Used for the health check thread, in case you need to manage your own thread production.
	 */
	@NotNull private final ThreadFactory threadFactory;
	/**
	 * Max lifetime policy, applied to idle connections during health checks and to connections being released.
	 */
	@NotNull private final ExpirationPolicy<C> expirationPolicy;
	/**
	 * Idle timeout policy, only applied while the pool holds more than {@link #minSize} connections.
	 */
	@NotNull private final ExpirationPolicy<C> idleExpirationPolicy;
	/**
	 * Checkout duration after which a leak warning is logged on every health check. Zero disables leak detection.
	 */
	private final long leakDetectionThresholdMs;
	/**
	 * Delay between health check cycles. Zero means no background health check; {@link ConnectionPool#runHealthCheck()} can still
	 * be called manually.
	 */
	private final long healthCheckIntervalMs;
	private final boolean validateIdleConnections;
	private final int creationAttempts;
	private final long creationBackoffFloorMs;
	private final long creationBackoffCeilingMs;
	private final int acquireAttempts;
	private final long acquireBackoffFloorMs;
	private final long acquireBackoffCeilingMs;
	/**
	 * How long each acquire attempt waits for an idle connection once the pool is at capacity.
	 */
	@NotNull private final Timeout acquireTimeout;

	@Builder
	@SuppressWarnings("unused")
	private PoolConfig(int minSize, int maxSize,
			@Nullable ThreadFactory threadFactory,
			@Nullable ExpirationPolicy<C> expirationPolicy,
			@Nullable ExpirationPolicy<C> idleExpirationPolicy,
			long leakDetectionThresholdMs,
			long healthCheckIntervalMs,
			@Nullable Boolean validateIdleConnections,
			int creationAttempts, long creationBackoffFloorMs, long creationBackoffCeilingMs,
			int acquireAttempts, long acquireBackoffFloorMs, long acquireBackoffCeilingMs,
			@Nullable Timeout acquireTimeout) {
		this.minSize = minSize;
		this.maxSize = maxSize;
		this.threadFactory = (threadFactory != null) ? threadFactory : Executors.defaultThreadFactory();
		this.expirationPolicy = (expirationPolicy != null) ? expirationPolicy : ExpirationPolicy.NeverExpirePolicy.<C>getInstance();
		this.idleExpirationPolicy = (idleExpirationPolicy != null) ? idleExpirationPolicy : ExpirationPolicy.NeverExpirePolicy.<C>getInstance();
		this.leakDetectionThresholdMs = leakDetectionThresholdMs;
		this.healthCheckIntervalMs = healthCheckIntervalMs;
		this.validateIdleConnections = (validateIdleConnections != null) ? validateIdleConnections : true;
		this.creationAttempts = (creationAttempts > 0) ? creationAttempts : DEFAULT_CREATION_ATTEMPTS;
		this.creationBackoffFloorMs = (creationBackoffFloorMs > 0) ? creationBackoffFloorMs : DEFAULT_CREATION_BACKOFF_FLOOR_MS;
		this.creationBackoffCeilingMs = (creationBackoffCeilingMs > 0) ? creationBackoffCeilingMs : DEFAULT_CREATION_BACKOFF_CEILING_MS;
		this.acquireAttempts = (acquireAttempts > 0) ? acquireAttempts : DEFAULT_ACQUIRE_ATTEMPTS;
		this.acquireBackoffFloorMs = (acquireBackoffFloorMs > 0) ? acquireBackoffFloorMs : DEFAULT_ACQUIRE_BACKOFF_FLOOR_MS;
		this.acquireBackoffCeilingMs = (acquireBackoffCeilingMs > 0) ? acquireBackoffCeilingMs : DEFAULT_ACQUIRE_BACKOFF_CEILING_MS;
		this.acquireTimeout = (acquireTimeout != null) ? acquireTimeout : DEFAULT_ACQUIRE_TIMEOUT;

		if (maxSize <= 0) {
			throw new IllegalArgumentException("Pool size should have a max size of at least one");
		}
		if (minSize < 0) {
			throw new IllegalArgumentException("Pool min size cannot be negative");
		}
		if (minSize > maxSize) {
			throw new IllegalArgumentException("Pool min size cannot be bigger than the pool's max size");
		}
		if (leakDetectionThresholdMs < 0 || healthCheckIntervalMs < 0) {
			throw new IllegalArgumentException("Leak detection threshold and health check interval cannot be negative");
		}
		if (this.creationBackoffCeilingMs < this.creationBackoffFloorMs || this.acquireBackoffCeilingMs < this.acquireBackoffFloorMs) {
			throw new IllegalArgumentException("Backoff ceiling cannot be lower than its floor");
		}
	}
}
