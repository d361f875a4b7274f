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

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.concurrent.atomic.AtomicLong;

import static lombok.AccessLevel.PACKAGE;
import static org.bbottema.loadharness.pool.PooledConnection.PoolStatus.DESTROYED;
import static org.bbottema.loadharness.pool.PooledConnection.PoolStatus.IDLE;

/**
 * A pool entry wrapping one raw backend connection as C, together with the bookkeeping the pool needs for lifetime eviction, idle
 * checks and leak detection.
 * <p>
 * Owned by the pool. A worker only borrows it between {@link ConnectionPool#acquire()} and {@link #release()} (or
 * {@link #invalidate()}); a borrowed connection that is never handed back shows up as a leak.
 *
 * @param <C> the raw connection type
 */
@ToString
public class PooledConnection<C> {

	enum PoolStatus {
		IDLE, ACTIVE, MAINTENANCE, DESTROYED
	}

	private static final AtomicLong ID_SEQUENCE = new AtomicLong();

	@ToString.Exclude
	private final ConnectionPool<C> pool;
	@ToString.Exclude
	@NotNull private final C connection;
	@Getter private final long id;
	/**
	 * Millisecond stamp from {@link System#currentTimeMillis()}.
	 */
	@Getter private final long creationStampMs;
	@Getter private long lastUsedStampMs;
	/**
	 * Zero while the connection is not checked out.
	 */
	@Getter private long checkoutStampMs;
	@Getter @Nullable private String holder;
	@Getter private long useCount;
	@NotNull @Getter(PACKAGE) @Setter(PACKAGE) private volatile PoolStatus currentPoolStatus;

	PooledConnection(@NotNull ConnectionPool<C> pool, @NotNull C connection) {
		this.pool = pool;
		this.connection = connection;
		this.id = ID_SEQUENCE.incrementAndGet();
		this.creationStampMs = System.currentTimeMillis();
		this.lastUsedStampMs = creationStampMs;
		this.currentPoolStatus = IDLE;
	}

	/**
	 * Hands this connection back to the pool so other workers can use it.
	 */
	public void release() {
		pool.release(this);
	}

	/**
	 * Hands this connection back to the pool for destruction, freeing its slot for a fresh connection on the next acquire.
	 */
	public void invalidate() {
		pool.invalidate(this);
	}

	void markCheckedOut(@NotNull String holder) {
		this.holder = holder;
		this.checkoutStampMs = System.currentTimeMillis();
		this.lastUsedStampMs = checkoutStampMs;
	}

	void markReleased() {
		this.holder = null;
		this.checkoutStampMs = 0;
		this.lastUsedStampMs = System.currentTimeMillis();
		this.useCount++;
	}

	/**
	 * @return The number of milliseconds since this connection was created.
	 */
	public long ageMs() {
		return System.currentTimeMillis() - creationStampMs;
	}

	/**
	 * @return The number of milliseconds since this connection was last checked out or returned.
	 */
	public long idleMs() {
		return System.currentTimeMillis() - lastUsedStampMs;
	}

	/**
	 * @return The number of milliseconds the current holder has had this connection, or -1 if it is not checked out.
	 */
	public long checkoutDurationMs() {
		return checkoutStampMs == 0 ? -1 : System.currentTimeMillis() - checkoutStampMs;
	}

	public boolean isCheckedOut() {
		return checkoutStampMs != 0;
	}

	@NotNull
	public C getConnection() {
		if (currentPoolStatus == DESTROYED) {
			throw new IllegalStateException("This connection has already been closed by the pool, you can't use it anymore!");
		}
		return connection;
	}

	@NotNull
	C rawConnection() {
		return connection;
	}
}
