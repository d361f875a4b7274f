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
package org.bbottema.loadharness.pool.expirypolicies;

import org.bbottema.loadharness.pool.PooledConnection;
import org.jetbrains.annotations.NotNull;

import java.util.concurrent.TimeUnit;

/**
 * Max lifetime: a connection expires once it has existed for the given duration, however busy it is.
 */
public class TimeoutSinceCreationExpirationPolicy<C> extends TimeoutExpirationPolicy<C> {
	public TimeoutSinceCreationExpirationPolicy(long expiryAge, @NotNull TimeUnit unit) {
		super(expiryAge, unit);
	}

	@Override
	long measuredAgeMs(@NotNull PooledConnection<C> pooledConnection) {
		return pooledConnection.ageMs();
	}
}
