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
import org.jetbrains.annotations.Nullable;

/**
 * No connection became available within the acquire attempts. Not fatal: the caller should back off and try again later.
 */
@Getter
public class PoolExhaustedException extends PoolException {
	private final int attempts;
	private final int maxSize;
	private final int activeConnections;

	PoolExhaustedException(int attempts, int maxSize, int activeConnections, @Nullable ConnectionCreationFailedException creationFailure) {
		super(String.format("No connection available after %d attempt(s) (maxSize=%d, active=%d)", attempts, maxSize, activeConnections),
				creationFailure);
		this.attempts = attempts;
		this.maxSize = maxSize;
		this.activeConnections = activeConnections;
	}
}
