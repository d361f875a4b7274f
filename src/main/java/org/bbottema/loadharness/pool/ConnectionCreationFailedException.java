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
 * The adapter could not open a connection, not even after retrying. The cause is the failure of the last attempt.
 */
@Getter
public class ConnectionCreationFailedException extends PoolException {
	private final int attempts;

	ConnectionCreationFailedException(int attempts, @Nullable Throwable lastFailure) {
		super("Unable to create connection after " + attempts + " attempt(s)", lastFailure);
		this.attempts = attempts;
	}
}
