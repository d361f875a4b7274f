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

import lombok.NoArgsConstructor;
import lombok.Value;
import lombok.experimental.NonFinal;
import org.jetbrains.annotations.NotNull;

import static lombok.AccessLevel.PRIVATE;

/**
 * Decides whether an idle connection should be taken out of circulation.
 */
public interface ExpirationPolicy<C> {
	boolean hasExpired(@NotNull PooledConnection<C> pooledConnection);

	@NonFinal
	@Value
	@NoArgsConstructor(access = PRIVATE)
	class NeverExpirePolicy<C> implements ExpirationPolicy<C> {
		private static final NeverExpirePolicy<?> NEVER_EXPIRE_POLICY = new NeverExpirePolicy<>();

		@SuppressWarnings("unchecked")
		public static <C> NeverExpirePolicy<C> getInstance() {
			return (NeverExpirePolicy<C>) NEVER_EXPIRE_POLICY;
		}

		@Override
		public boolean hasExpired(@NotNull PooledConnection<C> pooledConnection) {
			return false;
		}
	}
}
