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

import lombok.Value;
import lombok.experimental.NonFinal;

@NonFinal@Value
public class PoolMetrics {
	private final int idle;
	private final int active;
	/**
	 * Slots taken by connections being created or checked by the health check.
	 */
	private final int pending;
	private final int currentlyWaitingCount;
	private final int minSize;
	private final int maxSize;
	private final long totalCreated;
	private final long totalRecycled;
	private final long totalRemoved;
	private final long totalInvalidated;
	private final long totalAcquired;
	private final long leakWarnings;

	public int getTotal() {
		return idle + active;
	}
}
