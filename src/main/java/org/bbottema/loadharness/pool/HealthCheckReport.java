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

/**
 * Outcome of one health check cycle.
 */
@Value
public class HealthCheckReport {
	public static final HealthCheckReport NOTHING_CHECKED = new HealthCheckReport(0, 0, 0, 0);

	/**
	 * Idle connections looked at.
	 */
	private final int checked;
	/**
	 * Closed because they failed validation or sat idle too long.
	 */
	private final int removed;
	/**
	 * Closed because they exceeded their max lifetime.
	 */
	private final int recycled;
	/**
	 * Checked out connections held longer than the leak detection threshold.
	 */
	private final int leaks;
}
