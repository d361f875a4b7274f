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
package org.bbottema.loadharness.adapter;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import lombok.Value;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Opaque input for one adapter call. The core never interprets it beyond comparing read-back data in full mode.
 */
@Value
@SuppressFBWarnings(value = "RCN_REDUNDANT_NULLCHECK_OF_NONNULL_VALUE", justification = "Generated code")
public class Payload {
	/**
	 * Target record for select/update/delete; {@code null} lets the adapter pick one itself (or generate one for inserts).
	 */
	@Nullable private final Long recordId;
	@NotNull private final String data;
	@NotNull private final String workerName;

	/**
	 * @return a payload addressing the given record, keeping data and worker name.
	 */
	@NotNull
	public Payload forRecord(long recordId) {
		return new Payload(recordId, data, workerName);
	}
}
