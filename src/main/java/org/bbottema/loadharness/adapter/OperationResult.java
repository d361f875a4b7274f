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

import lombok.Value;
import org.jetbrains.annotations.Nullable;

/**
 * What an adapter reports back from one statement: the record touched (generated id for inserts), the data read (selects only) and
 * the number of affected rows.
 */
@Value
public class OperationResult {
	@Nullable private final Long recordId;
	@Nullable private final String data;
	private final int affectedRows;

	public static OperationResult inserted(long recordId) {
		return new OperationResult(recordId, null, 1);
	}

	public static OperationResult selected(long recordId, @Nullable String data) {
		return new OperationResult(recordId, data, 1);
	}

	public static OperationResult notFound() {
		return new OperationResult(null, null, 0);
	}

	public static OperationResult affected(@Nullable Long recordId, int affectedRows) {
		return new OperationResult(recordId, null, affectedRows);
	}
}
