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

import lombok.Getter;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Random alphanumeric data of a fixed length. For select/update/delete a random record id in {@code [1, maxRecordId]} is chosen
 * when a maximum is known, otherwise the adapter is left to pick a record.
 */
public class RandomPayloadGenerator implements PayloadGenerator {

	public static final int DEFAULT_DATA_LENGTH = 500;

	private static final char[] ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789".toCharArray();

	@Getter private final int dataLength;
	@Getter private final long maxRecordId;

	public RandomPayloadGenerator() {
		this(DEFAULT_DATA_LENGTH, 0);
	}

	public RandomPayloadGenerator(int dataLength, long maxRecordId) {
		if (dataLength < 1) {
			throw new IllegalArgumentException("Data length should be at least one");
		}
		this.dataLength = dataLength;
		this.maxRecordId = maxRecordId;
	}

	@NotNull
	@Override
	public Payload next(@NotNull OperationKind kind, @NotNull String workerName) {
		return new Payload(pickRecordId(kind), randomData(), workerName);
	}

	@Nullable
	private Long pickRecordId(@NotNull OperationKind kind) {
		if (kind == OperationKind.INSERT || maxRecordId < 1) {
			return null;
		}
		return ThreadLocalRandom.current().nextLong(1, maxRecordId + 1);
	}

	@NotNull
	private String randomData() {
		final ThreadLocalRandom random = ThreadLocalRandom.current();
		final char[] data = new char[dataLength];
		for (int i = 0; i < dataLength; i++) {
			data[i] = ALPHABET[random.nextInt(ALPHABET.length)];
		}
		return new String(data);
	}
}
