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
package org.bbottema.loadharness.worker;

import lombok.Getter;
import org.jetbrains.annotations.NotNull;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * The transaction shape every worker submits.
 */
public enum OperationMode {
	/**
	 * Insert, commit, select the inserted record back and verify it.
	 */
	FULL("full"),
	INSERT_ONLY("insert-only"),
	SELECT_ONLY("select-only"),
	UPDATE_ONLY("update-only"),
	DELETE_ONLY("delete-only"),
	/**
	 * Weighted random choice of insert (6), update (3) or delete (1), each committed.
	 */
	MIXED("mixed");

	@Getter private final String label;

	OperationMode(@NotNull String label) {
		this.label = label;
	}

	/**
	 * @throws IllegalArgumentException for anything but one of the labels, case-insensitive
	 */
	@NotNull
	public static OperationMode parse(@NotNull String label) {
		final String normalized = label.trim().toLowerCase(Locale.ROOT);
		for (OperationMode mode : values()) {
			if (mode.label.equals(normalized)) {
				return mode;
			}
		}
		throw new IllegalArgumentException(String.format("Unknown operation mode '%s', expected one of %s", label,
				Arrays.stream(values()).map(OperationMode::getLabel).collect(Collectors.joining(", "))));
	}
}
