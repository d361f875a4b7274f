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

import org.jetbrains.annotations.NotNull;

/**
 * Backend plug-in for the harness: opens raw connections and runs the fixed set of statements against them. Every method may block
 * and every method may fail; the core never looks at backend specific error codes.
 * <p>
 * Implementations are selected by configuration, one per backend type.
 *
 * @param <C> the raw connection handle type
 */
public interface DatabaseAdapter<C> {

	/**
	 * @return A new, ready to use connection.
	 * @throws Exception any failure establishing it (network, authentication, configuration).
	 */
	@NotNull
	C open() throws Exception;

	/**
	 * Cheap liveness check, typically a no-op query. A check that throws is treated as "not alive".
	 */
	boolean isAlive(@NotNull C connection);

	/**
	 * Executes one statement. Transaction demarcation is left to {@link #commit(Object)} and {@link #rollback(Object)}.
	 */
	@NotNull
	OperationResult execute(@NotNull C connection, @NotNull OperationKind kind, @NotNull Payload payload) throws Exception;

	default void commit(@NotNull C connection) throws Exception {
		// overridable hook, for auto-committing backends
	}

	default void rollback(@NotNull C connection) throws Exception {
		// overridable hook, for auto-committing backends
	}

	/**
	 * Clean up a connection no longer needed by the pool.
	 */
	void close(@NotNull C connection) throws Exception;
}
