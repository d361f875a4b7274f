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
package org.bbottema.loadharness.util;

import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * One-shot cancellation signal shared by everything that may block during a load test. Waiting on it replaces plain sleeps, so
 * that backoff pauses end the moment the signal fires.
 */
@Slf4j
public class StopSignal {

	private final CountDownLatch latch = new CountDownLatch(1);
	private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

	/**
	 * Fires the signal. Only the first call notifies listeners.
	 */
	public void stop() {
		synchronized (latch) {
			if (isStopped()) {
				return;
			}
			latch.countDown();
		}
		for (Runnable listener : listeners) {
			try {
				listener.run();
			} catch (RuntimeException e) {
				log.error("stop listener failed, continuing with the remaining listeners", e);
			}
		}
	}

	public boolean isStopped() {
		return latch.getCount() == 0;
	}

	/**
	 * Registers a callback that runs once when the signal fires, or right away if it already fired.
	 */
	public void onStop(@NotNull Runnable listener) {
		synchronized (latch) {
			if (!isStopped()) {
				listeners.add(listener);
				return;
			}
		}
		listener.run();
	}

	/**
	 * Pauses the calling thread for the given duration or until the signal fires, whichever comes first.
	 *
	 * @return true if the signal fired (or the thread was interrupted), false if the full duration elapsed.
	 */
	public boolean awaitStop(long duration, @NotNull TimeUnit unit) {
		if (duration <= 0) {
			return isStopped();
		}
		try {
			return latch.await(duration, unit);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			return true;
		}
	}

	public boolean awaitStopMs(long durationMs) {
		return awaitStop(durationMs, TimeUnit.MILLISECONDS);
	}
}
