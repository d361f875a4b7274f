package org.bbottema.loadharness.worker;

import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class WorkerBackoffTest {

	@Test
	public void testFirstFailurePausesWithoutTouchingBackoff() {
		final WorkerBackoff backoff = new WorkerBackoff();

		assertThat(backoff.onFailure()).isEqualTo(1000);
		assertThat(backoff.getConsecutiveFailures()).isEqualTo(1);
		assertThat(backoff.getCurrentBackoffMs()).isEqualTo(100);
	}

	@Test
	public void testRepeatedFailuresDoubleUpToCeiling() {
		final WorkerBackoff backoff = new WorkerBackoff();
		backoff.onFailure();

		assertThat(backoff.onFailure()).isEqualTo(100);
		assertThat(backoff.onFailure()).isEqualTo(200);
		assertThat(backoff.onFailure()).isEqualTo(400);
		assertThat(backoff.onFailure()).isEqualTo(800);
		assertThat(backoff.onFailure()).isEqualTo(1600);
		assertThat(backoff.onFailure()).isEqualTo(3200);
		assertThat(backoff.onFailure()).isEqualTo(5000);
		assertThat(backoff.onFailure()).isEqualTo(5000);
	}

	@Test
	public void testSingleSuccessResetsAfterAnyNumberOfFailures() {
		for (int failures = 1; failures <= 20; failures++) {
			final WorkerBackoff backoff = new WorkerBackoff();
			for (int i = 0; i < failures; i++) {
				backoff.onFailure();
			}

			backoff.onSuccess();

			assertThat(backoff.getConsecutiveFailures()).isZero();
			assertThat(backoff.getCurrentBackoffMs()).isEqualTo(backoff.getFloorMs());
			assertThat(backoff.onFailure()).isEqualTo(backoff.getFirstFailureDelayMs());
			assertThat(backoff.onFailure()).isEqualTo(backoff.getFloorMs());
		}
	}

	@Test
	public void testCustomBounds() {
		final WorkerBackoff backoff = new WorkerBackoff(10, 30, 5);

		assertThat(backoff.onFailure()).isEqualTo(5);
		assertThat(backoff.onFailure()).isEqualTo(10);
		assertThat(backoff.onFailure()).isEqualTo(20);
		assertThat(backoff.onFailure()).isEqualTo(30);
	}

	@Test
	public void testInvalidBounds() {
		assertThatThrownBy(() -> new WorkerBackoff(100, 50, 1000)).isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> new WorkerBackoff(100, 500, -1)).isInstanceOf(IllegalArgumentException.class);
	}
}
