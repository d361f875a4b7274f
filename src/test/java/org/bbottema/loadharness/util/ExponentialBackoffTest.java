package org.bbottema.loadharness.util;

import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ExponentialBackoffTest {

	@Test
	public void testDoublesUpToCeiling() {
		final ExponentialBackoff backoff = new ExponentialBackoff(100, 2000);

		assertThat(backoff.nextDelayMs()).isEqualTo(100);
		assertThat(backoff.nextDelayMs()).isEqualTo(200);
		assertThat(backoff.nextDelayMs()).isEqualTo(400);
		assertThat(backoff.nextDelayMs()).isEqualTo(800);
		assertThat(backoff.nextDelayMs()).isEqualTo(1600);
		assertThat(backoff.nextDelayMs()).isEqualTo(2000);
		assertThat(backoff.nextDelayMs()).isEqualTo(2000);
	}

	@Test
	public void testResetReturnsToFloor() {
		final ExponentialBackoff backoff = new ExponentialBackoff(100, 5000);
		backoff.nextDelayMs();
		backoff.nextDelayMs();

		backoff.reset();

		assertThat(backoff.getCurrentMs()).isEqualTo(100);
		assertThat(backoff.nextDelayMs()).isEqualTo(100);
	}

	@Test
	public void testInvalidBounds() {
		assertThatThrownBy(() -> new ExponentialBackoff(0, 10)).isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> new ExponentialBackoff(10, 5)).isInstanceOf(IllegalArgumentException.class);
	}
}
