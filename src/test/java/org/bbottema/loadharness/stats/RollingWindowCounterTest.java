package org.bbottema.loadharness.stats;

import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

public class RollingWindowCounterTest {

	/**
	 * Five transactions in each 100ms bucket between 1000 and 2000ms: 50 per second.
	 */
	private static RollingWindowCounter steadyFiftyPerSecond() {
		final RollingWindowCounter counter = new RollingWindowCounter(100, 10, 0);
		for (long bucketStart = 1000; bucketStart < 2000; bucketStart += 100) {
			for (int i = 0; i < 5; i++) {
				counter.record(bucketStart + 50);
			}
		}
		return counter;
	}

	@Test
	public void testRateOverWholeHorizon() {
		assertThat(steadyFiftyPerSecond().ratePerSecond(1999)).isCloseTo(50.0, within(0.1));
	}

	@Test
	public void testRateOverShorterWindow() {
		assertThat(steadyFiftyPerSecond().ratePerSecond(200, 1999)).isCloseTo(50.0, within(0.5));
	}

	@Test
	public void testWindowIsCappedAtHorizon() {
		final RollingWindowCounter counter = steadyFiftyPerSecond();

		assertThat(counter.ratePerSecond(60_000, 1999)).isEqualTo(counter.ratePerSecond(1999));
	}

	@Test
	public void testOldBucketsExpire() {
		final RollingWindowCounter counter = steadyFiftyPerSecond();

		assertThat(counter.ratePerSecond(5000)).isZero();

		counter.record(5050);
		assertThat(counter.ratePerSecond(5099)).isGreaterThan(0);
	}

	@Test
	public void testYoungCounterDoesNotDiluteOverFullHorizon() {
		final RollingWindowCounter counter = new RollingWindowCounter(100, 10, 10_000);
		for (int i = 0; i < 10; i++) {
			counter.record(10_050);
		}

		assertThat(counter.ratePerSecond(10_100)).isCloseTo(100.0, within(0.1));
	}
}
