package org.bbottema.loadharness.stats;

import org.junit.Test;

import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class LatencyRecorderTest {

	@Test
	public void testOldestSamplesAreOverwritten() {
		final LatencyRecorder recorder = new LatencyRecorder(3);
		for (long ms = 1; ms <= 5; ms++) {
			recorder.record(MILLISECONDS.toNanos(ms));
		}

		final LatencyStats stats = recorder.computeStats();

		assertThat(stats.getSampleCount()).isEqualTo(3);
		assertThat(stats.getMinMs()).isEqualTo(3.0);
		assertThat(stats.getMaxMs()).isEqualTo(5.0);
		assertThat(stats.getAverageMs()).isEqualTo(4.0);
	}

	@Test
	public void testReadingDoesNotEvict() {
		final LatencyRecorder recorder = new LatencyRecorder(10);
		recorder.record(MILLISECONDS.toNanos(7));
		recorder.record(MILLISECONDS.toNanos(3));

		assertThat(recorder.computeStats()).isEqualTo(recorder.computeStats());
		assertThat(recorder.computeStats().getSampleCount()).isEqualTo(2);
	}

	@Test
	public void testInvalidCapacity() {
		assertThatThrownBy(() -> new LatencyRecorder(0)).isInstanceOf(IllegalArgumentException.class);
	}
}
