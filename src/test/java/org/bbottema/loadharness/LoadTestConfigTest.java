package org.bbottema.loadharness;

import org.bbottema.loadharness.worker.OperationMode;
import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class LoadTestConfigTest {

	@Test
	public void testDefaults() {
		final LoadTestConfig config = LoadTestConfig.builder().workerCount(8).build();

		assertThat(config.getMinPoolSize()).isEqualTo(8);
		assertThat(config.getMaxPoolSize()).isEqualTo(8);
		assertThat(config.getMode()).isEqualTo(OperationMode.FULL);
		assertThat(config.getTargetTps()).isZero();
		assertThat(config.getSubSecondWindowMs()).isEqualTo(100);
		assertThat(config.getSubSecondBucketCount()).isEqualTo(10);
		assertThat(config.getLatencySampleCapacity()).isEqualTo(10_000);
		assertThat(config.getBatchSize()).isEqualTo(1);
		assertThat(config.getWorkerBackoffFloorMs()).isEqualTo(100);
		assertThat(config.getWorkerBackoffCeilingMs()).isEqualTo(5000);
		assertThat(config.getFirstFailureDelayMs()).isEqualTo(1000);
		assertThat(config.getErrorLogIntervalMs()).isEqualTo(10_000);
		assertThat(config.getAcquireTimeout().getDurationMs()).isEqualTo(1000);
	}

	@Test
	public void testMaxPoolSizeFollowsMinPoolSize() {
		final LoadTestConfig config = LoadTestConfig.builder().workerCount(2).minPoolSize(5).build();

		assertThat(config.getMaxPoolSize()).isEqualTo(5);
	}

	@Test
	public void testInvalidConfiguration() {
		assertThatThrownBy(() -> LoadTestConfig.builder().build()).isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> LoadTestConfig.builder().workerCount(2).minPoolSize(4).maxPoolSize(3).build())
				.isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> LoadTestConfig.builder().workerCount(2).targetTps(-1).build())
				.isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> LoadTestConfig.builder().workerCount(2).batchSize(-1).build())
				.isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> LoadTestConfig.builder().workerCount(2).workerBackoffFloorMs(500).workerBackoffCeilingMs(100).build())
				.isInstanceOf(IllegalArgumentException.class);
	}
}
