package org.bbottema.loadharness.worker;

import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class OperationModeTest {

	@Test
	public void testParseLabels() {
		assertThat(OperationMode.parse("full")).isEqualTo(OperationMode.FULL);
		assertThat(OperationMode.parse("insert-only")).isEqualTo(OperationMode.INSERT_ONLY);
		assertThat(OperationMode.parse("SELECT-ONLY")).isEqualTo(OperationMode.SELECT_ONLY);
		assertThat(OperationMode.parse(" update-only ")).isEqualTo(OperationMode.UPDATE_ONLY);
		assertThat(OperationMode.parse("delete-only")).isEqualTo(OperationMode.DELETE_ONLY);
		assertThat(OperationMode.parse("Mixed")).isEqualTo(OperationMode.MIXED);
	}

	@Test
	public void testParseUnknown() {
		assertThatThrownBy(() -> OperationMode.parse("insert_only"))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("insert-only");
	}
}
