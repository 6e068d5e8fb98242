package br.com.analytics.pipeline.sales_crm_batch.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WindowSpecTest {

    @Test
    void missingWeightsMeanUnweighted() {
        WindowSpec window = new WindowSpec(3, null);

        assertThat(window.weights()).isEmpty();
        assertThat(window.isWeighted()).isFalse();
    }

    @Test
    void weightsMustCoverTheWindow() {
        assertThatThrownBy(() -> new WindowSpec(3, List.of(0.5, 0.5)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("3");
        assertThat(new WindowSpec(2, List.of(0.3, 0.7)).isWeighted()).isTrue();
    }

    @Test
    void rejectsDegenerateWindows() {
        assertThatThrownBy(() -> WindowSpec.unweighted(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new WindowSpec(2, List.of(0.0, 0.0))).isInstanceOf(IllegalArgumentException.class);
    }
}
