package org.tweann.runtime.functions;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class ActivationFunctionTest {

    @Test
    void functionsComputeExpectedValues() {
        assertThat(ActivationFunction.TANH.apply(0.5)).isCloseTo(Math.tanh(0.5), within(1e-15));
        assertThat(ActivationFunction.SIGMOID.apply(0.0)).isEqualTo(0.5);
        assertThat(ActivationFunction.LINEAR.apply(-3.25)).isEqualTo(-3.25);
        assertThat(ActivationFunction.RELU.apply(-1.0)).isZero();
        assertThat(ActivationFunction.RELU.apply(2.0)).isEqualTo(2.0);
        assertThat(ActivationFunction.GAUSSIAN.apply(0.0)).isEqualTo(1.0);
    }

    @Test
    void namesResolveCaseInsensitively() {
        assertThat(ActivationFunction.fromName("tanh")).isEqualTo(ActivationFunction.TANH);
        assertThat(ActivationFunction.fromName(" Sigmoid ")).isEqualTo(ActivationFunction.SIGMOID);
    }

    @Test
    void unknownNameIsRejected() {
        assertThatThrownBy(() -> ActivationFunction.fromName("softmax"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("softmax");
    }
}
