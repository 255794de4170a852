package org.tweann.runtime;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.tweann.runtime.NetworkBlueprint.ActuatorNode;
import org.tweann.runtime.NetworkBlueprint.NeuronNode;
import org.tweann.runtime.NetworkBlueprint.SensorNode;
import org.tweann.runtime.NetworkBlueprint.WeightedInput;
import org.tweann.runtime.functions.ActivationFunction;

@Tag("unit")
class NetworkBlueprintTest {

    private static final SensorNode SENSOR = new SensorNode("s", "in", 2);

    @Test
    void wellFormedBlueprintPasses() {
        NetworkBlueprint blueprint = new NetworkBlueprint("ok", List.of(SENSOR),
                List.of(neuron("a", new WeightedInput("s", new double[]{1, 2})),
                        neuron("b", new WeightedInput("a", new double[]{1}), new WeightedInput("s", new double[]{0, 1}))),
                List.of(new ActuatorNode("out", "o", 1, List.of("b"))));

        assertThatCode(blueprint::validate).doesNotThrowAnyException();
    }

    @Test
    void weightVectorMustMatchSourceLength() {
        NetworkBlueprint blueprint = new NetworkBlueprint("bad", List.of(SENSOR),
                List.of(neuron("a", new WeightedInput("s", new double[]{1}))),
                List.of(new ActuatorNode("out", "o", 1, List.of("a"))));

        assertThatInvalid(blueprint, "expected 2");
    }

    @Test
    void unknownInputIsRejected() {
        NetworkBlueprint blueprint = new NetworkBlueprint("bad", List.of(SENSOR),
                List.of(neuron("a", new WeightedInput("ghost", new double[]{1}))),
                List.of(new ActuatorNode("out", "o", 1, List.of("a"))));

        assertThatInvalid(blueprint, "unknown input 'ghost'");
    }

    @Test
    void actuatorVectorLengthMustEqualFanIn() {
        NetworkBlueprint blueprint = new NetworkBlueprint("bad", List.of(SENSOR),
                List.of(neuron("a", new WeightedInput("s", new double[]{1, 1}))),
                List.of(new ActuatorNode("out", "o", 2, List.of("a"))));

        assertThatInvalid(blueprint, "vector length 2");
    }

    @Test
    void actuatorMustReferToNeurons() {
        NetworkBlueprint blueprint = new NetworkBlueprint("bad", List.of(SENSOR),
                List.of(neuron("a", new WeightedInput("s", new double[]{1, 1}))),
                List.of(new ActuatorNode("out", "o", 1, List.of("s"))));

        assertThatInvalid(blueprint, "unknown neuron 's'");
    }

    @Test
    void duplicateIdsAreRejected() {
        NetworkBlueprint blueprint = new NetworkBlueprint("bad", List.of(SENSOR),
                List.of(neuron("s", new WeightedInput("s", new double[]{1, 1}))),
                List.of(new ActuatorNode("out", "o", 1, List.of("s"))));

        assertThatInvalid(blueprint, "duplicate");
    }

    @Test
    void cyclesBetweenNeuronsAreRejected() {
        NetworkBlueprint blueprint = new NetworkBlueprint("bad", List.of(SENSOR),
                List.of(neuron("a", new WeightedInput("s", new double[]{1, 1}), new WeightedInput("b", new double[]{1})),
                        neuron("b", new WeightedInput("a", new double[]{1}))),
                List.of(new ActuatorNode("out", "o", 1, List.of("b"))));

        assertThatInvalid(blueprint, "cycle");
    }

    @Test
    void networkNeedsSensorsAndActuators() {
        assertThatInvalid(new NetworkBlueprint("bad", List.of(), List.of(), List.of()), "no sensors");
        assertThatInvalid(new NetworkBlueprint("bad", List.of(SENSOR), List.of(), List.of()), "no actuators");
    }

    private static NeuronNode neuron(String id, WeightedInput... inputs) {
        return new NeuronNode(id, ActivationFunction.TANH, List.of(inputs), 0.0);
    }

    private static void assertThatInvalid(NetworkBlueprint blueprint, String message) {
        assertThatThrownBy(blueprint::validate)
                .isInstanceOf(NetworkConfigurationException.class)
                .hasMessageContaining(message);
    }
}
