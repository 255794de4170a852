package org.tweann.evolution;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import org.tweann.genotype.ActuatorRef;
import org.tweann.genotype.ConnectionGene;
import org.tweann.genotype.Genotype;
import org.tweann.genotype.NodeGene;
import org.tweann.genotype.SensorRef;
import org.tweann.runtime.functions.FunctionCatalog;

/**
 * Builds fully connected, layered seed genotypes from a {@link Morphology}.
 * <p>
 * The first layer receives every element of every sensor, each later layer every neuron of the
 * layer before it. The last layer has one neuron per actuator element and is split across the
 * actuators in declaration order. Node ids depend only on the morphology, so all seed genotypes of a
 * population share their innovation numbers and differ only in weights.
 */
public class GenotypeConstructor {

    private final Morphology morphology;
    private final List<SensorRef> sensors = new ArrayList<>();
    private final List<FunctionCatalog.ActuatorType> actuatorTypes = new ArrayList<>();

    /**
     * @param morphology The seed shape.
     * @throws org.tweann.runtime.NetworkConfigurationException if a sensor or actuator name is unknown.
     */
    public GenotypeConstructor(Morphology morphology) {
        this.morphology = morphology;
        for (int i = 0; i < morphology.sensors().size(); i++) {
            FunctionCatalog.SensorType type = FunctionCatalog.sensor(morphology.sensors().get(i));
            sensors.add(new SensorRef("sensor:" + type.functionName() + ":" + i, type.functionName(), type.vectorLength()));
        }
        for (String name : morphology.actuators()) {
            actuatorTypes.add(FunctionCatalog.actuator(name));
        }
    }

    public Morphology getMorphology() {
        return morphology;
    }

    /**
     * Creates a seed genotype with random weights.
     *
     * @param id         Genotype id.
     * @param generation Generation the genotype is created in.
     * @param random     Source for weights.
     * @return The new, unevaluated genotype.
     */
    public Genotype construct(String id, int generation, Random random) {
        Genotype.Builder builder = Genotype.builder(id).generationCreated(generation);
        builder.node(NodeGene.bias());
        for (SensorRef sensor : sensors) {
            builder.node(NodeGene.sensor(sensor.id())).sensor(sensor);
        }

        int outputs = 0;
        for (FunctionCatalog.ActuatorType type : actuatorTypes) {
            outputs += type.vectorLength();
        }
        List<Integer> densities = new ArrayList<>(morphology.hiddenLayers());
        densities.add(outputs);

        List<String> previous = null;
        for (int layer = 1; layer <= densities.size(); layer++) {
            List<String> current = new ArrayList<>();
            for (int n = 0; n < densities.get(layer - 1); n++) {
                String neuronId = "neuron:L" + layer + ":" + n;
                current.add(neuronId);
                builder.node(NodeGene.neuron(neuronId, morphology.activation(), layer));
                if (previous == null) {
                    for (SensorRef sensor : sensors) {
                        for (int index = 0; index < sensor.vectorLength(); index++) {
                            builder.connection(ConnectionGene.of(sensor.id(), neuronId, index, weight(random)));
                        }
                    }
                } else {
                    for (String source : previous) {
                        builder.connection(ConnectionGene.of(source, neuronId, 0, weight(random)));
                    }
                }
                builder.connection(ConnectionGene.of(NodeGene.BIAS_ID, neuronId, 0, weight(random)));
            }
            previous = current;
        }

        int offset = 0;
        for (int a = 0; a < actuatorTypes.size(); a++) {
            FunctionCatalog.ActuatorType type = actuatorTypes.get(a);
            String actuatorId = "actuator:" + type.functionName() + ":" + a;
            List<String> fanIn = previous.subList(offset, offset + type.vectorLength());
            offset += type.vectorLength();
            builder.node(NodeGene.actuator(actuatorId))
                    .actuator(new ActuatorRef(actuatorId, type.functionName(), type.vectorLength(), fanIn));
        }
        return builder.build();
    }

    private double weight(Random random) {
        return (random.nextDouble() * 2.0 - 1.0) * morphology.initialWeightRange();
    }
}
