package org.tweann.genotype;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import it.unimi.dsi.fastutil.longs.Long2DoubleMap;
import it.unimi.dsi.fastutil.longs.LongOpenHashSet;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

/**
 * The evolvable encoding of one candidate network: node genes, connection genes, the sensor and
 * actuator references, and the bookkeeping the population manager attaches to it.
 * <p>
 * Genotypes are immutable. Every transformation ({@code with*} methods, mutation, crossover)
 * returns a new instance; a genotype can therefore be shared freely between evaluation threads.
 * <p>
 * Invariants checked on construction:
 * <ul>
 *   <li>node ids are unique and every connection endpoint refers to a known node</li>
 *   <li>connection genes are ordered by innovation number, and innovation numbers are unique
 *       (which rules out duplicate {@code (source, target, sourceIndex)} triples)</li>
 *   <li>sensors and the bias node are never targets, actuators are never sources</li>
 *   <li>every neuron has exactly one bias input</li>
 * </ul>
 */
public final class Genotype {

    /**
     * Whether the genotype's fitness value is meaningful.
     */
    public enum EvaluationStatus {
        UNEVALUATED,
        EVALUATED,
        /** The evaluation threw or timed out; fitness is recorded as 0. */
        FAILED
    }

    private final String id;
    private final List<NodeGene> nodes;
    private final List<ConnectionGene> connections;
    private final List<SensorRef> sensors;
    private final List<ActuatorRef> actuators;
    private final double fitness;
    private final double adjustedFitness;
    private final String speciesId;
    private final int generationCreated;
    private final EvaluationStatus status;

    private Genotype(Builder b) {
        this.id = Objects.requireNonNull(b.id, "id");
        this.nodes = List.copyOf(b.nodes);
        List<ConnectionGene> sorted = new ArrayList<>(b.connections);
        sorted.sort(Comparator.comparingLong(ConnectionGene::innovation));
        this.connections = Collections.unmodifiableList(sorted);
        this.sensors = List.copyOf(b.sensors);
        this.actuators = List.copyOf(b.actuators);
        this.fitness = b.fitness;
        this.adjustedFitness = b.adjustedFitness;
        this.speciesId = b.speciesId;
        this.generationCreated = b.generationCreated;
        this.status = Objects.requireNonNull(b.status, "status");
        validate();
    }

    private void validate() {
        Map<String, NodeGene> byId = new HashMap<>();
        for (NodeGene node : nodes) {
            if (byId.put(node.id(), node) != null) {
                throw new IllegalArgumentException("Genotype " + id + " has duplicate node id '" + node.id() + "'");
            }
        }

        LongOpenHashSet innovations = new LongOpenHashSet();
        Object2IntOpenHashMap<String> biasInputs = new Object2IntOpenHashMap<>();
        for (ConnectionGene c : connections) {
            NodeGene source = byId.get(c.source());
            NodeGene target = byId.get(c.target());
            if (source == null || target == null) {
                throw new IllegalArgumentException("Genotype " + id + " has connection " + c.source() + "->"
                        + c.target() + " referring to an unknown node");
            }
            if (target.kind() == NodeKind.SENSOR || target.kind() == NodeKind.BIAS) {
                throw new IllegalArgumentException("Genotype " + id + " has connection targeting " + target.kind()
                        + " node '" + target.id() + "'");
            }
            if (source.kind() == NodeKind.ACTUATOR) {
                throw new IllegalArgumentException("Genotype " + id + " has connection sourced at actuator '"
                        + source.id() + "'");
            }
            if (!innovations.add(c.innovation())) {
                throw new IllegalArgumentException("Genotype " + id + " has duplicate connection gene "
                        + c.source() + "[" + c.sourceIndex() + "]->" + c.target());
            }
            if (c.isBias()) {
                biasInputs.addTo(c.target(), 1);
            }
        }

        for (NodeGene node : nodes) {
            if (node.isNeuron() && biasInputs.getInt(node.id()) != 1) {
                throw new IllegalArgumentException("Neuron '" + node.id() + "' in genotype " + id
                        + " must have exactly one bias input, found " + biasInputs.getInt(node.id()));
            }
        }

        for (SensorRef sensor : sensors) {
            NodeGene node = byId.get(sensor.id());
            if (node == null || node.kind() != NodeKind.SENSOR) {
                throw new IllegalArgumentException("Sensor reference '" + sensor.id() + "' has no sensor node");
            }
        }
        for (ActuatorRef actuator : actuators) {
            NodeGene node = byId.get(actuator.id());
            if (node == null || node.kind() != NodeKind.ACTUATOR) {
                throw new IllegalArgumentException("Actuator reference '" + actuator.id() + "' has no actuator node");
            }
            for (String neuronId : actuator.fanIn()) {
                NodeGene fanIn = byId.get(neuronId);
                if (fanIn == null || !fanIn.isNeuron()) {
                    throw new IllegalArgumentException("Actuator '" + actuator.id() + "' fan-in '" + neuronId
                            + "' is not a neuron of genotype " + id);
                }
            }
        }
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    /**
     * Returns a builder pre-populated with this genotype's state.
     */
    public Builder toBuilder() {
        Builder b = new Builder(id);
        b.nodes.addAll(nodes);
        b.connections.addAll(connections);
        b.sensors.addAll(sensors);
        b.actuators.addAll(actuators);
        b.fitness = fitness;
        b.adjustedFitness = adjustedFitness;
        b.speciesId = speciesId;
        b.generationCreated = generationCreated;
        b.status = status;
        return b;
    }

    public String getId() {
        return id;
    }

    public List<NodeGene> getNodes() {
        return nodes;
    }

    /**
     * Returns the connection genes in ascending innovation order.
     */
    public List<ConnectionGene> getConnections() {
        return connections;
    }

    public List<SensorRef> getSensors() {
        return sensors;
    }

    public List<ActuatorRef> getActuators() {
        return actuators;
    }

    public double getFitness() {
        return fitness;
    }

    public double getAdjustedFitness() {
        return adjustedFitness;
    }

    /**
     * Returns the id of the species this genotype was last assigned to, or {@code null}.
     */
    public String getSpeciesId() {
        return speciesId;
    }

    public int getGenerationCreated() {
        return generationCreated;
    }

    public EvaluationStatus getStatus() {
        return status;
    }

    public boolean isEvaluated() {
        return status != EvaluationStatus.UNEVALUATED;
    }

    public Optional<NodeGene> findNode(String nodeId) {
        for (NodeGene node : nodes) {
            if (node.id().equals(nodeId)) {
                return Optional.of(node);
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the highest connection innovation number, or -1 for a genotype without connections.
     */
    public long maxInnovation() {
        return connections.isEmpty() ? -1L : connections.get(connections.size() - 1).innovation();
    }

    public Genotype withId(String newId) {
        Builder b = toBuilder();
        b.id = newId;
        return b.build();
    }

    /**
     * Records an evaluation result.
     *
     * @param newFitness The raw fitness.
     * @param newStatus  {@link EvaluationStatus#EVALUATED} or {@link EvaluationStatus#FAILED}.
     */
    public Genotype withFitness(double newFitness, EvaluationStatus newStatus) {
        return toBuilder().fitness(newFitness).status(newStatus).build();
    }

    public Genotype withAdjustedFitness(double newAdjustedFitness) {
        return toBuilder().adjustedFitness(newAdjustedFitness).build();
    }

    public Genotype withSpeciesId(String newSpeciesId) {
        return toBuilder().speciesId(newSpeciesId).build();
    }

    /**
     * Returns an unevaluated copy with fitness values cleared, as used for offspring.
     */
    public Genotype asOffspring(String newId, int generation) {
        Builder b = toBuilder();
        b.id = newId;
        return b.fitness(0.0).adjustedFitness(0.0).status(EvaluationStatus.UNEVALUATED)
                .generationCreated(generation).build();
    }

    /**
     * Writes back connection weights keyed by innovation number, leaving all other genes untouched.
     *
     * @param weightsByInnovation Replacement weights; innovations not present keep their weight.
     * @return The updated genotype.
     */
    public Genotype withConnectionWeights(Long2DoubleMap weightsByInnovation) {
        List<ConnectionGene> updated = new ArrayList<>(connections.size());
        for (ConnectionGene c : connections) {
            updated.add(weightsByInnovation.containsKey(c.innovation())
                    ? c.withWeight(weightsByInnovation.get(c.innovation()))
                    : c);
        }
        return toBuilder().connections(updated).build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Genotype other)) return false;
        return Double.compare(fitness, other.fitness) == 0
                && Double.compare(adjustedFitness, other.adjustedFitness) == 0
                && generationCreated == other.generationCreated
                && id.equals(other.id)
                && nodes.equals(other.nodes)
                && connections.equals(other.connections)
                && sensors.equals(other.sensors)
                && actuators.equals(other.actuators)
                && Objects.equals(speciesId, other.speciesId)
                && status == other.status;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, nodes, connections, sensors, actuators, fitness, adjustedFitness,
                speciesId, generationCreated, status);
    }

    @Override
    public String toString() {
        return "Genotype{id=" + id + ", nodes=" + nodes.size() + ", connections=" + connections.size()
                + ", fitness=" + fitness + ", species=" + speciesId + ", status=" + status + "}";
    }

    /**
     * Mutable builder for {@link Genotype}. Validation happens in {@link #build()}.
     */
    public static final class Builder {
        private String id;
        private final List<NodeGene> nodes = new ArrayList<>();
        private final List<ConnectionGene> connections = new ArrayList<>();
        private final List<SensorRef> sensors = new ArrayList<>();
        private final List<ActuatorRef> actuators = new ArrayList<>();
        private double fitness;
        private double adjustedFitness;
        private String speciesId;
        private int generationCreated;
        private EvaluationStatus status = EvaluationStatus.UNEVALUATED;

        private Builder(String id) {
            this.id = id;
        }

        public Builder node(NodeGene node) {
            nodes.add(node);
            return this;
        }

        public Builder nodes(List<NodeGene> newNodes) {
            nodes.clear();
            nodes.addAll(newNodes);
            return this;
        }

        public Builder connection(ConnectionGene connection) {
            connections.add(connection);
            return this;
        }

        public Builder connections(List<ConnectionGene> newConnections) {
            connections.clear();
            connections.addAll(newConnections);
            return this;
        }

        public Builder sensor(SensorRef sensor) {
            sensors.add(sensor);
            return this;
        }

        public Builder sensors(List<SensorRef> newSensors) {
            sensors.clear();
            sensors.addAll(newSensors);
            return this;
        }

        public Builder actuator(ActuatorRef actuator) {
            actuators.add(actuator);
            return this;
        }

        public Builder actuators(List<ActuatorRef> newActuators) {
            actuators.clear();
            actuators.addAll(newActuators);
            return this;
        }

        public Builder fitness(double value) {
            this.fitness = value;
            return this;
        }

        public Builder adjustedFitness(double value) {
            this.adjustedFitness = value;
            return this;
        }

        public Builder speciesId(String value) {
            this.speciesId = value;
            return this;
        }

        public Builder generationCreated(int value) {
            this.generationCreated = value;
            return this;
        }

        public Builder status(EvaluationStatus value) {
            this.status = value;
            return this;
        }

        /**
         * Returns the nodes added so far, keyed by id in insertion order.
         */
        public Map<String, NodeGene> nodesById() {
            Map<String, NodeGene> map = new LinkedHashMap<>();
            for (NodeGene node : nodes) {
                map.put(node.id(), node);
            }
            return map;
        }

        public Genotype build() {
            return new Genotype(this);
        }
    }
}
