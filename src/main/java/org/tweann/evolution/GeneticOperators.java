package org.tweann.evolution;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import it.unimi.dsi.fastutil.longs.LongOpenHashSet;
import org.tweann.evolution.mutation.AddConnectionMutation;
import org.tweann.evolution.mutation.AddNodeMutation;
import org.tweann.evolution.mutation.IMutationOperator;
import org.tweann.evolution.mutation.ToggleConnectionMutation;
import org.tweann.evolution.mutation.WeightMutation;
import org.tweann.genotype.ConnectionGene;
import org.tweann.genotype.Genotype;
import org.tweann.genotype.NodeGene;
import org.tweann.runtime.spi.IRandomProvider;

/**
 * Mutation, crossover and compatibility distance.
 * <p>
 * Mutations run in the fixed order weight, add-node, add-connection, toggle; each operator gates
 * itself with its own probability. Every operator and the crossover draw from their own stream
 * derived from the provider passed in, so a fixed seed reproduces the same offspring.
 * <p>
 * <strong>Thread Safety:</strong> Not thread-safe. The population manager calls it from a single
 * thread.
 */
public class GeneticOperators {

    private final List<IMutationOperator> mutations;
    private final CompatibilityDistance compatibility;
    private final Random crossoverRandom;

    /**
     * Creates the operators from the evolution configuration.
     *
     * @param randomProvider Source of randomness.
     * @param options        Configuration containing the {@code mutation} and {@code distance} sub-trees.
     */
    public GeneticOperators(IRandomProvider randomProvider, Config options) {
        Config mutation = options.getConfig("mutation");
        this.mutations = List.of(
                new WeightMutation(randomProvider.deriveFor("mutation.weight", 0), mutation.getConfig("weight")),
                new AddNodeMutation(randomProvider.deriveFor("mutation.add-node", 0), mutation.getConfig("add-node")),
                new AddConnectionMutation(randomProvider.deriveFor("mutation.add-connection", 0),
                        mutation.getConfig("add-connection")),
                new ToggleConnectionMutation(randomProvider.deriveFor("mutation.toggle", 0), mutation.getConfig("toggle")));
        this.compatibility = new CompatibilityDistance(
                options.hasPath("distance") ? options.getConfig("distance") : ConfigFactory.empty());
        this.crossoverRandom = randomProvider.deriveFor("crossover", 0).asJavaRandom();
    }

    GeneticOperators(List<IMutationOperator> mutations, CompatibilityDistance compatibility, Random crossoverRandom) {
        this.mutations = List.copyOf(mutations);
        this.compatibility = compatibility;
        this.crossoverRandom = crossoverRandom;
    }

    /**
     * Applies every mutation operator in order.
     *
     * @param genotype The genotype to mutate.
     * @return The mutated genotype; may be {@code genotype} itself if no operator fired.
     */
    public Genotype mutate(Genotype genotype) {
        Genotype current = genotype;
        for (IMutationOperator mutation : mutations) {
            current = mutation.mutate(current);
        }
        return current;
    }

    /**
     * Recombines two parents.
     * <p>
     * The fitter parent is {@code a} unless {@code b} has strictly higher fitness. Nodes are the
     * union of both parents by innovation number. Matching connection genes are taken from either
     * parent at random; disjoint and excess genes only from the fitter parent. Nodes contributed
     * only by the weaker parent keep their bias input so that every neuron still has one.
     *
     * @param a       First parent, preferred on ties.
     * @param b       Second parent.
     * @param childId Id of the child.
     * @return The unevaluated child.
     */
    public Genotype crossover(Genotype a, Genotype b, String childId) {
        Genotype fitter = b.getFitness() > a.getFitness() ? b : a;
        Genotype other = fitter == a ? b : a;

        LongOpenHashSet fitterNodes = new LongOpenHashSet();
        List<NodeGene> nodes = new ArrayList<>(fitter.getNodes());
        for (NodeGene node : fitter.getNodes()) {
            fitterNodes.add(node.innovation());
        }
        Set<String> inheritedFromOther = new HashSet<>();
        for (NodeGene node : other.getNodes()) {
            if (!fitterNodes.contains(node.innovation())) {
                nodes.add(node);
                inheritedFromOther.add(node.id());
            }
        }

        List<ConnectionGene> fc = fitter.getConnections();
        List<ConnectionGene> oc = other.getConnections();
        List<ConnectionGene> connections = new ArrayList<>(Math.max(fc.size(), oc.size()));
        int i = 0;
        int j = 0;
        while (i < fc.size() || j < oc.size()) {
            if (i < fc.size() && j < oc.size() && fc.get(i).innovation() == oc.get(j).innovation()) {
                ConnectionGene f = fc.get(i++);
                ConnectionGene o = oc.get(j++);
                ConnectionGene chosen = crossoverRandom.nextBoolean() ? f : o;
                // A connection recurrent in either parent stays recurrent, which keeps the child's
                // non-recurrent graph a subgraph of the fitter parent's.
                connections.add(chosen.withRecurrent(f.recurrent() || o.recurrent()));
            } else if (j >= oc.size() || (i < fc.size() && fc.get(i).innovation() < oc.get(j).innovation())) {
                connections.add(fc.get(i++));
            } else {
                ConnectionGene o = oc.get(j++);
                if (o.isBias() && inheritedFromOther.contains(o.target())) {
                    connections.add(o);
                }
            }
        }

        return Genotype.builder(childId)
                .nodes(nodes)
                .connections(connections)
                .sensors(fitter.getSensors())
                .actuators(fitter.getActuators())
                .speciesId(fitter.getSpeciesId())
                .generationCreated(fitter.getGenerationCreated() + 1)
                .build();
    }

    /**
     * Returns the compatibility distance of two genotypes. Symmetric.
     */
    public double distance(Genotype a, Genotype b) {
        return compatibility.distance(a, b);
    }
}
