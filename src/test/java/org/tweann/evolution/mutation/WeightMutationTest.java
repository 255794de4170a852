package org.tweann.evolution.mutation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;

import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.tweann.genotype.ConnectionGene;
import org.tweann.genotype.Genotype;
import org.tweann.runtime.internal.services.SeededRandomProvider;
import org.tweann.test.utils.GenotypeTestUtils;

@Tag("unit")
class WeightMutationTest {

    @Test
    void perturbationStaysWithinPowerAndKeepsStructure() {
        Genotype original = GenotypeTestUtils.hidden("g");
        WeightMutation mutation = new WeightMutation(new SeededRandomProvider(1), 1.0, 1.0, 0.5, 2.0);

        Genotype mutated = mutation.mutate(original);

        assertThat(mutated.getConnections()).hasSameSizeAs(original.getConnections());
        for (int i = 0; i < original.getConnections().size(); i++) {
            ConnectionGene before = original.getConnections().get(i);
            ConnectionGene after = mutated.getConnections().get(i);
            assertThat(after.innovation()).isEqualTo(before.innovation());
            assertThat(Math.abs(after.weight() - before.weight())).isLessThanOrEqualTo(0.5);
        }
        assertThat(mutated.getNodes()).isEqualTo(original.getNodes());
    }

    @Test
    void replacementDrawsFromWeightRange() {
        WeightMutation mutation = new WeightMutation(new SeededRandomProvider(2), 1.0, 0.0, 0.5, 2.0);

        Genotype mutated = mutation.mutate(GenotypeTestUtils.hidden("g"));

        assertThat(mutated.getConnections())
                .allSatisfy(c -> assertThat(c.weight()).isGreaterThanOrEqualTo(-2.0).isLessThan(2.0));
        assertThat(mutated).isNotEqualTo(GenotypeTestUtils.hidden("g"));
    }

    @Test
    void disabledConnectionsKeepTheirWeight() {
        Genotype base = GenotypeTestUtils.minimal("g");
        List<ConnectionGene> connections = new ArrayList<>();
        for (ConnectionGene c : base.getConnections()) {
            connections.add(c.sourceIndex() == 1 && !c.isBias() ? c.withEnabled(false) : c);
        }
        Genotype genotype = base.toBuilder().connections(connections).build();

        Genotype mutated = new WeightMutation(new SeededRandomProvider(3), 1.0, 0.0, 0.5, 2.0).mutate(genotype);

        for (int i = 0; i < connections.size(); i++) {
            if (!genotype.getConnections().get(i).enabled()) {
                assertThat(mutated.getConnections().get(i).weight()).isEqualTo(-0.5);
            }
        }
    }

    @Test
    void zeroRateReturnsSameInstance() {
        Genotype genotype = GenotypeTestUtils.hidden("g");

        assertThat(new WeightMutation(new SeededRandomProvider(4), 0.0, 0.9, 0.5, 2.0).mutate(genotype))
                .isSameAs(genotype);
    }

    @Test
    void sameSeedProducesSameWeights() {
        Genotype genotype = GenotypeTestUtils.hidden("g");
        var options = ConfigFactory.parseString("rate = 0.5");

        Genotype first = new WeightMutation(new SeededRandomProvider(5), options).mutate(genotype);
        Genotype second = new WeightMutation(new SeededRandomProvider(5), options).mutate(genotype);

        assertThat(first).isEqualTo(second);
    }

    @Test
    void invalidRatesAreRejected() {
        SeededRandomProvider random = new SeededRandomProvider(6);

        assertThatThrownBy(() -> new WeightMutation(random, 1.5, 0.9, 0.5, 2.0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("rate");
        assertThatThrownBy(() -> new WeightMutation(random, 0.5, 0.9, 0.5, 0.0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("weight-range");
    }
}
