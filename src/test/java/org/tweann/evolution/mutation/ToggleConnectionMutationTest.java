package org.tweann.evolution.mutation;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.tweann.genotype.ConnectionGene;
import org.tweann.genotype.Genotype;
import org.tweann.runtime.internal.services.SeededRandomProvider;
import org.tweann.test.utils.GenotypeTestUtils;

@Tag("unit")
class ToggleConnectionMutationTest {

    @Test
    void togglesOneConnectionAndKeepsLastActiveInput() {
        ToggleConnectionMutation mutation = new ToggleConnectionMutation(new SeededRandomProvider(1), 1.0);
        Genotype original = GenotypeTestUtils.minimal("g");

        Genotype once = mutation.mutate(original);
        assertThat(once.getConnections()).filteredOn(c -> !c.enabled()).singleElement()
                .satisfies(c -> assertThat(c.isBias()).isFalse());

        // The remaining sensor gene is the output's only active input, so only the disabled one may flip.
        Genotype twice = mutation.mutate(once);
        assertThat(twice).isEqualTo(original);
    }

    @Test
    void onlyActiveInputIsNeverDisabled() {
        Genotype base = GenotypeTestUtils.minimal("g");
        List<ConnectionGene> connections = new ArrayList<>();
        for (ConnectionGene c : base.getConnections()) {
            if (c.isBias() || c.sourceIndex() == 0) {
                connections.add(c);
            }
        }
        Genotype genotype = base.toBuilder().connections(connections).build();

        assertThat(new ToggleConnectionMutation(new SeededRandomProvider(2), 1.0).mutate(genotype)).isSameAs(genotype);
    }

    @Test
    void zeroRateReturnsSameInstance() {
        Genotype genotype = GenotypeTestUtils.hidden("g");

        assertThat(new ToggleConnectionMutation(new SeededRandomProvider(3), 0.0).mutate(genotype)).isSameAs(genotype);
    }
}
