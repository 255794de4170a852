package org.tweann.evaluation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.tweann.genotype.Genotype;
import org.tweann.runtime.NetworkFailureException;
import org.tweann.test.utils.GenotypeTestUtils;

@Tag("unit")
@ExtendWith(MockitoExtension.class)
class FitnessEvaluationDispatcherTest {

    @Mock
    private IFitnessEvaluator evaluator;

    @Test
    void outcomesFollowInputOrder() throws Exception {
        when(evaluator.evaluate(any())).thenAnswer(inv -> {
            Genotype genotype = inv.getArgument(0);
            return Double.parseDouble(genotype.getId().substring(1));
        });
        List<Genotype> genotypes = new ArrayList<>();
        for (int i = 0; i < 9; i++) {
            genotypes.add(GenotypeTestUtils.minimal("g" + i));
        }

        try (FitnessEvaluationDispatcher dispatcher = new FitnessEvaluationDispatcher(evaluator, 3)) {
            List<EvaluationOutcome> outcomes = dispatcher.evaluateAll(genotypes);

            assertThat(outcomes).extracting(EvaluationOutcome::fitness)
                    .containsExactly(0.0, 1.0, 2.0, 3.0, 4.0, 5.0, 6.0, 7.0, 8.0);
            assertThat(outcomes).noneMatch(EvaluationOutcome::isFailed);
            assertThat(dispatcher.getEvaluationCount()).isEqualTo(9);
        }
    }

    @Test
    void failuresAreIsolatedPerGenotype() throws Exception {
        Genotype healthy = GenotypeTestUtils.minimal("healthy");
        Genotype crashing = GenotypeTestUtils.minimal("crashing");
        Genotype timingOut = GenotypeTestUtils.minimal("timing-out");
        Genotype nan = GenotypeTestUtils.minimal("nan");
        when(evaluator.evaluate(healthy)).thenReturn(0.75);
        when(evaluator.evaluate(crashing)).thenThrow(new IllegalStateException("boom"));
        when(evaluator.evaluate(timingOut)).thenThrow(new NetworkFailureException("did not finish within 5ms"));
        when(evaluator.evaluate(nan)).thenReturn(Double.NaN);

        try (FitnessEvaluationDispatcher dispatcher = new FitnessEvaluationDispatcher(evaluator, 2)) {
            List<EvaluationOutcome> outcomes = dispatcher.evaluateAll(List.of(healthy, crashing, timingOut, nan));

            assertThat(outcomes.get(0)).isEqualTo(EvaluationOutcome.success("healthy", 0.75));
            assertThat(outcomes.subList(1, 4)).allSatisfy(outcome -> {
                assertThat(outcome.isFailed()).isTrue();
                assertThat(outcome.fitness()).isZero();
            });
            assertThat(outcomes.get(1).failureReason()).isEqualTo("boom");
            assertThat(outcomes.get(2).failureReason()).contains("did not finish");
            assertThat(outcomes.get(3).failureReason()).contains("NaN");
            assertThat(dispatcher.getFailureCount()).isEqualTo(3);
        }
    }

    @Test
    void interruptAbandonsBatchInsteadOfFailingGenotypes() throws Exception {
        when(evaluator.evaluate(any())).thenAnswer(inv -> {
            Thread.currentThread().interrupt();
            throw new NetworkFailureException("Interrupted while running network g0");
        });
        List<Genotype> genotypes = List.of(GenotypeTestUtils.minimal("g0"), GenotypeTestUtils.minimal("g1"));

        try (FitnessEvaluationDispatcher dispatcher = new FitnessEvaluationDispatcher(evaluator, 1)) {
            try {
                assertThatThrownBy(() -> dispatcher.evaluateAll(genotypes))
                        .isInstanceOf(EvaluationInterruptedException.class)
                        .hasCauseInstanceOf(NetworkFailureException.class);
                assertThat(Thread.currentThread().isInterrupted()).isTrue();
            } finally {
                Thread.interrupted();
            }

            assertThat(dispatcher.getFailureCount()).isZero();
            verify(evaluator, times(1)).evaluate(any());
        }
    }

    @Test
    void outcomeAppliesFitnessAndStatus() {
        Genotype genotype = GenotypeTestUtils.minimal("g");

        Genotype failed = EvaluationOutcome.failure("g", "broken").applyTo(genotype);

        assertThat(failed.getStatus()).isEqualTo(Genotype.EvaluationStatus.FAILED);
        assertThat(failed.isEvaluated()).isTrue();
        assertThat(failed.getFitness()).isZero();
    }

    @Test
    void closeShutsDownPool() {
        EvaluationWorkerPool pool = mock(EvaluationWorkerPool.class);

        new FitnessEvaluationDispatcher(evaluator, pool).close();

        verify(pool).shutdown();
    }
}
