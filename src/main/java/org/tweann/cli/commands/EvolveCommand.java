package org.tweann.cli.commands;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigValueFactory;
import org.tweann.cli.CommandLineInterface;
import org.tweann.genotype.Genotype;
import org.tweann.genotype.io.GenotypeWriter;
import org.tweann.orchestration.EvolutionEngine;
import org.tweann.orchestration.EvolutionService;
import org.tweann.orchestration.EvolutionStatus;
import org.tweann.orchestration.api.IService;
import org.tweann.orchestration.api.OperationalError;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

@Command(
    name = "evolve",
    description = "Evolve a population and save the best genotype"
)
public class EvolveCommand implements Callable<Integer> {

    @Option(
        names = {"-g", "--generations"},
        description = "Number of generations to run (default: ${DEFAULT-VALUE})"
    )
    private int generations = 50;

    @Option(
        names = {"-o", "--output"},
        description = "File the best genotype is written to (default: ${DEFAULT-VALUE})"
    )
    private Path output = Path.of("best-genotype.pb");

    @Option(
        names = {"-s", "--seed"},
        description = "Overrides tweann.seed"
    )
    private Long seed;

    @Option(
        names = {"-p", "--parallelism"},
        description = "Overrides tweann.evaluation.parallelism"
    )
    private Integer parallelism;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        Config config = parent.getConfig().getConfig("tweann");
        if (seed != null) {
            config = config.withValue("seed", ConfigValueFactory.fromAnyRef(seed));
        }
        if (parallelism != null) {
            config = config.withValue("evaluation.parallelism", ConfigValueFactory.fromAnyRef(parallelism));
        }

        try (EvolutionEngine engine = EvolutionEngine.create(config)) {
            EvolutionService service = new EvolutionService("evolution", config.getConfig("orchestration"), engine);
            service.startEvolution(generations, (generation, bestFitness, statistics) -> {
                out.printf("generation %d: best %.6f, species %d%n", generation, bestFitness,
                        statistics.speciesCountHistory().get(statistics.generationsCompleted() - 1));
                out.flush();
            });
            awaitTermination(service);

            if (service.getStatus() == EvolutionStatus.ERROR) {
                err.println("Evolution failed after " + service.getGenerationsCompleted() + " generations");
                for (OperationalError error : service.getErrors()) {
                    err.println("  " + error.code() + ": " + error.details());
                }
                return 1;
            }

            Optional<Genotype> best = service.getBest();
            if (best.isEmpty()) {
                err.println("No genotype was evaluated");
                return 1;
            }
            new GenotypeWriter().writeFile(output, List.of(best.get()));
            out.printf("Best genotype %s (fitness %.6f) written to %s%n", best.get().getId(), best.get().getFitness(),
                    output.toAbsolutePath());
            return 0;
        } catch (IOException e) {
            err.println("Failed to write " + output + ": " + e.getMessage());
            return 1;
        }
    }

    private static void awaitTermination(EvolutionService service) throws InterruptedException {
        while (service.getCurrentState() == IService.State.RUNNING
                || service.getCurrentState() == IService.State.PAUSED) {
            Thread.sleep(50);
        }
    }
}
