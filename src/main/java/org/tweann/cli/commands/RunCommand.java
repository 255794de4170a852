package org.tweann.cli.commands;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;

import com.typesafe.config.Config;
import org.tweann.cli.CommandLineInterface;
import org.tweann.genotype.Genotype;
import org.tweann.genotype.io.GenotypeFormatException;
import org.tweann.genotype.io.GenotypeReader;
import org.tweann.genotype.io.GenotypeWriter;
import org.tweann.runtime.Network;
import org.tweann.runtime.NetworkConfigurationException;
import org.tweann.runtime.NetworkFailureException;
import org.tweann.runtime.NetworkResult;
import org.tweann.runtime.PhenotypeMapper;
import org.tweann.runtime.functions.FunctionBindings;
import org.tweann.runtime.internal.services.SeededRandomProvider;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

@Command(
    name = "run",
    description = "Run the phenotype of a stored genotype with the built-in sensor and actuator functions"
)
public class RunCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Genotype file")
    private Path file;

    @Option(
        names = {"-n", "--steps"},
        description = "Number of sense-think-act cycles (default: ${DEFAULT-VALUE})"
    )
    private int steps = 1;

    @Option(
        names = {"-i", "--index"},
        description = "Position of the genotype in the file (default: ${DEFAULT-VALUE})"
    )
    private int index = 0;

    @Option(
        names = {"-t", "--timeout"},
        description = "Maximum run time in seconds (default: ${DEFAULT-VALUE})"
    )
    private long timeoutSeconds = 10;

    @Option(
        names = {"--save-weights"},
        description = "Write the genotype with the weights reported by the neurons to this file"
    )
    private Path saveWeights;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        if (steps < 1) {
            err.println("--steps must be at least 1");
            return 2;
        }
        Config config = parent.getConfig().getConfig("tweann");
        long seed = config.hasPath("seed") ? config.getLong("seed") : 42L;

        try {
            List<Genotype> genotypes = new GenotypeReader().readFile(file);
            if (index < 0 || index >= genotypes.size()) {
                err.println("File " + file + " holds " + genotypes.size() + " genotypes, no index " + index);
                return 1;
            }
            Genotype genotype = genotypes.get(index);

            NetworkResult result;
            try (Network network = PhenotypeMapper.instantiate(genotype,
                    FunctionBindings.defaults(new SeededRandomProvider(seed)))) {
                result = network.run(steps, Duration.ofSeconds(timeoutSeconds));
            }
            out.printf("Network %s completed %d cycles%n", result.networkId(), result.cyclesCompleted());

            if (saveWeights != null) {
                new GenotypeWriter().writeFile(saveWeights, List.of(PhenotypeMapper.applyBackup(genotype, result)));
                out.println("Weights written to " + saveWeights.toAbsolutePath());
            }
            return 0;
        } catch (IOException e) {
            err.println("Failed to access genotype file: " + e.getMessage());
            return 1;
        } catch (GenotypeFormatException | NetworkConfigurationException e) {
            err.println("Invalid genotype: " + e.getMessage());
            return 1;
        } catch (NetworkFailureException e) {
            err.println("Network run failed: " + e.getMessage());
            return 1;
        }
    }
}
