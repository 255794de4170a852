package org.tweann.cli.commands;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import org.tweann.genotype.contracts.ActuatorRecord;
import org.tweann.genotype.contracts.ConnectionRecord;
import org.tweann.genotype.contracts.GenotypeHeader;
import org.tweann.genotype.contracts.GenotypeRecord;
import org.tweann.genotype.contracts.NodeRecord;
import org.tweann.genotype.contracts.SensorRecord;
import org.tweann.genotype.io.GenotypeReader;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

@Command(
    name = "inspect",
    description = "Print the records of a genotype file as JSON lines"
)
public class InspectCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Genotype file")
    private Path file;

    @Spec
    private CommandSpec spec;

    private final Gson gson = new Gson();

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        List<GenotypeRecord> records;
        try (InputStream in = new BufferedInputStream(Files.newInputStream(file))) {
            records = new GenotypeReader().readRecords(in);
        } catch (IOException e) {
            spec.commandLine().getErr().println("Failed to read " + file + ": " + e.getMessage());
            return 1;
        }
        for (GenotypeRecord record : records) {
            out.println(gson.toJson(toJson(record)));
        }
        out.flush();
        return 0;
    }

    static JsonObject toJson(GenotypeRecord record) {
        JsonObject json = new JsonObject();
        switch (record.getRecordCase()) {
            case HEADER -> {
                GenotypeHeader header = record.getHeader();
                json.addProperty("type", "header");
                json.addProperty("id", header.getId());
                json.addProperty("fitness", header.getFitness());
                json.addProperty("adjustedFitness", header.getAdjustedFitness());
                json.addProperty("speciesId", header.getSpeciesId());
                json.addProperty("generationCreated", header.getGenerationCreated());
                json.addProperty("status", header.getStatus().name());
                json.addProperty("sensors", header.getSensorCount());
                json.addProperty("actuators", header.getActuatorCount());
                json.addProperty("nodes", header.getNodeCount());
                json.addProperty("connections", header.getConnectionCount());
            }
            case SENSOR -> {
                SensorRecord sensor = record.getSensor();
                json.addProperty("type", "sensor");
                json.addProperty("id", sensor.getId());
                json.addProperty("function", sensor.getFunction());
                json.addProperty("vectorLength", sensor.getVectorLength());
            }
            case ACTUATOR -> {
                ActuatorRecord actuator = record.getActuator();
                json.addProperty("type", "actuator");
                json.addProperty("id", actuator.getId());
                json.addProperty("function", actuator.getFunction());
                json.addProperty("vectorLength", actuator.getVectorLength());
                JsonArray fanIn = new JsonArray();
                actuator.getFanInList().forEach(fanIn::add);
                json.add("fanIn", fanIn);
            }
            case NODE -> {
                NodeRecord node = record.getNode();
                json.addProperty("type", "node");
                json.addProperty("id", node.getId());
                json.addProperty("kind", node.getKind().name());
                if (!node.getActivation().isEmpty()) {
                    json.addProperty("activation", node.getActivation());
                }
                json.addProperty("layer", node.getLayer());
                json.addProperty("innovation", node.getInnovation());
            }
            case CONNECTION -> {
                ConnectionRecord connection = record.getConnection();
                json.addProperty("type", "connection");
                json.addProperty("source", connection.getSource());
                json.addProperty("target", connection.getTarget());
                json.addProperty("sourceIndex", connection.getSourceIndex());
                json.addProperty("weight", connection.getWeight());
                json.addProperty("enabled", connection.getEnabled());
                json.addProperty("recurrent", connection.getRecurrent());
                json.addProperty("innovation", connection.getInnovation());
            }
            default -> json.addProperty("type", "unknown");
        }
        return json;
    }
}
