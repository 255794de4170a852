package org.tweann.genotype.io;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tweann.genotype.ActuatorRef;
import org.tweann.genotype.ConnectionGene;
import org.tweann.genotype.Genotype;
import org.tweann.genotype.NodeGene;
import org.tweann.genotype.SensorRef;
import org.tweann.genotype.contracts.ActuatorRecord;
import org.tweann.genotype.contracts.ConnectionRecord;
import org.tweann.genotype.contracts.EvaluationStatusProto;
import org.tweann.genotype.contracts.GenotypeHeader;
import org.tweann.genotype.contracts.GenotypeRecord;
import org.tweann.genotype.contracts.NodeKindProto;
import org.tweann.genotype.contracts.NodeRecord;
import org.tweann.genotype.contracts.SensorRecord;

/**
 * Encodes genotypes as length-delimited {@link GenotypeRecord} streams.
 * <p>
 * Each genotype becomes one header record followed by its sensor, actuator, node and connection
 * records, in that order. Several genotypes can be appended to the same stream.
 */
public final class GenotypeWriter {

    private static final Logger log = LoggerFactory.getLogger(GenotypeWriter.class);

    /**
     * Converts a genotype into its ordered record sequence.
     *
     * @param genotype The genotype to encode.
     * @return Header first, then sensors, actuators, nodes and connections.
     */
    public List<GenotypeRecord> toRecords(Genotype genotype) {
        List<GenotypeRecord> records = new ArrayList<>();

        GenotypeHeader.Builder header = GenotypeHeader.newBuilder()
                .setId(genotype.getId())
                .setFitness(genotype.getFitness())
                .setAdjustedFitness(genotype.getAdjustedFitness())
                .setGenerationCreated(genotype.getGenerationCreated())
                .setStatus(toProto(genotype.getStatus()))
                .setSensorCount(genotype.getSensors().size())
                .setActuatorCount(genotype.getActuators().size())
                .setNodeCount(genotype.getNodes().size())
                .setConnectionCount(genotype.getConnections().size());
        if (genotype.getSpeciesId() != null) {
            header.setSpeciesId(genotype.getSpeciesId());
        }
        records.add(GenotypeRecord.newBuilder().setHeader(header).build());

        for (SensorRef sensor : genotype.getSensors()) {
            records.add(GenotypeRecord.newBuilder().setSensor(SensorRecord.newBuilder()
                    .setId(sensor.id())
                    .setFunction(sensor.function())
                    .setVectorLength(sensor.vectorLength())).build());
        }
        for (ActuatorRef actuator : genotype.getActuators()) {
            records.add(GenotypeRecord.newBuilder().setActuator(ActuatorRecord.newBuilder()
                    .setId(actuator.id())
                    .setFunction(actuator.function())
                    .setVectorLength(actuator.vectorLength())
                    .addAllFanIn(actuator.fanIn())).build());
        }
        for (NodeGene node : genotype.getNodes()) {
            NodeRecord.Builder nodeRecord = NodeRecord.newBuilder()
                    .setId(node.id())
                    .setKind(toProto(node))
                    .setLayer(node.layer())
                    .setInnovation(node.innovation());
            if (node.activation() != null) {
                nodeRecord.setActivation(node.activation().name());
            }
            records.add(GenotypeRecord.newBuilder().setNode(nodeRecord).build());
        }
        for (ConnectionGene c : genotype.getConnections()) {
            records.add(GenotypeRecord.newBuilder().setConnection(ConnectionRecord.newBuilder()
                    .setSource(c.source())
                    .setTarget(c.target())
                    .setSourceIndex(c.sourceIndex())
                    .setWeight(c.weight())
                    .setEnabled(c.enabled())
                    .setInnovation(c.innovation())
                    .setRecurrent(c.recurrent())).build());
        }
        return records;
    }

    /**
     * Writes one genotype to the stream. The stream is not closed.
     */
    public void write(Genotype genotype, OutputStream out) throws IOException {
        for (GenotypeRecord record : toRecords(genotype)) {
            record.writeDelimitedTo(out);
        }
    }

    /**
     * Writes the genotypes to the stream in order. The stream is not closed.
     */
    public void writeAll(List<Genotype> genotypes, OutputStream out) throws IOException {
        for (Genotype genotype : genotypes) {
            write(genotype, out);
        }
    }

    /**
     * Writes the genotypes to a file, replacing it atomically.
     * <p>
     * The records go to a temporary file in the same directory first, which is then moved over the
     * target so readers never observe a partially written file.
     *
     * @param file      Target file.
     * @param genotypes Genotypes to store.
     * @throws IOException if writing or moving fails.
     */
    public void writeFile(Path file, List<Genotype> genotypes) throws IOException {
        Path absolute = file.toAbsolutePath();
        Path dir = absolute.getParent();
        if (dir != null) {
            Files.createDirectories(dir);
        }
        Path temp = Files.createTempFile(dir, absolute.getFileName().toString(), ".tmp");
        try {
            try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(temp))) {
                writeAll(genotypes, out);
            }
            Files.move(temp, absolute, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            Files.deleteIfExists(temp);
            throw e;
        }
        log.debug("Wrote {} genotype(s) to {}", genotypes.size(), absolute);
    }

    private static EvaluationStatusProto toProto(Genotype.EvaluationStatus status) {
        return switch (status) {
            case UNEVALUATED -> EvaluationStatusProto.EVALUATION_STATUS_UNEVALUATED;
            case EVALUATED -> EvaluationStatusProto.EVALUATION_STATUS_EVALUATED;
            case FAILED -> EvaluationStatusProto.EVALUATION_STATUS_FAILED;
        };
    }

    private static NodeKindProto toProto(NodeGene node) {
        return switch (node.kind()) {
            case SENSOR -> NodeKindProto.NODE_KIND_SENSOR;
            case NEURON -> NodeKindProto.NODE_KIND_NEURON;
            case ACTUATOR -> NodeKindProto.NODE_KIND_ACTUATOR;
            case BIAS -> NodeKindProto.NODE_KIND_BIAS;
        };
    }
}
