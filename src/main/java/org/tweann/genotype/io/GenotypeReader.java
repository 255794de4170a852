package org.tweann.genotype.io;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tweann.genotype.ActuatorRef;
import org.tweann.genotype.ConnectionGene;
import org.tweann.genotype.Genotype;
import org.tweann.genotype.NodeGene;
import org.tweann.genotype.NodeKind;
import org.tweann.genotype.SensorRef;
import org.tweann.genotype.contracts.ActuatorRecord;
import org.tweann.genotype.contracts.ConnectionRecord;
import org.tweann.genotype.contracts.GenotypeHeader;
import org.tweann.genotype.contracts.GenotypeRecord;
import org.tweann.genotype.contracts.NodeRecord;
import org.tweann.genotype.contracts.SensorRecord;
import org.tweann.runtime.functions.ActivationFunction;

/**
 * Decodes length-delimited {@link GenotypeRecord} streams written by {@link GenotypeWriter}.
 */
public final class GenotypeReader {

    private static final Logger log = LoggerFactory.getLogger(GenotypeReader.class);

    /**
     * Reads every record in the stream without interpreting it.
     *
     * @param in The stream; it is not closed.
     * @return The records in stream order.
     * @throws IOException if a record cannot be parsed.
     */
    public List<GenotypeRecord> readRecords(InputStream in) throws IOException {
        List<GenotypeRecord> records = new ArrayList<>();
        while (true) {
            GenotypeRecord record = GenotypeRecord.parseDelimitedFrom(in);
            if (record == null) break;
            records.add(record);
        }
        return records;
    }

    /**
     * Reads all genotypes in the stream.
     *
     * @param in The stream; it is not closed.
     * @return The decoded genotypes in stream order.
     * @throws IOException            if the stream cannot be read.
     * @throws GenotypeFormatException if the records do not describe valid genotypes.
     */
    public List<Genotype> readAll(InputStream in) throws IOException, GenotypeFormatException {
        return fromRecords(readRecords(in));
    }

    /**
     * Reads all genotypes stored in a file.
     */
    public List<Genotype> readFile(Path file) throws IOException, GenotypeFormatException {
        try (InputStream in = new BufferedInputStream(Files.newInputStream(file))) {
            List<Genotype> genotypes = readAll(in);
            log.debug("Read {} genotype(s) from {}", genotypes.size(), file);
            return genotypes;
        }
    }

    /**
     * Reconstructs genotypes from an ordered record sequence.
     *
     * @param records Records as produced by {@link GenotypeWriter#toRecords(Genotype)}, possibly
     *                several genotypes back to back.
     * @return The genotypes.
     * @throws GenotypeFormatException if a record is out of place, a count does not match, or the
     *                                 reconstructed genotype violates its invariants.
     */
    public List<Genotype> fromRecords(List<GenotypeRecord> records) throws GenotypeFormatException {
        List<Genotype> genotypes = new ArrayList<>();
        int pos = 0;
        while (pos < records.size()) {
            GenotypeRecord first = records.get(pos);
            if (first.getRecordCase() != GenotypeRecord.RecordCase.HEADER) {
                throw new GenotypeFormatException("Expected header record at position " + pos
                        + " but found " + first.getRecordCase());
            }
            GenotypeHeader header = first.getHeader();
            int expected = bodySize(header);
            if (expected > records.size() - pos - 1) {
                throw new GenotypeFormatException("Genotype " + header.getId() + " is truncated: expected "
                        + expected + " records after header, found " + (records.size() - pos - 1));
            }
            genotypes.add(decode(header, records.subList(pos + 1, pos + 1 + expected)));
            pos += 1 + expected;
        }
        return genotypes;
    }

    private static int bodySize(GenotypeHeader header) throws GenotypeFormatException {
        int[] counts = {header.getSensorCount(), header.getActuatorCount(),
                header.getNodeCount(), header.getConnectionCount()};
        long total = 0;
        for (int count : counts) {
            if (count < 0) {
                throw new GenotypeFormatException("Genotype " + header.getId() + " has a negative record count: " + count);
            }
            total += count;
        }
        if (total > Integer.MAX_VALUE) {
            throw new GenotypeFormatException("Genotype " + header.getId() + " declares " + total + " records");
        }
        return (int) total;
    }

    private Genotype decode(GenotypeHeader header, List<GenotypeRecord> body) throws GenotypeFormatException {
        Genotype.Builder builder = Genotype.builder(header.getId())
                .fitness(header.getFitness())
                .adjustedFitness(header.getAdjustedFitness())
                .speciesId(header.getSpeciesId().isEmpty() ? null : header.getSpeciesId())
                .generationCreated(header.getGenerationCreated());

        int index = 0;
        try {
            builder.status(switch (header.getStatus()) {
                case EVALUATION_STATUS_UNEVALUATED -> Genotype.EvaluationStatus.UNEVALUATED;
                case EVALUATION_STATUS_EVALUATED -> Genotype.EvaluationStatus.EVALUATED;
                case EVALUATION_STATUS_FAILED -> Genotype.EvaluationStatus.FAILED;
                default -> throw new GenotypeFormatException("Unknown evaluation status in genotype "
                        + header.getId() + ": " + header.getStatusValue());
            });

            for (int i = 0; i < header.getSensorCount(); i++) {
                SensorRecord s = expect(body.get(index++), GenotypeRecord.RecordCase.SENSOR, header).getSensor();
                builder.sensor(new SensorRef(s.getId(), s.getFunction(), s.getVectorLength()));
            }
            for (int i = 0; i < header.getActuatorCount(); i++) {
                ActuatorRecord a = expect(body.get(index++), GenotypeRecord.RecordCase.ACTUATOR, header).getActuator();
                builder.actuator(new ActuatorRef(a.getId(), a.getFunction(), a.getVectorLength(), a.getFanInList()));
            }
            for (int i = 0; i < header.getNodeCount(); i++) {
                NodeRecord n = expect(body.get(index++), GenotypeRecord.RecordCase.NODE, header).getNode();
                builder.node(new NodeGene(n.getId(), toKind(n, header), toActivation(n),
                        n.getLayer(), n.getInnovation()));
            }
            for (int i = 0; i < header.getConnectionCount(); i++) {
                ConnectionRecord c = expect(body.get(index++), GenotypeRecord.RecordCase.CONNECTION, header).getConnection();
                builder.connection(new ConnectionGene(c.getSource(), c.getTarget(), c.getSourceIndex(),
                        c.getWeight(), c.getEnabled(), c.getInnovation(), c.getRecurrent()));
            }
            return builder.build();
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new GenotypeFormatException("Invalid genotype " + header.getId() + ": " + e.getMessage(), e);
        }
    }

    private static GenotypeRecord expect(GenotypeRecord record, GenotypeRecord.RecordCase expected,
                                         GenotypeHeader header) throws GenotypeFormatException {
        if (record.getRecordCase() != expected) {
            throw new GenotypeFormatException("Genotype " + header.getId() + ": expected " + expected
                    + " record but found " + record.getRecordCase());
        }
        return record;
    }

    private static NodeKind toKind(NodeRecord node, GenotypeHeader header) throws GenotypeFormatException {
        return switch (node.getKind()) {
            case NODE_KIND_SENSOR -> NodeKind.SENSOR;
            case NODE_KIND_NEURON -> NodeKind.NEURON;
            case NODE_KIND_ACTUATOR -> NodeKind.ACTUATOR;
            case NODE_KIND_BIAS -> NodeKind.BIAS;
            default -> throw new GenotypeFormatException("Node '" + node.getId() + "' in genotype "
                    + header.getId() + " has no kind");
        };
    }

    private static ActivationFunction toActivation(NodeRecord node) {
        return node.getActivation().isEmpty() ? null : ActivationFunction.fromName(node.getActivation());
    }
}
