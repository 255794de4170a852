package org.tweann.genotype;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Computes historical markers for node and connection genes.
 * <p>
 * Innovation numbers are pure functions of the structural change they describe. Two genotypes that
 * independently add a connection between the same pair of nodes, or split the same connection,
 * receive identical innovation numbers (and, for splits, identical node ids). Crossover and
 * compatibility distance rely on this to align genes of genotypes with different topologies.
 * <p>
 * The hash is computed using SHA-256 over a tagged, length-prefixed encoding of the inputs, with
 * the first 8 bytes converted to a non-negative long.
 */
public final class InnovationHasher {

    private static final byte TAG_NODE = 1;
    private static final byte TAG_CONNECTION = 2;
    private static final byte TAG_SPLIT = 3;

    private InnovationHasher() {
        // Utility class - no instantiation
    }

    /**
     * Returns the innovation number of the node with the given id.
     *
     * @param nodeId The node id.
     * @return A non-negative 63-bit marker.
     */
    public static long nodeInnovation(String nodeId) {
        return hash(TAG_NODE, 0, nodeId);
    }

    /**
     * Returns the innovation number of a connection from {@code source} element {@code sourceIndex}
     * to {@code target}.
     *
     * @param source      Source node id.
     * @param target      Target node id.
     * @param sourceIndex Element index within the source signal.
     * @return A non-negative 63-bit marker.
     */
    public static long connectionInnovation(String source, String target, int sourceIndex) {
        return hash(TAG_CONNECTION, sourceIndex, source, target);
    }

    /**
     * Returns the id of the neuron inserted when the given connection is split.
     * <p>
     * The same connection always yields the same neuron id, so concurrent add-node mutations of the
     * same connection in different genotypes produce matching node and connection genes.
     *
     * @param split The connection being split.
     * @return The id for the new neuron.
     */
    public static String splitNodeId(ConnectionGene split) {
        long h = hash(TAG_SPLIT, split.sourceIndex(), split.source(), split.target());
        return "neuron:s" + Long.toHexString(h);
    }

    private static long hash(byte tag, int index, String... parts) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            ByteBuffer header = ByteBuffer.allocate(1 + Integer.BYTES);
            header.put(tag).putInt(index);
            digest.update(header.array());

            ByteBuffer length = ByteBuffer.allocate(Integer.BYTES);
            for (String part : parts) {
                byte[] bytes = part.getBytes(StandardCharsets.UTF_8);
                length.clear();
                length.putInt(bytes.length);
                digest.update(length.array());
                digest.update(bytes);
            }

            byte[] hash = digest.digest();
            // Take first 8 bytes as long (big-endian), sign bit cleared
            return ByteBuffer.wrap(hash, 0, Long.BYTES).getLong() & Long.MAX_VALUE;

        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
