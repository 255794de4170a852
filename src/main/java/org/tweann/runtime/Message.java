package org.tweann.runtime;

import java.util.Arrays;

/**
 * Messages exchanged between the actors of one network.
 * <p>
 * Messages are immutable; vector payloads are copied on construction and must not be modified by
 * receivers.
 */
public interface Message {

    /** Synchronizer to itself: begin running for the given number of cycles. */
    record Start(int steps) implements Message {
    }

    /** Synchronizer to sensor: produce one signal vector. */
    record Sample() implements Message {
    }

    /**
     * A signal vector forwarded along a connection. Sensors send vectors of their declared length,
     * neurons send vectors of length one.
     */
    record Signal(String from, double[] vector) implements Message {
        public Signal {
            vector = vector.clone();
        }

        @Override
        public String toString() {
            return "Signal[from=" + from + ", vector=" + Arrays.toString(vector) + "]";
        }
    }

    /** Actuator to synchronizer: this actuator has acted in the current cycle. */
    record Sync(String actuatorId) implements Message {
    }

    /** Synchronizer to neuron: report current weights. */
    record GetBackup() implements Message {
    }

    /** Neuron to synchronizer: answer to {@link GetBackup}. */
    record Backup(NeuronWeights weights) implements Message {
    }

    /** Stop processing. Sent to the synchronizer it ends the run early. */
    record Terminate() implements Message {
    }
}
