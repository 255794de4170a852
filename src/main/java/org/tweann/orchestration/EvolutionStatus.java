package org.tweann.orchestration;

/**
 * Externally visible status of an evolution run.
 */
public enum EvolutionStatus {
    IDLE,
    RUNNING,
    PAUSED,
    COMPLETED,
    ERROR
}
