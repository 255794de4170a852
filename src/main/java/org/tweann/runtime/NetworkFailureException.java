package org.tweann.runtime;

/**
 * Thrown when a running network fails: an actor crashed, the run timed out, or the caller was
 * interrupted while waiting. All actors of the network are stopped when this is raised.
 */
public class NetworkFailureException extends Exception {

    public NetworkFailureException(String message) {
        super(message);
    }

    public NetworkFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
