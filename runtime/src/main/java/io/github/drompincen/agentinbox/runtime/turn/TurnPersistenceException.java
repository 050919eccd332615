package io.github.drompincen.agentinbox.runtime.turn;

/** The agent message of a finished turn could not be stored. */
public class TurnPersistenceException extends RuntimeException {

    public TurnPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
