package com.example.seer.exception;

/**
 * An external collaborator (fix generation, PR creation, notification, ticketing)
 * returned an error or did not answer in time.
 */
public class CollaboratorException extends RuntimeException {

    private final String collaborator;

    public CollaboratorException(String collaborator, String message) {
        super(collaborator + ": " + message);
        this.collaborator = collaborator;
    }

    public CollaboratorException(String collaborator, String message, Throwable cause) {
        super(collaborator + ": " + message, cause);
        this.collaborator = collaborator;
    }

    public String getCollaborator() {
        return collaborator;
    }
}
