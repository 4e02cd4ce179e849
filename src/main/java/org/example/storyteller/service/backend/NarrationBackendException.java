package org.example.storyteller.service.backend;

/**
 * Base class for recoverable backend failures; the narrator fails over on any of them.
 */
public abstract class NarrationBackendException extends RuntimeException {

    private final String backendName;

    protected NarrationBackendException(String backendName, String message, Throwable cause) {
        super(message, cause);
        this.backendName = backendName;
    }

    public String getBackendName() {
        return backendName;
    }
}
