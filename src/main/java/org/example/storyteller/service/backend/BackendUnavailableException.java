package org.example.storyteller.service.backend;

public class BackendUnavailableException extends NarrationBackendException {

    public BackendUnavailableException(String backendName, String message) {
        super(backendName, message, null);
    }

    public BackendUnavailableException(String backendName, String message, Throwable cause) {
        super(backendName, message, cause);
    }
}
