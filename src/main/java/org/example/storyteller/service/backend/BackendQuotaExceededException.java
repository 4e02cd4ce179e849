package org.example.storyteller.service.backend;

public class BackendQuotaExceededException extends NarrationBackendException {

    public BackendQuotaExceededException(String backendName, String message) {
        super(backendName, message, null);
    }

    public BackendQuotaExceededException(String backendName, String message, Throwable cause) {
        super(backendName, message, cause);
    }
}
