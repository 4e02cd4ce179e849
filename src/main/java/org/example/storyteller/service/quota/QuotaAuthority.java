package org.example.storyteller.service.quota;

/**
 * External cost/quota authority consulted before every call to a metered backend.
 */
public interface QuotaAuthority {

    /**
     * Reserve {@code estimatedTokens} for one call to the named backend.
     *
     * @return true if the call may proceed; false is handled exactly like a backend failure
     */
    boolean estimateAndReserve(String backendName, int estimatedTokens);
}
