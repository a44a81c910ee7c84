package net.spookly.hostpilot.auth;

/**
 * Adds authentication headers to an outgoing request. Signers run after the body is final.
 */
@FunctionalInterface
public interface RequestSigner {
    void sign(SignableRequest request);
}
