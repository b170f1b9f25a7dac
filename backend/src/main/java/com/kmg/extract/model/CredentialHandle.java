package com.kmg.extract.model;

/**
 * A borrowed reference to one pooled credential. The secret is only handed to the inference client.
 */
public record CredentialHandle(String id, String fingerprint, String secret) {

    @Override
    public String toString() {
        return "CredentialHandle[id=" + id + ", fingerprint=" + fingerprint + "]";
    }
}
