package net.spookly.hostpilot.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class CredentialTest {
    @Test
    void toStringNeverShowsSecrets() {
        Credential credential = new Credential("ak", "very-secret", "cn-north-1", "air", "session-secret");

        String rendered = credential.toString();

        assertTrue(rendered.contains("accessKeyId=ak"));
        assertFalse(rendered.contains("very-secret"));
        assertFalse(rendered.contains("session-secret"));
        assertTrue(rendered.contains("sessionToken=" + SecretRedactor.REDACTED));
    }

    @Test
    void redactorKeepsNullAndEmpty() {
        assertNull(SecretRedactor.redact(null));
        assertEquals("", SecretRedactor.redact(""));
        assertEquals(SecretRedactor.REDACTED, SecretRedactor.redact("x"));
    }
}
