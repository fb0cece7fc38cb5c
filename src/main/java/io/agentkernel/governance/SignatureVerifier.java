package io.agentkernel.governance;

import java.security.GeneralSecurityException;

/**
 * Verifies oath signatures. Keys and signatures travel as Base64 text.
 */
public interface SignatureVerifier {

    /**
     * @return false when the signature does not match
     * @throws GeneralSecurityException when the public key can not be decoded at all
     */
    boolean verify(String publicKey, byte[] message, String signature) throws GeneralSecurityException;

    String algorithm();
}
