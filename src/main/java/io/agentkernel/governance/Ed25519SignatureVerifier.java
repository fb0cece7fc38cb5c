package io.agentkernel.governance;

import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PublicKey;
import java.security.Signature;
import java.security.SignatureException;
import java.security.spec.InvalidKeySpecException;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;

/**
 * Ed25519 through the JDK provider. Public keys are Base64 X.509 (SubjectPublicKeyInfo) encodings.
 */
public final class Ed25519SignatureVerifier implements SignatureVerifier {
    public static final String ALGORITHM = "Ed25519";

    @Override
    public boolean verify(String publicKey, byte[] message, String signature) throws GeneralSecurityException {
        PublicKey key = decodePublicKey(publicKey);
        byte[] sigBytes;
        try {
            sigBytes = Base64.getDecoder().decode(signature == null ? "" : signature.trim());
        } catch (IllegalArgumentException e) {
            return false;
        }
        Signature verifier = Signature.getInstance(ALGORITHM);
        verifier.initVerify(key);
        verifier.update(message);
        try {
            return verifier.verify(sigBytes);
        } catch (SignatureException e) {
            return false;
        }
    }

    @Override
    public String algorithm() {
        return ALGORITHM;
    }

    static PublicKey decodePublicKey(String publicKey) throws GeneralSecurityException {
        if (publicKey == null || publicKey.isBlank()) {
            throw new InvalidKeySpecException("public key is empty");
        }
        byte[] encoded;
        try {
            encoded = Base64.getDecoder().decode(publicKey.trim());
        } catch (IllegalArgumentException e) {
            throw new InvalidKeySpecException("public key is not Base64", e);
        }
        return KeyFactory.getInstance(ALGORITHM).generatePublic(new X509EncodedKeySpec(encoded));
    }

    /**
     * True when the running JDK ships an Ed25519 provider.
     */
    public static boolean available() {
        try {
            KeyFactory.getInstance(ALGORITHM);
            return true;
        } catch (GeneralSecurityException e) {
            return false;
        }
    }
}
