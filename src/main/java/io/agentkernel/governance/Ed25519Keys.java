package io.agentkernel.governance;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.security.Signature;
import java.security.spec.PKCS8EncodedKeySpec;
import java.util.Base64;

/**
 * Key generation and oath signing for operators and agents. The kernel itself only verifies.
 */
public final class Ed25519Keys {
    private Ed25519Keys() {
    }

    public static EncodedKeyPair generate() {
        try {
            KeyPair pair = KeyPairGenerator.getInstance(Ed25519SignatureVerifier.ALGORITHM).generateKeyPair();
            Base64.Encoder b64 = Base64.getEncoder();
            return new EncodedKeyPair(
                    b64.encodeToString(pair.getPublic().getEncoded()),
                    b64.encodeToString(pair.getPrivate().getEncoded())
            );
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Ed25519 key generation not available", e);
        }
    }

    /**
     * Signs the UTF-8 bytes of {@code policyHash} with a Base64 PKCS#8 private key.
     */
    public static String signOath(String privateKey, String policyHash) {
        try {
            byte[] encoded = Base64.getDecoder().decode(privateKey.trim());
            PrivateKey key = KeyFactory.getInstance(Ed25519SignatureVerifier.ALGORITHM)
                    .generatePrivate(new PKCS8EncodedKeySpec(encoded));
            Signature signer = Signature.getInstance(Ed25519SignatureVerifier.ALGORITHM);
            signer.initSign(key);
            signer.update(policyHash.getBytes(StandardCharsets.UTF_8));
            return Base64.getEncoder().encodeToString(signer.sign());
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new IllegalArgumentException("Failed to sign oath: " + e.getMessage(), e);
        }
    }

    public record EncodedKeyPair(String publicKey, String privateKey) {
    }
}
