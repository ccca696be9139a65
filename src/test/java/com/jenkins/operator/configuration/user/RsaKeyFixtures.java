package com.jenkins.operator.configuration.user;

import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.asn1.pkcs.RSAPrivateKey;
import org.bouncycastle.util.io.pem.PemObject;
import org.bouncycastle.util.io.pem.PemWriter;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;

/**
 * RSA deploy keys for the user configuration tests.
 */
final class RsaKeyFixtures {
    private static KeyPair keyPair;

    private RsaKeyFixtures() {
    }

    static synchronized KeyPair keyPair() {
        if (keyPair == null) {
            try {
                KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
                generator.initialize(1024);
                keyPair = generator.generateKeyPair();
            } catch (GeneralSecurityException e) {
                throw new IllegalStateException(e);
            }
        }
        return keyPair;
    }

    static RSAPrivateKey rsaPrivateKey() {
        try {
            return RSAPrivateKey.getInstance(
                    PrivateKeyInfo.getInstance(keyPair().getPrivate().getEncoded()).parsePrivateKey());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    static String pkcs1Pem() {
        return pkcs1Pem(rsaPrivateKey());
    }

    static String pkcs1Pem(RSAPrivateKey key) {
        try {
            return pem("RSA PRIVATE KEY", key.getEncoded());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    static String pkcs8Pem() {
        return pem("PRIVATE KEY", keyPair().getPrivate().getEncoded());
    }

    static String pem(String type, byte[] content) {
        StringWriter out = new StringWriter();
        try (PemWriter writer = new PemWriter(out)) {
            writer.writeObject(new PemObject(type, content));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out.toString();
    }
}
