package com.jenkins.operator.configuration.user;

import org.bouncycastle.asn1.pkcs.RSAPrivateKey;
import org.bouncycastle.util.io.pem.PemObject;
import org.bouncycastle.util.io.pem.PemReader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.StringReader;
import java.math.BigInteger;

/**
 * Checks that a PEM encoded deploy key is a structurally sound PKCS#1 RSA private key.
 */
@Component
public class PrivateKeyValidator {
    private static final BigInteger MAX_PUBLIC_EXPONENT = BigInteger.valueOf(Integer.MAX_VALUE);

    public void validate(String privateKey) throws InvalidPrivateKeyException {
        RSAPrivateKey key = parse(decode(privateKey));

        if (key.getPublicExponent().compareTo(BigInteger.TWO) < 0) {
            throw new InvalidPrivateKeyException("public exponent too small");
        }
        if (key.getPublicExponent().compareTo(MAX_PUBLIC_EXPONENT) > 0) {
            throw new InvalidPrivateKeyException("public exponent too large");
        }

        BigInteger p = key.getPrime1();
        BigInteger q = key.getPrime2();
        if (p.compareTo(BigInteger.ONE) <= 0 || q.compareTo(BigInteger.ONE) <= 0) {
            throw new InvalidPrivateKeyException("invalid prime value");
        }
        if (!p.multiply(q).equals(key.getModulus())) {
            throw new InvalidPrivateKeyException("invalid modulus");
        }

        // d*e must be congruent to 1 modulo p-1 and q-1
        BigInteger de = key.getPrivateExponent().multiply(key.getPublicExponent());
        for (BigInteger prime : new BigInteger[]{p, q}) {
            if (!de.mod(prime.subtract(BigInteger.ONE)).equals(BigInteger.ONE)) {
                throw new InvalidPrivateKeyException("invalid exponents");
            }
        }
    }

    private static byte[] decode(String privateKey) throws InvalidPrivateKeyException {
        PemObject pem;
        try (PemReader reader = new PemReader(new StringReader(privateKey))) {
            pem = reader.readPemObject();
        } catch (IOException | IllegalStateException e) {
            throw new InvalidPrivateKeyException("failed to decode PEM block", e);
        }
        if (pem == null || pem.getContent() == null || pem.getContent().length == 0) {
            throw new InvalidPrivateKeyException("failed to decode PEM block");
        }
        return pem.getContent();
    }

    private static RSAPrivateKey parse(byte[] der) throws InvalidPrivateKeyException {
        try {
            return RSAPrivateKey.getInstance(der);
        } catch (RuntimeException e) {
            // malformed DER surfaces as assorted unchecked exceptions from the ASN.1 parser
            throw new InvalidPrivateKeyException("failed to parse PKCS#1 RSA private key: " + e.getMessage(), e);
        }
    }
}
