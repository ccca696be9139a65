package com.jenkins.operator.configuration.user;

/**
 * Thrown when a deploy key is not a usable PKCS#1 RSA private key.
 */
public class InvalidPrivateKeyException extends Exception {

    public InvalidPrivateKeyException(String message) {
        super(message);
    }

    public InvalidPrivateKeyException(String message, Throwable cause) {
        super(message, cause);
    }
}
