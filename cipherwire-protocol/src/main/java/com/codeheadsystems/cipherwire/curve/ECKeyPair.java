package com.codeheadsystems.cipherwire.curve;

/**
 * A public key together with its private key.
 */
public record ECKeyPair(ECPublicKey publicKey, ECPrivateKey privateKey) {
}
