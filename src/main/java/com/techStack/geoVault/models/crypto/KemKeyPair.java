package com.techStack.geoVault.models.crypto;

public record KemKeyPair(KemPublicKey publicKey, KemSecretKey secretKey) {
}
