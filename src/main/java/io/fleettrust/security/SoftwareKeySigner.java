/*
 * Copyright 2022 Neil Madden.
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not use this file except
 * in compliance with the License. You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software distributed under the License
 * is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied. See the License for the specific language governing permissions and limitations under
 * the License.
 *
 */

package io.fleettrust.security;

import static java.util.Objects.requireNonNull;

import java.security.GeneralSecurityException;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.Signature;

/**
 * Signs with an in-memory JCA private key loaded from disk.
 */
final class SoftwareKeySigner implements PrivateKeySigner {
    private final PrivateKey privateKey;
    private final PublicKey publicKey;

    SoftwareKeySigner(PrivateKey privateKey, PublicKey publicKey) {
        this.privateKey = requireNonNull(privateKey, "privateKey");
        this.publicKey = requireNonNull(publicKey, "publicKey");
    }

    @Override
    public byte[] signDigest(HashAlgorithm algorithm, byte[] hash) throws GeneralSecurityException {
        var signature = Signature.getInstance(Crypto.RAW_RSA_SIGNATURE);
        signature.initSign(privateKey);
        signature.update(algorithm.digestInfo(hash));
        return signature.sign();
    }

    @Override
    public PublicKey publicKey() {
        return publicKey;
    }

    @Override
    public String toString() {
        return "SoftwareKeySigner{algorithm=" + privateKey.getAlgorithm() + "}";
    }
}
