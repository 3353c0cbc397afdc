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
import java.security.SignatureException;

import io.fleettrust.security.pkcs11.TokenException;
import io.fleettrust.security.pkcs11.TokenSession;

/**
 * Signs with a private key object that stays on a hardware token, using the raw {@code CKM_RSA_PKCS} mechanism.
 */
final class TokenKeySigner implements PrivateKeySigner {
    private final TokenSession session;
    private final PrivateKey keyHandle;
    private final PublicKey publicKey;

    TokenKeySigner(TokenSession session, PrivateKey keyHandle, PublicKey publicKey) {
        this.session = requireNonNull(session, "session");
        this.keyHandle = requireNonNull(keyHandle, "keyHandle");
        this.publicKey = requireNonNull(publicKey, "publicKey");
    }

    @Override
    public byte[] signDigest(HashAlgorithm algorithm, byte[] hash) throws GeneralSecurityException {
        try {
            return session.sign(keyHandle, algorithm.digestInfo(hash));
        } catch (TokenException e) {
            throw new SignatureException(e.getMessage(), e);
        }
    }

    @Override
    public PublicKey publicKey() {
        return publicKey;
    }

    @Override
    public String toString() {
        return "TokenKeySigner{}";
    }
}
