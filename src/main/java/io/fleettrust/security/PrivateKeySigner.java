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

import java.security.GeneralSecurityException;
import java.security.PublicKey;

/**
 * A capability to produce RSA PKCS#1 v1.5 signatures over pre-computed hashes with a single private key. The key
 * itself is never exposed: for hardware tokens it cannot leave the device at all.
 */
public interface PrivateKeySigner {

    /**
     * Signs a hash that has already been computed with the given algorithm. The implementation prepends the
     * algorithm's {@link HashAlgorithm#digestInfo(byte[]) DigestInfo} prefix before performing the raw RSA
     * operation.
     *
     * @param algorithm the algorithm that produced the hash.
     * @param hash the hash value.
     * @return the signature.
     * @throws GeneralSecurityException if the underlying key cannot perform the operation.
     */
    byte[] signDigest(HashAlgorithm algorithm, byte[] hash) throws GeneralSecurityException;

    /**
     * The public half of the signing key, as taken from the bound certificate.
     */
    PublicKey publicKey();
}
