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

package io.fleettrust.security.pkcs11;

import java.security.PrivateKey;

/**
 * A session with a token. Sessions are single threaded: callers must not use one session from several threads at
 * once. Closing a session logs it out.
 */
public interface TokenSession extends AutoCloseable {

    /**
     * Logs the normal user in.
     *
     * @throws TokenException if the token rejects the PIN. A token that reports the user as already logged in
     * raises an exception for which {@link TokenException#isAlreadyLoggedIn()} is true.
     */
    void login(char[] pin) throws TokenException;

    /**
     * Finds the single private key object on the token.
     *
     * @return a handle to the key. The key material cannot be extracted.
     * @throws TokenException if there is no private key or more than one.
     */
    PrivateKey findPrivateKey() throws TokenException;

    /**
     * Finds the single certificate object on the token.
     *
     * @return the DER encoding of the certificate.
     * @throws TokenException if there is no certificate or more than one.
     */
    byte[] findCertificate() throws TokenException;

    /**
     * Performs a raw {@code CKM_RSA_PKCS} signature: the token applies PKCS#1 v1.5 padding to the input, which must
     * already be a DigestInfo structure.
     */
    byte[] sign(PrivateKey key, byte[] input) throws TokenException;

    void logout() throws TokenException;

    @Override
    void close() throws TokenException;
}
