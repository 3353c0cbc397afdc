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

import java.io.IOException;
import java.net.http.HttpClient;
import java.security.GeneralSecurityException;
import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.util.function.BiConsumer;

/**
 * Authenticates this node by its X.509 identity and signs and verifies the messages it exchanges with other nodes.
 * Every backend signs the SHA-256 {@link #checksum(byte[]) checksum} of a message with RSA PKCS#1 v1.5, so a
 * signature made by one backend verifies with any other.
 * <p>
 * Providers are not internally synchronized on the signing path. A hardware token session in particular must not
 * be used by concurrent signers without external serialization.
 */
public interface SecurityProvider {

    /**
     * A short name for the backend, such as {@code file} or {@code pkcs11}.
     */
    String provider();

    /**
     * The Common Name of the active certificate.
     *
     * @throws IllegalStateException if the provider has not authenticated yet.
     */
    String identity();

    /**
     * The active certificate.
     *
     * @throws IllegalStateException if the provider has not authenticated yet.
     */
    X509Certificate publicCertificate();

    /**
     * The active certificate in PEM form.
     *
     * @throws IllegalStateException if the provider has not authenticated yet.
     */
    String publicCertificatePem();

    /**
     * The SHA-256 checksum of some data.
     */
    byte[] checksum(byte[] data);

    /**
     * Signs the checksum of the data with the active private key.
     *
     * @throws GeneralSecurityException if the key cannot sign.
     * @throws IllegalStateException if the provider has not authenticated yet.
     */
    byte[] signBytes(byte[] data) throws GeneralSecurityException;

    /**
     * Checks a signature. When {@code identity} is null or empty the active certificate is used, otherwise the
     * cached certificate of that identity. Failures of any kind are logged and reported as {@code false}.
     */
    boolean verifyByteSignature(byte[] data, byte[] signature, String identity);

    /**
     * Checks a signature that claims to come from {@code identity}, also accepting signatures made by any cached
     * privileged identity. The claimed identity is tried first, then privileged identities in lexicographic order;
     * the first match wins.
     */
    boolean privilegedVerifyByteSignature(byte[] data, byte[] signature, String identity);

    /**
     * The caller id of this node, in the form {@code fleet=<identity>}.
     */
    String callerName();

    /**
     * Extracts the identity from a caller id produced by {@link #callerName()}.
     *
     * @throws IllegalArgumentException if the caller id is malformed.
     */
    String callerIdentity(String caller);

    /**
     * Stores the public certificate of another identity in the certificate cache, subject to CA verification and
     * the allow-list.
     *
     * @throws CertificateException if the certificate is rejected.
     * @throws IOException if the cache cannot be written.
     */
    void cachePublicData(byte[] data, String identity) throws CertificateException, IOException;

    /**
     * Reads a previously cached certificate.
     *
     * @throws IOException if nothing is cached for the identity.
     */
    byte[] cachedPublicData(String identity) throws IOException;

    /**
     * Verifies that a PEM certificate chains to the configured CA and, when {@code name} is not empty, that its
     * Common Name equals {@code name}.
     */
    void verifyCertificate(byte[] certificatePem, String name) throws CertificateException;

    /**
     * TLS material for servers and clients of this node.
     */
    TlsConfiguration tlsConfiguration() throws IOException, GeneralSecurityException;

    /**
     * TLS material for outbound client connections.
     */
    TlsConfiguration clientTlsConfiguration() throws IOException, GeneralSecurityException;

    /**
     * An HTTP client that presents this node's identity when {@code secure} is set, or a plain client otherwise.
     */
    HttpClient httpClient(boolean secure) throws IOException, GeneralSecurityException;

    /**
     * Checks the configuration and reports every problem found, without failing.
     */
    Validation validate();

    /**
     * Requests a certificate from a CA and waits for it to be issued.
     *
     * @throws UnsupportedOperationException if the backend cannot enroll.
     */
    void enroll(Duration wait, BiConsumer<String, Integer> onAttempt) throws IOException;

    /**
     * Has a request signed by the configured remote signer.
     *
     * @throws UnsupportedOperationException if the backend does not sign remotely.
     */
    byte[] remoteSignRequest(byte[] request) throws IOException;

    boolean isRemoteSigning();
}
