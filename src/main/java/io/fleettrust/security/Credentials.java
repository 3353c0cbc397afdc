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

import java.security.PrivateKey;
import java.security.cert.X509Certificate;

/**
 * The active identity of a provider: its certificate and the key bound to it. Providers swap the whole object
 * when they authenticate, so the certificate and signer can never come from different logins.
 */
final class Credentials {
    final String identity;
    final X509Certificate certificate;
    final PrivateKey privateKey;
    final PrivateKeySigner signer;

    Credentials(String identity, X509Certificate certificate, PrivateKey privateKey, PrivateKeySigner signer) {
        this.identity = requireNonNull(identity, "identity");
        this.certificate = requireNonNull(certificate, "certificate");
        this.privateKey = requireNonNull(privateKey, "privateKey");
        this.signer = requireNonNull(signer, "signer");
    }

    /**
     * Extracts the Common Name that serves as the identity of a certificate.
     *
     * @throws CertificateLoadException if the certificate has no Common Name.
     */
    static String identityOf(X509Certificate certificate, String source) throws CertificateLoadException {
        return Crypto.commonName(certificate)
                .orElseThrow(() -> new CertificateLoadException(source + " must have a valid CommonName"));
    }

    @Override
    public String toString() {
        return "Credentials{identity='" + identity + "', signer=" + signer + '}';
    }
}
