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

import java.io.IOException;
import java.net.http.HttpClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.PrivateKey;
import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;

import javax.net.ssl.KeyManager;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLParameters;
import javax.net.ssl.TrustManager;
import javax.net.ssl.TrustManagerFactory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * TLS settings derived from a provider's active identity and the configured CA bundle. The identity certificate is
 * always presented, TLS 1.2 is the minimum protocol version, and peers are verified against the CA bundle unless
 * verification has been disabled.
 */
public final class TlsConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(TlsConfiguration.class);
    static final String[] PROTOCOLS = { "TLSv1.3", "TLSv1.2" };

    private final SSLContext context;
    private final boolean verificationDisabled;

    private TlsConfiguration(SSLContext context, boolean verificationDisabled) {
        this.context = requireNonNull(context, "context");
        this.verificationDisabled = verificationDisabled;
    }

    static TlsConfiguration create(X509Certificate certificate, PrivateKey privateKey, Path caFile,
            boolean disableVerify) throws IOException, GeneralSecurityException {
        var caCertificates = Crypto.readCertificates(Files.readAllBytes(caFile));
        if (caCertificates.isEmpty()) {
            throw new CertificateException("could not use CA '" + caFile + "' as PEM data");
        }

        TrustManager[] trustManagers;
        if (disableVerify) {
            logger.warn("TLS peer verification is disabled, connections are not authenticated");
            trustManagers = new TrustManager[] { new InsecureTrustManager() };
        } else {
            var trustStore = KeyStore.getInstance(KeyStore.getDefaultType());
            trustStore.load(null, null);
            for (int i = 0; i < caCertificates.size(); ++i) {
                trustStore.setCertificateEntry("ca-" + i, caCertificates.get(i));
            }
            var factory = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
            factory.init(trustStore);
            trustManagers = factory.getTrustManagers();
        }

        var context = SSLContext.getInstance("TLS");
        context.init(new KeyManager[] { new IdentityKeyManager(certificate, privateKey) }, trustManagers, null);
        return new TlsConfiguration(context, disableVerify);
    }

    public SSLContext context() {
        return context;
    }

    /**
     * Parameters to apply to sockets and engines created from {@link #context()}. Each call returns a fresh copy.
     */
    public SSLParameters parameters() {
        var parameters = context.getDefaultSSLParameters();
        parameters.setProtocols(PROTOCOLS.clone());
        parameters.setNeedClientAuth(true);
        return parameters;
    }

    public boolean isVerificationDisabled() {
        return verificationDisabled;
    }

    public HttpClient newHttpClient() {
        return HttpClient.newBuilder()
                .sslContext(context)
                .sslParameters(parameters())
                .build();
    }
}
