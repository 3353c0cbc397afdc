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
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.util.Optional;
import java.util.function.BiConsumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A security provider whose private key and certificate are PEM files on local disk.
 */
public final class FileSecurityProvider implements SecurityProvider {
    private static final Logger logger = LoggerFactory.getLogger(FileSecurityProvider.class);

    private final SecurityConfig config;
    private final FileSecurity fileSecurity;
    private final Optional<RequestSigner> remoteSigner;
    private final Credentials credentials;

    public FileSecurityProvider(SecurityConfig config) throws SecurityProviderException {
        this.config = config;
        this.fileSecurity = new FileSecurity(config);
        this.remoteSigner = config.remoteSigner();
        if (config.certificateFile() == null) {
            throw new ConfigurationException("the certificate file (" + SecurityConfig.CERTIFICATE_FILE +
                    ") is required");
        }
        if (config.keyFile() == null) {
            throw new ConfigurationException("the private key file (" + SecurityConfig.KEY_FILE + ") is required");
        }
        this.credentials = load(config.certificateFile(), config.keyFile());
        logger.debug("Loaded identity {} from {}", credentials.identity, config.certificateFile());
    }

    private static Credentials load(Path certificateFile, Path keyFile) throws CertificateLoadException {
        X509Certificate certificate;
        try {
            certificate = Crypto.readCertificate(Files.readAllBytes(certificateFile));
        } catch (IOException | CertificateException e) {
            throw new CertificateLoadException("could not load certificate " + certificateFile + ": " +
                    e.getMessage(), e);
        }
        var identity = Credentials.identityOf(certificate, "certificate " + certificateFile);

        try {
            var privateKey = Crypto.readPrivateKey(Files.readAllBytes(keyFile));
            var signer = new SoftwareKeySigner(privateKey, certificate.getPublicKey());
            return new Credentials(identity, certificate, privateKey, signer);
        } catch (IOException e) {
            throw new CertificateLoadException("could not load private key " + keyFile + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String provider() {
        return "file";
    }

    @Override
    public String identity() {
        return credentials.identity;
    }

    @Override
    public X509Certificate publicCertificate() {
        return credentials.certificate;
    }

    @Override
    public String publicCertificatePem() {
        return Crypto.toPem(credentials.certificate);
    }

    @Override
    public byte[] checksum(byte[] data) {
        return Crypto.checksum(data);
    }

    @Override
    public byte[] signBytes(byte[] data) throws GeneralSecurityException {
        return credentials.signer.signDigest(Crypto.CHECKSUM_ALGORITHM, checksum(data));
    }

    @Override
    public boolean verifyByteSignature(byte[] data, byte[] signature, String identity) {
        return fileSecurity.verifyByteSignature(credentials, data, signature, identity);
    }

    @Override
    public boolean privilegedVerifyByteSignature(byte[] data, byte[] signature, String identity) {
        return fileSecurity.privilegedVerifyByteSignature(credentials, data, signature, identity);
    }

    @Override
    public String callerName() {
        return FileSecurity.callerName(identity());
    }

    @Override
    public String callerIdentity(String caller) {
        return FileSecurity.callerIdentity(caller);
    }

    @Override
    public void cachePublicData(byte[] data, String identity) throws CertificateException, IOException {
        fileSecurity.cachePublicData(data, identity);
    }

    @Override
    public byte[] cachedPublicData(String identity) throws IOException {
        return fileSecurity.cachedPublicData(identity);
    }

    @Override
    public void verifyCertificate(byte[] certificatePem, String name) throws CertificateException {
        fileSecurity.verifyCertificate(certificatePem, name);
    }

    @Override
    public TlsConfiguration tlsConfiguration() throws IOException, GeneralSecurityException {
        return fileSecurity.tlsConfiguration(credentials);
    }

    @Override
    public TlsConfiguration clientTlsConfiguration() throws IOException, GeneralSecurityException {
        return tlsConfiguration();
    }

    @Override
    public HttpClient httpClient(boolean secure) throws IOException, GeneralSecurityException {
        return secure ? tlsConfiguration().newHttpClient() : HttpClient.newHttpClient();
    }

    @Override
    public Validation validate() {
        var problems = fileSecurity.validate();
        if (!Files.isRegularFile(config.certificateFile())) {
            problems.add(config.certificateFile() + ": certificate file does not exist");
        }
        if (!Files.isRegularFile(config.keyFile())) {
            problems.add(config.keyFile() + ": private key file does not exist");
        }
        return new Validation(problems);
    }

    @Override
    public void enroll(Duration wait, BiConsumer<String, Integer> onAttempt) {
        throw new UnsupportedOperationException("file security provider does not support enrollment");
    }

    @Override
    public byte[] remoteSignRequest(byte[] request) throws IOException {
        var signer = remoteSigner.orElseThrow(() ->
                new UnsupportedOperationException("no remote signer is configured"));
        logger.debug("Signing request using remote signer {}", signer.kind());
        return signer.sign(request);
    }

    @Override
    public boolean isRemoteSigning() {
        return remoteSigner.isPresent();
    }

    @Override
    public String toString() {
        return "FileSecurityProvider{identity='" + credentials.identity + "'}";
    }
}
