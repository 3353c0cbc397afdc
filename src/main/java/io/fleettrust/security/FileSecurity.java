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

import static io.fleettrust.security.Utils.isBlank;
import static io.fleettrust.security.Utils.require;
import static java.util.stream.Collectors.toSet;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.cert.CertPathValidator;
import java.security.cert.CertificateException;
import java.security.cert.CertificateFactory;
import java.security.cert.PKIXParameters;
import java.security.cert.TrustAnchor;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The certificate cache, CA verification and identity policy shared by every provider backend. Backends compose
 * one instance each and pass their active {@link Credentials} in where an operation needs them.
 */
final class FileSecurity {
    private static final Logger logger = LoggerFactory.getLogger(FileSecurity.class);
    static final String CALLER_PREFIX = "fleet=";
    private static final Pattern CALLER = Pattern.compile("^" + CALLER_PREFIX + "([\\w.\\-]+)$");

    private final Path caFile;
    private final CertificateCache cache;
    private final IdentityMatcher privilegedUsers;
    private final IdentityMatcher allowList;
    private final boolean disableTlsVerify;

    FileSecurity(SecurityConfig config) throws ConfigurationException {
        if (config.caFile() == null) {
            throw new ConfigurationException("the CA file (" + SecurityConfig.CA_FILE + ") is required");
        }
        if (config.cacheDirectory() == null) {
            throw new ConfigurationException("the certificate cache directory (" + SecurityConfig.CACHE_DIRECTORY +
                    ") is required");
        }
        this.caFile = config.caFile();
        this.cache = new CertificateCache(config.cacheDirectory(), config.alwaysOverwriteCache());
        this.privilegedUsers = IdentityMatcher.of(config.privilegedUsers());
        this.allowList = IdentityMatcher.of(config.allowList());
        this.disableTlsVerify = config.disableTlsVerify();
    }

    boolean verifyByteSignature(Credentials active, byte[] data, byte[] signature, String identity) {
        X509Certificate certificate;
        String source;
        try {
            if (isBlank(identity)) {
                if (active == null) {
                    logger.error("Cannot verify signature against the active certificate: not logged in");
                    return false;
                }
                certificate = active.certificate;
                source = "the active certificate";
            } else {
                var path = cache.path(identity);
                source = path.toString();
                logger.debug("Attempting to verify signature for {} using {}", identity, path);
                certificate = Crypto.readCertificate(Files.readAllBytes(path));
            }
        } catch (IOException | CertificateException e) {
            logger.error("Could not load public certificate for {}: {}", identity, e.getMessage());
            return false;
        }

        try {
            var hash = Crypto.checksum(data);
            if (!Crypto.verify(certificate.getPublicKey(), Crypto.CHECKSUM_ALGORITHM, hash, signature)) {
                logger.error("Signature verification using {} failed", source);
                return false;
            }
        } catch (GeneralSecurityException e) {
            logger.error("Signature verification using {} failed: {}", source, e.toString());
            return false;
        }

        logger.debug("Verified signature from {} using {}", identity, source);
        return true;
    }

    /**
     * The identities whose cached certificates may vouch for a signature claimed by {@code identity}: the identity
     * itself when it is cached, followed by every cached privileged identity in lexicographic order.
     */
    List<String> privilegedCandidates(String identity) {
        var candidates = new LinkedHashSet<String>();
        if (!isBlank(identity) && cache.exists(identity)) {
            candidates.add(identity);
        }
        candidates.addAll(cache.identities(privilegedUsers));
        return List.copyOf(candidates);
    }

    boolean privilegedVerifyByteSignature(Credentials active, byte[] data, byte[] signature, String identity) {
        for (var candidate : privilegedCandidates(identity)) {
            if (verifyByteSignature(active, data, signature, candidate)) {
                logger.debug("Allowing certificate {} to act as {}", candidate, identity);
                return true;
            }
        }
        return false;
    }

    /**
     * Stores a certificate for an identity after checking it chains to the CA. Certificates of privileged
     * identities are accepted for any identity; any other certificate must be issued to {@code identity} and the
     * identity must be allowed by the allow-list. An empty allow-list allows every identity.
     */
    void cachePublicData(byte[] data, String identity) throws CertificateException, IOException {
        require(!isBlank(identity), "identity is required");
        verifyCertificate(data, "");

        var commonName = Crypto.commonName(Crypto.readCertificate(data)).orElse("");
        if (!privilegedUsers.matches(commonName)) {
            if (!commonName.equals(identity)) {
                throw new CertificateException("certificate '" + commonName + "' does not match identity '" +
                        identity + "'");
            }
            if (!allowList.patterns().isEmpty() && !allowList.matches(identity)) {
                logger.warn("Received certificate '{}' that does not match the allow list {}", identity,
                        allowList.patterns());
                throw new CertificateException("certificate '" + identity + "' did not pass validation");
            }
        }

        cache.store(identity, data);
    }

    byte[] cachedPublicData(String identity) throws IOException {
        require(!isBlank(identity), "identity is required");
        return cache.read(identity);
    }

    void verifyCertificate(byte[] certificatePem, String name) throws CertificateException {
        List<X509Certificate> authorities;
        try {
            authorities = Crypto.readCertificates(Files.readAllBytes(caFile));
        } catch (IOException e) {
            throw new CertificateException("could not read CA '" + caFile + "': " + e.getMessage(), e);
        }
        if (authorities.isEmpty()) {
            throw new CertificateException("could not use CA '" + caFile + "' as PEM data");
        }

        var chain = Crypto.readCertificates(certificatePem);
        if (chain.isEmpty()) {
            throw new CertificateException("could not decode certificate '" + name + "' PEM data");
        }
        var leaf = chain.get(0);
        var path = new ArrayList<>(chain);
        path.removeAll(authorities);
        if (path.isEmpty()) {
            path.add(leaf);
        }

        try {
            var anchors = authorities.stream().map(ca -> new TrustAnchor(ca, null)).collect(toSet());
            var parameters = new PKIXParameters(anchors);
            parameters.setRevocationEnabled(false);
            var certPath = CertificateFactory.getInstance("X.509").generateCertPath(path);
            CertPathValidator.getInstance("PKIX").validate(certPath, parameters);
        } catch (GeneralSecurityException e) {
            throw new CertificateException("certificate '" + name + "' did not pass verification: " +
                    e.getMessage(), e);
        }

        if (!isBlank(name)) {
            var commonName = Crypto.commonName(leaf).orElse("");
            if (!commonName.equals(name)) {
                throw new CertificateException("certificate '" + commonName + "' does not match name '" + name +
                        "'");
            }
        }
    }

    List<String> validate() {
        var problems = new ArrayList<String>();

        var cacheDirectory = cache.directory();
        if (!Files.exists(cacheDirectory)) {
            problems.add(cacheDirectory + ": no such file or directory");
        } else if (!Files.isDirectory(cacheDirectory)) {
            problems.add(cacheDirectory + " is not a directory");
        }

        if (!Files.exists(caFile)) {
            problems.add(caFile + ": no such file or directory");
        } else if (!Files.isRegularFile(caFile)) {
            problems.add(caFile + " is not a regular file");
        }

        return problems;
    }

    TlsConfiguration tlsConfiguration(Credentials active) throws IOException, GeneralSecurityException {
        if (active == null) {
            throw new IllegalStateException("not logged in");
        }
        return TlsConfiguration.create(active.certificate, active.privateKey, caFile, disableTlsVerify);
    }

    static String callerName(String identity) {
        return CALLER_PREFIX + identity;
    }

    static String callerIdentity(String caller) {
        var matcher = CALLER.matcher(caller);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("could not find a valid caller identity in '" + caller + "'");
        }
        return matcher.group(1);
    }
}
