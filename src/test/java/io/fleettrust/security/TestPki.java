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

import static java.nio.charset.StandardCharsets.US_ASCII;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.concurrent.atomic.AtomicLong;

import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.asn1.x509.BasicConstraints;
import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.asn1.x509.KeyUsage;
import org.bouncycastle.cert.jcajce.JcaX509CertificateConverter;
import org.bouncycastle.cert.jcajce.JcaX509v3CertificateBuilder;
import org.bouncycastle.openssl.jcajce.JcaPEMWriter;
import org.bouncycastle.operator.jcajce.JcaContentSignerBuilder;

/**
 * A throwaway certificate authority for tests. The CA certificate is written to {@code ca.pem} in the directory the
 * authority is created in.
 */
public final class TestPki {
    private static final AtomicLong SERIAL = new AtomicLong(System.currentTimeMillis());

    private final X500Name name;
    private final KeyPair keyPair;
    private final X509Certificate certificate;
    private final Path caFile;

    public TestPki(Path directory) throws Exception {
        this("CN=Fleet Test CA", directory);
    }

    public TestPki(String name, Path directory) throws Exception {
        this.name = new X500Name(name);
        this.keyPair = generateKeyPair();
        var builder = builder(this.name, this.name, keyPair);
        builder.addExtension(Extension.basicConstraints, true, new BasicConstraints(true));
        builder.addExtension(Extension.keyUsage, true, new KeyUsage(KeyUsage.keyCertSign | KeyUsage.cRLSign));
        this.certificate = sign(builder);
        this.caFile = directory.resolve("ca.pem");
        Files.writeString(caFile, toPem(certificate), US_ASCII);
    }

    public static KeyPair generateKeyPair() throws GeneralSecurityException {
        var generator = KeyPairGenerator.getInstance("RSA");
        generator.initialize(2048);
        return generator.generateKeyPair();
    }

    public X509Certificate certificate() {
        return certificate;
    }

    public Path caFile() {
        return caFile;
    }

    public Issued issue(String commonName) throws Exception {
        return issue(new X500Name("CN=" + commonName + ",O=Fleet"));
    }

    public Issued issueWithoutCommonName() throws Exception {
        return issue(new X500Name("O=Fleet,OU=Nodes"));
    }

    private Issued issue(X500Name subject) throws Exception {
        var leafKeys = generateKeyPair();
        var leaf = sign(builder(name, subject, leafKeys));
        return new Issued(leaf, leafKeys);
    }

    private JcaX509v3CertificateBuilder builder(X500Name issuer, X500Name subject, KeyPair subjectKeys) {
        var now = Instant.now();
        return new JcaX509v3CertificateBuilder(issuer, BigInteger.valueOf(SERIAL.incrementAndGet()),
                Date.from(now.minus(Duration.ofDays(1))), Date.from(now.plus(Duration.ofDays(365))), subject,
                subjectKeys.getPublic());
    }

    private X509Certificate sign(JcaX509v3CertificateBuilder builder) throws Exception {
        var signer = new JcaContentSignerBuilder("SHA256withRSA").build(keyPair.getPrivate());
        return new JcaX509CertificateConverter().getCertificate(builder.build(signer));
    }

    static String toPem(Object object) {
        var out = new StringWriter();
        try (var writer = new JcaPEMWriter(out)) {
            writer.writeObject(object);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out.toString();
    }

    /**
     * A certificate issued by a {@link TestPki}, with its key pair.
     */
    public static final class Issued {
        private final X509Certificate certificate;
        private final KeyPair keyPair;

        Issued(X509Certificate certificate, KeyPair keyPair) {
            this.certificate = certificate;
            this.keyPair = keyPair;
        }

        public X509Certificate certificate() {
            return certificate;
        }

        public KeyPair keyPair() {
            return keyPair;
        }

        public String pem() {
            return toPem(certificate);
        }

        public byte[] pemBytes() {
            return pem().getBytes(US_ASCII);
        }

        public Path writeCertificate(Path file) throws IOException {
            return Files.writeString(file, pem(), US_ASCII);
        }

        public Path writePrivateKey(Path file) throws IOException {
            return Files.writeString(file, toPem(keyPair.getPrivate()), US_ASCII);
        }
    }
}
