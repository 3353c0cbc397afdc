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

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.security.GeneralSecurityException;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.Signature;
import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.asn1.x500.style.BCStyle;
import org.bouncycastle.asn1.x500.style.IETFUtils;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.cert.jcajce.JcaX509CertificateConverter;
import org.bouncycastle.openssl.PEMEncryptedKeyPair;
import org.bouncycastle.openssl.PEMKeyPair;
import org.bouncycastle.openssl.PEMParser;
import org.bouncycastle.openssl.jcajce.JcaPEMKeyConverter;
import org.bouncycastle.openssl.jcajce.JcaPEMWriter;
import org.bouncycastle.pkcs.PKCS8EncryptedPrivateKeyInfo;

final class Crypto {
    /**
     * The content digest used for every signature, regardless of backend.
     */
    static final HashAlgorithm CHECKSUM_ALGORITHM = HashAlgorithm.SHA256;
    static final String RAW_RSA_SIGNATURE = "NONEwithRSA";

    static byte[] checksum(byte[] data) {
        return CHECKSUM_ALGORITHM.digest(data);
    }

    /**
     * Verifies an RSA PKCS#1 v1.5 signature over a pre-computed hash.
     */
    static boolean verify(PublicKey key, HashAlgorithm algorithm, byte[] hash, byte[] signature)
            throws GeneralSecurityException {
        var verifier = Signature.getInstance(RAW_RSA_SIGNATURE);
        verifier.initVerify(key);
        verifier.update(algorithm.digestInfo(hash));
        return verifier.verify(signature);
    }

    static List<X509Certificate> readCertificates(byte[] pem) throws CertificateException {
        var converter = new JcaX509CertificateConverter();
        var certificates = new ArrayList<X509Certificate>();
        try (var parser = new PEMParser(new InputStreamReader(new ByteArrayInputStream(pem), US_ASCII))) {
            Object object;
            while ((object = parser.readObject()) != null) {
                if (object instanceof X509CertificateHolder) {
                    certificates.add(converter.getCertificate((X509CertificateHolder) object));
                }
            }
        } catch (IOException e) {
            throw new CertificateException("could not parse PEM data: " + e.getMessage(), e);
        }
        return certificates;
    }

    static X509Certificate readCertificate(byte[] pem) throws CertificateException {
        var certificates = readCertificates(pem);
        if (certificates.isEmpty()) {
            throw new CertificateException("no certificate found in PEM data");
        }
        return certificates.get(0);
    }

    static X509Certificate parseCertificate(byte[] der) throws CertificateException {
        try {
            return new JcaX509CertificateConverter().getCertificate(new X509CertificateHolder(der));
        } catch (IOException e) {
            throw new CertificateException("failed to parse X509 certificate: " + e.getMessage(), e);
        }
    }

    static PrivateKey readPrivateKey(byte[] pem) throws IOException {
        var converter = new JcaPEMKeyConverter();
        try (var parser = new PEMParser(new InputStreamReader(new ByteArrayInputStream(pem), US_ASCII))) {
            Object object;
            while ((object = parser.readObject()) != null) {
                if (object instanceof PEMKeyPair) {
                    return converter.getKeyPair((PEMKeyPair) object).getPrivate();
                } else if (object instanceof PrivateKeyInfo) {
                    return converter.getPrivateKey((PrivateKeyInfo) object);
                } else if (object instanceof PEMEncryptedKeyPair || object instanceof PKCS8EncryptedPrivateKeyInfo) {
                    throw new IOException("encrypted private keys are not supported");
                }
            }
        }
        throw new IOException("no private key found in PEM data");
    }

    static Optional<String> commonName(X509Certificate certificate) {
        var subject = X500Name.getInstance(certificate.getSubjectX500Principal().getEncoded());
        var rdns = subject.getRDNs(BCStyle.CN);
        if (rdns.length == 0) {
            return Optional.empty();
        }
        var commonName = IETFUtils.valueToString(rdns[0].getFirst().getValue());
        return commonName.isEmpty() ? Optional.empty() : Optional.of(commonName);
    }

    static String toPem(X509Certificate certificate) {
        var out = new StringWriter();
        try (var writer = new JcaPEMWriter(out)) {
            writer.writeObject(certificate);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out.toString();
    }
}
