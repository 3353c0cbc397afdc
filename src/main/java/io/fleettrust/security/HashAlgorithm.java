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

import static io.fleettrust.security.Utils.concat;
import static io.fleettrust.security.Utils.require;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.Provider;

import org.bouncycastle.jce.provider.BouncyCastleProvider;

/**
 * Digest algorithms that can be used with RSA PKCS#1 v1.5 signatures. Each algorithm knows the DER-encoded
 * ASN.1 {@code DigestInfo} prefix that must be prepended to a raw hash before it is handed to a raw RSA signing
 * operation, such as the {@code CKM_RSA_PKCS} mechanism of a hardware token or the JCA {@code NONEwithRSA}
 * signature.
 */
public enum HashAlgorithm {
    MD5("MD5", 16, 0x30, 0x20, 0x30, 0x0c, 0x06, 0x08, 0x2a, 0x86, 0x48, 0x86, 0xf7, 0x0d, 0x02, 0x05, 0x05, 0x00,
            0x04, 0x10),
    SHA1("SHA-1", 20, 0x30, 0x21, 0x30, 0x09, 0x06, 0x05, 0x2b, 0x0e, 0x03, 0x02, 0x1a, 0x05, 0x00, 0x04, 0x14),
    SHA224("SHA-224", 28, 0x30, 0x2d, 0x30, 0x0d, 0x06, 0x09, 0x60, 0x86, 0x48, 0x01, 0x65, 0x03, 0x04, 0x02, 0x04,
            0x05, 0x00, 0x04, 0x1c),
    SHA256("SHA-256", 32, 0x30, 0x31, 0x30, 0x0d, 0x06, 0x09, 0x60, 0x86, 0x48, 0x01, 0x65, 0x03, 0x04, 0x02, 0x01,
            0x05, 0x00, 0x04, 0x20),
    SHA384("SHA-384", 48, 0x30, 0x41, 0x30, 0x0d, 0x06, 0x09, 0x60, 0x86, 0x48, 0x01, 0x65, 0x03, 0x04, 0x02, 0x02,
            0x05, 0x00, 0x04, 0x30),
    SHA512("SHA-512", 64, 0x30, 0x51, 0x30, 0x0d, 0x06, 0x09, 0x60, 0x86, 0x48, 0x01, 0x65, 0x03, 0x04, 0x02, 0x03,
            0x05, 0x00, 0x04, 0x40),
    /**
     * The concatenation of an MD5 and a SHA-1 hash, as used by TLS 1.1 and earlier. It has no DigestInfo prefix.
     */
    MD5SHA1("MD5+SHA-1", 36),
    RIPEMD160("RIPEMD160", 20, 0x30, 0x20, 0x30, 0x08, 0x06, 0x06, 0x28, 0xcf, 0x06, 0x03, 0x00, 0x31, 0x04, 0x14);

    private static final Provider BOUNCY_CASTLE = new BouncyCastleProvider();

    private final String jcaName;
    private final int digestLength;
    private final byte[] prefix;

    HashAlgorithm(String jcaName, int digestLength, int... prefix) {
        this.jcaName = jcaName;
        this.digestLength = digestLength;
        this.prefix = new byte[prefix.length];
        for (int i = 0; i < prefix.length; ++i) {
            this.prefix[i] = (byte) prefix[i];
        }
    }

    /**
     * The DER encoding of the {@code DigestInfo} header for this algorithm, up to and including the length byte of
     * the digest OCTET STRING.
     *
     * @return a fresh copy of the prefix bytes. Empty for {@link #MD5SHA1}.
     */
    public byte[] prefix() {
        return prefix.clone();
    }

    public int digestLength() {
        return digestLength;
    }

    /**
     * Computes the digest of the given data with this algorithm.
     *
     * @param data the data to hash.
     * @return the raw hash value.
     */
    public byte[] digest(byte[] data) {
        if (this == MD5SHA1) {
            return concat(MD5.digest(data), SHA1.digest(data));
        }
        try {
            var digest = this == RIPEMD160
                    ? MessageDigest.getInstance(jcaName, BOUNCY_CASTLE)
                    : MessageDigest.getInstance(jcaName);
            return digest.digest(data);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }

    /**
     * Builds the block that a raw RSA PKCS#1 v1.5 signing operation expects: the DigestInfo prefix followed by the
     * hash.
     *
     * @param hash a hash previously computed with this algorithm.
     * @return the prefixed hash.
     * @throws IllegalArgumentException if the hash has the wrong length for this algorithm.
     */
    public byte[] digestInfo(byte[] hash) {
        require(hash.length == digestLength, "hash is " + hash.length + " bytes but " + this + " produces " +
                digestLength);
        return concat(prefix, hash);
    }
}
