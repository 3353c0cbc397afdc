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

package io.fleettrust.protocol;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

import java.io.IOException;
import java.security.GeneralSecurityException;
import java.security.cert.CertificateException;
import java.util.Base64;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.grack.nanojson.JsonObject;
import com.grack.nanojson.JsonParser;
import com.grack.nanojson.JsonParserException;
import com.grack.nanojson.JsonWriter;

import io.fleettrust.security.SecurityProvider;

/**
 * A request message signed by the sending node, together with the certificate needed to check the signature.
 */
public final class SecureRequest {
    private static final Logger logger = LoggerFactory.getLogger(SecureRequest.class);

    private final String message;
    private final byte[] signature;
    private final String publicCertificate;

    SecureRequest(String message, byte[] signature, String publicCertificate) {
        this.message = requireNonNull(message, "message");
        this.signature = requireNonNull(signature, "signature").clone();
        this.publicCertificate = requireNonNull(publicCertificate, "publicCertificate");
    }

    /**
     * Signs a message with the provider's private key.
     *
     * @param message the request body.
     * @param provider an authenticated security provider.
     * @return the signed request.
     * @throws GeneralSecurityException if signing fails.
     */
    public static SecureRequest sign(String message, SecurityProvider provider) throws GeneralSecurityException {
        var signature = provider.signBytes(message.getBytes(UTF_8));
        return new SecureRequest(message, signature, provider.publicCertificatePem());
    }

    public String message() {
        return message;
    }

    public byte[] signature() {
        return signature.clone();
    }

    public String publicCertificate() {
        return publicCertificate;
    }

    /**
     * Checks the request on the receiving side. The embedded certificate is offered to the provider's cache under
     * the claimed identity, then the signature is checked against the claimed identity or any privileged identity.
     * A certificate the cache refuses is logged but does not by itself fail verification, as the sender's
     * certificate may already be cached. A request that claims no identity can only be vouched for by a
     * privileged certificate that is already cached.
     *
     * @param provider the receiving node's security provider.
     * @param claimedIdentity the identity the sender claims.
     * @return whether the signature is valid.
     */
    public boolean verify(SecurityProvider provider, String claimedIdentity) {
        if (claimedIdentity == null || claimedIdentity.isBlank()) {
            logger.debug("Request claims no identity, not caching its certificate");
        } else {
            try {
                provider.cachePublicData(publicCertificate.getBytes(UTF_8), claimedIdentity);
            } catch (CertificateException | IOException e) {
                logger.warn("Could not cache the certificate of {}: {}", claimedIdentity, e.getMessage());
            }
        }
        return provider.privilegedVerifyByteSignature(message.getBytes(UTF_8), signature, claimedIdentity);
    }

    public String toJson() {
        return JsonWriter.string().object()
                .value("protocol", Protocol.SECURE_REQUEST_V1)
                .value("message", message)
                .value("signature", Base64.getEncoder().encodeToString(signature))
                .value("pubcert", publicCertificate)
                .end()
                .done();
    }

    public static SecureRequest fromJson(String json) throws IOException {
        JsonObject document;
        try {
            document = JsonParser.object().from(json);
        } catch (JsonParserException e) {
            throw new IOException("could not parse secure request", e);
        }
        if (!Protocol.SECURE_REQUEST_V1.equals(document.getString("protocol"))) {
            throw new IOException("unsupported secure request protocol: " + document.get("protocol"));
        }
        var message = document.getString("message");
        var signature = document.getString("signature");
        var pubcert = document.getString("pubcert");
        if (message == null || signature == null || pubcert == null) {
            throw new IOException("secure request is missing message, signature or pubcert");
        }
        try {
            return new SecureRequest(message, Base64.getDecoder().decode(signature), pubcert);
        } catch (IllegalArgumentException e) {
            throw new IOException("secure request signature is not valid base64", e);
        }
    }
}
