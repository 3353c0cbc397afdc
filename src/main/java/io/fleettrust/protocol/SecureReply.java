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
import java.security.MessageDigest;
import java.util.Base64;

import com.grack.nanojson.JsonObject;
import com.grack.nanojson.JsonParser;
import com.grack.nanojson.JsonParserException;
import com.grack.nanojson.JsonWriter;

import io.fleettrust.security.HashAlgorithm;
import io.fleettrust.security.SecurityProvider;

/**
 * A reply message with a SHA-256 checksum that lets the receiver detect corruption. Replies are not signed.
 */
public final class SecureReply {
    private final String message;
    private final byte[] hash;

    SecureReply(String message, byte[] hash) {
        this.message = requireNonNull(message, "message");
        this.hash = requireNonNull(hash, "hash").clone();
    }

    public static SecureReply of(String message, SecurityProvider provider) {
        return new SecureReply(message, provider.checksum(message.getBytes(UTF_8)));
    }

    public String message() {
        return message;
    }

    public byte[] hash() {
        return hash.clone();
    }

    /**
     * Checks that the hash matches the message.
     */
    public boolean isValid() {
        var expected = HashAlgorithm.SHA256.digest(message.getBytes(UTF_8));
        return MessageDigest.isEqual(expected, hash);
    }

    public String toJson() {
        return JsonWriter.string().object()
                .value("protocol", Protocol.SECURE_REPLY_V1)
                .value("message", message)
                .value("hash", Base64.getEncoder().encodeToString(hash))
                .end()
                .done();
    }

    public static SecureReply fromJson(String json) throws IOException {
        JsonObject document;
        try {
            document = JsonParser.object().from(json);
        } catch (JsonParserException e) {
            throw new IOException("could not parse secure reply", e);
        }
        if (!Protocol.SECURE_REPLY_V1.equals(document.getString("protocol"))) {
            throw new IOException("unsupported secure reply protocol: " + document.get("protocol"));
        }
        var message = document.getString("message");
        var hash = document.getString("hash");
        if (message == null || hash == null) {
            throw new IOException("secure reply is missing message or hash");
        }
        try {
            return new SecureReply(message, Base64.getDecoder().decode(hash));
        } catch (IllegalArgumentException e) {
            throw new IOException("secure reply hash is not valid base64", e);
        }
    }
}
