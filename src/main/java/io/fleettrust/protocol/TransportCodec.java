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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.grack.nanojson.JsonObject;
import com.grack.nanojson.JsonParser;
import com.grack.nanojson.JsonParserException;
import com.grack.nanojson.JsonWriter;

/**
 * Converts {@link TransportMessage}s to and from their JSON wire form:
 * <pre>{@code
 * {"protocol":"fleet:transport:1","data":"<base64>","headers":{"reply-to":"...","mc_sender":"...",
 *  "seen-by":[["in","via","out"]],"federation":{"req":"...","reply-to":"...","target":["..."]}}}
 * }</pre>
 * Fields are always written in this order and optional fields that are empty are left out. With strict validation
 * enabled every document is checked against the envelope schema on the way in and on the way out.
 */
public final class TransportCodec {
    private static final Logger logger = LoggerFactory.getLogger(TransportCodec.class);

    private final boolean strictValidation;

    public TransportCodec(boolean strictValidation) {
        this.strictValidation = strictValidation;
    }

    public String encode(TransportMessage message) throws InvalidTransportException {
        var snapshot = message.snapshot();
        var writer = JsonWriter.string().object()
                .value("protocol", snapshot.version)
                .value("data", snapshot.data)
                .object("headers");

        if (!snapshot.replyTo.isEmpty()) {
            writer.value("reply-to", snapshot.replyTo);
        }
        if (!snapshot.sender.isEmpty()) {
            writer.value("mc_sender", snapshot.sender);
        }
        if (!snapshot.hops.isEmpty()) {
            writer.array("seen-by");
            for (var hop : snapshot.hops) {
                writer.array().value(hop.in()).value(hop.processor()).value(hop.out()).end();
            }
            writer.end();
        }
        var federation = snapshot.federation;
        if (federation != null) {
            writer.object("federation");
            if (!federation.requestId().isEmpty()) {
                writer.value("req", federation.requestId());
            }
            if (!federation.replyTo().isEmpty()) {
                writer.value("reply-to", federation.replyTo());
            }
            if (!federation.targets().isEmpty()) {
                writer.array("target");
                for (var target : federation.targets()) {
                    writer.value(target);
                }
                writer.end();
            }
            writer.end();
        }
        var json = writer.end().end().done();

        if (strictValidation) {
            check(parse(json));
        }
        return json;
    }

    public TransportMessage decode(String json) throws InvalidTransportException {
        var document = parse(json);
        if (strictValidation) {
            check(document);
        }

        var message = new TransportMessage(string(document, "protocol"));
        message.setEncodedData(string(document, "data"));

        var headers = object(document, "headers");
        message.setReplyTo(string(headers, "reply-to"));
        message.setSender(string(headers, "mc_sender"));
        for (var hop : list(headers, "seen-by")) {
            if (hop instanceof List && ((List<?>) hop).size() == 3) {
                var fields = (List<?>) hop;
                message.recordNetworkHop(String.valueOf(fields.get(0)), String.valueOf(fields.get(1)),
                        String.valueOf(fields.get(2)));
            } else {
                logger.debug("Ignoring malformed seen-by entry {}", hop);
            }
        }

        if (headers.get("federation") instanceof Map) {
            var federation = object(headers, "federation");
            var targets = new ArrayList<String>();
            for (var target : list(federation, "target")) {
                if (target instanceof String) {
                    targets.add((String) target);
                }
            }
            message.setFederation(new FederationHeader(string(federation, "req"), string(federation, "reply-to"),
                    targets));
        }
        return message;
    }

    private static JsonObject parse(String json) throws InvalidTransportException {
        try {
            return JsonParser.object().from(json);
        } catch (JsonParserException e) {
            throw new InvalidTransportException("could not parse transport message: " + e.getMessage(), e);
        }
    }

    private static void check(Map<String, Object> document) throws InvalidTransportException {
        var violations = TransportSchema.validate(document);
        if (!violations.isEmpty()) {
            logger.debug("Transport message failed validation: {}", violations);
            throw new InvalidTransportException(violations);
        }
    }

    private static String string(Map<String, Object> object, String key) {
        var value = object.get(key);
        return value instanceof String ? (String) value : "";
    }

    private static List<?> list(Map<String, Object> object, String key) {
        var value = object.get(key);
        return value instanceof List ? (List<?>) value : List.of();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> object(Map<String, Object> object, String key) {
        var value = object.get(key);
        return value instanceof Map ? (Map<String, Object>) value : Map.of();
    }
}
