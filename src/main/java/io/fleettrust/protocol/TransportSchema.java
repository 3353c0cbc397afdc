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
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Structural rules for the wire form of a {@link TransportMessage}. The document is checked after it has been parsed
 * into maps and lists, and every rule that fails is collected.
 */
final class TransportSchema {
    private static final Set<String> KNOWN_VERSIONS = Set.of(Protocol.TRANSPORT_V1);
    private static final Set<String> ROOT_PROPERTIES = Set.of("protocol", "data", "headers");
    private static final Set<String> HEADER_PROPERTIES = Set.of("reply-to", "mc_sender", "seen-by", "federation");
    private static final Set<String> FEDERATION_PROPERTIES = Set.of("req", "reply-to", "target");

    private final List<String> violations = new ArrayList<>();

    private TransportSchema() {}

    /**
     * Checks a parsed transport document.
     *
     * @param document the parsed JSON object.
     * @return the violations found, empty if the document is valid.
     */
    static List<String> validate(Map<String, Object> document) {
        var schema = new TransportSchema();
        schema.checkRoot(document);
        return List.copyOf(schema.violations);
    }

    private void checkRoot(Map<String, Object> document) {
        unknownProperties("(root)", document, ROOT_PROPERTIES);

        var protocol = document.get("protocol");
        if (protocol == null) {
            violations.add("protocol is required");
        } else if (!(protocol instanceof String)) {
            violations.add("protocol: must be a string");
        } else if (!KNOWN_VERSIONS.contains(protocol)) {
            violations.add("protocol: unknown transport version " + protocol);
        }

        var data = document.get("data");
        if (data == null) {
            violations.add("data is required");
        } else if (!(data instanceof String)) {
            violations.add("data: must be a string");
        } else if (((String) data).isEmpty()) {
            violations.add("data: must not be empty");
        } else if (!isBase64((String) data)) {
            violations.add("data: must be base64 encoded");
        }

        var headers = document.get("headers");
        if (headers == null) {
            violations.add("headers is required");
        } else if (!(headers instanceof Map)) {
            violations.add("headers: must be an object");
        } else {
            checkHeaders(asObject(headers));
        }
    }

    private void checkHeaders(Map<String, Object> headers) {
        unknownProperties("headers", headers, HEADER_PROPERTIES);
        string("headers.reply-to", headers.get("reply-to"));
        string("headers.mc_sender", headers.get("mc_sender"));

        var seenBy = headers.get("seen-by");
        if (seenBy != null) {
            if (!(seenBy instanceof List)) {
                violations.add("headers.seen-by: must be an array");
            } else {
                var hops = (List<?>) seenBy;
                for (int i = 0; i < hops.size(); ++i) {
                    checkHop("headers.seen-by." + i, hops.get(i));
                }
            }
        }

        var federation = headers.get("federation");
        if (federation != null) {
            if (!(federation instanceof Map)) {
                violations.add("headers.federation: must be an object");
            } else {
                checkFederation(asObject(federation));
            }
        }
    }

    private void checkHop(String path, Object hop) {
        if (!(hop instanceof List)) {
            violations.add(path + ": must be an array");
            return;
        }
        var fields = (List<?>) hop;
        if (fields.size() != 3) {
            violations.add(path + ": must have exactly 3 items");
        }
        for (int i = 0; i < fields.size(); ++i) {
            if (!(fields.get(i) instanceof String)) {
                violations.add(path + "." + i + ": must be a string");
            }
        }
    }

    private void checkFederation(Map<String, Object> federation) {
        unknownProperties("headers.federation", federation, FEDERATION_PROPERTIES);
        string("headers.federation.req", federation.get("req"));
        string("headers.federation.reply-to", federation.get("reply-to"));

        var targets = federation.get("target");
        if (targets != null) {
            if (!(targets instanceof List)) {
                violations.add("headers.federation.target: must be an array");
            } else {
                var items = (List<?>) targets;
                for (int i = 0; i < items.size(); ++i) {
                    if (!(items.get(i) instanceof String)) {
                        violations.add("headers.federation.target." + i + ": must be a string");
                    }
                }
            }
        }
    }

    private void string(String path, Object value) {
        if (value != null && !(value instanceof String)) {
            violations.add(path + ": must be a string");
        }
    }

    private void unknownProperties(String path, Map<String, Object> object, Set<String> allowed) {
        object.keySet().stream()
                .filter(key -> !allowed.contains(key))
                .sorted()
                .forEach(key -> violations.add(path + ": additional property " + key + " is not allowed"));
    }

    private static boolean isBase64(String value) {
        try {
            Base64.getDecoder().decode(value);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asObject(Object value) {
        return (Map<String, Object>) value;
    }
}
