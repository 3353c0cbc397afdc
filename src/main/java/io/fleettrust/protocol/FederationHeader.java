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

import java.util.List;
import java.util.Objects;

/**
 * Routing information added by a federation broker: the broker's request id, the reply-to destination it
 * replaced, and the identities the message must be duplicated to. Instances are immutable; the envelope swaps in a
 * new one on every change so the block is never seen half built.
 */
public final class FederationHeader {
    static final FederationHeader EMPTY = new FederationHeader("", "", List.of());

    private final String requestId;
    private final String replyTo;
    private final List<String> targets;

    FederationHeader(String requestId, String replyTo, List<String> targets) {
        this.requestId = requestId == null ? "" : requestId;
        this.replyTo = replyTo == null ? "" : replyTo;
        this.targets = targets == null ? List.of() : List.copyOf(targets);
    }

    public String requestId() {
        return requestId;
    }

    public String replyTo() {
        return replyTo;
    }

    public List<String> targets() {
        return targets;
    }

    FederationHeader withRequestId(String requestId) {
        return new FederationHeader(requestId, replyTo, targets);
    }

    FederationHeader withReplyTo(String replyTo) {
        return new FederationHeader(requestId, replyTo, targets);
    }

    FederationHeader withTargets(List<String> targets) {
        return new FederationHeader(requestId, replyTo, targets);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) { return true; }
        if (!(other instanceof FederationHeader)) { return false; }
        FederationHeader that = (FederationHeader) other;
        return requestId.equals(that.requestId) && replyTo.equals(that.replyTo) && targets.equals(that.targets);
    }

    @Override
    public int hashCode() {
        return Objects.hash(requestId, replyTo, targets);
    }

    @Override
    public String toString() {
        return "FederationHeader{" +
                "requestId='" + requestId + '\'' +
                ", replyTo='" + replyTo + '\'' +
                ", targets=" + targets +
                '}';
    }
}
