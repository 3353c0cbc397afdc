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
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * The envelope that carries a signed request or reply between nodes. Besides the payload it records where a reply
 * should be sent, which node sent it, every stage that processed it on the way and, when it passed through a
 * federation broker, the broker's routing information.
 * <p>
 * Every accessor and mutator takes a lock held by the instance, so a single envelope may be shared between
 * threads. The lock is never held while the payload documents are serialized.
 */
public final class TransportMessage {
    private final ReentrantLock lock = new ReentrantLock();

    private final String version;
    private String data = "";
    private String replyTo = "";
    private String sender = "";
    private final List<NetworkHop> hops = new ArrayList<>();
    private FederationHeader federation;

    public TransportMessage() {
        this(Protocol.TRANSPORT_V1);
    }

    TransportMessage(String version) {
        this.version = requireNonNull(version, "version");
    }

    public String version() {
        return version;
    }

    /**
     * Decodes the payload carried by this envelope.
     *
     * @return the JSON text of the signed request or reply document.
     * @throws IOException if the payload is not valid base64.
     */
    public String message() throws IOException {
        var encoded = locked(() -> data);
        try {
            return new String(Base64.getDecoder().decode(encoded), UTF_8);
        } catch (IllegalArgumentException e) {
            throw new IOException("could not base64 decode the message data", e);
        }
    }

    public void setRequestData(SecureRequest request) {
        setData(request.toJson());
    }

    public void setReplyData(SecureReply reply) {
        setData(reply.toJson());
    }

    private void setData(String json) {
        var encoded = Base64.getEncoder().encodeToString(json.getBytes(UTF_8));
        update(() -> data = encoded);
    }

    void setEncodedData(String data) {
        update(() -> this.data = requireNonNull(data, "data"));
    }

    public String replyTo() {
        return locked(() -> replyTo);
    }

    public void setReplyTo(String replyTo) {
        update(() -> this.replyTo = requireNonNull(replyTo, "replyTo"));
    }

    public String senderId() {
        return locked(() -> sender);
    }

    public void setSender(String sender) {
        update(() -> this.sender = requireNonNull(sender, "sender"));
    }

    /**
     * Appends a processing stage to the list of hops. Hops are never removed or reordered.
     *
     * @param in the endpoint the message arrived on.
     * @param processor the identity of the node that handled it.
     * @param out the endpoint the message left on.
     */
    public void recordNetworkHop(String in, String processor, String out) {
        var hop = new NetworkHop(in, processor, out);
        update(() -> hops.add(hop));
    }

    /**
     * The hops recorded so far, in the order they were recorded.
     *
     * @return an immutable snapshot.
     */
    public List<NetworkHop> networkHops() {
        return locked(() -> List.copyOf(hops));
    }

    public boolean isFederated() {
        return locked(() -> federation != null);
    }

    public Optional<List<String>> federationTargets() {
        return locked(() -> Optional.ofNullable(federation).map(FederationHeader::targets));
    }

    public Optional<String> federationReplyTo() {
        return locked(() -> Optional.ofNullable(federation).map(FederationHeader::replyTo));
    }

    public Optional<String> federationRequestId() {
        return locked(() -> Optional.ofNullable(federation).map(FederationHeader::requestId));
    }

    public void setFederationTargets(List<String> targets) {
        var copy = List.copyOf(targets);
        update(() -> federation = orEmpty().withTargets(copy));
    }

    public void setFederationReplyTo(String replyTo) {
        requireNonNull(replyTo, "replyTo");
        update(() -> federation = orEmpty().withReplyTo(replyTo));
    }

    public void setFederationRequestId(String requestId) {
        requireNonNull(requestId, "requestId");
        update(() -> federation = orEmpty().withRequestId(requestId));
    }

    void setFederation(FederationHeader federation) {
        update(() -> this.federation = federation);
    }

    /**
     * Removes the federation block entirely. Later encodings omit it.
     */
    public void setUnfederated() {
        update(() -> federation = null);
    }

    /**
     * Copies every field under a single acquisition of the lock, so the copy reflects one moment in the life of
     * the envelope.
     */
    Snapshot snapshot() {
        return locked(() -> new Snapshot(version, data, replyTo, sender, List.copyOf(hops), federation));
    }

    private FederationHeader orEmpty() {
        return federation == null ? FederationHeader.EMPTY : federation;
    }

    private <T> T locked(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    private void update(Runnable action) {
        lock.lock();
        try {
            action.run();
        } finally {
            lock.unlock();
        }
    }

    static final class Snapshot {
        final String version;
        final String data;
        final String replyTo;
        final String sender;
        final List<NetworkHop> hops;
        final FederationHeader federation;

        private Snapshot(String version, String data, String replyTo, String sender, List<NetworkHop> hops,
                FederationHeader federation) {
            this.version = version;
            this.data = data;
            this.replyTo = replyTo;
            this.sender = sender;
            this.hops = hops;
            this.federation = federation;
        }
    }

    @Override
    public String toString() {
        return locked(() -> "TransportMessage{" +
                "version='" + version + '\'' +
                ", replyTo='" + replyTo + '\'' +
                ", sender='" + sender + '\'' +
                ", hops=" + hops +
                ", federation=" + federation +
                '}');
    }
}
