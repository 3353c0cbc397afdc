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
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIOException;

import java.nio.file.Files;
import java.nio.file.Path;

import org.testng.annotations.BeforeClass;
import org.testng.annotations.Test;

import io.fleettrust.security.FileSecurityProvider;
import io.fleettrust.security.SecurityConfig;
import io.fleettrust.security.SecurityProvider;
import io.fleettrust.security.TestPki;

public class SecureRequestTest {
    private Path root;
    private SecurityProvider sender;
    private SecurityProvider receiver;
    private SecurityProvider auditor;

    @BeforeClass
    public void createNodes() throws Exception {
        root = Files.createTempDirectory("securerequest");
        var pki = new TestPki(root);
        sender = node(pki, "node1");
        receiver = node(pki, "node2");
        auditor = node(pki, "auditor", "/^node1$/");
    }

    private SecurityProvider node(TestPki pki, String name, String... privilegedUsers) throws Exception {
        var issued = pki.issue(name);
        var cache = Files.createDirectory(root.resolve(name + "-cache"));
        return new FileSecurityProvider(SecurityConfig.builder()
                .caFile(pki.caFile())
                .cacheDirectory(cache)
                .certificateFile(issued.writeCertificate(root.resolve(name + ".pem")))
                .keyFile(issued.writePrivateKey(root.resolve(name + "-key.pem")))
                .privilegedUsers(privilegedUsers)
                .build());
    }

    @Test
    public void shouldVerifyRequestCarriedInEnvelope() throws Exception {
        var codec = new TransportCodec(true);
        var envelope = new TransportMessage();
        envelope.setRequestData(SecureRequest.sign("{\"agent\":\"rpcutil\",\"action\":\"ping\"}", sender));
        envelope.setSender(sender.identity());
        envelope.setReplyTo("fleet.reply.node1.1");
        envelope.recordNetworkHop("nats-a", sender.identity(), "nats-b");

        var received = codec.decode(codec.encode(envelope));
        var request = SecureRequest.fromJson(received.message());

        assertThat(request.message()).isEqualTo("{\"agent\":\"rpcutil\",\"action\":\"ping\"}");
        assertThat(request.verify(receiver, received.senderId())).isTrue();
        assertThat(receiver.cachedPublicData("node1")).isEqualTo(request.publicCertificate().getBytes(UTF_8));
    }

    @Test
    public void shouldVerifyRequestWithoutSenderOnlyThroughPrivilegedCertificate() throws Exception {
        var codec = new TransportCodec(true);
        var envelope = new TransportMessage();
        envelope.setRequestData(SecureRequest.sign("ping", sender));
        auditor.cachePublicData(sender.publicCertificatePem().getBytes(UTF_8), "node1");

        var received = codec.decode(codec.encode(envelope));
        var request = SecureRequest.fromJson(received.message());

        assertThat(received.senderId()).isEmpty();
        assertThat(request.verify(receiver, received.senderId())).isFalse();
        assertThat(request.verify(receiver, null)).isFalse();
        assertThat(request.verify(auditor, received.senderId())).isTrue();
    }

    @Test
    public void shouldRejectTamperedMessage() throws Exception {
        var request = SecureRequest.sign("ping", sender);
        var tampered = new SecureRequest("pong", request.signature(), request.publicCertificate());

        assertThat(tampered.verify(receiver, "node1")).isFalse();
    }

    @Test
    public void shouldRejectRequestClaimingAnotherIdentity() throws Exception {
        var request = SecureRequest.sign("ping", sender);

        assertThat(request.verify(receiver, "node3")).isFalse();
    }

    @Test
    public void shouldRejectUnknownDocumentVersion() {
        assertThatIOException().isThrownBy(() -> SecureRequest.fromJson(
                "{\"protocol\":\"fleet:secure:request:0\",\"message\":\"m\",\"signature\":\"\",\"pubcert\":\"\"}"));
        assertThatIOException().isThrownBy(() -> SecureRequest.fromJson("{\"protocol\":\"fleet:secure:request:1\"}"));
    }

    @Test
    public void shouldDetectCorruptedReply() throws Exception {
        var reply = SecureReply.fromJson(SecureReply.of("pong", sender).toJson());
        var corrupted = new SecureReply("p0ng", reply.hash());

        assertThat(reply.message()).isEqualTo("pong");
        assertThat(reply.isValid()).isTrue();
        assertThat(corrupted.isValid()).isFalse();
    }

    @Test
    public void shouldCarryReplyInEnvelope() throws Exception {
        var envelope = new TransportMessage();
        envelope.setReplyData(SecureReply.of("pong", receiver));

        var reply = SecureReply.fromJson(envelope.message());

        assertThat(reply.isValid()).isTrue();
        assertThatIOException().isThrownBy(() -> SecureRequest.fromJson(envelope.message()));
    }
}
