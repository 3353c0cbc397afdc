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

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.nio.file.Files;
import java.nio.file.Path;
import java.security.Signature;
import java.security.cert.CertificateException;
import java.time.Duration;

import org.assertj.core.api.SoftAssertions;
import org.testng.annotations.BeforeClass;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import io.fleettrust.security.TestPki.Issued;

public class FileSecurityProviderTest {
    private static final byte[] DATA = "{\"agent\":\"rpcutil\",\"action\":\"ping\"}".getBytes(UTF_8);

    private Path root;
    private TestPki pki;
    private Issued node1;
    private Issued node2;
    private Issued admin;

    private Path cacheDirectory;
    private SecurityConfig.Builder config;

    @BeforeClass
    public void createPki() throws Exception {
        root = Files.createTempDirectory("filesec");
        pki = new TestPki(root);
        node1 = pki.issue("node1");
        node2 = pki.issue("node2");
        admin = pki.issue("admin.privileged");
        node1.writeCertificate(root.resolve("node1.pem"));
        node1.writePrivateKey(root.resolve("node1-key.pem"));
    }

    @BeforeMethod
    public void createCache() throws Exception {
        cacheDirectory = Files.createTempDirectory(root, "cache");
        config = SecurityConfig.builder()
                .caFile(pki.caFile())
                .cacheDirectory(cacheDirectory)
                .certificateFile(root.resolve("node1.pem"))
                .keyFile(root.resolve("node1-key.pem"))
                .privilegedUsers("/\\.privileged$/");
    }

    private FileSecurityProvider provider() throws Exception {
        return new FileSecurityProvider(config.build());
    }

    private static byte[] sign(Issued signer, byte[] data) throws Exception {
        var signature = Signature.getInstance("SHA256withRSA");
        signature.initSign(signer.keyPair().getPrivate());
        signature.update(data);
        return signature.sign();
    }

    @Test
    public void shouldUseCommonNameAsIdentity() throws Exception {
        var provider = provider();

        var softly = new SoftAssertions();
        softly.assertThat(provider.provider()).isEqualTo("file");
        softly.assertThat(provider.identity()).isEqualTo("node1");
        softly.assertThat(provider.publicCertificate()).isEqualTo(node1.certificate());
        softly.assertThat(provider.publicCertificatePem()).isEqualTo(node1.pem());
        softly.assertThat(provider.callerName()).isEqualTo("fleet=node1");
        softly.assertAll();
    }

    @Test
    public void shouldVerifyOwnSignatureAgainstActiveCertificate() throws Exception {
        var provider = provider();
        var signature = provider.signBytes(DATA);

        assertThat(provider.verifyByteSignature(DATA, signature, "")).isTrue();
        assertThat(provider.verifyByteSignature(DATA, signature, null)).isTrue();
    }

    @Test
    public void shouldProduceStandardSha256WithRsaSignatures() throws Exception {
        var signature = provider().signBytes(DATA);

        var verifier = Signature.getInstance("SHA256withRSA");
        verifier.initVerify(node1.certificate().getPublicKey());
        verifier.update(DATA);
        assertThat(verifier.verify(signature)).isTrue();
    }

    @Test
    public void shouldRejectSignatureOverAlteredData() throws Exception {
        var provider = provider();
        var signature = provider.signBytes(DATA);
        var altered = DATA.clone();
        altered[altered.length - 1] ^= 1;

        assertThat(provider.verifyByteSignature(altered, signature, "")).isFalse();
    }

    @Test
    public void shouldVerifyAgainstCachedCertificate() throws Exception {
        var provider = provider();
        provider.cachePublicData(node2.pemBytes(), "node2");

        assertThat(provider.verifyByteSignature(DATA, sign(node2, DATA), "node2")).isTrue();
        assertThat(provider.verifyByteSignature(DATA, sign(node1, DATA), "node2")).isFalse();
    }

    @Test
    public void shouldFailVerificationForUncachedIdentity() throws Exception {
        assertThat(provider().verifyByteSignature(DATA, sign(node2, DATA), "node2")).isFalse();
    }

    @Test
    public void shouldAllowPrivilegedCertificateToActForOthers() throws Exception {
        var provider = provider();
        provider.cachePublicData(admin.pemBytes(), "admin.privileged");
        var signature = sign(admin, DATA);

        assertThat(provider.verifyByteSignature(DATA, signature, "node2")).isFalse();
        assertThat(provider.privilegedVerifyByteSignature(DATA, signature, "node2")).isTrue();
    }

    @Test
    public void shouldNotAllowUnprivilegedCertificateToActForOthers() throws Exception {
        var provider = provider();
        provider.cachePublicData(node2.pemBytes(), "node2");

        assertThat(provider.privilegedVerifyByteSignature(DATA, sign(node2, DATA), "node3")).isFalse();
    }

    @Test
    public void shouldTryClaimedIdentityBeforePrivilegedIdentities() throws Exception {
        var security = new FileSecurity(config.build());
        security.cachePublicData(node2.pemBytes(), "node2");
        security.cachePublicData(admin.pemBytes(), "zeta.privileged");
        security.cachePublicData(admin.pemBytes(), "admin.privileged");

        assertThat(security.privilegedCandidates("node2"))
                .containsExactly("node2", "admin.privileged", "zeta.privileged");
        assertThat(security.privilegedCandidates("admin.privileged"))
                .containsExactly("admin.privileged", "zeta.privileged");
        assertThat(security.privilegedCandidates("node9"))
                .containsExactly("admin.privileged", "zeta.privileged");
    }

    @Test
    public void shouldOnlyCacheAllowListedIdentities() throws Exception {
        var provider = new FileSecurityProvider(config.allowList("/^node/").build());
        var rogue = pki.issue("rogue");

        provider.cachePublicData(node2.pemBytes(), "node2");
        assertThatThrownBy(() -> provider.cachePublicData(rogue.pemBytes(), "rogue"))
                .isInstanceOf(CertificateException.class);

        assertThat(Files.exists(cacheDirectory.resolve("node2.pem"))).isTrue();
        assertThat(Files.exists(cacheDirectory.resolve("rogue.pem"))).isFalse();
    }

    @Test
    public void shouldCachePrivilegedCertificateUnderAnyIdentity() throws Exception {
        var provider = new FileSecurityProvider(config.allowList("/^node/").build());

        provider.cachePublicData(admin.pemBytes(), "ops7");

        assertThat(provider.cachedPublicData("ops7")).isEqualTo(admin.pemBytes());
    }

    @Test
    public void shouldRejectCertificateIssuedToAnotherIdentity() throws Exception {
        var provider = provider();

        assertThatThrownBy(() -> provider.cachePublicData(node2.pemBytes(), "node3"))
                .isInstanceOf(CertificateException.class)
                .hasMessageContaining("does not match identity");
    }

    @Test
    public void shouldRejectCertificateFromUntrustedAuthority() throws Exception {
        var otherRoot = Files.createTempDirectory("otherca");
        var impostor = new TestPki("CN=Impostor CA", otherRoot).issue("node2");
        var provider = provider();

        assertThatThrownBy(() -> provider.cachePublicData(impostor.pemBytes(), "node2"))
                .isInstanceOf(CertificateException.class);
        assertThat(Files.exists(cacheDirectory.resolve("node2.pem"))).isFalse();
    }

    @Test
    public void shouldKeepFirstCachedCertificate() throws Exception {
        var provider = provider();
        var reissued = pki.issue("node2");

        provider.cachePublicData(node2.pemBytes(), "node2");
        provider.cachePublicData(reissued.pemBytes(), "node2");

        assertThat(provider.cachedPublicData("node2")).isEqualTo(node2.pemBytes());
    }

    @Test
    public void shouldReplaceCachedCertificateWhenOverwriting() throws Exception {
        var provider = new FileSecurityProvider(config.alwaysOverwriteCache(true).build());
        var reissued = pki.issue("node2");

        provider.cachePublicData(node2.pemBytes(), "node2");
        provider.cachePublicData(reissued.pemBytes(), "node2");

        assertThat(provider.cachedPublicData("node2")).isEqualTo(reissued.pemBytes());
    }

    @Test
    public void shouldVerifyCertificateName() throws Exception {
        var provider = provider();

        provider.verifyCertificate(node2.pemBytes(), "node2");
        provider.verifyCertificate(node2.pemBytes(), "");
        assertThatThrownBy(() -> provider.verifyCertificate(node2.pemBytes(), "node1"))
                .isInstanceOf(CertificateException.class);
    }

    @Test
    public void shouldReportEveryValidationProblem() throws Exception {
        var provider = new FileSecurityProvider(config
                .caFile(root.resolve("missing-ca.pem"))
                .cacheDirectory(root.resolve("missing-cache"))
                .build());

        var validation = provider.validate();

        assertThat(validation.isValid()).isFalse();
        assertThat(validation.problems()).hasSize(2);
        assertThat(validation.problems()).allMatch(problem -> problem.contains("no such file or directory"));
    }

    @Test
    public void shouldValidateCompleteConfiguration() throws Exception {
        assertThat(provider().validate().problems()).isEmpty();
    }

    @Test
    public void shouldRequireCertificateAndKeyFiles() {
        assertThatThrownBy(() -> new FileSecurityProvider(config.certificateFile(null).build()))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    public void shouldRequireCommonNameOnCertificate() throws Exception {
        var anonymous = pki.issueWithoutCommonName();
        anonymous.writeCertificate(root.resolve("anonymous.pem"));
        anonymous.writePrivateKey(root.resolve("anonymous-key.pem"));

        assertThatThrownBy(() -> new FileSecurityProvider(config
                .certificateFile(root.resolve("anonymous.pem"))
                .keyFile(root.resolve("anonymous-key.pem"))
                .build()))
                .isInstanceOf(CertificateLoadException.class)
                .hasMessageContaining("must have a valid CommonName");
    }

    @Test
    public void shouldBuildMutualTlsConfiguration() throws Exception {
        var tls = provider().tlsConfiguration();

        assertThat(tls.isVerificationDisabled()).isFalse();
        assertThat(tls.context().getProtocol()).isEqualTo("TLS");
        assertThat(tls.parameters().getNeedClientAuth()).isTrue();
        assertThat(tls.parameters().getProtocols()).containsExactly("TLSv1.3", "TLSv1.2");
    }

    @Test
    public void shouldBuildInsecureTlsConfigurationWhenVerificationDisabled() throws Exception {
        var tls = new FileSecurityProvider(config.disableTlsVerify(true).build()).clientTlsConfiguration();

        assertThat(tls.isVerificationDisabled()).isTrue();
    }

    @Test
    public void shouldBuildHttpClients() throws Exception {
        var provider = provider();

        assertThat(provider.httpClient(true).sslContext().getProtocol()).isEqualTo("TLS");
        assertThat(provider.httpClient(false)).isNotNull();
    }

    @Test
    public void shouldExtractCallerIdentity() throws Exception {
        var provider = provider();

        assertThat(provider.callerIdentity("fleet=node2.example.net")).isEqualTo("node2.example.net");
        assertThatThrownBy(() -> provider.callerIdentity("cert=node2"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void shouldDelegateToRemoteSigner() throws Exception {
        var signer = mock(RequestSigner.class);
        when(signer.kind()).thenReturn("test");
        when(signer.sign(DATA)).thenReturn(new byte[] { 42 });
        var provider = new FileSecurityProvider(config.remoteSigner(signer).build());

        assertThat(provider.isRemoteSigning()).isTrue();
        assertThat(provider.remoteSignRequest(DATA)).containsExactly(42);
        verify(signer).sign(DATA);
    }

    @Test
    public void shouldNotSignRemotelyWithoutSigner() throws Exception {
        var provider = provider();

        assertThat(provider.isRemoteSigning()).isFalse();
        assertThatThrownBy(() -> provider.remoteSignRequest(DATA))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> provider.enroll(Duration.ofSeconds(1), (message, attempt) -> { }))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
