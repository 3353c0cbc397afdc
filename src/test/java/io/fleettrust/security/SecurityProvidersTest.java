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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Files;

import org.testng.annotations.Test;

public class SecurityProvidersTest {

    @Test
    public void shouldCreateFileProvider() throws Exception {
        var root = Files.createTempDirectory("providers");
        var pki = new TestPki(root);
        var node = pki.issue("node1");

        var provider = SecurityProviders.newProvider(SecurityConfig.builder()
                .caFile(pki.caFile())
                .cacheDirectory(root)
                .certificateFile(node.writeCertificate(root.resolve("node1.pem")))
                .keyFile(node.writePrivateKey(root.resolve("node1-key.pem")))
                .build());

        assertThat(provider).isInstanceOf(FileSecurityProvider.class);
        assertThat(provider.identity()).isEqualTo("node1");
    }

    @Test
    public void shouldRequireFilesForFileProvider() {
        assertThatThrownBy(() -> SecurityProviders.newProvider(SecurityConfig.builder().build()))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    public void shouldRequireDriverFileForTokenProvider() {
        var config = SecurityConfig.builder().backend(SecurityConfig.Backend.PKCS11).build();

        assertThatThrownBy(() -> SecurityProviders.newProvider(config))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining(SecurityConfig.PKCS11_DRIVER_FILE);
    }
}
