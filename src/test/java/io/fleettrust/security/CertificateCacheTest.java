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

import java.nio.file.Files;
import java.nio.file.Path;

import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

public class CertificateCacheTest {
    private Path directory;

    @BeforeMethod
    public void createDirectory() throws Exception {
        directory = Files.createTempDirectory("certcache");
    }

    @Test
    public void shouldKeepFirstWriteByDefault() throws Exception {
        var cache = new CertificateCache(directory, false);

        assertThat(cache.store("node1", "first".getBytes(UTF_8))).isTrue();
        assertThat(cache.store("node1", "second".getBytes(UTF_8))).isFalse();
        assertThat(cache.read("node1")).asString(UTF_8).isEqualTo("first");
    }

    @Test
    public void shouldOverwriteWhenConfigured() throws Exception {
        var cache = new CertificateCache(directory, true);

        cache.store("node1", "first".getBytes(UTF_8));
        assertThat(cache.store("node1", "second".getBytes(UTF_8))).isTrue();
        assertThat(cache.read("node1")).asString(UTF_8).isEqualTo("second");
    }

    @Test
    public void shouldStoreUnderIdentityFileName() throws Exception {
        var cache = new CertificateCache(directory, false);
        cache.store("node1.example.net", new byte[] { 1 });

        assertThat(cache.path("node1.example.net")).isEqualTo(directory.resolve("node1.example.net.pem"));
        assertThat(cache.exists("node1.example.net")).isTrue();
        assertThat(cache.exists("node2.example.net")).isFalse();
    }

    @Test
    public void shouldListMatchingIdentitiesInOrder() throws Exception {
        var cache = new CertificateCache(directory, false);
        for (var id : new String[] { "zeta.privileged", "node1", "alpha.privileged", "beta.privileged" }) {
            cache.store(id, new byte[] { 1 });
        }
        Files.writeString(directory.resolve("notes.txt"), "ignored");
        Files.createDirectory(directory.resolve("nested.privileged.pem"));

        assertThat(cache.identities(IdentityMatcher.of("/\\.privileged$/")))
                .containsExactly("alpha.privileged", "beta.privileged", "zeta.privileged");
    }

    @Test
    public void shouldListNothingForMissingDirectory() {
        var cache = new CertificateCache(directory.resolve("missing"), false);

        assertThat(cache.identities(IdentityMatcher.of("/.*/"))).isEmpty();
    }
}
