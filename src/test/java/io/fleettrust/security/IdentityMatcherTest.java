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

import java.util.List;

import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public class IdentityMatcherTest {

    @DataProvider
    public Object[][] matches() {
        return new Object[][] {
                { List.of("/^admin-.*$/"), "admin-01", true },
                { List.of("/^admin-.*$/"), "user-admin-01", false },
                { List.of("admin"), "user-admin-01", true },
                { List.of("admin"), "operator", false },
                { List.of("/operator/"), "ops.operator.example", true },
                { List.of("node1", "/^privileged/"), "privileged.example", true },
                { List.of(), "anyone", false },
                { List.of("/^exact$/"), "exact", true },
                { List.of("/^exact$/"), "exactly", false },
        };
    }

    @Test(dataProvider = "matches")
    public void shouldMatchIdentities(List<String> patterns, String identity, boolean expected) {
        assertThat(IdentityMatcher.of(patterns).matches(identity)).isEqualTo(expected);
    }

    @Test
    public void shouldIgnoreInvalidPatterns() {
        var matcher = IdentityMatcher.of("/[unclosed/", "node");

        assertThat(matcher.matches("node1")).isTrue();
        assertThat(matcher.matches("[unclosed")).isFalse();
        assertThat(matcher.patterns()).containsExactly("/[unclosed/", "node");
    }

    @Test
    public void shouldNotTreatSingleSlashAsDelimited() {
        assertThat(IdentityMatcher.of("/").matches("a/b")).isTrue();
        assertThat(IdentityMatcher.of("/").matches("ab")).isFalse();
    }
}
