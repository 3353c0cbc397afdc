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

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Matches identities against an ordered list of patterns, as used for the privileged-user and allow-list settings.
 * A pattern written as {@code /regex/} has its delimiters removed. Every pattern, delimited or not, is then treated
 * as a regular expression that may match anywhere in the identity, so {@code admin} matches {@code user-admin-01}.
 * Anchor the pattern ({@code /^admin$/}) when an exact match is wanted.
 */
public final class IdentityMatcher {
    private static final Logger logger = LoggerFactory.getLogger(IdentityMatcher.class);
    private static final Pattern DELIMITED = Pattern.compile("^/.+/$");

    private final List<String> patterns;
    private final List<Pattern> compiled;

    private IdentityMatcher(List<String> patterns, List<Pattern> compiled) {
        this.patterns = patterns;
        this.compiled = compiled;
    }

    public static IdentityMatcher of(Collection<String> patterns) {
        var compiled = new ArrayList<Pattern>(patterns.size());
        for (var pattern : patterns) {
            var regex = pattern;
            if (DELIMITED.matcher(regex).matches()) {
                regex = stripSlashes(regex);
            }
            try {
                compiled.add(Pattern.compile(regex));
            } catch (PatternSyntaxException e) {
                logger.warn("Ignoring invalid identity pattern '{}': {}", pattern, e.getDescription());
            }
        }
        return new IdentityMatcher(List.copyOf(patterns), List.copyOf(compiled));
    }

    public static IdentityMatcher of(String... patterns) {
        return of(List.of(patterns));
    }

    public boolean matches(String identity) {
        for (var pattern : compiled) {
            if (pattern.matcher(identity).find()) {
                return true;
            }
        }
        return false;
    }

    public List<String> patterns() {
        return patterns;
    }

    private static String stripSlashes(String pattern) {
        int start = 0;
        int end = pattern.length();
        while (start < end && pattern.charAt(start) == '/') {
            start++;
        }
        while (end > start && pattern.charAt(end - 1) == '/') {
            end--;
        }
        return pattern.substring(start, end);
    }

    @Override
    public String toString() {
        return "IdentityMatcher" + patterns;
    }
}
