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

import java.util.List;

/**
 * The outcome of a provider self-check. Every detected problem is reported, not just the first.
 */
public final class Validation {
    private final List<String> problems;

    Validation(List<String> problems) {
        this.problems = List.copyOf(problems);
    }

    public List<String> problems() {
        return problems;
    }

    public boolean isValid() {
        return problems.isEmpty();
    }

    @Override
    public String toString() {
        return isValid() ? "Validation{ok}" : "Validation" + problems;
    }
}
