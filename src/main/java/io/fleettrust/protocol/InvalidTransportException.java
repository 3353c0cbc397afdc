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

import java.io.IOException;
import java.util.List;

/**
 * Thrown when a transport document does not conform to the envelope schema. All violations found are reported, not
 * just the first.
 */
public class InvalidTransportException extends IOException {
    private static final long serialVersionUID = 1L;

    private final List<String> violations;

    public InvalidTransportException(List<String> violations) {
        super(String.join(", ", violations));
        this.violations = List.copyOf(violations);
    }

    public InvalidTransportException(String message, Throwable cause) {
        super(message, cause);
        this.violations = List.of(message);
    }

    public List<String> violations() {
        return violations;
    }
}
