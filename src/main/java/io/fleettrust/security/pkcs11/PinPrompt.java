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

package io.fleettrust.security.pkcs11;

import java.io.IOException;

/**
 * Asks a person for a token PIN. This blocks until the PIN is supplied and has no timeout.
 */
@FunctionalInterface
public interface PinPrompt {

    char[] readPin(String message) throws IOException;

    /**
     * A prompt that always answers with a fixed PIN.
     */
    static PinPrompt fixed(char[] pin) {
        var copy = pin.clone();
        return message -> copy.clone();
    }
}
