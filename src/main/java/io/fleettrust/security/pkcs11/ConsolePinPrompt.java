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
 * Reads a PIN from the system console without echoing it.
 */
public final class ConsolePinPrompt implements PinPrompt {

    @Override
    public char[] readPin(String message) throws IOException {
        var console = System.console();
        if (console == null) {
            throw new IOException("no console is available to prompt for the " + message);
        }
        var pin = console.readPassword("%s: ", message);
        if (pin == null) {
            throw new IOException("no " + message + " was entered");
        }
        return pin;
    }
}
