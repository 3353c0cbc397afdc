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

import java.util.Optional;

import io.fleettrust.security.SecurityProviderException;

/**
 * A failure reported by a PKCS#11 module, slot or session. Where the token returned a {@code CKR_*} code it is
 * available as the {@link #returnValue()}.
 */
public class TokenException extends SecurityProviderException {
    public static final String CKR_USER_ALREADY_LOGGED_IN = "CKR_USER_ALREADY_LOGGED_IN";
    public static final String CKR_PIN_INCORRECT = "CKR_PIN_INCORRECT";

    private final String returnValue;

    public TokenException(String message) {
        this(message, null, null);
    }

    public TokenException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public TokenException(String message, String returnValue, Throwable cause) {
        super(message, cause);
        this.returnValue = returnValue;
    }

    public Optional<String> returnValue() {
        return Optional.ofNullable(returnValue);
    }

    /**
     * Whether the token refused a login because the user is already logged in. Drivers that cannot report return
     * codes directly are recognised by the code appearing anywhere in the message or cause chain.
     */
    public boolean isAlreadyLoggedIn() {
        if (CKR_USER_ALREADY_LOGGED_IN.equals(returnValue)) {
            return true;
        }
        for (Throwable t = this; t != null; t = t.getCause()) {
            if (t.getMessage() != null && t.getMessage().contains(CKR_USER_ALREADY_LOGGED_IN)) {
                return true;
            }
        }
        return false;
    }
}
