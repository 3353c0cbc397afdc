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

/**
 * Base class of the errors that prevent a security provider from being constructed or authenticated. Signature
 * verification never throws these; it reports failure as {@code false}.
 */
public class SecurityProviderException extends Exception {
    public SecurityProviderException(String message) {
        super(message);
    }

    public SecurityProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
