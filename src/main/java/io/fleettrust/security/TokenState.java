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
 * Progress of a hardware token login. A failure at any step leaves the provider in the state it had reached; the
 * provider must be discarded and rebuilt to try again.
 */
public enum TokenState {
    UNINITIALIZED,
    PIN_REQUESTED,
    SESSION_OPEN,
    LOGGED_IN,
    KEY_RESOLVED
}
