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

import java.io.IOException;

/**
 * A delegate that signs requests on behalf of this node using a remote service, for example a central
 * authentication and authorization service that holds privileged keys.
 */
public interface RequestSigner {

    /**
     * Submits an unsigned request for signing.
     *
     * @param request the request document.
     * @return the signed request document, ready to be placed in a transport envelope.
     * @throws IOException if the remote service cannot be reached or refuses to sign.
     */
    byte[] sign(byte[] request) throws IOException;

    /**
     * A short description of the remote signer, used in log messages.
     */
    String kind();
}
