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

import java.nio.file.Path;

/**
 * Loads PKCS#11 modules. This is the seam between the hardware token security provider and the native Cryptoki
 * library, so that the provider's login logic can be exercised without a device.
 */
public interface TokenDriver extends AutoCloseable {

    /**
     * Opens the module implemented by a native driver library.
     *
     * @param driverFile the shared library, usually a {@code .so} file.
     * @return the opened module.
     * @throws TokenException if the library cannot be loaded.
     */
    TokenModule open(Path driverFile) throws TokenException;

    /**
     * Releases everything the driver keeps for the modules it has opened. A later {@link #open(Path)} starts
     * afresh.
     */
    @Override
    default void close() throws TokenException {
    }
}
