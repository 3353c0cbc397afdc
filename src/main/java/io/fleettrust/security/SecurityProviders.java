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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates the security provider selected by a configuration.
 */
public final class SecurityProviders {
    private static final Logger logger = LoggerFactory.getLogger(SecurityProviders.class);

    public static SecurityProvider newProvider(SecurityConfig config) throws SecurityProviderException {
        logger.debug("Creating {} security provider", config.backend().getIdentifier());
        switch (config.backend()) {
            case FILE:
                return new FileSecurityProvider(config);
            case PKCS11:
                return new Pkcs11SecurityProvider(config);
            default:
                throw new ConfigurationException("unsupported security provider " + config.backend());
        }
    }

    private SecurityProviders() {}
}
