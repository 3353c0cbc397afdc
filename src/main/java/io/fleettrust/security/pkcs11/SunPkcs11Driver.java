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
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.AuthProvider;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.PrivateKey;
import java.security.Provider;
import java.security.ProviderException;
import java.security.Security;
import java.security.Signature;
import java.security.cert.CertificateEncodingException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Pattern;

import javax.security.auth.login.LoginException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A token driver built on the JDK's {@code SunPKCS11} provider. Each slot is backed by its own provider instance
 * configured with the slot's position in the module's slot list, so slot ids reported by this driver are slot-list
 * indexes. Login and object lookup go through a {@code PKCS11} key store and signing uses the {@code NONEwithRSA}
 * signature, which maps to the {@code CKM_RSA_PKCS} mechanism.
 * <p>
 * Provider instances are created once per library and slot and reused by every later {@link #open(Path)}, until
 * {@link #close()} logs them out and forgets them.
 */
public final class SunPkcs11Driver implements TokenDriver {
    private static final Logger logger = LoggerFactory.getLogger(SunPkcs11Driver.class);
    private static final String PROVIDER_NAME = "SunPKCS11";
    private static final Pattern RETURN_VALUE = Pattern.compile("CKR_[A-Z_]+");
    private static final int MAX_SLOTS = 64;

    private final Function<String, Provider> configurer;
    private final Map<Path, Module> modules = new HashMap<>();

    public SunPkcs11Driver() {
        this(SunPkcs11Driver::configureSunPkcs11);
    }

    SunPkcs11Driver(Function<String, Provider> configurer) {
        this.configurer = configurer;
    }

    private static Provider configureSunPkcs11(String config) {
        var base = Security.getProvider(PROVIDER_NAME);
        if (base == null) {
            throw new ProviderException("the " + PROVIDER_NAME + " provider is not available in this JVM");
        }
        return base.configure(config);
    }

    @Override
    public synchronized TokenModule open(Path driverFile) throws TokenException {
        if (!Files.isRegularFile(driverFile)) {
            throw new TokenException("failed to open PKCS11 driver file " + driverFile + ": no such file");
        }
        return modules.computeIfAbsent(driverFile.toAbsolutePath(), Module::new);
    }

    @Override
    public synchronized void close() throws TokenException {
        TokenException failure = null;
        for (var module : modules.values()) {
            for (var slot : module.configured()) {
                try {
                    slot.logout();
                } catch (TokenException e) {
                    logger.warn("Failed to release PKCS11 slot {} of {}: {}", slot.id(), module.library,
                            e.getMessage());
                    failure = e;
                }
            }
        }
        modules.clear();
        if (failure != null) {
            throw failure;
        }
    }

    static TokenException wrap(String message, Throwable cause) {
        for (Throwable t = cause; t != null; t = t.getCause()) {
            if (t.getMessage() != null) {
                var matcher = RETURN_VALUE.matcher(t.getMessage());
                if (matcher.find()) {
                    return new TokenException(message + ": " + t.getMessage(), matcher.group(), cause);
                }
            }
        }
        return new TokenException(message + ": " + cause, cause);
    }

    private final class Module implements TokenModule {
        private final Path library;
        private List<Slot> slots;

        Module(Path library) {
            this.library = library;
        }

        @Override
        public List<TokenSlot> slots() throws TokenException {
            synchronized (SunPkcs11Driver.this) {
                if (slots == null) {
                    slots = discover();
                }
                return Collections.unmodifiableList(slots);
            }
        }

        List<Slot> configured() {
            return slots == null ? List.of() : slots;
        }

        private List<Slot> discover() throws TokenException {
            var found = new ArrayList<Slot>();
            for (int index = 0; index < MAX_SLOTS; ++index) {
                var config = "--name = fleettrust-slot" + index + "\n" +
                        "library = \"" + library + "\"\n" +
                        "slotListIndex = " + index + "\n";
                try {
                    found.add(new Slot(index, configurer.apply(config)));
                } catch (RuntimeException e) {
                    if (isPastLastSlot(e)) {
                        break;
                    }
                    throw wrap("failed to fetch PKCS11 driver slots", e);
                }
            }
            logger.debug("Module {} has {} slots", library, found.size());
            return found;
        }

        private boolean isPastLastSlot(Throwable e) {
            for (Throwable t = e; t != null; t = t.getCause()) {
                if (t.getMessage() != null && t.getMessage().contains("slotListIndex")) {
                    return true;
                }
            }
            return false;
        }
    }

    private static final class Slot implements TokenSlot {
        private final long id;
        private final Provider provider;

        Slot(long id, Provider provider) {
            this.id = id;
            this.provider = provider;
        }

        @Override
        public long id() {
            return id;
        }

        void logout() throws TokenException {
            SunPkcs11Driver.logout(provider);
        }

        @Override
        public TokenSession openSession() throws TokenException {
            try {
                return new Session(provider, KeyStore.getInstance("PKCS11", provider));
            } catch (GeneralSecurityException e) {
                throw wrap("failed to open PKCS11 session", e);
            }
        }
    }

    private static final class Session implements TokenSession {
        private final Provider provider;
        private final KeyStore keyStore;

        Session(Provider provider, KeyStore keyStore) {
            this.provider = provider;
            this.keyStore = keyStore;
        }

        @Override
        public void login(char[] pin) throws TokenException {
            try {
                keyStore.load(null, pin);
            } catch (IOException | GeneralSecurityException e) {
                throw wrap("C_Login failed", e);
            }
        }

        @Override
        public PrivateKey findPrivateKey() throws TokenException {
            var keys = new ArrayList<PrivateKey>();
            try {
                for (var alias : Collections.list(keyStore.aliases())) {
                    if (keyStore.isKeyEntry(alias)) {
                        var key = keyStore.getKey(alias, null);
                        if (key instanceof PrivateKey) {
                            keys.add((PrivateKey) key);
                        }
                    }
                }
            } catch (GeneralSecurityException e) {
                throw wrap("failed to find private key object", e);
            }
            if (keys.size() != 1) {
                throw new TokenException("failed to find private key object: found " + keys.size() +
                        " private keys, expected exactly one");
            }
            return keys.get(0);
        }

        @Override
        public byte[] findCertificate() throws TokenException {
            var certificates = new ArrayList<byte[]>();
            try {
                for (var alias : Collections.list(keyStore.aliases())) {
                    var certificate = keyStore.getCertificate(alias);
                    if (certificate != null) {
                        var encoded = certificate.getEncoded();
                        if (certificates.stream().noneMatch(existing -> Arrays.equals(existing, encoded))) {
                            certificates.add(encoded);
                        }
                    }
                }
            } catch (CertificateEncodingException e) {
                throw wrap("failed to get certificate object value", e);
            } catch (GeneralSecurityException e) {
                throw wrap("failed to find certificate object", e);
            }
            if (certificates.size() != 1) {
                throw new TokenException("failed to find certificate object: found " + certificates.size() +
                        " certificates, expected exactly one");
            }
            return certificates.get(0);
        }

        @Override
        public byte[] sign(PrivateKey key, byte[] input) throws TokenException {
            try {
                var signature = Signature.getInstance("NONEwithRSA", provider);
                signature.initSign(key);
                signature.update(input);
                return signature.sign();
            } catch (GeneralSecurityException e) {
                throw wrap("failed to sign with token key", e);
            }
        }

        @Override
        public void logout() throws TokenException {
            SunPkcs11Driver.logout(provider);
        }

        @Override
        public void close() throws TokenException {
            logout();
        }
    }

    private static void logout(Provider provider) throws TokenException {
        if (provider instanceof AuthProvider) {
            try {
                ((AuthProvider) provider).logout();
            } catch (LoginException e) {
                throw wrap("failed to logout of PKCS11 session", e);
            }
        }
    }
}
