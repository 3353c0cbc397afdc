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
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.util.List;
import java.util.function.BiConsumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.fleettrust.security.pkcs11.ConsolePinPrompt;
import io.fleettrust.security.pkcs11.PinPrompt;
import io.fleettrust.security.pkcs11.SunPkcs11Driver;
import io.fleettrust.security.pkcs11.TokenDriver;
import io.fleettrust.security.pkcs11.TokenException;
import io.fleettrust.security.pkcs11.TokenSession;
import io.fleettrust.security.pkcs11.TokenSlot;

/**
 * A security provider whose private key and certificate live on a PKCS#11 hardware token. The key never leaves the
 * token, so this provider cannot enroll or sign remotely.
 * <p>
 * When a PIN is configured the provider logs in as it is constructed. Otherwise login is deferred until
 * {@link #login()} or {@link #validate()} is called, at which point the PIN is requested from the {@link PinPrompt}.
 * A failed login is not retried: discard the provider and create a new one. The session opened by a failed login
 * attempt is always logged out before the error is thrown.
 */
public final class Pkcs11SecurityProvider implements SecurityProvider, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(Pkcs11SecurityProvider.class);
    static final String PIN_PROMPT_MESSAGE = "PIN";

    private final SecurityConfig config;
    private final FileSecurity fileSecurity;
    private final TokenDriver driver;
    private final PinPrompt pinPrompt;
    private final Path driverFile;

    private char[] pin;
    private boolean loggedOut;
    private TokenSession session;
    private volatile Credentials credentials;
    private volatile TokenState state = TokenState.UNINITIALIZED;

    public Pkcs11SecurityProvider(SecurityConfig config) throws SecurityProviderException {
        this(config, new SunPkcs11Driver(), new ConsolePinPrompt());
    }

    public Pkcs11SecurityProvider(SecurityConfig config, TokenDriver driver, PinPrompt pinPrompt)
            throws SecurityProviderException {
        this.config = config;
        this.driver = driver;
        this.pinPrompt = pinPrompt;
        this.driverFile = config.pkcs11DriverFile();
        if (driverFile == null) {
            throw new ConfigurationException("pkcs11: the driver file (" + SecurityConfig.PKCS11_DRIVER_FILE +
                    ") is required");
        }
        this.fileSecurity = new FileSecurity(config);
        this.pin = config.pin().orElse(null);

        if (pin != null) {
            login();
        }
    }

    public TokenState state() {
        return state;
    }

    /**
     * Opens a session on the configured slot, logs in and resolves the key and certificate objects. On success the
     * new certificate and signer replace any previous ones together.
     *
     * @throws TokenException if the driver, slot, session or login fails.
     * @throws CertificateLoadException if the certificate on the token is unusable.
     */
    public synchronized void login() throws SecurityProviderException {
        try {
            authenticate();
        } catch (SecurityProviderException | RuntimeException e) {
            if (credentials != null) {
                state = TokenState.KEY_RESOLVED;
            }
            throw e;
        }
    }

    private void authenticate() throws SecurityProviderException {
        if (pin == null) {
            state = TokenState.PIN_REQUESTED;
            try {
                pin = pinPrompt.readPin(PIN_PROMPT_MESSAGE);
            } catch (IOException e) {
                throw new TokenException("failed to read PIN: " + e.getMessage(), e);
            }
        }

        logger.debug("Attempting to open PKCS11 driver file {}", driverFile);
        var module = driver.open(driverFile);

        logger.debug("Attempting to fetch PKCS11 driver slots");
        var slot = selectSlot(module.slots(), config.pkcs11Slot());

        logger.debug("Attempting to open session for selected slot {}", slot.id());
        var newSession = slot.openSession();
        state = TokenState.SESSION_OPEN;

        try {
            try {
                newSession.login(pin);
            } catch (TokenException e) {
                if (!e.isAlreadyLoggedIn()) {
                    throw new TokenException("failed to login with provided pin: " + e.getMessage(),
                            e.returnValue().orElse(null), e);
                }
                logger.debug("Token reports that the user is already logged in");
            }
            state = TokenState.LOGGED_IN;

            logger.debug("Attempting to find private key object");
            var privateKey = newSession.findPrivateKey();

            logger.debug("Attempting to find certificate object");
            X509Certificate certificate;
            try {
                certificate = Crypto.parseCertificate(newSession.findCertificate());
            } catch (CertificateException e) {
                throw new CertificateLoadException(e.getMessage(), e);
            }
            var identity = Credentials.identityOf(certificate, "cert on token");

            var signer = new TokenKeySigner(newSession, privateKey, certificate.getPublicKey());
            var previous = session;
            session = newSession;
            credentials = new Credentials(identity, certificate, privateKey, signer);
            state = TokenState.KEY_RESOLVED;
            logger.debug("Logged in to token as {}", identity);

            if (previous != null && previous != newSession) {
                closeQuietly(previous);
            }
        } catch (SecurityProviderException | RuntimeException e) {
            closeQuietly(newSession);
            throw e;
        }
    }

    static TokenSlot selectSlot(List<TokenSlot> slots, long slotId) throws TokenException {
        for (var slot : slots) {
            logger.debug("Found slot {}", slot.id());
            if (slot.id() == slotId) {
                return slot;
            }
        }
        if (slots.size() == 1) {
            logger.debug("Slot {} not found, using the only slot {}", slotId, slots.get(0).id());
            return slots.get(0);
        }
        throw new TokenException("failed to find slot with id " + slotId);
    }

    private static void closeQuietly(TokenSession session) {
        try {
            session.close();
        } catch (TokenException e) {
            logger.warn("Failed to close PKCS11 session: {}", e.getMessage());
        }
    }

    /**
     * Ends the token session. The provider does not log in again by itself afterwards, not even from
     * {@link #validate()}.
     */
    public synchronized void logout() throws TokenException {
        loggedOut = true;
        var current = session;
        session = null;
        credentials = null;
        state = TokenState.UNINITIALIZED;
        if (current != null) {
            current.logout();
        }
    }

    /**
     * Logs out, forgets the PIN and releases the driver. A later {@link #login()} prompts for the PIN again.
     */
    @Override
    public synchronized void close() throws TokenException {
        try {
            logout();
        } finally {
            Utils.wipe(pin);
            pin = null;
            driver.close();
        }
    }

    private Credentials requireCredentials() {
        var current = credentials;
        if (current == null) {
            throw new IllegalStateException("not logged in");
        }
        return current;
    }

    @Override
    public String provider() {
        return "pkcs11";
    }

    @Override
    public String identity() {
        return requireCredentials().identity;
    }

    @Override
    public X509Certificate publicCertificate() {
        return requireCredentials().certificate;
    }

    @Override
    public String publicCertificatePem() {
        return Crypto.toPem(publicCertificate());
    }

    @Override
    public byte[] checksum(byte[] data) {
        return Crypto.checksum(data);
    }

    @Override
    public byte[] signBytes(byte[] data) throws GeneralSecurityException {
        return requireCredentials().signer.signDigest(Crypto.CHECKSUM_ALGORITHM, checksum(data));
    }

    @Override
    public boolean verifyByteSignature(byte[] data, byte[] signature, String identity) {
        return fileSecurity.verifyByteSignature(credentials, data, signature, identity);
    }

    @Override
    public boolean privilegedVerifyByteSignature(byte[] data, byte[] signature, String identity) {
        return fileSecurity.privilegedVerifyByteSignature(credentials, data, signature, identity);
    }

    @Override
    public String callerName() {
        return FileSecurity.callerName(identity());
    }

    @Override
    public String callerIdentity(String caller) {
        return FileSecurity.callerIdentity(caller);
    }

    @Override
    public void cachePublicData(byte[] data, String identity) throws CertificateException, IOException {
        fileSecurity.cachePublicData(data, identity);
    }

    @Override
    public byte[] cachedPublicData(String identity) throws IOException {
        return fileSecurity.cachedPublicData(identity);
    }

    @Override
    public void verifyCertificate(byte[] certificatePem, String name) throws CertificateException {
        fileSecurity.verifyCertificate(certificatePem, name);
    }

    @Override
    public TlsConfiguration tlsConfiguration() throws IOException, GeneralSecurityException {
        return fileSecurity.tlsConfiguration(credentials);
    }

    @Override
    public TlsConfiguration clientTlsConfiguration() throws IOException, GeneralSecurityException {
        return tlsConfiguration();
    }

    @Override
    public HttpClient httpClient(boolean secure) throws IOException, GeneralSecurityException {
        if (!secure) {
            return HttpClient.newHttpClient();
        }
        try {
            return tlsConfiguration().newHttpClient();
        } catch (IOException | GeneralSecurityException e) {
            throw new IOException("pkcs11: could not set up HTTP connection: " + e.getMessage(), e);
        }
    }

    @Override
    public synchronized Validation validate() {
        var problems = fileSecurity.validate();
        if (credentials == null && loggedOut) {
            problems.add("not logged in to token");
        } else if (credentials == null) {
            logger.debug("Attempting to login to token in validate()");
            try {
                login();
            } catch (SecurityProviderException e) {
                problems.add("failed to login to token in validate(): " + e.getMessage());
            }
        }
        return new Validation(problems);
    }

    @Override
    public void enroll(Duration wait, BiConsumer<String, Integer> onAttempt) {
        throw new UnsupportedOperationException("pkcs11 security provider does not support enrollment");
    }

    @Override
    public byte[] remoteSignRequest(byte[] request) {
        throw new UnsupportedOperationException("pkcs11 security provider does not support remote signing requests");
    }

    @Override
    public boolean isRemoteSigning() {
        return false;
    }

    @Override
    public String toString() {
        var current = credentials;
        return "Pkcs11SecurityProvider{driver=" + driverFile + ", slot=" + config.pkcs11Slot() + ", identity=" +
                (current == null ? null : "'" + current.identity + "'") + ", state=" + state + '}';
    }
}
