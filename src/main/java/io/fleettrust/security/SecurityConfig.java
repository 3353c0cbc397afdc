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

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Properties;

/**
 * Immutable settings shared by every security provider backend. Settings that only apply to one backend are ignored
 * by the other.
 */
public final class SecurityConfig {
    public static final String PROVIDER = "plugin.security.provider";
    public static final String CA_FILE = "plugin.security.file.ca";
    public static final String CACHE_DIRECTORY = "plugin.security.file.cache";
    public static final String CERTIFICATE_FILE = "plugin.security.file.certificate";
    public static final String KEY_FILE = "plugin.security.file.key";
    public static final String PRIVILEGED_USERS = "plugin.security.privileged_users";
    public static final String ALLOW_LIST = "plugin.security.certname_allowlist";
    public static final String DISABLE_TLS_VERIFY = "plugin.security.disable_tls_verify";
    public static final String ALWAYS_OVERWRITE_CACHE = "plugin.security.always_overwrite_cache";
    public static final String PKCS11_DRIVER_FILE = "plugin.security.pkcs11.driver_file";
    public static final String PKCS11_SLOT = "plugin.security.pkcs11.slot";

    public enum Backend {
        FILE("file"),
        PKCS11("pkcs11");

        private final String identifier;

        Backend(String identifier) {
            this.identifier = identifier;
        }

        public String getIdentifier() {
            return identifier;
        }

        static Backend fromIdentifier(String identifier) throws ConfigurationException {
            for (var backend : values()) {
                if (backend.identifier.equals(identifier.trim().toLowerCase(Locale.ROOT))) {
                    return backend;
                }
            }
            throw new ConfigurationException("unknown security provider '" + identifier + "'");
        }
    }

    private final Backend backend;
    private final Path caFile;
    private final Path cacheDirectory;
    private final Path certificateFile;
    private final Path keyFile;
    private final List<String> privilegedUsers;
    private final List<String> allowList;
    private final boolean disableTlsVerify;
    private final boolean alwaysOverwriteCache;
    private final Path pkcs11DriverFile;
    private final long pkcs11Slot;
    private final char[] pin;
    private final RequestSigner remoteSigner;

    private SecurityConfig(Builder builder) {
        this.backend = builder.backend;
        this.caFile = builder.caFile;
        this.cacheDirectory = builder.cacheDirectory;
        this.certificateFile = builder.certificateFile;
        this.keyFile = builder.keyFile;
        this.privilegedUsers = List.copyOf(builder.privilegedUsers);
        this.allowList = List.copyOf(builder.allowList);
        this.disableTlsVerify = builder.disableTlsVerify;
        this.alwaysOverwriteCache = builder.alwaysOverwriteCache;
        this.pkcs11DriverFile = builder.pkcs11DriverFile;
        this.pkcs11Slot = builder.pkcs11Slot;
        this.pin = builder.pin == null ? null : builder.pin.clone();
        this.remoteSigner = builder.remoteSigner;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads settings from a set of properties, using the {@code plugin.security.*} keys declared on this class.
     * Pattern lists are comma separated.
     *
     * @throws ConfigurationException if a value cannot be parsed.
     */
    public static SecurityConfig fromProperties(Properties properties) throws ConfigurationException {
        var builder = builder();
        var provider = properties.getProperty(PROVIDER);
        if (provider != null) {
            builder.backend(Backend.fromIdentifier(provider));
        }
        path(properties, CA_FILE).ifPresent(builder::caFile);
        path(properties, CACHE_DIRECTORY).ifPresent(builder::cacheDirectory);
        path(properties, CERTIFICATE_FILE).ifPresent(builder::certificateFile);
        path(properties, KEY_FILE).ifPresent(builder::keyFile);
        builder.privilegedUsers(list(properties.getProperty(PRIVILEGED_USERS)));
        builder.allowList(list(properties.getProperty(ALLOW_LIST)));
        builder.disableTlsVerify(bool(properties, DISABLE_TLS_VERIFY));
        builder.alwaysOverwriteCache(bool(properties, ALWAYS_OVERWRITE_CACHE));
        path(properties, PKCS11_DRIVER_FILE).ifPresent(builder::pkcs11DriverFile);
        var slot = properties.getProperty(PKCS11_SLOT);
        if (slot != null && !slot.isBlank()) {
            try {
                builder.pkcs11Slot(Long.parseUnsignedLong(slot.trim()));
            } catch (NumberFormatException e) {
                throw new ConfigurationException(PKCS11_SLOT + " must be a non-negative integer: " + slot, e);
            }
        }
        return builder.build();
    }

    private static Optional<Path> path(Properties properties, String key) {
        var value = properties.getProperty(key);
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(Path.of(value.trim()));
    }

    private static boolean bool(Properties properties, String key) throws ConfigurationException {
        var value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return false;
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "true":
            case "yes":
            case "1":
                return true;
            case "false":
            case "no":
            case "0":
                return false;
            default:
                throw new ConfigurationException(key + " must be a boolean: " + value);
        }
    }

    private static List<String> list(String value) {
        if (value == null) {
            return List.of();
        }
        var result = new ArrayList<String>();
        for (var item : value.split(",")) {
            if (!item.isBlank()) {
                result.add(item.trim());
            }
        }
        return result;
    }

    public Backend backend() {
        return backend;
    }

    public Path caFile() {
        return caFile;
    }

    public Path cacheDirectory() {
        return cacheDirectory;
    }

    public Path certificateFile() {
        return certificateFile;
    }

    public Path keyFile() {
        return keyFile;
    }

    public List<String> privilegedUsers() {
        return privilegedUsers;
    }

    public List<String> allowList() {
        return allowList;
    }

    public boolean disableTlsVerify() {
        return disableTlsVerify;
    }

    public boolean alwaysOverwriteCache() {
        return alwaysOverwriteCache;
    }

    public Path pkcs11DriverFile() {
        return pkcs11DriverFile;
    }

    public long pkcs11Slot() {
        return pkcs11Slot;
    }

    /**
     * The token PIN, if one was configured. Callers receive a copy and should wipe it after use.
     */
    public Optional<char[]> pin() {
        return Optional.ofNullable(pin).map(char[]::clone);
    }

    public Optional<RequestSigner> remoteSigner() {
        return Optional.ofNullable(remoteSigner);
    }

    @Override
    public String toString() {
        return "SecurityConfig{" +
                "backend=" + backend +
                ", caFile=" + caFile +
                ", cacheDirectory=" + cacheDirectory +
                ", certificateFile=" + certificateFile +
                ", keyFile=" + keyFile +
                ", privilegedUsers=" + privilegedUsers +
                ", allowList=" + allowList +
                ", disableTlsVerify=" + disableTlsVerify +
                ", alwaysOverwriteCache=" + alwaysOverwriteCache +
                ", pkcs11DriverFile=" + pkcs11DriverFile +
                ", pkcs11Slot=" + pkcs11Slot +
                ", pin=" + (pin == null ? "<unset>" : "<redacted>") +
                ", remoteSigner=" + (remoteSigner == null ? null : remoteSigner.kind()) +
                '}';
    }

    public static final class Builder {
        private Backend backend = Backend.FILE;
        private Path caFile;
        private Path cacheDirectory;
        private Path certificateFile;
        private Path keyFile;
        private List<String> privilegedUsers = List.of();
        private List<String> allowList = List.of();
        private boolean disableTlsVerify;
        private boolean alwaysOverwriteCache;
        private Path pkcs11DriverFile;
        private long pkcs11Slot;
        private char[] pin;
        private RequestSigner remoteSigner;

        private Builder() {}

        public Builder backend(Backend backend) {
            this.backend = backend;
            return this;
        }

        public Builder caFile(Path caFile) {
            this.caFile = caFile;
            return this;
        }

        public Builder cacheDirectory(Path cacheDirectory) {
            this.cacheDirectory = cacheDirectory;
            return this;
        }

        public Builder certificateFile(Path certificateFile) {
            this.certificateFile = certificateFile;
            return this;
        }

        public Builder keyFile(Path keyFile) {
            this.keyFile = keyFile;
            return this;
        }

        public Builder privilegedUsers(List<String> patterns) {
            this.privilegedUsers = patterns;
            return this;
        }

        public Builder privilegedUsers(String... patterns) {
            return privilegedUsers(Arrays.asList(patterns));
        }

        public Builder allowList(List<String> patterns) {
            this.allowList = patterns;
            return this;
        }

        public Builder allowList(String... patterns) {
            return allowList(Arrays.asList(patterns));
        }

        public Builder disableTlsVerify(boolean disableTlsVerify) {
            this.disableTlsVerify = disableTlsVerify;
            return this;
        }

        public Builder alwaysOverwriteCache(boolean alwaysOverwriteCache) {
            this.alwaysOverwriteCache = alwaysOverwriteCache;
            return this;
        }

        public Builder pkcs11DriverFile(Path driverFile) {
            this.pkcs11DriverFile = driverFile;
            return this;
        }

        public Builder pkcs11Slot(long slot) {
            this.pkcs11Slot = slot;
            return this;
        }

        public Builder pin(char[] pin) {
            this.pin = pin == null ? null : pin.clone();
            return this;
        }

        public Builder remoteSigner(RequestSigner remoteSigner) {
            this.remoteSigner = remoteSigner;
            return this;
        }

        public SecurityConfig build() {
            return new SecurityConfig(this);
        }
    }
}
