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

import static java.util.Objects.requireNonNull;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A directory of PEM certificates named {@code <identity>.pem}. Entries are never removed by this class. There is
 * no locking: concurrent writers of the same identity race at the filesystem and the last writer wins.
 */
public final class CertificateCache {
    private static final Logger logger = LoggerFactory.getLogger(CertificateCache.class);
    static final String EXTENSION = ".pem";

    private final Path directory;
    private final boolean alwaysOverwrite;

    public CertificateCache(Path directory, boolean alwaysOverwrite) {
        this.directory = requireNonNull(directory, "directory");
        this.alwaysOverwrite = alwaysOverwrite;
    }

    public Path directory() {
        return directory;
    }

    /**
     * The cache file for an identity. The identity is joined to the directory as-is, so it must already be a safe
     * file name.
     */
    public Path path(String identity) {
        return directory.resolve(identity + EXTENSION);
    }

    public boolean exists(String identity) {
        return Files.isRegularFile(path(identity));
    }

    public byte[] read(String identity) throws IOException {
        return Files.readAllBytes(path(identity));
    }

    /**
     * Writes the certificate data for an identity unless an entry already exists and overwriting is disabled.
     *
     * @return whether the data was written.
     */
    public boolean store(String identity, byte[] data) throws IOException {
        var file = path(identity);
        if (Files.exists(file) && !alwaysOverwrite) {
            logger.debug("Already have a certificate in cache for {}", identity);
            return false;
        }
        Files.write(file, data);
        logger.debug("Cached certificate for {} in {}", identity, file);
        return true;
    }

    /**
     * Lists the identities that have a cache entry and match the given patterns, in lexicographic order. Only
     * {@code .pem} files directly inside the cache directory are considered. Any error while listing the directory is
     * logged and yields an empty list rather than a partial one.
     */
    public List<String> identities(IdentityMatcher matcher) {
        try (var files = Files.walk(directory, 1)) {
            return files.filter(Files::isRegularFile)
                    .map(file -> file.getFileName().toString())
                    .filter(name -> name.endsWith(EXTENSION))
                    .map(name -> name.substring(0, name.length() - EXTENSION.length()))
                    .filter(matcher::matches)
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException | UncheckedIOException e) {
            logger.warn("Could not list certificates in {}: {}", directory, e.toString());
            return List.of();
        }
    }

    @Override
    public String toString() {
        return "CertificateCache{directory=" + directory + ", alwaysOverwrite=" + alwaysOverwrite + '}';
    }
}
