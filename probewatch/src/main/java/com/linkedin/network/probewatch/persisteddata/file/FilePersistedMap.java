/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.network.probewatch.persisteddata.file;

import com.linkedin.network.probewatch.persisteddata.PersistedMap;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.AbstractMap;
import java.util.HashSet;
import java.util.Set;
import javax.annotation.Nonnull;
import org.apache.commons.lang3.tuple.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stores each entry as its own file {@code <key>.json} in a directory. The file content is the
 * value. Every write goes to a temporary file in the same directory that is then renamed over
 * the target, so readers never observe a partially written value. Concurrent writers of the same
 * key are not coordinated; the last rename wins.
 */
public class FilePersistedMap extends PersistedMap {

    public static final String FILE_SUFFIX = ".json";

    /**
     * @param directory The directory holding one file per key. Created on first write.
     */
    public FilePersistedMap(Path directory) {
        super(new DirectoryMap(directory));
    }

    /**
     * @return The directory holding the files of this map.
     */
    public Path directory() {
        return ((DirectoryMap) this._child)._directory;
    }

    /**
     * Live view of the {@code *.json} files in one directory.
     */
    private static final class DirectoryMap extends AbstractMap<String, String> {

        private static final Logger LOG = LoggerFactory.getLogger(FilePersistedMap.class);
        private static final String TEMP_FILE_PREFIX = ".pending-";

        private final Path _directory;

        DirectoryMap(Path directory) {
            this._directory = directory;
        }

        @Override
        public String get(Object key) {
            Path file = fileFor(key);
            try {
                return Files.readString(file, StandardCharsets.UTF_8);
            } catch (NoSuchFileException e) {
                return null;
            } catch (IOException e) {
                throw new FilePersistedMapException(String.format("Failed to read %s", file), e);
            }
        }

        @Override
        public boolean containsKey(Object key) {
            return Files.isRegularFile(fileFor(key));
        }

        @Override
        public String put(String key, String value) {
            if (value == null) {
                return remove(key);
            }
            Path file = fileFor(key);
            String oldValue = readQuietly(file);
            Path temp = null;
            try {
                Files.createDirectories(this._directory);
                temp = Files.createTempFile(this._directory, TEMP_FILE_PREFIX, ".tmp");
                Files.writeString(temp, value, StandardCharsets.UTF_8);
                moveOver(temp, file);
                temp = null;
                LOG.debug("Saved file={}, value={}", file, value);
            } catch (IOException e) {
                throw new FilePersistedMapException(String.format("Failed to write %s", file), e);
            } finally {
                deleteQuietly(temp);
            }
            return oldValue;
        }

        @Override
        public String remove(Object key) {
            Path file = fileFor(key);
            String oldValue = readQuietly(file);
            try {
                Files.deleteIfExists(file);
            } catch (IOException e) {
                throw new FilePersistedMapException(String.format("Failed to delete %s", file), e);
            }
            return oldValue;
        }

        @Nonnull
        @Override
        public Set<Entry<String, String>> entrySet() {
            Set<Entry<String, String>> entries = new HashSet<>();
            if (!Files.isDirectory(this._directory)) {
                return entries;
            }
            try (DirectoryStream<Path> files = Files.newDirectoryStream(this._directory, "*" + FILE_SUFFIX)) {
                for (Path file : files) {
                    String fileName = file.getFileName().toString();
                    String value = readQuietly(file);
                    if (value != null) {
                        entries.add(Pair.of(fileName.substring(0, fileName.length() - FILE_SUFFIX.length()), value));
                    }
                }
            } catch (IOException e) {
                throw new FilePersistedMapException(String.format("Failed to list %s", this._directory), e);
            }
            return entries;
        }

        private Path fileFor(Object key) {
            if (key == null) {
                throw new FilePersistedMapException("Key cannot be null.");
            }
            try {
                Path file = this._directory.resolve(key + FILE_SUFFIX);
                if (!this._directory.equals(file.getParent())) {
                    throw new FilePersistedMapException(String.format("Key %s does not map to a file in %s", key, this._directory));
                }
                return file;
            } catch (InvalidPathException e) {
                throw new FilePersistedMapException(String.format("Key %s is not a valid file name", key), e);
            }
        }

        private static void moveOver(Path source, Path target) throws IOException {
            try {
                Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                LOG.debug("Atomic move is not supported for {}, replacing it.", target);
                Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
            }
        }

        private static String readQuietly(Path file) {
            try {
                return Files.readString(file, StandardCharsets.UTF_8);
            } catch (NoSuchFileException e) {
                return null;
            } catch (IOException e) {
                LOG.debug("Ignoring unreadable file {}.", file, e);
                return null;
            }
        }

        private static void deleteQuietly(Path file) {
            if (file == null) {
                return;
            }
            try {
                Files.deleteIfExists(file);
            } catch (IOException e) {
                LOG.warn("Failed to delete temporary file {}.", file, e);
            }
        }
    }
}
