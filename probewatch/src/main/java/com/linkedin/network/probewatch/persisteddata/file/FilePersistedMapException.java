/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */
package com.linkedin.network.probewatch.persisteddata.file;

/**
 * Thrown when a {@link FilePersistedMap} fails to read or write a file.
 */
public class FilePersistedMapException extends RuntimeException {

    public FilePersistedMapException(String message, Exception cause) {
        super(message, cause);
    }

    public FilePersistedMapException(String message) {
        super(message);
    }
}
