package com.sandcastle.core.error;

/**
 * Thrown when the blob store cannot persist, read or sign an object.
 */
public class StorageException extends SandcastleException {

    public StorageException(String message) {
        super(ErrorKind.STORAGE, message);
    }

    public StorageException(String message, Throwable cause) {
        super(ErrorKind.STORAGE, message, cause);
    }
}
