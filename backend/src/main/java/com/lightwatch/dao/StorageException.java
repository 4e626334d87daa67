package com.lightwatch.dao;

public final class StorageException extends RuntimeException {
    private final String operation;

    public StorageException(String operation, Throwable cause) {
        super("Database error in " + operation, cause);
        this.operation = operation;
    }

    public String operation() {
        return operation;
    }
}
