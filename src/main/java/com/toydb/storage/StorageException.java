package com.toydb.storage;

/**
 * StorageException - 存储层异常
 *
 * 表管理和行访问失败时抛出此异常(或其子类)。
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
