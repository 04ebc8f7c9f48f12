package com.example.musiccurator.common.exception;

/**
 * The embedded catalog store is unavailable or corrupt. Aborts the current operation.
 */
public class CatalogException extends BusinessException {

    public static final String CODE = "CATALOG_ERROR";

    public CatalogException(String message, Throwable cause) {
        super(CODE, message, "Check that the catalog database file is readable and not locked by another process", cause);
    }
}
