package com.adsgateway.core;

/**
 * Credential storage could not be reached. Fatal to the calling operation, never retried.
 */
public class StorageUnavailableException extends GatewayException {

    public StorageUnavailableException(String message, Throwable cause) {
        super(ErrorKind.STORAGE_UNAVAILABLE, message, cause);
    }
}
