package com.ayjx.browser;

/**
 * A DevTools command failed: the socket refused it, no reply arrived in
 * time, the peer answered with an error, or the transport is gone.
 */
public class CdpException extends Exception {

    public CdpException(String message) {
        super(message);
    }

    public CdpException(String message, Throwable cause) {
        super(message, cause);
    }
}
