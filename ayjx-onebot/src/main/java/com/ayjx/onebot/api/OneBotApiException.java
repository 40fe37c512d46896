package com.ayjx.onebot.api;

/**
 * A OneBot API call did not produce a usable result: the request could not
 * be sent, no reply arrived in time, the reply carried a non-zero
 * {@code retcode}, or its {@code data} did not decode.
 */
public class OneBotApiException extends Exception {

    private final String action;
    private final Integer retcode;

    public OneBotApiException(String action, String message) {
        this(action, null, message, null);
    }

    public OneBotApiException(String action, String message, Throwable cause) {
        this(action, null, message, cause);
    }

    public OneBotApiException(String action, Integer retcode, String message, Throwable cause) {
        super(action + ": " + message, cause);
        this.action = action;
        this.retcode = retcode;
    }

    public String getAction() {
        return action;
    }

    /** Non-zero retcode from the reply, or null when none was received. */
    public Integer getRetcode() {
        return retcode;
    }
}
