package com.quotefeed.common.exception;

public class BroadcastException extends RuntimeException {

    public BroadcastException(String message) {
        super(message);
    }
}
