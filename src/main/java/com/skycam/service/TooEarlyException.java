package com.skycam.service;

public class TooEarlyException extends Exception {

    public TooEarlyException(String message) {
        super(message);
    }
}
