package com.example.SmartNews.service.media;

public class TransformException extends Exception {

    public TransformException(String message) {
        super(message);
    }

    public TransformException(String message, Throwable cause) {
        super(message, cause);
    }
}
