package com.example.filament_ledger.service.recognition;

public class RecognitionAccessException extends RuntimeException {
    public RecognitionAccessException(String message) {
        super(message);
    }

    public RecognitionAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
