package com.example.filament_ledger.service.recognition;

import java.util.Optional;

public interface RecognitionProvider {

    /**
     * Reads a spool label photo.
     *
     * @return raw fields the service could read, empty when it recognized nothing
     * @throws RecognitionAccessException when the service cannot be reached or answers with an error
     */
    Optional<RecognitionResult> recognize(byte[] image, String filename, String contentType);
}
