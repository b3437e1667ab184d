package com.example.filament_ledger.service.recognition;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Qualifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.io.IOException;
import java.util.Optional;

/**
 * Client of the label recognition service: {@code POST /api/v1/recognize} with the photo in the
 * multipart field {@code image}.
 */
@Component
class HttpRecognitionProvider implements RecognitionProvider {
    private static final Logger LOGGER = LoggerFactory.getLogger(HttpRecognitionProvider.class);
    static final String RECOGNIZE_PATH = "/api/v1/recognize";

    private final WebClient webClient;
    private final ObjectMapper objectMapper;

    HttpRecognitionProvider(@Qualifier("recognitionWebClient") WebClient webClient, ObjectMapper objectMapper) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<RecognitionResult> recognize(byte[] image, String filename, String contentType) {
        MultipartBodyBuilder body = new MultipartBodyBuilder();
        body.part("image", new ByteArrayResource(image) {
                    @Override
                    public String getFilename() {
                        return filename == null || filename.isBlank() ? "image.jpg" : filename;
                    }
                })
                .contentType(partContentType(contentType));
        try {
            String payload = webClient.post()
                    .uri(RECOGNIZE_PATH)
                    .contentType(MediaType.MULTIPART_FORM_DATA)
                    .body(BodyInserters.fromMultipartData(body.build()))
                    .retrieve()
                    .bodyToMono(String.class)
                    .block();
            if (payload == null || payload.isBlank()) {
                return Optional.empty();
            }
            JsonNode node = objectMapper.readTree(payload);
            if (!node.path("success").asBoolean(false)) {
                throw new RecognitionAccessException("recognition failed: " + textOrDefault(node, "error", "unknown error"));
            }
            JsonNode data = node.get("data");
            if (data == null || data.isNull()) {
                return Optional.empty();
            }
            Double confidence = node.hasNonNull("confidence") ? node.get("confidence").asDouble() : null;
            Double diameter = data.hasNonNull("diameter") && data.get("diameter").isNumber()
                    ? data.get("diameter").asDouble() : null;
            return Optional.of(new RecognitionResult(
                    textOrNull(data, "brand"),
                    textOrNull(data, "material"),
                    textOrNull(data, "colorName"),
                    textOrNull(data, "colorHex"),
                    textOrNull(data, "weight"),
                    diameter,
                    textOrNull(data, "temperatureInfo"),
                    confidence));
        } catch (RecognitionAccessException ex) {
            throw ex;
        } catch (WebClientResponseException ex) {
            throw new RecognitionAccessException("recognition service answered " + ex.getStatusCode().value(), ex);
        } catch (WebClientRequestException | IOException ex) {
            throw new RecognitionAccessException("recognition service unreachable", ex);
        } catch (DataBufferLimitException ex) {
            throw new RecognitionAccessException("recognition response too large", ex);
        } catch (WebClientException ex) {
            throw new RecognitionAccessException("recognition request failed", ex);
        } catch (RuntimeException ex) {
            throw new RecognitionAccessException("recognition call failed: " + ex.getMessage(), ex);
        }
    }

    /**
     * Content type for the image part. Missing or unparseable client values fall back to JPEG.
     */
    static MediaType partContentType(String contentType) {
        if (contentType == null || contentType.isBlank()) {
            return MediaType.IMAGE_JPEG;
        }
        try {
            return MediaType.parseMediaType(contentType);
        } catch (InvalidMediaTypeException ex) {
            LOGGER.debug("HttpRecognitionProvider ignoring content type value={} reason={}", contentType, ex.getMessage());
            return MediaType.IMAGE_JPEG;
        }
    }

    private static String textOrNull(JsonNode node, String field) {
        if (node == null || !node.hasNonNull(field)) {
            return null;
        }
        String value = node.get(field).asText();
        return value != null && !value.isBlank() ? value.trim() : null;
    }

    private static String textOrDefault(JsonNode node, String field, String fallback) {
        String value = textOrNull(node, field);
        return value != null ? value : fallback;
    }
}
