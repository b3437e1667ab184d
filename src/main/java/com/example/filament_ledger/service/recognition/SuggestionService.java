package com.example.filament_ledger.service.recognition;

import com.example.filament_ledger.config.RecognitionProperties;
import com.example.filament_ledger.ledger.HexColor;
import com.example.filament_ledger.ledger.LedgerException;
import com.example.filament_ledger.ledger.SpoolLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a label photo into spool suggestions. Recognition is best effort: when the service is off,
 * slow or failing the caller gets {@link SpoolSuggestion#none()} and enters the values by hand.
 */
@Service
public class SuggestionService {
    private static final Logger LOGGER = LoggerFactory.getLogger(SuggestionService.class);
    private static final Pattern WEIGHT = Pattern.compile("^\\s*(\\d+(?:[.,]\\d+)?)\\s*(kg|g)?\\s*$", Pattern.CASE_INSENSITIVE);

    private final RecognitionProvider provider;
    private final RecognitionProperties properties;

    public SuggestionService(RecognitionProvider provider, RecognitionProperties properties) {
        this.provider = provider;
        this.properties = properties;
    }

    public SpoolSuggestion suggest(byte[] image, String filename, String contentType) {
        if (image == null || image.length == 0) {
            throw LedgerException.invalidInput("Image is required");
        }
        if (image.length > properties.getMaxImageBytes()) {
            throw LedgerException.invalidInput("Image is larger than " + properties.getMaxImageBytes() + " bytes");
        }
        if (!properties.isEnabled()) {
            LOGGER.debug("SuggestionService recognition disabled");
            return SpoolSuggestion.none();
        }
        Optional<RecognitionResult> result;
        try {
            result = provider.recognize(image, filename, contentType);
        } catch (RecognitionAccessException ex) {
            LOGGER.warn("SuggestionService recognition unavailable bytes={} reason={}", image.length, ex.getMessage());
            return SpoolSuggestion.none();
        }
        SpoolSuggestion suggestion = result.map(SuggestionService::interpret).orElseGet(SpoolSuggestion::none);
        LOGGER.info("SuggestionService suggest bytes={} hasData={} confidence={}",
                image.length, suggestion.hasAnyData(), suggestion.confidence());
        return suggestion;
    }

    static SpoolSuggestion interpret(RecognitionResult raw) {
        Double diameter = raw.diameter() != null && SpoolLedger.isStandardDiameter(raw.diameter()) ? raw.diameter() : null;
        return new SpoolSuggestion(
                raw.brand(),
                raw.material(),
                raw.colorName(),
                HexColor.normalize(raw.colorHex()),
                parseGrams(raw.weight()),
                diameter,
                raw.temperatureInfo(),
                raw.confidence());
    }

    /**
     * Label weight text in grams: {@code 1000}, {@code 1000g}, {@code 1kg} and {@code 0.75 kg} are
     * understood, anything else yields {@code null}.
     */
    static Double parseGrams(String text) {
        if (text == null) {
            return null;
        }
        Matcher m = WEIGHT.matcher(text);
        if (!m.matches()) {
            return null;
        }
        double value = Double.parseDouble(m.group(1).replace(',', '.'));
        String unit = m.group(2) == null ? "g" : m.group(2).toLowerCase(Locale.ROOT);
        double grams = unit.equals("kg") ? value * 1000 : value;
        return grams > 0 ? grams : null;
    }
}
