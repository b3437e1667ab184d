package com.example.filament_ledger.ledger;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum Language {
    SYSTEM("system"),
    ENGLISH("en"),
    CHINESE("zh_Hans");

    private final String code;

    Language(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static Language fromCode(String code) {
        if (code == null) {
            return SYSTEM;
        }
        return Arrays.stream(values())
                .filter(l -> l.code.equals(code.trim()))
                .findFirst()
                .orElse(SYSTEM);
    }
}
