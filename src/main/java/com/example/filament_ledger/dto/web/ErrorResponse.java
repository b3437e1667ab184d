package com.example.filament_ledger.dto.web;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
        String code,
        String message,
        List<String> violations,
        Integer written,
        Integer total
) {
    public static ErrorResponse of(String code, String message) {
        return new ErrorResponse(code, message, null, null, null);
    }
}
