package com.whereq.headshot.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Error body returned to API callers
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ErrorResponse {
    private String errorMessage;
    private List<String> errors;

    public static ErrorResponse of(String message) {
        return new ErrorResponse(message, List.of());
    }
}
