package com.claimvoyant.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ErrorResponse {
    private String error;

    public static ErrorResponse of(String message) {
        return new ErrorResponse(message);
    }
}
