package com.ofdtext.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ErrorResponseDTO {

    private String error;

    public static ErrorResponseDTO of(String error) {
        return new ErrorResponseDTO(error);
    }
}
