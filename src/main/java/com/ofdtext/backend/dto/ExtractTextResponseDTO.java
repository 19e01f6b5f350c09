package com.ofdtext.backend.dto;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.ofdtext.backend.services.extraction.ExtractionResult;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"text", "length", "links"})
public class ExtractTextResponseDTO {

    private String text;

    /**
     * Characters in {@link #text}.
     */
    private int length;

    /**
     * "pdf" and/or "fns"; empty object when the page had neither.
     */
    private Map<String, String> links;

    public static ExtractTextResponseDTO from(ExtractionResult result) {
        return ExtractTextResponseDTO.builder()
                .text(result.text())
                .length(result.length())
                .links(result.links().asMap())
                .build();
    }
}
