package com.ofdtext.backend.controllers;

import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import com.fasterxml.jackson.databind.JsonNode;
import com.ofdtext.backend.dto.ErrorResponseDTO;
import com.ofdtext.backend.dto.ExtractTextResponseDTO;
import com.ofdtext.backend.exceptions.BadRequestException;
import com.ofdtext.backend.services.extraction.ExtractionResult;
import com.ofdtext.backend.services.extraction.TextExtractionPipeline;

import io.swagger.v3.oas.annotations.Operation;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@RestController
@RequiredArgsConstructor
@Slf4j
public class ExtractionController {

    public static final String NO_JSON = "No JSON data provided";
    static final String MISSING_HTML = "Missing 'html' field in request";
    static final String INVALID_HTML = "Invalid 'html' field";

    private final TextExtractionPipeline pipeline;

    @PostMapping(value = "/extract-text", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Extract readable text and important links from an HTML page")
    public ResponseEntity<?> extractText(
            @RequestBody(required = false) JsonNode payload,
            HttpServletRequest request
    ) {
        String html = requireHtml(payload);

        log.info("Processing HTML content from {} (length: {})", request.getRemoteAddr(), ExtractionResult.characterCount(html));
        try {
            ExtractionResult result = pipeline.extract(html);
            log.info("Successfully extracted text (length: {})", result.length());
            return ResponseEntity.ok(ExtractTextResponseDTO.from(result));
        } catch (Exception e) {
            log.error("Error processing request: {}", e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(ErrorResponseDTO.of("Error processing request: " + e.getMessage()));
        }
    }

    private static String requireHtml(JsonNode payload) {
        if (isEmptyJson(payload)) {
            throw new BadRequestException(NO_JSON);
        }
        if (!payload.isObject() || !payload.has("html")) {
            throw new BadRequestException(MISSING_HTML);
        }

        JsonNode html = payload.get("html");
        if (!html.isTextual() || html.textValue().isEmpty()) {
            throw new BadRequestException(INVALID_HTML);
        }
        return html.textValue();
    }

    // null, {}, [], "", 0 and false all count as "no data".
    private static boolean isEmptyJson(JsonNode payload) {
        if (payload == null || payload.isNull() || payload.isMissingNode()) return true;
        if (payload.isContainerNode()) return payload.isEmpty();
        if (payload.isTextual()) return payload.textValue().isEmpty();
        if (payload.isBoolean()) return !payload.booleanValue();
        if (payload.isNumber()) return payload.asDouble() == 0;
        return false;
    }
}
