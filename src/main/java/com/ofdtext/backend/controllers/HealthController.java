package com.ofdtext.backend.controllers;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import com.ofdtext.backend.dto.HealthResponseDTO;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirements;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;

@RestController
@Slf4j
public class HealthController {

    @GetMapping("/health")
    @Operation(summary = "Liveness check, no authentication")
    @SecurityRequirements
    public ResponseEntity<HealthResponseDTO> health(HttpServletRequest request) {
        log.info("Health check from {}", request.getRemoteAddr());
        return ResponseEntity.ok(new HealthResponseDTO("healthy"));
    }
}
