package com.kreasipositif.transactionservice.controller;

import com.kreasipositif.transactionservice.dto.ApiInfo;
import com.kreasipositif.transactionservice.dto.SystemHealth;
import com.kreasipositif.transactionservice.dto.SystemMetadata;
import com.kreasipositif.transactionservice.service.SystemService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
@Tag(name = "System", description = "Health and service metadata")
public class SystemController {

    private final SystemService systemService;

    @GetMapping(value = "/", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Service information")
    public ResponseEntity<ApiInfo> root() {
        return ResponseEntity.ok(systemService.getInfo());
    }

    @GetMapping(value = "/api/system/health", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Health check", description = "Reports whether the transaction set is loaded.")
    public ResponseEntity<SystemHealth> getHealth() {
        return ResponseEntity.ok(systemService.getHealth());
    }

    @GetMapping(value = "/api/system/metadata", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Service metadata", description = "Version, environment, data source and totals.")
    public ResponseEntity<SystemMetadata> getMetadata() {
        return ResponseEntity.ok(systemService.getMetadata());
    }
}
