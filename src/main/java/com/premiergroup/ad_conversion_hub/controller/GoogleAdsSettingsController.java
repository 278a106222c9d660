package com.premiergroup.ad_conversion_hub.controller;

import com.premiergroup.ad_conversion_hub.dto.ApiMessage;
import com.premiergroup.ad_conversion_hub.dto.ConversionActionDetails;
import com.premiergroup.ad_conversion_hub.dto.CreateConversionActionRequest;
import com.premiergroup.ad_conversion_hub.dto.CreateConversionActionResult;
import com.premiergroup.ad_conversion_hub.dto.CredentialNotice;
import com.premiergroup.ad_conversion_hub.service.DiagnosticLogger;
import com.premiergroup.ad_conversion_hub.service.GoogleAdsAdminService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Pattern;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/google-ads")
@Validated
@RequiredArgsConstructor
public class GoogleAdsSettingsController {

    private final GoogleAdsAdminService adminService;
    private final DiagnosticLogger diagnosticLogger;

    /**
     * Current settings; client secret, refresh token and developer token are masked.
     */
    @GetMapping("/settings")
    public ResponseEntity<Map<String, String>> getSettings() {
        return ResponseEntity.ok(adminService.maskedSettings());
    }

    @PutMapping("/settings")
    public ResponseEntity<Map<String, String>> updateSettings(@RequestBody Map<String, String> settings) {
        return ResponseEntity.ok(adminService.updateSettings(settings));
    }

    @PostMapping("/test-connection")
    public ResponseEntity<ApiMessage> testConnection() {
        try {
            ApiMessage result = adminService.testConnection();
            return result.success() ? ResponseEntity.ok(result) : ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(result);
        } catch (IllegalStateException e) {
            return ResponseEntity.badRequest().body(new ApiMessage(false, e.getMessage()));
        }
    }

    @PostMapping("/conversion-actions")
    public ResponseEntity<CreateConversionActionResult> createConversionAction(
            @Valid @RequestBody CreateConversionActionRequest request) {
        try {
            CreateConversionActionResult result = adminService.createConversionAction(request);
            return result.success() ? ResponseEntity.ok(result) : ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(result);
        } catch (IllegalStateException e) {
            return ResponseEntity.badRequest().body(CreateConversionActionResult.failure(e.getMessage(), true));
        }
    }

    @GetMapping("/conversion-actions/{id}")
    public ResponseEntity<ConversionActionDetails> getConversionAction(
            @PathVariable("id") @Pattern(regexp = "\\d+", message = "id must be numeric") String id) {
        try {
            ConversionActionDetails details = adminService.fetchConversionActionDetails(id);
            return details.success() ? ResponseEntity.ok(details) : ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(details);
        } catch (IllegalStateException e) {
            return ResponseEntity.badRequest().body(ConversionActionDetails.failure(e.getMessage()));
        }
    }

    @GetMapping("/credential-notice")
    public ResponseEntity<CredentialNotice> getCredentialNotice() {
        return ResponseEntity.ok(adminService.credentialNotice());
    }

    /**
     * Downloads the diagnostic log as a text attachment.
     */
    @GetMapping("/log")
    public ResponseEntity<String> downloadLog() {
        if (!diagnosticLogger.exists()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok()
                .contentType(MediaType.TEXT_PLAIN)
                .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment()
                        .filename(diagnosticLogger.getPath().getFileName().toString())
                        .build()
                        .toString())
                .body(diagnosticLogger.getContents());
    }

    @DeleteMapping("/log")
    public ResponseEntity<Void> clearLog() {
        diagnosticLogger.clear();
        return ResponseEntity.noContent().build();
    }
}
