package com.fintech.paymentengine.controller;

import com.fintech.paymentengine.dto.CallbackResponse;
import com.fintech.paymentengine.service.WebhookIngestionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Receives payment system webhooks. The body is taken as raw text so that signatures are
 * checked against exactly what was sent.
 */
@RestController
@RequestMapping("/api/v1/callbacks")
@RequiredArgsConstructor
@Tag(name = "Callbacks", description = "Inbound payment system webhooks")
public class WebhookController {

    private final WebhookIngestionService ingestionService;

    @Operation(summary = "Receive a webhook")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Callback accepted"),
            @ApiResponse(responseCode = "400", description = "Invalid signature or unparseable body"),
            @ApiResponse(responseCode = "404", description = "Unknown payment system or transaction"),
            @ApiResponse(responseCode = "409", description = "Reported status contradicts the local one")
    })
    @PostMapping("/{systemType}")
    public ResponseEntity<CallbackResponse> receive(@PathVariable String systemType,
                                                    @RequestHeader Map<String, String> headers,
                                                    @RequestBody(required = false) String rawBody,
                                                    HttpServletRequest request) {
        return ResponseEntity.ok(ingestionService.receive(systemType, headers, rawBody, request.getRemoteAddr()));
    }
}
