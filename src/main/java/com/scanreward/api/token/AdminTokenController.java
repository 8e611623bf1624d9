package com.scanreward.api.token;

import com.scanreward.api.token.exceptions.DuplicateTokenIdException;
import com.scanreward.api.token.exceptions.TokenNotFoundException;
import com.scanreward.api.token.exceptions.TokenStoreUnavailableException;
import com.scanreward.api.token.payload.DashboardStatsResponse;
import com.scanreward.api.token.payload.IssueBatchParams;
import com.scanreward.api.token.payload.IssuedBatchResponse;
import com.scanreward.api.token.payload.ProductStatsResponse;
import com.scanreward.api.token.payload.TokenResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@Validated
@RestController
@RequestMapping("/v1/admin/tokens")
@Slf4j
@Tag(name = "admin")
@SecurityRequirement(name = "admin-password")
class AdminTokenController {

    private final TokenIssuanceService issuanceService;
    private final TokenReportService reportService;

    @Autowired
    AdminTokenController(@NonNull TokenIssuanceService issuanceService, @NonNull TokenReportService reportService) {
        this.issuanceService = issuanceService;
        this.reportService = reportService;
    }

    /**
     * Issues a batch of new tokens for the given product. The response lists the id of each
     * issued token with the url that its QR code should encode. The batch is issued
     * all-or-nothing.
     */
    @Operation(summary = "Issue a batch of tokens")
    @ApiResponses({
        @ApiResponse(responseCode = "201", description = "tokens issued successfully"),
        @ApiResponse(responseCode = "400", description = "request is not valid", content = @Content),
        @ApiResponse(responseCode = "401", description = "admin password is missing or invalid", content = @Content),
        @ApiResponse(responseCode = "500", description = "internal server error", content = @Content),
        @ApiResponse(responseCode = "503", description = "token store is temporarily unavailable", content = @Content),
    })
    @NonNull
    @PostMapping("/batches")
    ResponseEntity<IssuedBatchResponse> issueBatch(@Valid @NotNull @RequestBody IssueBatchParams params) {
        try {
            return ResponseEntity.status(HttpStatus.CREATED).body(issuanceService.issueBatch(params));
        } catch (DuplicateTokenIdException e) {
            // already logged as an integrity anomaly by the issuance service.
            return ResponseEntity.internalServerError().build();
        } catch (TokenStoreUnavailableException e) {
            log.warn("failed to issue token batch", e);
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
        }
    }

    /**
     * Summarises issued, redeemed and remaining tokens, and the rewards paid so far. The numbers
     * are consistent with each other, but may trail redemptions that are in flight.
     */
    @Operation(summary = "Get dashboard stats")
    @ApiResponses({
        @ApiResponse(responseCode = "200"),
        @ApiResponse(responseCode = "401", description = "admin password is missing or invalid", content = @Content),
        @ApiResponse(responseCode = "500", description = "internal server error", content = @Content),
        @ApiResponse(responseCode = "503", description = "token store is temporarily unavailable", content = @Content),
    })
    @NonNull
    @GetMapping("/stats")
    ResponseEntity<DashboardStatsResponse> getDashboardStats() {
        try {
            return ResponseEntity.ok(reportService.getDashboardStats());
        } catch (TokenStoreUnavailableException e) {
            log.warn("failed to compute dashboard stats", e);
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
        }
    }

    @Operation(summary = "Get per-product stats")
    @ApiResponses({
        @ApiResponse(responseCode = "200"),
        @ApiResponse(responseCode = "401", description = "admin password is missing or invalid", content = @Content),
        @ApiResponse(responseCode = "500", description = "internal server error", content = @Content),
        @ApiResponse(responseCode = "503", description = "token store is temporarily unavailable", content = @Content),
    })
    @NonNull
    @GetMapping("/stats/products")
    ResponseEntity<List<ProductStatsResponse>> getProductStats() {
        try {
            return ResponseEntity.ok(reportService.getProductStats());
        } catch (TokenStoreUnavailableException e) {
            log.warn("failed to compute product stats", e);
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
        }
    }

    /**
     * Get the current state of a single token, e.g. to look into a disputed scan.
     */
    @Operation(summary = "Get a token")
    @ApiResponses({
        @ApiResponse(responseCode = "200"),
        @ApiResponse(responseCode = "400", description = "request is not valid", content = @Content),
        @ApiResponse(responseCode = "401", description = "admin password is missing or invalid", content = @Content),
        @ApiResponse(responseCode = "404", description = "token doesn't exist", content = @Content),
        @ApiResponse(responseCode = "500", description = "internal server error", content = @Content),
        @ApiResponse(responseCode = "503", description = "token store is temporarily unavailable", content = @Content),
    })
    @NonNull
    @GetMapping("/{tokenId}")
    ResponseEntity<TokenResponse> getToken(@NotBlank @Size(max = 64) @PathVariable String tokenId) {
        try {
            return ResponseEntity.ok(reportService.getToken(tokenId));
        } catch (TokenNotFoundException e) {
            return ResponseEntity.notFound().build();
        } catch (TokenStoreUnavailableException e) {
            log.warn("failed to get token", e);
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
        }
    }
}
