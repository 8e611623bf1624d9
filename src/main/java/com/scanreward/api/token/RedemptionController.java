package com.scanreward.api.token;

import com.scanreward.api.token.exceptions.TokenAlreadyUsedException;
import com.scanreward.api.token.exceptions.TokenExpiredException;
import com.scanreward.api.token.exceptions.TokenNotFoundException;
import com.scanreward.api.token.exceptions.TokenStoreUnavailableException;
import com.scanreward.api.token.payload.RedemptionResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Validated
@RestController
@RequestMapping("/v1/tokens")
@Slf4j
@Tag(name = "redemption")
class RedemptionController {

    private final RedemptionService redemptionService;

    @Autowired
    RedemptionController(@NonNull RedemptionService redemptionService) {
        this.redemptionService = redemptionService;
    }

    /**
     * Redeems the token encoded in a scanned QR code and returns the reward amount assigned to it.
     * It doesn't require authentication. Each token can be redeemed only once; later attempts,
     * including concurrent ones that lose the race, receive a 422 response.
     *
     * @param tokenId id of the token encoded in the QR code.
     */
    @Operation(summary = "Redeem a token")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "token redeemed successfully"),
        @ApiResponse(responseCode = "400", description = "request is not valid", content = @Content),
        @ApiResponse(responseCode = "404", description = "token doesn't exist", content = @Content),
        @ApiResponse(responseCode = "410", description = "token has expired", content = @Content),
        @ApiResponse(responseCode = "422", description = "token has already been redeemed", content = @Content),
        @ApiResponse(responseCode = "500", description = "internal server error", content = @Content),
        @ApiResponse(responseCode = "503", description = "token store is temporarily unavailable; safe to retry", content = @Content),
    })
    @NonNull
    @PostMapping("/{tokenId}/redeem")
    ResponseEntity<RedemptionResponse> redeem(@NotBlank @Size(max = 64) @PathVariable String tokenId) {
        try {
            return ResponseEntity.ok(redemptionService.redeem(tokenId));
        } catch (TokenNotFoundException e) {
            return ResponseEntity.notFound().build();
        } catch (TokenExpiredException e) {
            return ResponseEntity.status(HttpStatus.GONE).build();
        } catch (TokenAlreadyUsedException e) {
            return ResponseEntity.unprocessableEntity().build();
        } catch (TokenStoreUnavailableException e) {
            log.warn("failed to redeem token", e);
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
        }
    }
}
