package com.scanreward.api.token.payload;

import com.scanreward.api.token.entities.TokenState;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NonNull;

import java.time.OffsetDateTime;

@Data
@Builder
@AllArgsConstructor
@Schema(name = "Token")
public class TokenResponse {

    @Schema(required = true)
    @NonNull
    private String id;

    @Schema(required = true)
    @NonNull
    private String productName;

    @Schema(required = true)
    @NonNull
    private String batchId;

    @Schema(required = true)
    @NonNull
    private TokenState state;

    @Schema(required = true, description = "reward amount; always 0 until the token is redeemed.")
    @NonNull
    private Long amount;

    @Schema(type = "integer", format = "int64", required = true, description = "epoch millis when the token was issued.")
    @NonNull
    private OffsetDateTime createdAt;

    @Schema(type = "integer", format = "int64", description = "epoch millis when the token was redeemed.")
    private OffsetDateTime redeemedAt;

    @Schema(type = "integer", format = "int64", description = "optional epoch millis when the token expires.")
    private OffsetDateTime expiresAt;
}
