package com.scanreward.api.token.payload;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NonNull;

import java.time.OffsetDateTime;

@Data
@Builder
@AllArgsConstructor
@Schema(name = "Redemption")
public class RedemptionResponse {

    @Schema(required = true, description = "reward amount assigned to the token.")
    @NonNull
    private Long amount;

    @Schema(type = "integer", format = "int64", required = true, description = "epoch millis when the token was redeemed.")
    @NonNull
    private OffsetDateTime redeemedAt;
}
