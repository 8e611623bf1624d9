package com.scanreward.api.token.payload;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NonNull;

@Data
@Builder
@AllArgsConstructor
@Schema(name = "ProductStats")
public class ProductStatsResponse {

    @Schema(required = true)
    @NonNull
    private String productName;

    @Schema(required = true, description = "number of tokens issued for the product.")
    @NonNull
    private Long total;

    @Schema(required = true, description = "number of redeemed tokens for the product.")
    @NonNull
    private Long redeemed;
}
