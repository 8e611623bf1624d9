package com.scanreward.api.token.payload;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IssueBatchParams {

    public static final int MAX_COUNT = 10_000;

    @Schema(required = true, description = "name of the product that the printed codes ship with.")
    @NotBlank
    @Size(max = 128)
    private String productName;

    @Schema(required = true, description = "business identifier shared by all tokens in the batch.")
    @NotBlank
    @Size(max = 64)
    private String batchId;

    @Schema(required = true, description = "number of tokens to issue.")
    @NotNull
    @Min(1)
    @Max(MAX_COUNT)
    private Integer count;

    @Schema(type = "integer", format = "int64", description = "optional epoch millis after which the tokens can't be redeemed.")
    private OffsetDateTime expiresAt;
}
