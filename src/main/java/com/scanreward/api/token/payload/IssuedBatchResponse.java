package com.scanreward.api.token.payload;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NonNull;

import java.time.OffsetDateTime;
import java.util.List;

@Data
@Builder
@AllArgsConstructor
@Schema(name = "IssuedBatch")
public class IssuedBatchResponse {

    @Schema(required = true)
    @NonNull
    private String productName;

    @Schema(required = true)
    @NonNull
    private String batchId;

    @Schema(type = "integer", format = "int64", description = "optional epoch millis when the tokens expire.")
    private OffsetDateTime expiresAt;

    @Schema(required = true, description = "issued tokens along with the urls to encode in their QR codes.")
    @NonNull
    private List<IssuedToken> tokens;

    @Data
    @Builder
    @AllArgsConstructor
    @Schema(name = "IssuedToken")
    public static class IssuedToken {

        @Schema(required = true, description = "unguessable id of the token.")
        @NonNull
        private String id;

        @Schema(required = true, description = "url that the QR code for this token should encode.")
        @NonNull
        private String redemptionUrl;
    }
}
