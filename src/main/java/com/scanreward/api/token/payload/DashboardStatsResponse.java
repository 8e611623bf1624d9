package com.scanreward.api.token.payload;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NonNull;

@Data
@Builder
@AllArgsConstructor
@Schema(name = "DashboardStats")
public class DashboardStatsResponse {

    @Schema(required = true, description = "number of tokens issued so far.")
    @NonNull
    private Long totalIssued;

    @Schema(required = true, description = "number of redeemed tokens.")
    @NonNull
    private Long redeemedCount;

    @Schema(required = true, description = "number of tokens that haven't been redeemed, including expired ones.")
    @NonNull
    private Long remainingCount;

    @Schema(required = true, description = "sum of reward amounts assigned to redeemed tokens.")
    @NonNull
    private Long totalRewardPaid;
}
