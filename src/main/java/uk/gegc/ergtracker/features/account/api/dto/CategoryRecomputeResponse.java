package uk.gegc.ergtracker.features.account.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Outcome of the batch age-category refresh")
public record CategoryRecomputeResponse(
        @Schema(description = "Accounts with a birth year that were inspected")
        int examined,

        @Schema(description = "Accounts whose stored category changed")
        int changed
) {
}
