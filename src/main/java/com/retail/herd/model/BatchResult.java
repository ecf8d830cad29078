package com.retail.herd.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Per-outcome counts for a batch of submitted events")
public class BatchResult {

    @Schema(description = "Events counted into a bucket", example = "98")
    private int accepted;

    @Schema(description = "Events older than the product's active bucket", example = "1")
    private int late;

    @Schema(description = "Events rejected for validation, overload or shutdown", example = "1")
    private int rejected;

    @Schema(description = "Validation errors, one per rejected event")
    @Builder.Default
    private List<String> errors = new ArrayList<>();
}
