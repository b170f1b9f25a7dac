package com.kmg.extract.dto;

import com.kmg.extract.model.InsurerProfile;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record StartRunRequest(
        @NotBlank String backlogDir,
        @NotNull InsurerProfile profile,
        @Min(0) int startIndex,
        @Min(0) Integer limit,
        String outputDir,
        @Min(1) @Max(8) Integer workers
) {
}
