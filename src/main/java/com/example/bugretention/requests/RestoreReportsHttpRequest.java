package com.example.bugretention.requests;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import java.util.List;

public record RestoreReportsHttpRequest(
        @JsonProperty("reportIds")
        @NotEmpty @Size(max = ReportIdConstraints.MAX_REPORT_IDS)
        List<@NotNull @Pattern(regexp = ReportIdConstraints.UUID_PATTERN) String> reportIds
) {}
