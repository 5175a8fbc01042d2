package com.example.bugretention.requests;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import java.util.List;

/**
 * HTTP-layer payload for permanent deletion. {@code confirm} must be literally true; anything
 * else is rejected before the service is called.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HardDeleteHttpRequest(
        @JsonProperty("reportIds")
        @NotEmpty @Size(max = ReportIdConstraints.MAX_REPORT_IDS)
        List<@NotNull @Pattern(regexp = ReportIdConstraints.UUID_PATTERN) String> reportIds,
        @JsonProperty("confirm") @NotNull @AssertTrue(message = "must be true to permanently delete reports")
        Boolean confirm,
        @JsonProperty("generateCertificate") Boolean generateCertificate
) {

    public boolean certificateRequested() {
        return generateCertificate == null || generateCertificate;
    }
}
