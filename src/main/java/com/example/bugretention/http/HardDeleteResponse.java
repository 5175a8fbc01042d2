package com.example.bugretention.http;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record HardDeleteResponse(
        @JsonProperty("success") boolean success,
        @JsonProperty("deletedCount") int deletedCount,
        @JsonProperty("certificate") DeletionCertificateResponse certificate
) {}
