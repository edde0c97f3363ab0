package com.qgistoolkit.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

import java.time.OffsetDateTime;

/**
 * Response for {@code POST /v1/profiles/reload}.
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ProfilesReloadResponse {
    private String status;
    private int loaded;
    private OffsetDateTime reloadedAt;
}
