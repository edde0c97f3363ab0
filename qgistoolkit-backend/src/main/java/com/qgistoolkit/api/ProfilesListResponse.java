package com.qgistoolkit.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.qgistoolkit.model.ExtractionProfile;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Response payload for listing the loaded extraction profiles.
 */
@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ProfilesListResponse {
    private List<ExtractionProfile> profiles;
}
