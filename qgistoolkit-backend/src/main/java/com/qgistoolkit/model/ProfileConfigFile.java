package com.qgistoolkit.model;

import lombok.Data;

import java.util.List;

/**
 * Root object of one profile YAML file.
 */
@Data
public class ProfileConfigFile {
    private List<ExtractionProfile> profiles;
}
