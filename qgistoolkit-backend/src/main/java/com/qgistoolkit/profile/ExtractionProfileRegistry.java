package com.qgistoolkit.profile;

import com.qgistoolkit.model.ExtractionProfile;
import com.qgistoolkit.model.ProfileConfigFile;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Named extraction profiles loaded from YAML files in the configured profile directory.
 */
@Component
public class ExtractionProfileRegistry {
    private static final Logger log = LoggerFactory.getLogger(ExtractionProfileRegistry.class);

    private final String profilesPath;

    private volatile Map<String, ExtractionProfile> profilesByName = Map.of();

    public ExtractionProfileRegistry(@Value("${toolkit.profiles.path:profiles}") String profilesPath) {
        this.profilesPath = profilesPath;
    }

    @PostConstruct
    public void loadProfiles() {
        reloadProfiles();
    }

    /**
     * Reloads profile YAML from the profile directory.
     *
     * The new map is built completely and then swapped in, so readers never see a partial load.
     *
     * @return number of profiles loaded
     */
    public int reloadProfiles() {
        Map<String, ExtractionProfile> loaded = new LinkedHashMap<>();
        Path profilesDir = Paths.get(profilesPath);
        if (!Files.isDirectory(profilesDir)) {
            log.warn("Profile directory not found: {}", profilesPath);
            profilesByName = Map.of();
            return 0;
        }

        List<Path> yamlFiles;
        try (Stream<Path> files = Files.list(profilesDir)) {
            yamlFiles = files
                    .filter(p -> p.toString().endsWith(".yaml") || p.toString().endsWith(".yml"))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            log.error("Failed to list profiles in {}", profilesPath, e);
            return profilesByName.size();
        }

        for (Path yamlFile : yamlFiles) {
            try {
                ProfileConfigFile config = loadYamlConfig(yamlFile);
                if (config == null || config.getProfiles() == null) {
                    log.warn("No profiles declared in {}", yamlFile);
                    continue;
                }
                for (ExtractionProfile profile : config.getProfiles()) {
                    if (profile.getName() == null || profile.getName().isBlank()) {
                        log.warn("Skipping unnamed profile in {}", yamlFile);
                        continue;
                    }
                    profile.setSourceFile(String.valueOf(yamlFile.getFileName()));
                    ExtractionProfile previous = loaded.put(profile.getName(), profile);
                    if (previous != null) {
                        log.warn("Profile '{}' from {} overrides the one from {}",
                                profile.getName(), profile.getSourceFile(), previous.getSourceFile());
                    }
                    log.debug("Loaded profile: {} from {}", profile.getName(), yamlFile.getFileName());
                }
            } catch (Exception e) {
                log.error("Failed to load profile file: {}", yamlFile, e);
            }
        }

        profilesByName = Map.copyOf(loaded);
        log.info("Reloaded {} extraction profiles from {}", loaded.size(), profilesPath);
        return loaded.size();
    }

    private ProfileConfigFile loadYamlConfig(Path yamlFile) throws IOException {
        try (InputStream in = Files.newInputStream(yamlFile)) {
            return new Yaml().loadAs(in, ProfileConfigFile.class);
        }
    }

    public List<ExtractionProfile> listProfiles() {
        List<ExtractionProfile> profiles = new ArrayList<>(profilesByName.values());
        profiles.sort(Comparator.comparing(ExtractionProfile::getName, String.CASE_INSENSITIVE_ORDER));
        return profiles;
    }

    public ExtractionProfile getProfile(String name) {
        ExtractionProfile profile = profilesByName.get(name);
        if (profile == null) {
            throw new ProfileNotFoundException("Extraction profile not found: " + name);
        }
        return profile;
    }
}
