/*
 * TeX-Outline - Document outline construction for LaTeX sources
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.tex.outline.core;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

/**
 * Outline configuration snapshot. Loaded from YAML; the construction pipeline only reads it.
 *
 * <pre>
 * sections:
 *   - part
 *   - chapter
 *   - section|addsec
 * commands: [label]
 * environments: [theorem]
 * floats_enabled: true
 * </pre>
 */
public final class OutlineSettings {
    private static final String DEFAULT_SETTINGS_RESOURCE = "/outline-defaults.yaml";
    private static final Logger logger = LoggerFactory.getLogger(OutlineSettings.class);

    /** Section names from outermost to innermost; {@code a|b} puts several names at one rank. */
    public List<String> sections = new ArrayList<>();

    /** Extra macros surfaced as command elements. */
    public List<String> commands = new ArrayList<>();

    /** Extra environments surfaced as environment elements. */
    public List<String> environments = new ArrayList<>();

    public boolean floats_enabled = true;
    public boolean captions_enabled = true;
    public boolean float_numbers_enabled = true;
    public boolean section_numbers_enabled = true;

    /** Directories searched for included files after the including and root file directories. */
    public List<String> search_dirs = new ArrayList<>();

    /** Rank groups: index is the rank, each entry the names at that rank. */
    public List<List<String>> sectionGroups() {
        List<List<String>> groups = new ArrayList<>();
        for (String entry : nullToEmpty(sections)) {
            groups.add(
                    Arrays.stream(entry.split("\\|"))
                            .map(String::trim)
                            .filter(name -> !name.isEmpty())
                            .toList());
        }
        return groups;
    }

    public List<String> commandNames() {
        return nullToEmpty(commands);
    }

    public List<String> environmentNames() {
        return nullToEmpty(environments);
    }

    public boolean floatsEnabled() {
        return floats_enabled;
    }

    public boolean captionsEnabled() {
        return captions_enabled;
    }

    public boolean floatNumbersEnabled() {
        return float_numbers_enabled;
    }

    public boolean sectionNumbersEnabled() {
        return section_numbers_enabled;
    }

    public List<Path> searchDirs() {
        return nullToEmpty(search_dirs).stream().map(Path::of).toList();
    }

    /**
     * Load settings from a classpath resource.
     *
     * @param resourcePath Path starting with "/" for absolute resource path
     */
    public static OutlineSettings fromResource(String resourcePath) {
        try (InputStream in = OutlineSettings.class.getResourceAsStream(resourcePath)) {
            if (in == null) {
                throw new IllegalArgumentException("Resource not found: " + resourcePath);
            }
            return load(in, resourcePath);
        } catch (IOException e) {
            throw new RuntimeException(
                    "Failed to load settings from resource " + resourcePath + ": " + e.getMessage(),
                    e);
        }
    }

    /** Load settings from a YAML file on disk. */
    public static OutlineSettings fromFile(Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            return load(in, file.toString());
        } catch (IOException e) {
            throw new RuntimeException(
                    "Failed to load settings from " + file + ": " + e.getMessage(), e);
        }
    }

    public static OutlineSettings loadDefault() {
        return fromResource(DEFAULT_SETTINGS_RESOURCE);
    }

    private static OutlineSettings load(InputStream in, String origin) {
        OutlineSettings settings;
        try {
            var yaml = new Yaml(new Constructor(OutlineSettings.class, new LoaderOptions()));
            settings = yaml.load(in);
        } catch (RuntimeException e) {
            logger.error("Failed to parse outline settings from {}: {}", origin, e.getMessage());
            throw new IllegalArgumentException(
                    "Invalid outline settings in " + origin + ": " + e.getMessage(), e);
        }
        if (settings == null) {
            settings = new OutlineSettings();
        }
        logger.debug(
                "Loaded outline settings with {} section ranks from {}",
                settings.sectionGroups().size(),
                origin);

        var warnings = settings.validateConsistency();
        if (!warnings.isEmpty()) {
            logger.warn(
                    "Settings loaded from {} have {} consistency warnings:",
                    origin,
                    warnings.size());
            for (String warning : warnings) {
                logger.warn("  - {}", warning);
            }
        }
        return settings;
    }

    /**
     * Checks the settings for problems that do not prevent a run but make its result surprising: a
     * section name listed at two ranks (the innermost wins), or a name configured both as a section
     * and as a command (the section wins).
     *
     * @return List of warning messages (empty if the settings are consistent)
     */
    public List<String> validateConsistency() {
        List<String> warnings = new ArrayList<>();
        Map<String, Integer> seen = new HashMap<>();
        List<List<String>> groups = sectionGroups();
        for (int rank = 0; rank < groups.size(); rank++) {
            if (groups.get(rank).isEmpty()) {
                warnings.add(String.format("Empty section group at rank %d", rank));
            }
            for (String name : groups.get(rank)) {
                Integer previous = seen.put(name, rank);
                if (previous != null) {
                    warnings.add(
                            String.format(
                                    "Section \\%s listed at ranks %d and %d",
                                    name,
                                    previous,
                                    rank));
                }
            }
        }
        for (String command : commandNames()) {
            if (seen.containsKey(command)) {
                warnings.add(
                        String.format(
                                "\\%s is configured both as a section and as a command", command));
            }
        }
        return warnings;
    }

    private static <T> List<T> nullToEmpty(List<T> list) {
        return list != null ? list : List.of();
    }
}
