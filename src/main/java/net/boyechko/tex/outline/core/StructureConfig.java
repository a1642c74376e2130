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

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Read-only configuration of one construction run, derived from {@link OutlineSettings}.
 *
 * @param sectionCommands rank groups; index 0 is the outermost rank
 * @param sectionIndex rank of every section name
 * @param commandNames macros surfaced as command elements
 * @param environmentNames environments surfaced as environment elements, including the enabled
 *     float kinds and {@code frame}
 * @param floatsEnabled whether figures and tables are surfaced, whatever the environment names
 * @param captionsEnabled whether float labels carry their caption
 * @param searchDirs directories searched for included files
 * @param mergeSubFiles whether included files are extracted and spliced into the outline
 * @param rootFile root file of the run
 */
public record StructureConfig(
        List<List<String>> sectionCommands,
        Map<String, Integer> sectionIndex,
        Set<String> commandNames,
        Set<String> environmentNames,
        boolean floatsEnabled,
        boolean captionsEnabled,
        List<Path> searchDirs,
        boolean mergeSubFiles,
        Path rootFile) {

    /** Environments always surfaced, whether or not float kinds are enabled. */
    static final List<String> DEFAULT_FLOATS = List.of("frame");

    public StructureConfig {
        sectionCommands = List.copyOf(sectionCommands);
        sectionIndex = Map.copyOf(sectionIndex);
        commandNames = Set.copyOf(commandNames);
        environmentNames = Set.copyOf(environmentNames);
        searchDirs = List.copyOf(searchDirs);
    }

    public static StructureConfig from(
            OutlineSettings settings, boolean mergeSubFiles, Path rootFile) {
        List<List<String>> groups = settings.sectionGroups();
        Map<String, Integer> index = new HashMap<>();
        for (int rank = 0; rank < groups.size(); rank++) {
            for (String name : groups.get(rank)) {
                index.put(name, rank);
            }
        }

        Set<String> envs = new LinkedHashSet<>();
        if (settings.floatsEnabled()) {
            envs.add("figure");
            envs.add("table");
        }
        envs.addAll(DEFAULT_FLOATS);
        envs.addAll(settings.environmentNames());

        return new StructureConfig(
                groups,
                index,
                new LinkedHashSet<>(settings.commandNames()),
                envs,
                settings.floatsEnabled(),
                settings.captionsEnabled(),
                new ArrayList<>(settings.searchDirs()),
                mergeSubFiles,
                rootFile);
    }

    public boolean isSectionCommand(String name) {
        return sectionIndex.containsKey(name);
    }

    /** Returns the configured rank of {@code name}, or null if it has none. */
    public Integer rankOf(String name) {
        return sectionIndex.get(name);
    }

    public Path rootDir() {
        return rootFile != null ? rootFile.toAbsolutePath().getParent() : null;
    }
}
