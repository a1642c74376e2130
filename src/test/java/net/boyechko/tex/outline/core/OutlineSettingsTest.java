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

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class OutlineSettingsTest {

    @TempDir Path tempDir;

    @Test
    void loadDefault() {
        OutlineSettings settings = OutlineSettings.loadDefault();

        List<List<String>> groups = settings.sectionGroups();
        assertEquals(7, groups.size());
        assertEquals(List.of("part"), groups.get(0));
        assertEquals(List.of("chapter", "addchap"), groups.get(1));
        assertTrue(settings.floatsEnabled());
        assertTrue(settings.captionsEnabled());
        assertTrue(settings.floatNumbersEnabled());
        assertTrue(settings.sectionNumbersEnabled());
        assertTrue(settings.commandNames().isEmpty());
        assertTrue(settings.validateConsistency().isEmpty(), "Defaults should be consistent");
    }

    @Test
    void loadFromResource() {
        OutlineSettings settings = OutlineSettings.fromResource("/outline-test.yaml");

        assertEquals(
                List.of(
                        List.of("chapter"),
                        List.of("section", "frametitle"),
                        List.of("subsection")),
                settings.sectionGroups());
        assertEquals(List.of("label"), settings.commandNames());
        assertEquals(List.of("theorem", "lemma"), settings.environmentNames());
        assertFalse(settings.floatsEnabled());
        assertFalse(settings.floatNumbersEnabled());
        assertEquals(List.of(Path.of("styles"), Path.of("/opt/texmf")), settings.searchDirs());
    }

    @Test
    void inconsistenciesAreReported() {
        OutlineSettings settings = OutlineSettings.fromResource("/outline-inconsistent.yaml");

        List<String> warnings = settings.validateConsistency();

        assertEquals(2, warnings.size(), "Got: " + warnings);
        assertTrue(warnings.get(0).contains("\\section listed at ranks 1 and 2"));
        assertTrue(warnings.get(1).contains("\\chapter is configured both"));
    }

    @Test
    void emptyFileGivesDefaults() throws Exception {
        Path file = tempDir.resolve("empty.yaml");
        Files.writeString(file, "");

        OutlineSettings settings = OutlineSettings.fromFile(file);

        assertTrue(settings.sectionGroups().isEmpty());
        assertTrue(settings.floatsEnabled());
    }

    @Test
    void invalidYamlIsRejected() throws Exception {
        Path file = tempDir.resolve("broken.yaml");
        Files.writeString(file, "sections: [chapter\n");

        assertThrows(IllegalArgumentException.class, () -> OutlineSettings.fromFile(file));
    }

    @Test
    void unknownKeyIsRejected() throws Exception {
        Path file = tempDir.resolve("unknown.yaml");
        Files.writeString(file, "sectoins: [chapter]\n");

        assertThrows(IllegalArgumentException.class, () -> OutlineSettings.fromFile(file));
    }

    @Test
    void missingResourceIsRejected() {
        assertThrows(
                IllegalArgumentException.class,
                () -> OutlineSettings.fromResource("/no-such-settings.yaml"));
    }

    @Test
    void missingFileIsRejected() {
        Path missing = tempDir.resolve("none.yaml");
        assertThrows(RuntimeException.class, () -> OutlineSettings.fromFile(missing));
    }
}
