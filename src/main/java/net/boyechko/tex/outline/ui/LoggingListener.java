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
package net.boyechko.tex.outline.ui;

import java.nio.file.Path;
import net.boyechko.tex.outline.core.ConstructionListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** A {@link ConstructionListener} that routes all events through SLF4J. */
public class LoggingListener implements ConstructionListener {

    static final String LOGGER_NAME = "net.boyechko.tex.outline.construction";

    private static final Logger logger = LoggerFactory.getLogger(LOGGER_NAME);

    @Override
    public void onConstructionStart(Path rootFile, boolean mergeSubFiles) {
        logger.info("START {} (sub-files {})", rootFile, mergeSubFiles ? "merged" : "unmerged");
    }

    @Override
    public void onFileExtracted(Path file, int elementCount) {
        logger.debug("FILE {} elements={}", file, elementCount);
    }

    @Override
    public void onFileUnavailable(Path file, String missing) {
        logger.warn("UNAVAILABLE {}: no {}; the file is left out of the outline", file, missing);
    }

    @Override
    public void onConstructionComplete(Path rootFile, int fileCount, int topLevelCount) {
        logger.info("DONE {} files={} top-level={}", rootFile, fileCount, topLevelCount);
    }
}
