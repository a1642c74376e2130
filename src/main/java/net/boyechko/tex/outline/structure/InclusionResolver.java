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
package net.boyechko.tex.outline.structure;

import java.nio.file.Path;
import net.boyechko.tex.outline.core.StructureConfig;
import net.boyechko.tex.outline.document.FileStructureCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Extracts a root file and, through the extractor's recursion, every file it includes. */
public class InclusionResolver {
    private static final Logger logger = LoggerFactory.getLogger(InclusionResolver.class);

    private final FileExtractor extractor;

    public InclusionResolver(FileExtractor extractor) {
        this.extractor = extractor;
    }

    /** Returns a fresh cache holding the forest of every file reached from {@code rootFile}. */
    public FileStructureCache resolve(Path rootFile, StructureConfig config) {
        FileStructureCache cache = new FileStructureCache();
        extractor.extract(rootFile, config, cache);
        logger.debug("Resolved {} file(s) from {}", cache.size(), rootFile);
        return cache;
    }
}
