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

/**
 * Defines the verbosity levels for output control.
 *
 * <p>Levels (from least to most verbose):
 *
 * <ul>
 *   <li>QUIET - Only errors
 *   <li>NORMAL - Warnings such as unavailable files (default)
 *   <li>VERBOSE - Progress of each construction run
 *   <li>DEBUG - All information including debug logs
 * </ul>
 */
public enum VerbosityLevel {
    QUIET("ERROR"),
    NORMAL("WARN"),
    VERBOSE("INFO"),
    DEBUG("DEBUG");

    private final String logLevel;

    VerbosityLevel(String logLevel) {
        this.logLevel = logLevel;
    }

    /** Name of the Logback level the root logger is set to at this verbosity. */
    public String logLevel() {
        return logLevel;
    }
}
