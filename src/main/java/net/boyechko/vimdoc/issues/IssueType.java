/*
 * Vimdoc-HTML - Vimdoc Help File Conversion
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
package net.boyechko.vimdoc.issues;

/** Represents the type of a problem found while converting a help file. */
public enum IssueType {
    // Syntax tree issues
    INVALID_NODE("error nodes in the syntax tree"),
    MISSING_NODE("missing nodes in the syntax tree"),

    // Rendering issues
    PARSE_ERROR_RENDERED("parse errors rendered as error markers"),
    NOISE_LINE("boilerplate lines suppressed"),
    UNRESOLVED_TAGLINK("links to tags not defined in the file");

    private final String groupLabel;

    IssueType(String groupLabel) {
        this.groupLabel = groupLabel;
    }

    public String groupLabel() {
        return groupLabel;
    }
}
