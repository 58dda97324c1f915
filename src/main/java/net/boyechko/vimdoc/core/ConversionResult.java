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
package net.boyechko.vimdoc.core;

import net.boyechko.vimdoc.issues.IssueList;
import net.boyechko.vimdoc.render.RenderStats;

/**
 * Output of one conversion. {@code stats} is only filled in for {@link OutputFormat#HTML}; the
 * other formats leave it empty.
 */
public record ConversionResult(
        OutputFormat format, String output, RenderStats stats, IssueList issues) {

    public boolean hasIssues() {
        return !issues.isEmpty();
    }
}
