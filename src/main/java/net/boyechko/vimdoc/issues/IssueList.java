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

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;
import java.util.stream.Collectors;

/** List of issues found while converting a help file. */
public class IssueList extends ArrayList<Issue> {

    public IssueList() {
        super();
    }

    public IssueList(Collection<Issue> issues) {
        super(issues != null ? issues : new ArrayList<>());
    }

    /** Returns a subset of this list with only the issues of the given type. */
    public IssueList ofType(IssueType type) {
        return stream()
                .filter(issue -> issue.type() == type)
                .collect(Collectors.toCollection(IssueList::new));
    }

    /** Returns a subset of this list with the issues at or above the given severity. */
    public IssueList atLeast(IssueSeverity severity) {
        return stream()
                .filter(issue -> issue.severity().compareTo(severity) >= 0)
                .collect(Collectors.toCollection(IssueList::new));
    }

    public boolean hasErrors() {
        return stream().anyMatch(issue -> issue.severity() == IssueSeverity.ERROR);
    }

    /** Returns the number of issues per type, in declaration order of the types. */
    public Map<IssueType, Integer> countByType() {
        Map<IssueType, Integer> counts = new EnumMap<>(IssueType.class);
        for (Issue issue : this) {
            counts.merge(issue.type(), 1, Integer::sum);
        }
        return counts;
    }

    /** Returns one line per issue type, e.g. "2 error nodes in the syntax tree". */
    public String summary() {
        return countByType().entrySet().stream()
                .map(e -> e.getValue() + " " + e.getKey().groupLabel())
                .collect(Collectors.joining("\n"));
    }
}
