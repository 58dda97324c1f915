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
package net.boyechko.vimdoc.render;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import net.boyechko.vimdoc.issues.Issue;
import net.boyechko.vimdoc.issues.IssueList;
import net.boyechko.vimdoc.issues.IssueLocation;
import net.boyechko.vimdoc.issues.IssueSeverity;
import net.boyechko.vimdoc.issues.IssueType;
import net.boyechko.vimdoc.text.TextRules;

/** What an HTML walk came across: tags defined and linked, parse errors and noise lines. */
public final class RenderStats {
    private final Set<String> tags = new LinkedHashSet<>();
    private final Set<String> taglinks = new LinkedHashSet<>();
    private final List<String> parseErrors = new ArrayList<>();
    private final List<String> noiseLines = new ArrayList<>();

    void addTag(String name) {
        tags.add(name);
    }

    void addTaglink(String name) {
        taglinks.add(name);
    }

    void addParseError(String text) {
        parseErrors.add(text);
    }

    void addNoiseLine(String line) {
        noiseLines.add(line);
    }

    void clear() {
        tags.clear();
        taglinks.clear();
        parseErrors.clear();
        noiseLines.clear();
    }

    /** Tag names defined in the document, in order of first definition. */
    public Set<String> tags() {
        return Collections.unmodifiableSet(tags);
    }

    /** The first tag defined in the document, usually the file name tag. */
    public Optional<String> firstTag() {
        return tags.stream().findFirst();
    }

    public Set<String> taglinks() {
        return Collections.unmodifiableSet(taglinks);
    }

    /** Text of the unparseable fragments rendered as error markers. */
    public List<String> parseErrors() {
        return Collections.unmodifiableList(parseErrors);
    }

    public List<String> noiseLines() {
        return Collections.unmodifiableList(noiseLines);
    }

    /** Linked tag names with no definition in this document, minus known false positives. */
    public Set<String> unresolvedTaglinks() {
        Set<String> unresolved = new LinkedHashSet<>();
        for (String name : taglinks) {
            if (!tags.contains(name) && !TextRules.ignoreInvalid(name)) {
                unresolved.add(name);
            }
        }
        return unresolved;
    }

    public IssueList toIssues() {
        IssueList issues = new IssueList();
        for (String text : parseErrors) {
            issues.add(
                    new Issue(
                            IssueType.PARSE_ERROR_RENDERED,
                            IssueSeverity.WARNING,
                            IssueLocation.atText(text),
                            "Rendered as an error marker"));
        }
        for (String line : noiseLines) {
            issues.add(
                    new Issue(
                            IssueType.NOISE_LINE,
                            IssueSeverity.INFO,
                            IssueLocation.atText(line),
                            "Suppressed boilerplate line"));
        }
        for (String name : unresolvedTaglinks()) {
            issues.add(
                    new Issue(
                            IssueType.UNRESOLVED_TAGLINK,
                            IssueSeverity.INFO,
                            IssueLocation.atText(name),
                            "No tag named '" + name + "' in this file"));
        }
        return issues;
    }

    @Override
    public String toString() {
        return "RenderStats{tags="
                + tags.size()
                + ", taglinks="
                + taglinks.size()
                + ", parseErrors="
                + parseErrors.size()
                + ", noiseLines="
                + noiseLines.size()
                + "}";
    }
}
