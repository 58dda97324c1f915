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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Receives issues as they are found. */
@FunctionalInterface
public interface IssueReporter {

    void report(Issue issue);

    /** Logs each issue at WARN, or INFO for informational ones. */
    static IssueReporter logging() {
        Logger logger = LoggerFactory.getLogger(IssueReporter.class);
        return issue -> {
            IssueType type = issue.type();
            if (type == IssueType.INVALID_NODE || type == IssueType.MISSING_NODE) {
                logger.warn("Encountered invalid node @ {}: {}", issue.where(), issue.message());
            } else if (issue.severity() == IssueSeverity.INFO) {
                logger.info("{} @ {}: {}", type.groupLabel(), issue.where(), issue.message());
            } else {
                logger.warn("{} @ {}: {}", type.groupLabel(), issue.where(), issue.message());
            }
        };
    }

    static IssueReporter collecting(IssueList sink) {
        return sink::add;
    }

    static IssueReporter ignoring() {
        return issue -> {};
    }

    default IssueReporter andThen(IssueReporter next) {
        return issue -> {
            report(issue);
            next.report(issue);
        };
    }
}
