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

import static org.junit.jupiter.api.Assertions.*;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.util.List;
import java.util.Map;
import net.boyechko.vimdoc.syntax.Point;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class IssueListTest {

    private static IssueList sampleIssues() {
        IssueList issues = new IssueList();
        issues.add(
                new Issue(
                        IssueType.INVALID_NODE,
                        IssueSeverity.WARNING,
                        new IssueLocation.AtNode("ERROR", new Point(0, 4), new Point(0, 8)),
                        "(ERROR (word))"));
        issues.add(
                new Issue(
                        IssueType.UNRESOLVED_TAGLINK,
                        IssueSeverity.INFO,
                        IssueLocation.atText("foo"),
                        "No tag named 'foo' in this file"));
        issues.add(new Issue(IssueType.INVALID_NODE, IssueSeverity.ERROR, "(ERROR)"));
        return issues;
    }

    @Test
    void filtersByTypeAndSeverity() {
        IssueList issues = sampleIssues();

        assertEquals(2, issues.ofType(IssueType.INVALID_NODE).size());
        assertEquals(0, issues.ofType(IssueType.NOISE_LINE).size());
        assertEquals(2, issues.atLeast(IssueSeverity.WARNING).size());
        assertEquals(3, issues.atLeast(IssueSeverity.INFO).size());
        assertTrue(issues.hasErrors());
        assertFalse(issues.ofType(IssueType.UNRESOLVED_TAGLINK).hasErrors());
    }

    @Test
    void countsAndSummarizesByType() {
        IssueList issues = sampleIssues();

        assertEquals(
                Map.of(IssueType.INVALID_NODE, 2, IssueType.UNRESOLVED_TAGLINK, 1),
                issues.countByType());
        assertEquals(
                "2 error nodes in the syntax tree\n1 links to tags not defined in the file",
                issues.summary());
        assertEquals("", new IssueList().summary());
    }

    @Test
    void describesWhereIssuesWereFound() {
        IssueList issues = sampleIssues();

        assertEquals("ERROR @ (0, 4)", issues.get(0).where().toString());
        assertEquals("\"foo\"", issues.get(1).where().toString());
        assertEquals("(document)", issues.get(2).where().toString());
        assertEquals(
                "WARNING INVALID_NODE ERROR @ (0, 4): (ERROR (word))", issues.get(0).toString());
    }

    @Test
    void copyConstructorToleratesNull() {
        assertTrue(new IssueList(null).isEmpty());
        assertEquals(3, new IssueList(sampleIssues()).size());
    }

    @Test
    void reportersCanBeChained() {
        IssueList first = new IssueList();
        IssueList second = new IssueList();
        IssueReporter reporter =
                IssueReporter.collecting(first)
                        .andThen(IssueReporter.ignoring())
                        .andThen(IssueReporter.collecting(second));

        for (Issue issue : sampleIssues()) {
            reporter.report(issue);
        }

        assertEquals(3, first.size());
        assertEquals(3, second.size());
        assertSame(first.get(0), second.get(0));
    }

    @Test
    void loggingReporterLogsInformationalIssuesAtInfo() {
        Logger logger = (Logger) LoggerFactory.getLogger(IssueReporter.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        try {
            IssueReporter reporter = IssueReporter.logging();
            sampleIssues().forEach(reporter::report);
        } finally {
            logger.detachAppender(appender);
        }

        List<Level> levels = appender.list.stream().map(ILoggingEvent::getLevel).toList();
        assertEquals(List.of(Level.WARN, Level.INFO, Level.WARN), levels);
        assertEquals(
                "Encountered invalid node @ ERROR @ (0, 4): (ERROR (word))",
                appender.list.get(0).getFormattedMessage());
    }
}
