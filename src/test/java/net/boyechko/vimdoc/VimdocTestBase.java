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
package net.boyechko.vimdoc;

import net.boyechko.vimdoc.issues.IssueList;
import net.boyechko.vimdoc.issues.IssueReporter;
import net.boyechko.vimdoc.syntax.ParseTreeReadException;
import net.boyechko.vimdoc.syntax.ParseTreeReader;
import net.boyechko.vimdoc.syntax.SourceText;
import net.boyechko.vimdoc.syntax.SyntaxTree;
import net.boyechko.vimdoc.syntax.TreeNode;
import org.junit.jupiter.api.BeforeEach;

/** Base for tests that need syntax trees of small help files. */
public abstract class VimdocTestBase {

    // ── Fixtures ────────────────────────────────────────────────────

    protected static final String HELLO_SOURCE = "hello world\n";

    protected static final String HELLO_DUMP =
            """
            (help_file [0, 0] - [1, 0]
              (block [0, 0] - [1, 0]
                (line [0, 0] - [1, 0]
                  (word [0, 0] - [0, 5])
                  (word [0, 6] - [0, 11]))))
            """;

    protected static final String HELLO_HTML = "<div class=\"help-para\">\nhello world\n\n</div>\n";

    /** A code block with a language: {@code >lua}, one line of code, then {@code <}. */
    protected static final String CODEBLOCK_SOURCE = ">lua\n    x = 1\n<\n";

    protected static final String CODEBLOCK_DUMP =
            """
            (help_file [0, 0] - [3, 0]
              (block [0, 0] - [3, 0]
                (line [0, 0] - [3, 0]
                  (codeblock [0, 0] - [3, 0]
                    (">" [0, 0] - [0, 1])
                    (language [0, 1] - [0, 4])
                    (code [1, 0] - [2, 0]
                      (line [1, 0] - [2, 0]))
                    ("<" [2, 0] - [2, 1])))))
            """;

    /** A heading with a tag: {@code INTRO  *intro*}. */
    protected static final String HEADING_SOURCE = "INTRO  *intro*\n";

    protected static final String HEADING_DUMP =
            """
            (help_file [0, 0] - [1, 0]
              (block [0, 0] - [1, 0]
                (line [0, 0] - [1, 0]
                  (h3 [0, 0] - [0, 14]
                    name: (uppercase_name [0, 0] - [0, 5])
                    (tag [0, 7] - [0, 14]
                      ("*" [0, 7] - [0, 8])
                      text: (word [0, 8] - [0, 13])
                      ("*" [0, 13] - [0, 14]))))))
            """;

    // ── Issue collection ────────────────────────────────────────────

    protected IssueList issues;

    @BeforeEach
    protected void resetIssues() {
        issues = new IssueList();
    }

    protected final IssueReporter collectIssues() {
        return IssueReporter.collecting(issues);
    }

    // ── Tree construction ───────────────────────────────────────────

    /** Reads a parse-tree dump over the source; fails the test on a malformed dump. */
    protected static SyntaxTree parse(String source, String dump) {
        try {
            return ParseTreeReader.read(dump, source);
        } catch (ParseTreeReadException e) {
            throw new IllegalStateException("Malformed test dump: " + e.getMessage(), e);
        }
    }

    protected static SyntaxTree tree(String source, TreeNode.Builder root) {
        SourceText text = SourceText.of(source);
        return new SyntaxTree(text, root.build(text));
    }

    protected static TreeNode.Builder named(String kind, int start, int end) {
        return TreeNode.named(kind).span(start, end);
    }

    protected static TreeNode.Builder word(int start, int end) {
        return named("word", start, end);
    }

    /** Wraps lines into {@code help_file > block} spanning the whole source. */
    protected static TreeNode.Builder document(String source, TreeNode.Builder... blockChildren) {
        TreeNode.Builder block = named("block", 0, source.length());
        for (TreeNode.Builder child : blockChildren) {
            block.child(child);
        }
        return named("help_file", 0, source.length()).child(block);
    }
}
