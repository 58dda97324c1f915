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
package net.boyechko.vimdoc.syntax;

import static org.junit.jupiter.api.Assertions.*;

import net.boyechko.vimdoc.VimdocTestBase;
import org.junit.jupiter.api.Test;

class SyntaxTreePrinterTest extends VimdocTestBase {

    @Test
    void sexpListsNamedNodes() {
        SyntaxTree tree = parse(HELLO_SOURCE, HELLO_DUMP);

        assertEquals(
                "(help_file (block (line (word) (word))))",
                SyntaxTreePrinter.toSexp(tree.root()));
    }

    @Test
    void sexpShowsFieldNamesAndSkipsAnonymousTokens() {
        SyntaxTree tree = parse(HEADING_SOURCE, HEADING_DUMP);

        assertEquals(
                "(help_file (block (line (h3 name: (uppercase_name) (tag text: (word))))))",
                tree.root().toSexp());
    }

    @Test
    void sexpShowsMissingNodes() {
        String dump =
                """
                (line [0, 0] - [0, 3]
                  (word [0, 0] - [0, 3])
                  (MISSING word [0, 3] - [0, 3])
                  (MISSING "|" [0, 3] - [0, 3]))
                """;
        SyntaxTree tree = parse("foo", dump);

        assertEquals("(line (word) (MISSING word) (MISSING \"|\"))", tree.root().toSexp());
    }

    @Test
    void sexpOfSubtreeStaysInsideIt() {
        SyntaxTree tree = parse(HELLO_SOURCE, HELLO_DUMP);
        SyntaxNode line = tree.root().children().get(0).children().get(0);

        assertEquals("(line (word) (word))", line.toSexp());
        assertEquals("(word)", line.children().get(0).toSexp());
    }

    @Test
    void indentedTreeListsOneNodePerLine() {
        SyntaxTree tree = parse(HELLO_SOURCE, HELLO_DUMP);

        String expected =
                """
                Name: "", Kind: "help_file" [Row:0, Col:0] - [Row:1, Col:0]
                  Name: "", Kind: "block" [Row:0, Col:0] - [Row:1, Col:0]
                    Name: "", Kind: "line" [Row:0, Col:0] - [Row:1, Col:0]
                      Name: "", Kind: "word" [Row:0, Col:0] - [Row:0, Col:5]
                      Name: "", Kind: "word" [Row:0, Col:6] - [Row:0, Col:11]
                """;
        assertEquals(expected, SyntaxTreePrinter.toIndentedTreeString(tree.root(), false));
    }

    @Test
    void indentedTreeShowsAnonymousTokensOnRequest() {
        SyntaxTree tree = parse(HEADING_SOURCE, HEADING_DUMP);

        String withoutAnonymous = SyntaxTreePrinter.toIndentedTreeString(tree.root(), false);
        String withAnonymous = SyntaxTreePrinter.toIndentedTreeString(tree.root(), true);

        assertFalse(withoutAnonymous.contains("Kind: \"*\""));
        assertTrue(withAnonymous.contains("Kind: \"*\" [Row:0, Col:7] - [Row:0, Col:8]"));
        assertTrue(withAnonymous.contains("Name: \"name: \", Kind: \"uppercase_name\""));
        assertEquals(9, withAnonymous.lines().count());
    }

    @Test
    void sexpHandlesVeryDeepTrees() {
        TreeNode.Builder root = named("help_file", 0, 1);
        TreeNode.Builder current = root;
        for (int i = 0; i < 50_000; i++) {
            TreeNode.Builder next = named("block", 0, 1);
            current.child(next);
            current = next;
        }
        SyntaxTree tree = tree("x", root);

        String sexp = tree.root().toSexp();
        assertTrue(sexp.startsWith("(help_file (block (block"));
        assertTrue(sexp.endsWith(")".repeat(50_001)));
    }
}
