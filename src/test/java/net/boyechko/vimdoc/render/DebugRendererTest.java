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

import static org.junit.jupiter.api.Assertions.*;

import net.boyechko.vimdoc.VimdocTestBase;
import net.boyechko.vimdoc.syntax.TreeNode;
import org.junit.jupiter.api.Test;

class DebugRendererTest extends VimdocTestBase {

    @Test
    void dumpsOneIndentedLinePerNamedNode() {
        String expected =
                """
                Kind: "help_file" [Row:0, Col:0] - [Row:1, Col:0] = "hello worl" [trimmed]
                    Kind: "block" [Row:0, Col:0] - [Row:1, Col:0] = "hello worl" [trimmed]
                        Kind: "line" [Row:0, Col:0] - [Row:1, Col:0] = "hello worl" [trimmed]
                            Kind: "word" [Row:0, Col:0] - [Row:0, Col:5] = "hello"
                            Kind: "word" [Row:0, Col:6] - [Row:0, Col:11] = "world"\
                """;

        assertEquals(expected, new DebugRenderer().render(parse(HELLO_SOURCE, HELLO_DUMP)));
    }

    @Test
    void escapesControlCharactersInText() {
        String source = "a\n";
        String dump = new DebugRenderer().render(tree(source, named("help_file", 0, 2)));

        assertEquals("Kind: \"help_file\" [Row:0, Col:0] - [Row:1, Col:0] = \"a\\n\"", dump);
    }

    @Test
    void textOfExactlyTenBytesIsNotTrimmed() {
        String source = "0123456789";
        String dump = new DebugRenderer().render(tree(source, named("help_file", 0, 10)));

        assertEquals("Kind: \"help_file\" [Row:0, Col:0] - [Row:0, Col:10] = \"0123456789\"", dump);
    }

    @Test
    void errorNodesAreListedByKind() {
        String source = "x?";
        TreeNode.Builder root =
                named("help_file", 0, 2).child(word(0, 1)).child(TreeNode.error().span(1, 2));

        String dump = new DebugRenderer().render(tree(source, root));

        assertTrue(
                dump.endsWith("    Kind: \"ERROR\" [Row:0, Col:1] - [Row:0, Col:2] = \"?\""), dump);
        assertEquals(3, dump.lines().count());
    }
}
