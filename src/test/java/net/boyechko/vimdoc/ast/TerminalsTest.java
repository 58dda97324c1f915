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
package net.boyechko.vimdoc.ast;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import net.boyechko.vimdoc.syntax.Point;
import org.junit.jupiter.api.Test;

class TerminalsTest {

    private static Word word(String text) {
        return new Word(text, Point.ORIGIN);
    }

    @Test
    void collectsLeavesInDocumentOrder() {
        Codeblock codeblock =
                new Codeblock(
                        Optional.of(new Language("vim", Point.ORIGIN)),
                        List.of(new Line(List.of(word(":q")))));
        H3 heading =
                new H3(
                        new UppercaseName("USAGE", Point.ORIGIN),
                        List.of(new Tag(word("usage")), new Keycode("<CR>", Point.ORIGIN)));
        Line first = new Line(List.of(heading));
        Line second = new Line(List.of(word("Type"), new Taglink(word("quit")), codeblock));
        LineLi item = new LineLi(List.of(new Line(List.of(new Url(word("https://x.org"))))));
        HelpFile helpFile =
                new HelpFile(List.of(new Block(List.of(first, second)), new Block(List.of(item))));

        assertEquals(
                List.of("USAGE", "usage", "<CR>", "Type", "quit", "vim", ":q", "https://x.org"),
                Terminals.texts(helpFile));
    }

    @Test
    void nodesKeepCopiesOfTheirChildren() {
        List<LineChild> children = new ArrayList<>(List.of(word("a")));
        Line line = new Line(children);
        children.add(word("b"));

        assertEquals(1, line.children().size());
        assertThrows(UnsupportedOperationException.class, () -> line.children().add(word("c")));
    }

    @Test
    void headingRequiresName() {
        assertThrows(NullPointerException.class, () -> new H3(null, List.of()));
    }

    @Test
    void codeblockWithoutLanguageIsEmpty() {
        Codeblock codeblock = new Codeblock(null, List.of());

        assertTrue(codeblock.language().isEmpty());
    }
}
