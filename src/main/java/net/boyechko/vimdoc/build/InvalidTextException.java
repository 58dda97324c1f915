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
package net.boyechko.vimdoc.build;

import java.nio.charset.CharacterCodingException;
import net.boyechko.vimdoc.syntax.Point;

/** The source bytes under a node are not valid UTF-8. */
public class InvalidTextException extends TreeBuildException {

    public InvalidTextException(Point start, CharacterCodingException cause) {
        super(start, "[@ " + start + "] Invalid UTF-8: " + cause.getMessage(), cause);
    }

    @Override
    public synchronized CharacterCodingException getCause() {
        return (CharacterCodingException) super.getCause();
    }
}
