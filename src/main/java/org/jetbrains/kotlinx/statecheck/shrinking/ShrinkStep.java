/*-
 * #%L
 * Statecheck
 * %%
 * Copyright (C) 2019 - 2020 JetBrains s.r.o.
 * %%
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 * 
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * #L%
 */
package org.jetbrains.kotlinx.statecheck.shrinking;

/**
 * A position of the sequence shrinking search.
 */
final class ShrinkStep {
    enum Kind {
        /**
         * Exclude the command at {@code index} from the sequence.
         */
        DELETE_COMMAND,
        /**
         * Simplify the arguments of the command at {@code index}.
         */
        SHRINK_COMMAND
    }

    final Kind kind;
    final int index;

    private ShrinkStep(Kind kind, int index) {
        this.kind = kind;
        this.index = index;
    }

    static ShrinkStep deleteCommand(int index) {
        return new ShrinkStep(Kind.DELETE_COMMAND, index);
    }

    static ShrinkStep shrinkCommand(int index) {
        return new ShrinkStep(Kind.SHRINK_COMMAND, index);
    }

    @Override
    public String toString() {
        return kind + "(" + index + ")";
    }
}
