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
package org.jetbrains.kotlinx.statecheck;

/**
 * Thrown by {@link StateMachine#postcondition} when the result of the system under test
 * differs from the one the model expects.
 */
public class PostconditionException extends CommandExecutionException {
    private final String expected;
    private final String actual;

    public PostconditionException(Object command, Object expected, Object actual) {
        super(String.valueOf(command),
            "Postcondition does not hold. Command: " + command + ". Expected result: " + expected +
                ". Actual result: " + actual,
            null);
        this.expected = String.valueOf(expected);
        this.actual = String.valueOf(actual);
    }

    public String getExpected() {
        return expected;
    }

    public String getActual() {
        return actual;
    }
}
