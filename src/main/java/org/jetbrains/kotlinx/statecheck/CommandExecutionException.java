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
 * Failure of a single command in an executed sequence.
 * It is either a {@link PostconditionException} or a {@link SystemUnderTestException}.
 */
public abstract class CommandExecutionException extends Exception {
    private final String command;

    protected CommandExecutionException(String command, String message, Throwable cause) {
        super(message, cause);
        this.command = command;
    }

    /**
     * The string representation of the failed command.
     */
    public String getCommand() {
        return command;
    }
}
