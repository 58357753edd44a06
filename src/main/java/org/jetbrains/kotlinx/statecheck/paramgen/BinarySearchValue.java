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
package org.jetbrains.kotlinx.statecheck.paramgen;

/**
 * Shrinks an integral value toward the {@code target} by binary search.
 * <p>
 * The search keeps two bounds: {@code accepted} is the last value known to fail
 * and {@code lowest} is the closest to the target value that has not been ruled out yet.
 * Every {@link #simplify()} proposes the middle between them, every {@link #complicate()}
 * reverts to {@code accepted} and rules the proposed value out.
 * Both bounds are always on the same side of the target, so the arithmetic never overflows.
 */
public class BinarySearchValue implements ShrinkableValue<Long> {
    private long lowest;
    private long accepted;
    private long current;

    public BinarySearchValue(long value, long target) {
        this.lowest = target;
        this.accepted = value;
        this.current = value;
    }

    /**
     * Creates a value which shrinks toward the point of {@code [min; max]} closest to zero.
     */
    public static BinarySearchValue inRange(long value, long min, long max) {
        if (value < min || value > max)
            throw new IllegalArgumentException("Value " + value + " is out of range [" + min + "; " + max + "]");
        long target = min > 0 ? min : (max < 0 ? max : 0);
        return new BinarySearchValue(value, target);
    }

    @Override
    public Long current() {
        return current;
    }

    @Override
    public boolean simplify() {
        accepted = current;
        if (accepted == lowest)
            return false;
        current = lowest + (accepted - lowest) / 2;
        return true;
    }

    @Override
    public boolean complicate() {
        if (current == accepted)
            return false;
        lowest = current + (accepted > current ? 1 : -1);
        current = accepted;
        return true;
    }

    @Override
    public String toString() {
        return "BinarySearchValue{current=" + current + ", lowest=" + lowest + ", accepted=" + accepted + "}";
    }
}
