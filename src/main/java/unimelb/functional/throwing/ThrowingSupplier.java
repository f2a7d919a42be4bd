/*
 * Copyright 2019 Zoey Hewll
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */

package unimelb.functional.throwing;

import unimelb.functional.util.Throwables;

import java.util.function.Supplier;

/**
 * A zero-argument computation which may throw a checked exception.
 *
 * @param <T> the type of the supplied value
 * @param <E> the type of exception which may be thrown
 */
@FunctionalInterface
public interface ThrowingSupplier<T, E extends Throwable>
{
    /**
     * Gets a result.
     *
     * @return a result
     * @throws E if the operation throws an exception
     */
    T get() throws E;

    /**
     * Returns a plain {@link Supplier} which relays any exception thrown by this operation unchanged,
     * without declaring it.
     *
     * @return an unchecked view of this operation
     */
    default Supplier<T> unchecked()
    {
        return () ->
        {
            try
            {
                return get();
            }
            catch (Throwable t)
            {
                return Throwables.sneakyThrow(t);
            }
        };
    }
}
