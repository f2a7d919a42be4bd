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

@FunctionalInterface
public interface ThrowingRunnable<E extends Throwable>
{
    /**
     * Perform this operation.
     *
     * @throws E if the operation throws an exception
     */
    void run() throws E;

    /**
     * Returns a supplier that first performs this operation,
     * and then returns the value supplied by {@code after}.
     * If either operation throws an exception, it is relayed to the caller.
     *
     * @param <R>   the type of output of {@code after}
     * @param after the supplier to use after this operation
     * @return a {@code ThrowingSupplier} that performs this operation followed by {@code after}
     */
    default <R> ThrowingSupplier<R, E> andThen(ThrowingSupplier<? extends R, ? extends E> after)
    {
        return () ->
        {
            run();
            return after.get();
        };
    }
}
