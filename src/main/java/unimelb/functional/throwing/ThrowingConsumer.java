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

import unimelb.functional.util.AssertUtil;

@FunctionalInterface
public interface ThrowingConsumer<T, E extends Throwable>
{
    /**
     * Performs this operation on the given argument.
     *
     * @param t the input argument
     * @throws E if the operation throws an exception
     */
    void accept(T t) throws E;

    /**
     * Returns a function that first performs this operation on its input,
     * and then returns the value supplied by {@code after}.
     *
     * @param <R>   the type of output of {@code after}
     * @param after the supplier to use after this operation
     * @return a {@code ThrowingFunction} that performs this operation followed by {@code after}
     * @throws IllegalArgumentException if {@code after} is null
     */
    default <R> ThrowingFunction<T, R, E> andThen(ThrowingSupplier<? extends R, ? extends E> after)
    {
        AssertUtil.notNull(after, "after must be not null");
        return (T t) ->
        {
            this.accept(t);
            return after.get();
        };
    }
}
