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
import unimelb.functional.util.Throwables;

import java.util.function.Function;

/**
 * A one-argument function which may throw a checked exception.
 *
 * @param <T> the type of the argument
 * @param <R> the type of the result
 * @param <E> the type of exception which may be thrown
 */
@FunctionalInterface
public interface ThrowingFunction<T, R, E extends Throwable>
{
    /**
     * Applies this function to the given argument.
     *
     * @param t the function argument
     * @return the function result
     * @throws E if the function throws an exception
     */
    R apply(T t) throws E;

    /**
     * Returns a composed function that first applies this function to
     * its input, and then applies the {@code after} function to the result.
     * If evaluation of either function throws an exception, it is relayed to
     * the caller of the composed function.
     *
     * @param <V>   the type of output of the {@code after} function
     * @param after the function to apply after this function is applied
     * @return the composed function
     * @throws IllegalArgumentException if after is null
     */
    default <V> ThrowingFunction<T, V, E> andThen(ThrowingFunction<? super R, ? extends V, ? extends E> after)
    {
        AssertUtil.notNull(after, "after must be not null");
        return (T t) -> after.apply(this.apply(t));
    }

    /**
     * Returns a plain {@link Function} which relays any exception thrown by this function unchanged,
     * without declaring it.
     *
     * @return an unchecked view of this function
     */
    default Function<T, R> unchecked()
    {
        return (T t) ->
        {
            try
            {
                return apply(t);
            }
            catch (Throwable ex)
            {
                return Throwables.sneakyThrow(ex);
            }
        };
    }
}
