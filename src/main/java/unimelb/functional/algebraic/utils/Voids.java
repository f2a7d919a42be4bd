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

package unimelb.functional.algebraic.utils;

import unimelb.functional.throwing.ThrowingConsumer;
import unimelb.functional.throwing.ThrowingFunction;
import unimelb.functional.throwing.ThrowingRunnable;
import unimelb.functional.throwing.ThrowingSupplier;

public final class Voids
{
    private Voids() {}

    /**
     * Turns a consumer into an equivalent function returning {@code Void} (always null).
     *
     * @param f   The consumer to convert
     * @param <T> The parameter type of the consumer
     * @param <E> The exception type of the consumer
     * @return An equivalent function that returns Void instead of void
     */
    public static <T, E extends Throwable> ThrowingFunction<T, Void, E> convertUnsafe(ThrowingConsumer<T, E> f)
    {
        return f.andThen(() -> null);
    }

    /**
     * Turns an action into an equivalent supplier of {@code Void} (always null).
     *
     * @param f   The action to convert
     * @param <E> The exception type of the action
     * @return An equivalent supplier that returns Void instead of void
     */
    public static <E extends Throwable> ThrowingSupplier<Void, E> convertUnsafe(ThrowingRunnable<E> f)
    {
        return f.andThen(() -> null);
    }
}
