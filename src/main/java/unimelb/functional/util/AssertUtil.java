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

package unimelb.functional.util;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.Nullable;

/**
 * Argument checks shared by the algebraic types.
 */
public final class AssertUtil
{
    private static final String DEFAULT_MESSAGE = "The given value must be not null";

    // private constructor to prevent initialization
    private AssertUtil() {}

    /**
     * Ensures the given value is not null.
     *
     * @param value the value to check
     * @param <T>   the type of the value
     * @return the value itself
     * @throws IllegalArgumentException if the value is null
     */
    @Contract("null -> fail; !null -> param1")
    public static <T> T notNull(@Nullable T value)
    {
        return notNull(value, DEFAULT_MESSAGE);
    }

    /**
     * Ensures the given value is not null, failing with the given message otherwise.
     *
     * @param value   the value to check
     * @param message the message of the raised exception
     * @param <T>     the type of the value
     * @return the value itself
     * @throws IllegalArgumentException if the value is null
     */
    @Contract("null, _ -> fail; !null, _ -> param1")
    public static <T> T notNull(@Nullable T value, String message)
    {
        if (value == null)
        {
            throw new IllegalArgumentException(message);
        }
        return value;
    }
}
