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

import unimelb.functional.config.FunctionalConfiguration;

/**
 * Helpers for routing throwables caught inside wrapped computations.
 */
public final class Throwables
{
    private Throwables() {}

    @SuppressWarnings("unchecked")
    private static <E extends Throwable> void sneakyThrow0(Throwable ex) throws E
    {
        throw (E) ex;
    }

    /**
     * Raises the given throwable without declaring it, whether or not it is checked.
     * The declared return type only lets callers write {@code return sneakyThrow(e);}.
     *
     * @param ex  the throwable to raise
     * @param <T> the type the caller expects
     * @return never returns normally
     */
    public static <T> T sneakyThrow(Throwable ex)
    {
        Throwables.<RuntimeException>sneakyThrow0(ex);
        return null;
    }

    /**
     * Returns whether the throwable must never be captured into a value.
     *
     * @param t the throwable to check
     * @return true for errors the JVM cannot recover from
     */
    public static boolean isFatal(Throwable t)
    {
        return t instanceof VirtualMachineError
                || t instanceof LinkageError;
    }

    /**
     * Converts a caught throwable into an {@link Exception} that may be stored in a value.
     * Exceptions are returned unchanged; other throwables are wrapped, using the configured
     * unknown-error message. Fatal errors are re-raised.
     *
     * @param t the caught throwable
     * @return an exception representing {@code t}
     */
    public static Exception normalize(Throwable t)
    {
        AssertUtil.notNull(t, "t must be not null");
        if (isFatal(t))
        {
            return sneakyThrow(t);
        }
        if (t instanceof Exception)
        {
            return (Exception) t;
        }
        return new RuntimeException(FunctionalConfiguration.getUnknownErrorMessage() + t, t);
    }
}
