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

package unimelb.functional.algebraic;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * A prioritised error message, suitable as the error type of a {@link Validation}.
 * Errors are ordered by priority; any error is greater than null.
 */
public final class ValidationError implements Comparable<ValidationError>
{
    private final int priority;
    private final String errorMessage;

    private ValidationError(int priority, String errorMessage)
    {
        this.priority = priority;
        this.errorMessage = errorMessage;
    }

    public static ValidationError of(int priority, String errorMessage)
    {
        return new ValidationError(priority, errorMessage);
    }

    public static ValidationError of(String errorMessage)
    {
        return new ValidationError(0, errorMessage);
    }

    public int getPriority()
    {
        return priority;
    }

    public String getErrorMessage()
    {
        return errorMessage;
    }

    @Override
    public int compareTo(@Nullable ValidationError other)
    {
        return Optional.ofNullable(other)
                .map((ValidationError o) -> Integer.compare(priority, o.priority))
                .getOrElse(1);
    }

    @Override
    public boolean equals(Object o)
    {
        if (o instanceof ValidationError)
        {
            ValidationError e = (ValidationError) o;
            return priority == e.priority && Objects.equals(errorMessage, e.errorMessage);
        }
        return false;
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(priority, errorMessage);
    }

    @Override
    public String toString()
    {
        return "ValidationError(" + priority + ", " + errorMessage + ')';
    }
}
