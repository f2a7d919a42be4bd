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

package unimelb.functional.combinator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.BinaryOperator;
import java.util.function.Predicate;

public final class Combinators
{
    private Combinators() {}

    public static <A> A id(A a)
    {
        return a;
    }

    public static <A> void noop(A __) {}

    public static <A> Predicate<A> alwaysTrue()
    {
        return (A __) -> true;
    }

    /**
     * An operator which keeps its first operand and ignores the second.
     */
    public static <A> BinaryOperator<A> returnFirst()
    {
        return (A first, A __) -> first;
    }

    /**
     * An operator which keeps its second operand and ignores the first.
     */
    public static <A> BinaryOperator<A> returnLast()
    {
        return (A __, A last) -> last;
    }

    /**
     * An operator which concatenates two lists, preserving the order of both, into a new unmodifiable list.
     */
    public static <A> BinaryOperator<List<A>> concat()
    {
        return (List<A> first, List<A> second) ->
        {
            List<A> result = new ArrayList<>(first.size() + second.size());
            result.addAll(first);
            result.addAll(second);
            return Collections.unmodifiableList(result);
        };
    }
}
