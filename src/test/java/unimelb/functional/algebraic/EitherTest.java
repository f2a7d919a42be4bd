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

import org.junit.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.junit.Assert.*;

public class EitherTest {

    @Test
    public void basicTest() {
        Either<String, Integer> left = Either.left("a");
        assertTrue(left.isLeft());
        assertFalse(left.isRight());
        assertEquals("a", left.getLeft());
        assertThrows(IllegalStateException.class, left::get);

        Either<String, Integer> right = Either.right(1);
        assertTrue(right.isRight());
        assertEquals(Integer.valueOf(1), right.get());
        assertThrows(IllegalStateException.class, right::getLeft);
    }

    @Test
    public void matchTest() {
        Either<String, Integer> left = Either.left("abc");
        Either<String, Integer> right = Either.right(5);
        assertEquals(Integer.valueOf(3), left.matchThen(String::length, i -> i));
        assertEquals(Integer.valueOf(5), right.matchThen(String::length, i -> i));

        List<Object> seen = new ArrayList<>();
        left.match(seen::add, seen::add);
        right.ifLeft(seen::add);
        right.ifRight(seen::add);
        assertEquals(List.of("abc", 5), seen);
    }

    @Test
    public void fromLeftFromRightTest() {
        assertEquals("a", Either.<String, Integer>left("a").fromLeft("b"));
        assertEquals("b", Either.<String, Integer>right(1).fromLeft("b"));
        assertEquals(Integer.valueOf(1), Either.<String, Integer>right(1).fromRight(2));
        assertEquals(Integer.valueOf(2), Either.<String, Integer>left("a").fromRight(2));
    }

    @Test
    public void mapTest() {
        assertEquals(Either.right(2), Either.<String, Integer>right(1).map(i -> i + 1));
        assertEquals(Either.left("a"), Either.<String, Integer>left("a").map(i -> i + 1));
        assertEquals(Either.left(1), Either.<String, Integer>left("a").mapLeft(String::length));
        assertEquals(Either.left(1), Either.<String, Integer>left("a").bimap(String::length, i -> i * 10));
        assertEquals(Either.right(10), Either.<String, Integer>right(1).bimap(String::length, i -> i * 10));
    }

    @Test
    public void flatMapTest() {
        assertEquals(Either.right("1"), Either.<String, Integer>right(1).flatMap(i -> Either.right(String.valueOf(i))));
        assertEquals(Either.left("no"), Either.<String, Integer>right(1).flatMap(i -> Either.left("no")));
        assertEquals(Either.left("a"), Either.<String, Integer>left("a").flatMap(i -> Either.right(i)));
    }

    @Test
    public void swapTest() {
        assertEquals(Either.right("a"), Either.<String, Integer>left("a").swap());
        assertEquals(Either.left(1), Either.<String, Integer>right(1).swap());
    }

    @Test
    public void conversionsTest() {
        assertEquals(Optional.of(1), Either.<String, Integer>right(1).toOptional());
        assertEquals(Optional.empty(), Either.<String, Integer>right(null).toOptional());
        assertEquals(Optional.empty(), Either.<String, Integer>left("a").toOptional());

        assertEquals(Try.success(1), Either.<String, Integer>right(1).toTry(IOException::new));
        Try<Integer> failed = Either.<String, Integer>left("io").toTry(IOException::new);
        assertTrue(failed.getError() instanceof IOException);
        assertEquals("io", failed.getError().getMessage());

        assertEquals(Validation.valid(1), Either.<String, Integer>right(1).toValidation());
        assertEquals(List.of("a"), Either.<String, Integer>left("a").toValidation().getErrors());
    }

    @Test
    public void equalityTest() {
        assertEquals(Either.left("a"), Either.left("a"));
        assertEquals(Either.right("a").hashCode(), Either.right("a").hashCode());
        assertNotEquals(Either.left("a"), Either.right("a"));
        assertEquals("Either.left(a)", Either.left("a").toString());
    }

    @Test
    public void apTest() {
        Either<String, Integer> one = Either.right(1);
        Either<String, Integer> two = Either.right(2);
        Either<String, Integer> a = Either.left("a");
        Either<String, Integer> b = Either.left("b");

        assertEquals(Either.right(3), one.ap(two, String::concat, Integer::sum));
        assertSame(a, one.ap(a, String::concat, Integer::sum));
        assertSame(a, a.ap(one, String::concat, Integer::sum));
        assertEquals(Either.left("ab"), a.ap(b, String::concat, Integer::sum));
        assertSame(one, one.ap(null, String::concat, Integer::sum));

        // a mapper is only required for the case that uses it
        assertEquals(Either.right(3), one.ap(two, null, Integer::sum));
        assertEquals(Either.left("ab"), a.ap(b, String::concat, null));
        assertThrows(IllegalArgumentException.class, () -> one.ap(two, String::concat, null));
        assertThrows(IllegalArgumentException.class, () -> a.ap(b, null, Integer::sum));
    }

    @Test
    public void apMapperExceptionPropagatesTest() {
        Either<String, Integer> one = Either.right(1);
        IllegalStateException thrown = assertThrows(IllegalStateException.class,
                () -> one.ap(one, String::concat, (x, y) -> {
                    throw new IllegalStateException("merge");
                }));
        assertEquals("merge", thrown.getMessage());
    }

    @Test
    public void combineTest() {
        List<Either<String, Integer>> rights = Arrays.asList(
                Either.right(1), null, Either.right(2), Either.right(3));
        assertEquals(Either.right(6), Either.combine(String::concat, Integer::sum, rights));

        List<Either<String, Integer>> mixed = Arrays.asList(
                Either.right(1), Either.left("a"), Either.right(2), Either.left("b"));
        assertEquals(Either.left("ab"), Either.combine(String::concat, Integer::sum, mixed));
        assertEquals(Either.right(null), Either.<String, Integer>combine(String::concat, Integer::sum, null));
        assertEquals(Either.right(null), Either.<String, Integer>combine(String::concat, Integer::sum, List.of()));
    }

    @Test
    public void combineGetFirstLeftTest() {
        AtomicInteger calls = new AtomicInteger();
        List<Supplier<Either<String, Integer>>> suppliers = Arrays.asList(
                () -> { calls.incrementAndGet(); return Either.right(1); },
                () -> { calls.incrementAndGet(); return null; },
                () -> { calls.incrementAndGet(); return Either.left("first"); },
                () -> { calls.incrementAndGet(); return Either.left("second"); });
        assertEquals(Either.left("first"), Either.combineGetFirstLeft(Integer::sum, suppliers));
        assertEquals(3, calls.get());

        List<Supplier<Either<String, Integer>>> rights = Arrays.asList(
                () -> Either.right(1),
                () -> Either.right(2));
        assertEquals(Either.right(3), Either.combineGetFirstLeft(Integer::sum, rights));

        assertEquals(Either.right(null), Either.<String, Integer>combineGetFirstLeft(Integer::sum, null));
        assertEquals(Either.right(null), Either.<String, Integer>combineGetFirstLeft(Integer::sum, List.of()));

        List<Supplier<Either<String, Integer>>> withNull = Arrays.asList(() -> Either.right(1), null);
        assertThrows(IllegalArgumentException.class, () -> Either.combineGetFirstLeft(Integer::sum, withNull));
    }

    @Test
    public void containAndIsEmptyTest() {
        assertTrue(Either.<String, Integer>right(1).contain(1));
        assertFalse(Either.<String, Integer>right(1).contain(2));
        assertFalse(Either.<String, String>left("a").contain("a"));
        assertTrue(Either.<String, Integer>right(null).contain(null));

        assertFalse(Either.<String, Integer>right(1).isEmpty());
        assertTrue(Either.<String, Integer>right(null).isEmpty());
        assertTrue(Either.<String, Integer>left("a").isEmpty());
    }

    @Test
    public void filterTest() {
        Either<String, Integer> one = Either.right(1);
        Either<String, Integer> a = Either.left("a");

        assertSame(one, one.filter(i -> i > 0));
        assertNull(one.filter(i -> i > 1));
        assertSame(one, one.filter(null));
        assertSame(a, a.filter(i -> false));

        assertEquals(Optional.of(one), one.filterOptional(i -> i > 0));
        assertTrue(one.filterOptional(i -> i > 1).isEmpty());
    }

    @Test
    public void filterOrElseTest() {
        Either<String, Integer> one = Either.right(1);
        Either<String, Integer> a = Either.left("a");

        assertSame(one, one.filterOrElse(i -> i > 0, () -> "negative"));
        assertEquals(Either.left("too small"), one.filterOrElse(i -> i > 1, () -> "too small"));
        assertSame(one, one.filterOrElse(null, () -> "unused"));
        assertSame(a, a.filterOrElse(i -> false, () -> "unused"));

        // zero is only required when the predicate fails
        assertSame(one, one.filterOrElse(i -> true, null));
        assertThrows(IllegalArgumentException.class, () -> one.filterOrElse(i -> false, null));
    }

    @Test
    public void getOrElseTest() {
        assertEquals(Integer.valueOf(1), Either.<String, Integer>right(1).getOrElse(2));
        assertEquals(Integer.valueOf(2), Either.<String, Integer>left("a").getOrElse(2));
        assertNull(Either.<String, Integer>left("a").getOrElse((Integer) null));

        AtomicInteger calls = new AtomicInteger();
        Supplier<Integer> other = () -> calls.incrementAndGet() + 10;
        assertEquals(Integer.valueOf(1), Either.<String, Integer>right(1).getOrElse(other));
        assertEquals(0, calls.get());
        assertEquals(Integer.valueOf(11), Either.<String, Integer>left("a").getOrElse(other));
        assertEquals(1, calls.get());
    }

    @Test
    public void orElseTest() {
        Either<String, Integer> one = Either.right(1);
        Either<String, Integer> two = Either.right(2);
        Either<String, Integer> a = Either.left("a");

        assertSame(one, one.orElse(two));
        assertSame(two, a.orElse(two));
        assertThrows(IllegalArgumentException.class, () -> a.orElse((Either<String, Integer>) null));

        AtomicInteger calls = new AtomicInteger();
        Supplier<Either<String, Integer>> lazy = () -> {
            calls.incrementAndGet();
            return two;
        };
        assertSame(one, one.orElse(lazy));
        assertEquals(0, calls.get());
        assertEquals(two, a.orElse(lazy));
        assertEquals(1, calls.get());
    }
}
