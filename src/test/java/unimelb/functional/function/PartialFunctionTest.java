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

package unimelb.functional.function;

import org.junit.Test;
import unimelb.functional.algebraic.Optional;

import java.util.AbstractMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.junit.Assert.*;

public class PartialFunctionTest {

    private static final PartialFunction<Integer, Integer> HALF = PartialFunction.of(i -> i % 2 == 0, i -> i / 2);
    private static final PartialFunction<Integer, String> NEGATIVE = PartialFunction.of(i -> i < 0, i -> "negative " + i);

    @Test
    public void ofTest() {
        assertTrue(HALF.isDefinedAt(4));
        assertFalse(HALF.isDefinedAt(3));
        assertEquals(Integer.valueOf(2), HALF.apply(4));
        assertTrue(HALF.getVerifier().test(2));
        assertEquals(Integer.valueOf(5), HALF.getMapper().apply(10));
    }

    @Test
    public void ofWithoutVerifierIsTotalTest() {
        PartialFunction<String, Integer> length = PartialFunction.of(null, String::length);
        assertTrue(length.isDefinedAt("a"));
        assertTrue(length.isDefinedAt(null));
        assertEquals(Integer.valueOf(3), length.apply("abc"));
    }

    @Test
    public void ofRejectsNullMapperTest() {
        assertThrows(IllegalArgumentException.class, () -> PartialFunction.<Integer, Integer>of(i -> true, null));
    }

    @Test
    public void applyIgnoresDomainTest() {
        assertEquals(Integer.valueOf(1), HALF.apply(3));
    }

    @Test
    public void applyOrElseTest() {
        assertEquals(Integer.valueOf(2), HALF.applyOrElse(4, i -> -1));
        assertEquals(Integer.valueOf(-1), HALF.applyOrElse(3, i -> -1));
        // the default is only required outside the domain
        assertEquals(Integer.valueOf(2), HALF.applyOrElse(4, null));
        assertThrows(IllegalArgumentException.class, () -> HALF.applyOrElse(3, null));
    }

    @Test
    public void identityTest() {
        PartialFunction<String, String> identity = PartialFunction.identity();
        assertTrue(identity.isDefinedAt("a"));
        assertEquals("a", identity.apply("a"));
        assertNull(identity.apply(null));
    }

    @Test
    public void ofToEntryTest() {
        PartialFunction<String, Map.Entry<Character, Integer>> entry =
                PartialFunction.ofToEntry(s -> !s.isEmpty(), s -> s.charAt(0), String::length);
        assertFalse(entry.isDefinedAt(""));
        assertEquals(new AbstractMap.SimpleImmutableEntry<>('a', 3), entry.apply("abc"));

        PartialFunction<String, Map.Entry<String, String>> nullValue = PartialFunction.ofToEntry(null, s -> s, s -> null);
        assertNull(nullValue.apply("k").getValue());
    }

    @Test
    public void andThenTotalFunctionTest() {
        Function<Integer, String> show = i -> "value " + i;
        PartialFunction<Integer, String> composed = HALF.andThen(show);
        assertTrue(composed.isDefinedAt(6));
        assertFalse(composed.isDefinedAt(5));
        assertEquals("value 3", composed.apply(6));
    }

    @Test
    public void andThenPartialFunctionTest() {
        PartialFunction<Integer, Integer> quarter = HALF.andThen(HALF);
        assertTrue(quarter.isDefinedAt(4));
        assertFalse(quarter.isDefinedAt(6));
        assertFalse(quarter.isDefinedAt(3));
        assertEquals(Integer.valueOf(1), quarter.apply(4));
    }

    @Test
    public void andThenDoesNotApplyOutsideFirstDomainTest() {
        AtomicInteger calls = new AtomicInteger();
        PartialFunction<Integer, Integer> counted = PartialFunction.of(i -> i > 0, i -> calls.incrementAndGet());
        PartialFunction<Integer, Integer> composed = counted.andThen(HALF);
        assertFalse(composed.isDefinedAt(-1));
        assertEquals(0, calls.get());
    }

    @Test
    public void composeTotalFunctionTest() {
        Function<String, Integer> length = String::length;
        PartialFunction<String, Integer> composed = HALF.compose(length);
        assertTrue(composed.isDefinedAt("ab"));
        assertFalse(composed.isDefinedAt("abc"));
        assertEquals(Integer.valueOf(2), composed.apply("abcd"));
    }

    @Test
    public void composePartialFunctionTest() {
        PartialFunction<String, Integer> parse = PartialFunction.of(s -> s.matches("-?\\d+"), Integer::parseInt);
        PartialFunction<String, Integer> composed = HALF.compose(parse);
        assertTrue(composed.isDefinedAt("8"));
        assertFalse(composed.isDefinedAt("7"));
        assertFalse(composed.isDefinedAt("x"));
        assertEquals(Integer.valueOf(4), composed.apply("8"));
    }

    @Test
    public void orElseTest() {
        PartialFunction<Integer, String> even = HALF.andThen((Integer i) -> "half " + i);
        PartialFunction<Integer, String> both = even.orElse(NEGATIVE);
        assertTrue(both.isDefinedAt(4));
        assertTrue(both.isDefinedAt(-3));
        assertFalse(both.isDefinedAt(3));
        assertEquals("half 2", both.apply(4));
        assertEquals("negative -3", both.apply(-3));
        // left-biased where the domains overlap
        assertEquals("half -2", both.apply(-4));
    }

    @Test
    public void orElseNullTest() {
        PartialFunction<Integer, Integer> same = HALF.orElse(null);
        assertNotSame(HALF, same);
        assertTrue(same.isDefinedAt(2));
        assertFalse(same.isDefinedAt(3));
        assertEquals(Integer.valueOf(1), same.apply(2));
    }

    @Test
    public void liftTest() {
        Function<Integer, Optional<Integer>> lifted = HALF.lift();
        assertEquals(Optional.of(2), lifted.apply(4));
        assertEquals(Optional.empty(), lifted.apply(3));

        Function<Integer, Optional<Object>> nullResult = PartialFunction.<Integer, Object>of(null, i -> null).lift();
        assertEquals(Optional.empty(), nullResult.apply(1));
    }

    @Test
    public void nullArgumentsTest() {
        assertThrows(IllegalArgumentException.class, () -> HALF.andThen((Function<Integer, Integer>) null));
        assertThrows(IllegalArgumentException.class, () -> HALF.andThen((PartialFunction<Integer, Integer>) null));
        assertThrows(IllegalArgumentException.class, () -> HALF.compose((Function<Integer, Integer>) null));
        assertThrows(IllegalArgumentException.class, () -> HALF.compose((PartialFunction<Integer, Integer>) null));
    }
}
