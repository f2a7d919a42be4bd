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

import org.junit.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.function.Supplier;

import static org.junit.Assert.*;

public class ThrowingFunctionsTest {

    @Test
    public void supplierUncheckedTest() {
        ThrowingSupplier<String, IOException> ok = () -> "a";
        assertEquals("a", ok.unchecked().get());

        IOException io = new IOException("io");
        ThrowingSupplier<String, IOException> failing = () -> { throw io; };
        Supplier<String> unchecked = failing.unchecked();
        Exception thrown = assertThrows(IOException.class, unchecked::get);
        assertSame(io, thrown);
    }

    @Test
    public void functionAndThenTest() throws IOException {
        ThrowingFunction<String, Integer, IOException> length = String::length;
        ThrowingFunction<String, String, IOException> composed = length.andThen(i -> "length " + i);
        assertEquals("length 3", composed.apply("abc"));
        assertThrows(IllegalArgumentException.class, () -> length.andThen(null));
    }

    @Test
    public void functionUncheckedTest() {
        ThrowingFunction<String, Integer, IOException> failing = s -> { throw new IOException(s); };
        Function<String, Integer> unchecked = failing.unchecked();
        IOException thrown = assertThrows(IOException.class, () -> unchecked.apply("io"));
        assertEquals("io", thrown.getMessage());
    }

    @Test
    public void runnableAndThenTest() throws Exception {
        List<String> seen = new ArrayList<>();
        ThrowingRunnable<Exception> action = () -> seen.add("run");
        ThrowingSupplier<String, Exception> supplier = action.andThen(() -> "done");
        assertEquals("done", supplier.get());
        assertEquals(List.of("run"), seen);
    }

    @Test
    public void consumerAndThenTest() throws Exception {
        List<String> seen = new ArrayList<>();
        ThrowingConsumer<String, Exception> add = seen::add;
        ThrowingFunction<String, Integer, Exception> function = add.andThen(() -> seen.size());
        assertEquals(Integer.valueOf(1), function.apply("a"));
        assertEquals(List.of("a"), seen);
    }
}
