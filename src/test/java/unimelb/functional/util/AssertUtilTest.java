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

import org.junit.Test;

import static org.junit.Assert.*;

public class AssertUtilTest {

    @Test
    public void notNullTest() {
        assertEquals("a", AssertUtil.notNull("a"));
        assertEquals("a", AssertUtil.notNull("a", "message"));
    }

    @Test
    public void nullTest() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> AssertUtil.notNull(null, "value must be not null"));
        assertEquals("value must be not null", e.getMessage());
        assertThrows(IllegalArgumentException.class, () -> AssertUtil.notNull(null));
    }
}
