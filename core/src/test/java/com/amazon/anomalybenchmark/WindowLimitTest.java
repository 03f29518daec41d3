/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.anomalybenchmark;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.LocalDateTime;

import org.junit.jupiter.api.Test;

public class WindowLimitTest {

    private static LocalDateTime hour(int hour) {
        return LocalDateTime.of(2020, 1, 1, hour, 0);
    }

    @Test
    public void testContains() {
        WindowLimit limit = new WindowLimit(hour(2), hour(4));
        assertTrue(limit.contains(hour(2)));
        assertTrue(limit.contains(hour(3)));
        assertTrue(limit.contains(hour(4)));
        assertFalse(limit.contains(hour(1)));
        assertFalse(limit.contains(hour(5)));
    }

    @Test
    public void testOverlaps() {
        WindowLimit limit = new WindowLimit(hour(2), hour(4));
        assertTrue(limit.overlaps(new WindowLimit(hour(3), hour(6))));
        assertTrue(limit.overlaps(new WindowLimit(hour(4), hour(6))));
        assertFalse(limit.overlaps(new WindowLimit(hour(5), hour(6))));
    }

    @Test
    public void testMerge() {
        WindowLimit limit = new WindowLimit(hour(2), hour(8));
        assertEquals(new WindowLimit(hour(2), hour(10)), limit.merge(new WindowLimit(hour(5), hour(10))));
        // a window nested in its predecessor keeps the later end
        assertEquals(limit, limit.merge(new WindowLimit(hour(3), hour(4))));
    }

    @Test
    public void testInvalidLimits() {
        assertThrows(IllegalArgumentException.class, () -> new WindowLimit(hour(4), hour(2)));
        assertThrows(NullPointerException.class, () -> new WindowLimit(null, hour(2)));
        assertEquals("(2020-01-01T02:00, 2020-01-01T04:00)", new WindowLimit(hour(2), hour(4)).toString());
    }
}
