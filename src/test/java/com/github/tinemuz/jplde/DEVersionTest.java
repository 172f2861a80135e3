/*
 * MIT License
 *
 * Copyright (c) 2025 tinemuz
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */
package com.github.tinemuz.jplde;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class DEVersionTest {

    @Test
    @DisplayName("Prefix and case are ignored")
    void parse() {
        assertEquals("421", DEVersion.parse("DE421").token());
        assertEquals("430t", DEVersion.parse("de430T").token());
        assertEquals("406", DEVersion.parse(" 406 ").token());
        assertEquals(DEVersion.parse("421"), DEVersion.DEFAULT);
        assertEquals("DE432t", DEVersion.parse("432t").toString());
    }

    @Test
    @DisplayName("Unknown releases are rejected")
    void unknown() {
        assertThrows(IllegalArgumentException.class, () -> DEVersion.parse("DE999"));
        assertThrows(IllegalArgumentException.class, () -> DEVersion.parse("DE"));
    }

    @Test
    @DisplayName("Every published release is known")
    void known() {
        for (String token : DEVersion.KNOWN) {
            assertEquals(token, DEVersion.parse("DE" + token).token());
        }
        assertEquals(19, DEVersion.KNOWN.size());
    }
}
