/*
 * Copyright (c) 2025 Original Author(s), PhonePe India Pvt. Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.phonepe.ensembleai.core.utils;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests {@link AgentUtils}
 */
class AgentUtilsTest {

    @Test
    void testRootCause() {
        final var root = new IOException("connection refused");
        assertSame(root, AgentUtils.rootCause(new RuntimeException(new UncheckedIOException(root))));
        assertSame(root, AgentUtils.rootCause(root));
    }

    @Test
    void testAbbreviate() {
        assertEquals("abc...", AgentUtils.abbreviate("abcdef", 3));
        assertEquals("abc", AgentUtils.abbreviate("abc", 3));
        assertNull(AgentUtils.abbreviate(null, 3));
    }
}
