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

package com.phonepe.ensembleai.core.engine;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests {@link CancellationToken}
 */
class CancellationTokenTest {

    @Test
    void testManualCancel() {
        final var token = CancellationToken.create();
        assertFalse(token.isCancelled());
        token.cancel();
        token.cancel();
        assertTrue(token.isCancelled());
    }

    @Test
    void testDeadline() {
        final var token = CancellationToken.withDeadline(Duration.ofMillis(200));
        assertFalse(token.isCancelled());
        await().atMost(Duration.ofSeconds(2))
                .until(token::isCancelled);
    }

    @Test
    void testNoneCannotBeCancelled() {
        final var token = CancellationToken.none();
        assertFalse(token.isCancelled());
        assertThrows(UnsupportedOperationException.class, token::cancel);
        assertFalse(token.isCancelled());
    }

    @Test
    void testListenersNotifiedOnce() {
        final var token = CancellationToken.create();
        final var notified = new AtomicInteger();
        final var removed = new AtomicInteger();
        token.onCancel(notified::incrementAndGet);
        token.onCancel(removed::incrementAndGet).close();
        token.cancel();
        token.cancel();
        assertEquals(1, notified.get());
        assertEquals(0, removed.get());

        final var late = new AtomicInteger();
        token.onCancel(late::incrementAndGet);
        assertEquals(1, late.get());
    }

    @Test
    void testDeadlineNotifiesListeners() {
        final var token = CancellationToken.withDeadline(Duration.ofMillis(100));
        final var notified = new AtomicInteger();
        token.onCancel(notified::incrementAndGet);
        await().atMost(Duration.ofSeconds(2))
                .until(() -> notified.get() == 1);
    }
}
