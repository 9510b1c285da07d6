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

import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal for a run. Checked before a task is scheduled and before every attempt. Clients
 * waiting out a retry backoff are woken up through {@link #onCancel(Runnable)}.
 * An attempt already in flight is not interrupted by cancellation, it is bounded by its own timeout.
 */
@Slf4j
public class CancellationToken {
    private static final CancellationToken NONE = new CancellationToken(null, Clock.systemUTC()) {
        @Override
        public void cancel() {
            throw new UnsupportedOperationException("The shared no-op token cannot be cancelled");
        }

        @Override
        public Registration onCancel(@NonNull Runnable listener) {
            return () -> {
            };
        }
    };

    /**
     * Handle for a listener added with {@link #onCancel(Runnable)}. Closing it removes the listener.
     */
    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();
    private final Instant deadline;
    private final Clock clock;

    private CancellationToken(Instant deadline, Clock clock) {
        this.deadline = deadline;
        this.clock = clock;
    }

    public static CancellationToken create() {
        return new CancellationToken(null, Clock.systemUTC());
    }

    /**
     * A token that can never be cancelled. Used when the caller does not need cancellation.
     */
    public static CancellationToken none() {
        return NONE;
    }

    /**
     * A token that gets cancelled once the given duration has passed
     */
    public static CancellationToken withDeadline(@NonNull Duration duration) {
        final var clock = Clock.systemUTC();
        final var token = new CancellationToken(clock.instant().plus(duration), clock);
        if (duration.isNegative() || duration.isZero()) {
            token.trigger();
        }
        else {
            CompletableFuture.delayedExecutor(duration.toMillis(), TimeUnit.MILLISECONDS)
                    .execute(token::trigger);
        }
        return token;
    }

    public void cancel() {
        trigger();
    }

    public boolean isCancelled() {
        return cancelled.get() || (deadline != null && !clock.instant().isBefore(deadline));
    }

    /**
     * Register a listener to be called once when the token gets cancelled. The listener is called right away on the
     * calling thread if the token is already cancelled.
     *
     * @param listener Must be quick and must not throw
     * @return Registration to be closed once the caller is no longer interested
     */
    public Registration onCancel(@NonNull Runnable listener) {
        final var notified = new AtomicBoolean(false);
        final Runnable once = () -> {
            if (notified.compareAndSet(false, true)) {
                listener.run();
            }
        };
        listeners.add(once);
        if (isCancelled()) {
            notifyListener(once);
        }
        return () -> listeners.remove(once);
    }

    private void trigger() {
        if (cancelled.compareAndSet(false, true)) {
            log.debug("Cancellation requested. Notifying {} listener(s)", listeners.size());
            listeners.forEach(CancellationToken::notifyListener);
        }
    }

    private static void notifyListener(Runnable listener) {
        try {
            listener.run();
        }
        catch (RuntimeException e) {
            log.warn("Cancellation listener failed: {}", e.getMessage(), e);
        }
    }
}
