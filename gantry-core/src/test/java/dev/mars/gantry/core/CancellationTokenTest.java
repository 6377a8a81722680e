/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.gantry.core;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class CancellationTokenTest {

    @Test
    void testCancelRunsCallbacksOnce() {
        CancellationToken token = CancellationToken.create();
        AtomicInteger calls = new AtomicInteger();
        token.onCancel(calls::incrementAndGet);

        assertTrue(token.cancel("stop"));
        assertFalse(token.cancel("again"));

        assertTrue(token.isCancelled());
        assertEquals("stop", token.getReason());
        assertEquals(1, calls.get());
    }

    @Test
    void testCallbackRegisteredAfterCancelRunsImmediately() {
        CancellationToken token = CancellationToken.create();
        token.cancel("done");

        AtomicInteger calls = new AtomicInteger();
        token.onCancel(calls::incrementAndGet);

        assertEquals(1, calls.get());
    }

    @Test
    void testParentCancelsChild() {
        CancellationToken parent = CancellationToken.create();
        CancellationToken child = parent.child();

        parent.cancel("run cancelled");

        assertTrue(child.isCancelled());
        assertEquals("run cancelled", child.getReason());
    }

    @Test
    void testChildCancelLeavesParent() {
        CancellationToken parent = CancellationToken.create();
        CancellationToken child = parent.child();

        child.cancel("superseded");

        assertTrue(child.isCancelled());
        assertFalse(parent.isCancelled());
    }

    @Test
    void testFailingCallbackDoesNotStopOthers() {
        CancellationToken token = CancellationToken.create();
        AtomicInteger calls = new AtomicInteger();
        token.onCancel(() -> {
            throw new IllegalStateException("boom");
        });
        token.onCancel(calls::incrementAndGet);

        token.cancel("stop");

        assertEquals(1, calls.get());
    }
}
