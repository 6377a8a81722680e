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


package dev.mars.gantry.workflow.run;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class ConcurrencyGroupRegistryTest {

    private ConcurrencyGroupRegistry registry;
    private JobScheduler first;
    private JobScheduler second;

    @BeforeEach
    void setUp() {
        registry = new ConcurrencyGroupRegistry();
        first = mock(JobScheduler.class);
        second = mock(JobScheduler.class);
    }

    @Test
    void testFreeGroupIsAcquired() {
        assertTrue(registry.acquire("deploy", first, "prod", false));
        assertEquals("prod", registry.holderOf("deploy"));
        assertTrue(registry.acquire("deploy", first, "prod", false), "re-acquiring is idempotent");
        assertNull(registry.holderOf("other"));
    }

    @Test
    void testWaiterIsWokenOnRelease() {
        registry.acquire("deploy", first, "prod", false);

        assertFalse(registry.acquire("deploy", second, "prod", false));
        verify(second, never()).wake();

        registry.release("deploy", first, "prod");

        verify(second).wake();
        assertNull(registry.holderOf("deploy"));
        assertTrue(registry.acquire("deploy", second, "prod", false));
    }

    @Test
    void testCancelInProgressSupersedesHolder() {
        registry.acquire("deploy", first, "prod", false);

        assertTrue(registry.acquire("deploy", second, "prod", true));

        verify(first).cancelInstance(eq("prod"), contains("Superseded by 'prod'"));
        verify(second, never()).cancelInstance(anyString(), anyString());
        assertEquals("prod", registry.holderOf("deploy"));
    }

    @Test
    void testReleaseByNonHolderKeepsGroup() {
        registry.acquire("deploy", first, "a", false);
        registry.acquire("deploy", first, "b", false);

        registry.release("deploy", first, "b");
        registry.release("deploy", first, "b");

        assertEquals("a", registry.holderOf("deploy"));
        registry.release("deploy", first, "a");
        verify(first, never()).wake();
    }
}
