package com.jreinhal.veritas.workspace;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class WorkspaceContextTest {

    @BeforeEach
    void setUp() {
        WorkspaceContext.clear();
        WorkspaceContext.setDefaultWorkspaceId("workspace_default");
    }

    @AfterEach
    void tearDown() {
        WorkspaceContext.clear();
    }

    @Test
    @DisplayName("Should prefer an explicit workspace over the thread's")
    void shouldPreferExplicitWorkspace() {
        WorkspaceContext.setCurrentWorkspaceId("ws_alpha");

        assertEquals("ws_beta", WorkspaceContext.resolve(" ws_beta "));
        assertEquals("ws_alpha", WorkspaceContext.resolve(null));
        assertEquals("ws_alpha", WorkspaceContext.resolve("  "));
    }

    @Test
    @DisplayName("Should ignore a blank default")
    void shouldIgnoreBlankDefault() {
        WorkspaceContext.setDefaultWorkspaceId(" ");

        assertEquals("workspace_default", WorkspaceContext.getDefaultWorkspaceId());
    }

    @Test
    @DisplayName("Should not leak the workspace into other threads")
    void shouldIsolateThreads() throws InterruptedException {
        WorkspaceContext.setCurrentWorkspaceId("ws_alpha");
        AtomicReference<String> seen = new AtomicReference<>();
        CountDownLatch done = new CountDownLatch(1);

        Thread worker = new Thread(() -> {
            seen.set(WorkspaceContext.getCurrentWorkspaceId());
            done.countDown();
        });
        worker.start();
        done.await();

        assertEquals("workspace_default", seen.get());
        assertEquals("ws_alpha", WorkspaceContext.getCurrentWorkspaceId());
    }
}
