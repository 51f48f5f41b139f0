package com.jreinhal.veritas.workspace;

/**
 * Workspace of the request running on the current thread. Worker threads do not inherit it, so the
 * pipeline resolves the workspace once and passes it explicitly to the stages.
 */
public final class WorkspaceContext {
    private static final ThreadLocal<String> currentWorkspace = new ThreadLocal<>();
    private static volatile String defaultWorkspaceId = "workspace_default";

    private WorkspaceContext() {
    }

    public static void setDefaultWorkspaceId(String workspaceId) {
        if (workspaceId == null || workspaceId.isBlank()) {
            return;
        }
        defaultWorkspaceId = workspaceId.trim();
    }

    public static String getDefaultWorkspaceId() {
        return defaultWorkspaceId;
    }

    public static void setCurrentWorkspaceId(String workspaceId) {
        if (workspaceId == null || workspaceId.isBlank()) {
            currentWorkspace.set(defaultWorkspaceId);
            return;
        }
        currentWorkspace.set(workspaceId.trim());
    }

    public static String getCurrentWorkspaceId() {
        String workspaceId = currentWorkspace.get();
        if (workspaceId == null || workspaceId.isBlank()) {
            return defaultWorkspaceId;
        }
        return workspaceId;
    }

    /**
     * Explicit id when present, otherwise the thread's current workspace.
     */
    public static String resolve(String explicitWorkspaceId) {
        if (explicitWorkspaceId != null && !explicitWorkspaceId.isBlank()) {
            return explicitWorkspaceId.trim();
        }
        return getCurrentWorkspaceId();
    }

    public static void clear() {
        currentWorkspace.remove();
    }
}
