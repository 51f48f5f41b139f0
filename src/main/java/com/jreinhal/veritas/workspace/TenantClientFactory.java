package com.jreinhal.veritas.workspace;

@FunctionalInterface
public interface TenantClientFactory {
    TenantClients create(String workspaceId);
}
