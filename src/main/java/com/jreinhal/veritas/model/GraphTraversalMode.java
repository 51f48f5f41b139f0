package com.jreinhal.veritas.model;

public enum GraphTraversalMode {
    ENTITY_CENTRIC,
    MULTI_HOP,
    CROSS_SOURCE
}
