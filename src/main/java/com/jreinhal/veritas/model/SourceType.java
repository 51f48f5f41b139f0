package com.jreinhal.veritas.model;

public enum SourceType {
    VECTOR,
    GRAPH
}
