package com.jreinhal.veritas.model;

public record EvidenceCounts(int vector, int graph) {
    public static final EvidenceCounts NONE = new EvidenceCounts(0, 0);

    public boolean isEmpty() {
        return this.vector == 0 && this.graph == 0;
    }

    public int total() {
        return this.vector + this.graph;
    }
}
