package com.jreinhal.veritas.model;

public enum Verdict {
    ACCEPTED,
    REJECTED
}
