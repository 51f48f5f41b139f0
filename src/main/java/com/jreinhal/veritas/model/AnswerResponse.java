package com.jreinhal.veritas.model;

import java.util.List;

public record AnswerResponse(String answer, List<Citation> citations, boolean grounded, Diagnostics diagnostics) {
    public AnswerResponse {
        citations = citations == null ? List.of() : List.copyOf(citations);
    }
}
