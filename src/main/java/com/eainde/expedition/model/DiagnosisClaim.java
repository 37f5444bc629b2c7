package com.eainde.expedition.model;

import java.io.Serializable;
import java.util.List;

/**
 * One factual statement of a diagnosis together with the evidence ids it rests on.
 */
public record DiagnosisClaim(String text, List<String> citations) implements Serializable {

    public DiagnosisClaim {
        citations = List.copyOf(citations);
    }
}
