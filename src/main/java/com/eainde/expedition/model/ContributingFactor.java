package com.eainde.expedition.model;

import java.io.Serializable;
import java.util.List;

/**
 * @param name       short factor label
 * @param magnitude  estimated share of the deviation explained, signed
 * @param citations  evidence field ids backing the factor
 */
public record ContributingFactor(String name, double magnitude, List<String> citations) implements Serializable {

    public ContributingFactor {
        citations = List.copyOf(citations);
    }
}
