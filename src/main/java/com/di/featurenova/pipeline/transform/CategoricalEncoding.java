package com.di.featurenova.pipeline.transform;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Most-frequent imputation plus one-hot encoding of one categorical column.
 * Categories are the sorted distinct training values; an unseen value
 * encodes as all zeros.
 */
public record CategoricalEncoding(@JsonProperty("column") String column,
                                  @JsonProperty("fill_value") String fillValue,
                                  @JsonProperty("categories") List<String> categories) {

    public CategoricalEncoding {
        categories = List.copyOf(categories);
    }

    /** Output column names, {@code column=category}. */
    List<String> outputColumns() {
        return categories.stream().map(c -> column + "=" + c).toList();
    }

    void encode(String value, double[] out, int offset) {
        String v = value == null ? fillValue : value;
        int hit = categories.indexOf(v);
        for (int i = 0; i < categories.size(); i++) {
            out[offset + i] = i == hit ? 1.0 : 0.0;
        }
    }
}
