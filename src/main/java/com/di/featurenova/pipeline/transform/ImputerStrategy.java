package com.di.featurenova.pipeline.transform;

/** How missing numeric feature values are filled. */
public enum ImputerStrategy {
    /** Mean of the k nearest training rows by NaN-euclidean distance. */
    KNN,
    /** Training column mean. */
    MEAN
}
