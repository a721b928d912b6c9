package com.aastreli.modelengine.domain.classifier;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * A trained multi-class model over scaled feature vectors. Class indices are the
 * positions of the accompanying {@link LabelEncoder}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = GaussianNaiveBayesClassifier.class, name = "gaussian_nb")
})
public interface Classifier {

    int numFeatures();

    int numClasses();

    double[] predictProba(double[] features);
}
