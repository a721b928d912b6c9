package com.aastreli.modelengine.domain.classifier;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.TreeSet;

/**
 * Maps fault labels to class indices. Classes are kept sorted, so extending the label set
 * yields the encoder that a fresh fit over the union would produce.
 */
public final class LabelEncoder {

    private final List<String> classes;

    @JsonCreator
    public LabelEncoder(@JsonProperty("classes") Collection<String> classes) {
        this.classes = List.copyOf(new TreeSet<>(classes));
    }

    @JsonProperty("classes")
    public List<String> classes() {
        return classes;
    }

    public int size() {
        return classes.size();
    }

    public boolean contains(String label) {
        return indexOf(label) >= 0;
    }

    public int encode(String label) {
        int idx = indexOf(label);
        if (idx < 0) {
            throw new IllegalArgumentException("Unknown label: " + label);
        }
        return idx;
    }

    public String decode(int index) {
        return classes.get(index);
    }

    public LabelEncoder extend(Collection<String> labels) {
        TreeSet<String> union = new TreeSet<>(classes);
        if (!union.addAll(labels)) {
            return this;
        }
        return new LabelEncoder(union);
    }

    private int indexOf(String label) {
        int idx = Collections.binarySearch(classes, label);
        return idx >= 0 ? idx : -1;
    }
}
