package com.aastreli.modelengine.domain.service.registry;

public record LabelScore(String label, double confidence) {
}
