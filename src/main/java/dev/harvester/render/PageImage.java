package dev.harvester.render;

import org.jspecify.annotations.Nullable;

public record PageImage(String src, @Nullable String alt) {}
