package dev.harvester.render;

import org.jspecify.annotations.Nullable;

public record PageLink(String href, @Nullable String text, @Nullable String title) {}
