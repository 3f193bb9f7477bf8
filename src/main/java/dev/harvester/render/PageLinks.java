package dev.harvester.render;

import java.util.List;

/** Links found on a rendered page, split by whether they stay on the page's own site. */
public record PageLinks(List<PageLink> internal, List<PageLink> external) {

  public PageLinks {
    internal = internal == null ? List.of() : List.copyOf(internal);
    external = external == null ? List.of() : List.copyOf(external);
  }

  public static PageLinks empty() {
    return new PageLinks(List.of(), List.of());
  }
}
