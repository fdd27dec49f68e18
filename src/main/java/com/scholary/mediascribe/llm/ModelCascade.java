package com.scholary.mediascribe.llm;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Ordered, non-empty list of model identifiers: the preferred model first, fallbacks after.
 *
 * <p>Immutable and shared by every caller.
 */
public record ModelCascade(List<String> models) {

  public ModelCascade {
    if (models == null || models.isEmpty()) {
      throw new IllegalArgumentException("Model cascade needs at least one model");
    }
    for (String model : models) {
      if (model == null || model.isBlank()) {
        throw new IllegalArgumentException("Model identifiers cannot be blank");
      }
    }
    models = List.copyOf(models);
  }

  /**
   * Build a cascade from a primary model and its fallbacks. The primary and any repeats are
   * dropped from the fallback tail.
   *
   * @param primary the preferred model
   * @param fallbacks models to try after it, in order
   * @return the cascade
   */
  public static ModelCascade of(String primary, List<String> fallbacks) {
    if (primary == null || primary.isBlank()) {
      throw new IllegalArgumentException("Primary model is required");
    }
    Set<String> ordered = new LinkedHashSet<>();
    ordered.add(primary.trim());
    if (fallbacks != null) {
      for (String fallback : fallbacks) {
        if (fallback != null && !fallback.isBlank()) {
          ordered.add(fallback.trim());
        }
      }
    }
    return new ModelCascade(new ArrayList<>(ordered));
  }

  public String primary() {
    return models.get(0);
  }

  public int size() {
    return models.size();
  }
}
