package com.codeheadsystems.pairing.server.manager;

import com.codeheadsystems.pairing.server.exception.PairingException;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Shared request validation for the managers.
 */
final class Validation {

  static final int MAX_NAME_LENGTH = 100;

  private Validation() {
  }

  /**
   * Trims a name and checks it is 1 to 100 characters.
   */
  static String name(String value, String field) {
    if (value == null || value.isBlank()) {
      throw PairingException.validation(field + " is required", field);
    }
    String trimmed = value.trim();
    if (trimmed.length() > MAX_NAME_LENGTH) {
      throw PairingException.validation(
          field + " must be at most " + MAX_NAME_LENGTH + " characters", field);
    }
    return trimmed;
  }

  /**
   * Normalizes an area list: null becomes empty, blank entries are rejected, duplicates are
   * dropped keeping the first occurrence.
   */
  static List<String> areas(List<String> areas, String field) {
    if (areas == null) {
      return List.of();
    }
    Set<String> unique = new LinkedHashSet<>();
    for (String area : areas) {
      if (area == null || area.isBlank()) {
        throw PairingException.validation(field + " must not contain blank entries", field);
      }
      unique.add(area.trim());
    }
    return List.copyOf(unique);
  }
}
