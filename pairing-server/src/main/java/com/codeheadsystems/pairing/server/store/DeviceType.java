package com.codeheadsystems.pairing.server.store;

import java.util.Locale;
import java.util.Optional;

/**
 * Kind of device a client runs on, as reported while pairing.
 */
public enum DeviceType {
  MOBILE,
  TABLET,
  DESKTOP,
  OTHER;

  /**
   * Parses the lowercase wire form.
   *
   * @param value the wire value, may be null
   * @return the device type, or empty if the value is not one of the known types
   */
  public static Optional<DeviceType> fromWire(String value) {
    if (value == null) {
      return Optional.empty();
    }
    for (DeviceType type : values()) {
      if (type.wireName().equals(value)) {
        return Optional.of(type);
      }
    }
    return Optional.empty();
  }

  /**
   * Lowercase wire form.
   *
   * @return the wire name
   */
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
