package co.keyfmt.core.conversion;

import java.time.Instant;

/**
 * Resolution of an epoch counter encoding.
 */
public enum EpochUnit {
  SECONDS("unix"),
  MILLISECONDS("unixmilli"),
  NANOSECONDS("unixnano");

  private final String modifier;

  EpochUnit(String modifier) {
    this.modifier = modifier;
  }

  public String modifier() {
    return modifier;
  }

  public long count(Instant instant) {
    switch (this) {
      case SECONDS:
        return instant.getEpochSecond();
      case MILLISECONDS:
        return instant.toEpochMilli();
      default:
        return Math.addExact(Math.multiplyExact(instant.getEpochSecond(), 1_000_000_000L), instant.getNano());
    }
  }

  /** The unit named by a modifier, or {@code null} if the modifier is not an epoch format. */
  public static EpochUnit fromModifier(String modifier) {
    for (EpochUnit unit : values()) {
      if (unit.modifier.equals(modifier)) return unit;
    }
    return null;
  }
}
