package se.kth.castor.deepcheck.shape;

/**
 * The runtime category of a value. Every algorithm in this library is a total function over these
 * variants.
 */
public enum Shape {
  NIL,
  BOOL,
  NUMERIC,
  TEXT,
  /**
   * A {@code byte[]}. Compared byte for byte, and the only array with a dedicated shape.
   */
  RAW_BYTES,
  /**
   * Any other array, or a {@link java.util.List}.
   */
  SEQUENCE,
  /**
   * A {@link java.util.Map} or a {@link java.util.Set}.
   */
  ASSOCIATIVE,
  /**
   * A {@link java.util.Queue} that is not also a list.
   */
  CHANNEL_LIKE,
  /**
   * A holder that may point to nothing, like {@link java.util.Optional}.
   */
  REFERENCE,
  CALLABLE,
  /**
   * A record or class whose instance fields can be read reflectively.
   */
  COMPOSITE,
  /**
   * Anything whose state can not be introspected. Compared with its own {@code equals}.
   */
  OPAQUE;

  public boolean isCountable() {
    return switch (this) {
      case RAW_BYTES, SEQUENCE, ASSOCIATIVE, CHANNEL_LIKE -> true;
      default -> false;
    };
  }
}
