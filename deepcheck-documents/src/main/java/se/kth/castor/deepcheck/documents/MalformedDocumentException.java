package se.kth.castor.deepcheck.documents;

/**
 * Thrown when one of the compared documents can not be parsed.
 */
public class MalformedDocumentException extends Exception {

  private final Side side;

  public MalformedDocumentException(Side side, String document, Throwable cause) {
    super(side.describe() + " value ('" + document + "') is not a valid document", cause);
    this.side = side;
  }

  public Side getSide() {
    return side;
  }

  public enum Side {
    EXPECTED,
    ACTUAL;

    String describe() {
      return this == EXPECTED ? "Expected" : "Input";
    }
  }
}
