package org.fpbeditor.common;

/**
 * Thrown when a serialized process model cannot be read.
 */
public class ModelFormatException extends Exception {

  private static final long serialVersionUID = -3862021147412830716L;

  public ModelFormatException(String message) {
    super(message);
  }

  public ModelFormatException(String message, Throwable cause) {
    super(message, cause);
  }
}
