package com.quantori.mlp.core.source;

/**
 * Raised when a structure document cannot be read or written as JSON.
 */
public class StructureFormatException extends RuntimeException {

  public StructureFormatException(String message) {
    super(message);
  }

  public StructureFormatException(String message, Throwable cause) {
    super(message, cause);
  }
}
