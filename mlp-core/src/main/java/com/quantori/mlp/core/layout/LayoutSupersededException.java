package com.quantori.mlp.core.layout;

/**
 * Reported to the requester of a layout that finished after a newer request was accepted.
 */
public class LayoutSupersededException extends RuntimeException {

  public LayoutSupersededException(String message) {
    super(message);
  }
}
