package com.codurance.backoff;

/**
 * Thrown when a named operation or attribute cannot be resolved on the wrapped client.
 */
public class NoSuchOperationException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  private final String operationName;

  public NoSuchOperationException(String operationName, String message) {
    super(message);
    this.operationName = operationName;
  }

  public String getOperationName() {
    return operationName;
  }
}
