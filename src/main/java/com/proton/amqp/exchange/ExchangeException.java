package com.proton.amqp.exchange;

/**
 * Base exception for failures raised by this library itself. Errors coming from the broker or
 * the client (IOException, TimeoutException, ShutdownSignalException) are never wrapped in it.
 */
public class ExchangeException extends Exception {
  public ExchangeException(String message) {
    super(message);
  }

  public ExchangeException(String message, Throwable cause) {
    super(message, cause);
  }

  /** Thrown when a declaration does not supply a required member. */
  public static class MissingDeclarationException extends ExchangeException {
    private final String member;

    public MissingDeclarationException(String declaration, String member) {
      super(
          "Exchange declaration "
              + declaration
              + " must implement `"
              + member
              + "()` and return a non-empty value");
      this.member = member;
    }

    public String getMember() {
      return member;
    }
  }

  /** Thrown when the broker URL of a declaration cannot be parsed. */
  public static class InvalidEndpointException extends ExchangeException {
    public InvalidEndpointException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  /** Thrown when the pre-channel setup step fails or is interrupted. */
  public static class SetupFailedException extends ExchangeException {
    private final String exchangeName;

    public SetupFailedException(String exchangeName, Throwable cause) {
      super("Setup before creating the channel of exchange " + exchangeName + " failed", cause);
      this.exchangeName = exchangeName;
    }

    public String getExchangeName() {
      return exchangeName;
    }
  }
}
