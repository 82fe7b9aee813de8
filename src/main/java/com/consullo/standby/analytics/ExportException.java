package com.consullo.standby.analytics;

/**
 * Structured export failure surfaced to the caller.
 *
 * @since 1.0
 */
public final class ExportException extends Exception {

  private static final long serialVersionUID = 1L;

  public enum Reason {
    NOT_ENOUGH_DATA,
    INVALID_PAYLOAD,
    DECODE_FAILED,
    WRITE_FAILED,
    NO_EXPORT_DIRECTORY
  }

  private final Reason reason;

  public ExportException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public ExportException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  /**
   * Creates the insufficient-data failure. The message keeps the {@code NOT_ENOUGH_DATA:<threshold>} form the
   * dashboard parses.
   *
   * @param threshold minimum record count
   * @return exception
   */
  public static ExportException notEnoughData(int threshold) {
    return new ExportException(Reason.NOT_ENOUGH_DATA, "NOT_ENOUGH_DATA:" + threshold);
  }

  public Reason reason() {
    return reason;
  }
}
