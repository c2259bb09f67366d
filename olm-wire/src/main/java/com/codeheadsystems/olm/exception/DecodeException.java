package com.codeheadsystems.olm.exception;

/**
 * Raised when received bytes cannot be decoded into an Olm message.
 * <p>
 * Every failure is a deterministic function of the input. Callers drop the message and treat it as a protocol
 * violation; nothing here is retried.
 */
public class DecodeException extends RuntimeException {

  /**
   * Value used for {@link #expected()} and {@link #actual()} when the reason carries no such value.
   */
  public static final int NOT_APPLICABLE = -1;

  private final Reason reason;
  private final int expected;
  private final int actual;

  private DecodeException(final Reason reason, final String message, final int expected, final int actual,
                          final Throwable cause) {
    super(message, cause);
    this.reason = reason;
    this.expected = expected;
    this.actual = actual;
  }

  /**
   * The buffer was empty, so there is no version byte.
   *
   * @return the decode exception
   */
  public static DecodeException missingVersion() {
    return new DecodeException(Reason.MISSING_VERSION, "The message didn't contain a version",
        NOT_APPLICABLE, NOT_APPLICABLE, null);
  }

  /**
   * The version byte is not the supported one.
   *
   * @param expected the supported version
   * @param actual   the version found, as an unsigned byte
   * @return the decode exception
   */
  public static DecodeException invalidVersion(final int expected, final int actual) {
    return new DecodeException(Reason.INVALID_VERSION,
        "The message didn't have a valid version, expected " + expected + ", got " + actual,
        expected, actual, null);
  }

  /**
   * The buffer cannot hold a version, a body and a MAC.
   *
   * @param actualLength the buffer length
   * @return the decode exception
   */
  public static DecodeException messageTooShort(final int actualLength) {
    return new DecodeException(Reason.MESSAGE_TOO_SHORT,
        "The message was too short, it didn't contain a valid payload: " + actualLength + " bytes",
        NOT_APPLICABLE, actualLength, null);
  }

  /**
   * A public key field has the wrong size.
   *
   * @param expected the key length
   * @param actual   the decoded field length
   * @return the decode exception
   */
  public static DecodeException invalidKeyLength(final int expected, final int actual) {
    return new DecodeException(Reason.INVALID_KEY_LENGTH,
        "The message contained a public key with an invalid size, expected " + expected + ", got " + actual,
        expected, actual, null);
  }

  /**
   * The MAC slice has the wrong size.
   *
   * @param expected the truncated MAC length
   * @param actual   the slice length
   * @return the decode exception
   */
  public static DecodeException invalidMacLength(final int expected, final int actual) {
    return new DecodeException(Reason.INVALID_MAC_LENGTH,
        "The message contained a MAC with an invalid size, expected " + expected + ", got " + actual,
        expected, actual, null);
  }

  /**
   * A signature check performed by a collaborator failed.
   *
   * @param cause the signature failure
   * @return the decode exception
   */
  public static DecodeException signature(final Throwable cause) {
    return new DecodeException(Reason.SIGNATURE,
        "The message contained an invalid signature: " + cause.getMessage(),
        NOT_APPLICABLE, NOT_APPLICABLE, cause);
  }

  /**
   * The structured body is not well formed.
   *
   * @param cause the structural decoder failure
   * @return the decode exception
   */
  public static DecodeException malformedPayload(final Throwable cause) {
    return new DecodeException(Reason.MALFORMED_PAYLOAD,
        "The message payload is malformed: " + cause.getMessage(),
        NOT_APPLICABLE, NOT_APPLICABLE, cause);
  }

  public Reason reason() {
    return reason;
  }

  /**
   * Expected value for {@link Reason#INVALID_VERSION}, {@link Reason#INVALID_KEY_LENGTH} and
   * {@link Reason#INVALID_MAC_LENGTH}; {@link #NOT_APPLICABLE} otherwise.
   *
   * @return the int
   */
  public int expected() {
    return expected;
  }

  /**
   * Actual value found for the reasons that carry one ({@link Reason#MESSAGE_TOO_SHORT} reports the buffer
   * length); {@link #NOT_APPLICABLE} otherwise.
   *
   * @return the int
   */
  public int actual() {
    return actual;
  }

  /**
   * Closed set of decode failures.
   */
  public enum Reason {
    MISSING_VERSION,
    INVALID_VERSION,
    MESSAGE_TOO_SHORT,
    INVALID_KEY_LENGTH,
    INVALID_MAC_LENGTH,
    SIGNATURE,
    MALFORMED_PAYLOAD
  }
}
