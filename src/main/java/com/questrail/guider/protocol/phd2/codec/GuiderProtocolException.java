package com.questrail.guider.protocol.phd2.codec;

/**
 * A single inbound message could not be decoded.
 *
 * <p>Typical causes:</p>
 * <ul>
 *   <li>The line is not valid JSON</li>
 *   <li>The line is valid JSON but not an object</li>
 *   <li>A response carries an error object without a numeric code</li>
 * </ul>
 *
 * Always recovered locally: the message is logged and skipped, the
 * connection stays up.
 */
public final class GuiderProtocolException extends RuntimeException
{
    public GuiderProtocolException(String message) {
        super(message);
    }

    public GuiderProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
