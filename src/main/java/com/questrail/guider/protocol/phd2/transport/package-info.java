/**
 * Guider Transport Ports
 * =============================================================================
 *
 * These interfaces define the <em>framework-agnostic stream boundary</em>
 * between a concrete networking implementation (Netty TCP in production, a
 * scripted fake in tests) and the guider session runtime.
 *
 * <p>Everything above the transport adapter sees only:</p>
 * <ul>
 *   <li>Complete inbound lines as {@code byte[]}, terminator stripped</li>
 *   <li>Outbound lines as {@code byte[]}, terminator included</li>
 *   <li>One close notification per connection</li>
 * </ul>
 *
 * <h2>Architectural constraints (binding)</h2>
 * Implementations of these ports MUST:
 * <ul>
 *   <li>Perform transport I/O and line framing only</li>
 *   <li>Not parse JSON or correlate responses</li>
 *   <li>Not schedule retries or reconnects</li>
 * </ul>
 */
package com.questrail.guider.protocol.phd2.transport;
