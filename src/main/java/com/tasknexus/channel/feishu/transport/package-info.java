/**
 * Feishu Transport Ports
 * =============================================================================
 *
 * <p>These interfaces are the boundary between the channel's reliability layer
 * (supervision, deduplication, normalization) and the vendor SDK.</p>
 *
 * <p>Everything above the ports sees only {@link
 * com.tasknexus.channel.feishu.transport.InboundEvent} values, plain strings
 * for outbound text, and connection lifecycle calls. SDK types stay inside
 * {@code transport.lark}.</p>
 *
 * <h2>Constraints</h2>
 * Implementations of these ports MUST:
 * <ul>
 *   <li>Perform transport I/O only (no deduplication or content decoding)</li>
 *   <li>Not invoke the host's message handler directly</li>
 *   <li>Not retry or reconnect on behalf of the supervisor</li>
 * </ul>
 */
package com.tasknexus.channel.feishu.transport;
