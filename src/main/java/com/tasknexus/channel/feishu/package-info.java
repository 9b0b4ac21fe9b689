/**
 * Feishu (Lark) channel plugin.
 *
 * <p>{@link com.tasknexus.channel.feishu.FeishuChannel} is the only type the
 * host interacts with. Subpackages:</p>
 * <ul>
 *   <li>{@code config}: credentials and supervision timings</li>
 *   <li>{@code codec}: text content encoding</li>
 *   <li>{@code transport}: SDK-neutral ports, with the Lark SDK binding in
 *       {@code transport.lark}</li>
 *   <li>{@code internal}: deduplication, normalization and connection
 *       supervision</li>
 *   <li>{@code observability}: sink for state changes, dropped events and errors</li>
 * </ul>
 */
package com.tasknexus.channel.feishu;
