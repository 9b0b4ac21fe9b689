/**
 * Host-facing channel contract.
 *
 * <p>Types in this package are platform-agnostic. Nothing here refers to a
 * particular chat vendor; concrete channels live in their own packages and
 * depend on this one, never the reverse.</p>
 */
package com.tasknexus.channel.api;
