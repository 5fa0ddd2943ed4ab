/**
 * Shared primitives for the Stash container layer.
 *
 * <p>Contains {@link com.libragraph.stash.util.LinearCongruential} (the 64-bit
 * mixing step behind the default key hash) and
 * {@link com.libragraph.stash.util.Owned} (payload plus cleanup).
 * No framework dependencies.
 */
package com.libragraph.stash.util;
