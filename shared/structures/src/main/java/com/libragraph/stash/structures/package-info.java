/**
 * In-memory containers shared by Stash modules.
 *
 * <ul>
 *   <li>{@code array}: block-allocated growable array with stable slots</li>
 *   <li>{@code list}: sentinel-framed linked list</li>
 *   <li>{@code map}: byte-keyed chaining hash map</li>
 *   <li>{@code heap}: binary priority heap</li>
 * </ul>
 * Containers own the payloads handed to them together with a cleanup callback,
 * and are single-threaded: callers serialize access to an instance.
 * Logging goes through JBoss Logging; sizing is read through MicroProfile Config.
 */
package com.libragraph.stash.structures;
