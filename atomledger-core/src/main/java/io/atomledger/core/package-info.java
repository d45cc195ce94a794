/**
 * Model-centric core for atomledger.
 *
 * <p>This module is deliberately transport-neutral. It contains only:
 * <ul>
 *   <li>Fixed-width value types (identifiers, 256-bit integers, byte strings)</li>
 *   <li>The quark, particle and atom record model</li>
 *   <li>The schema-driven DSON (canonical) and wire (JSON-shaped) serialization engine</li>
 * </ul>
 *
 * <p>Node connections and JSON text handling live in other modules.
 */
package io.atomledger.core;
