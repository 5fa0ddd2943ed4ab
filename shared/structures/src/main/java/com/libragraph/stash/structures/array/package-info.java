/**
 * Block-allocated growable array with stable element slots.
 */
package com.libragraph.stash.structures.array;
