/**
 * Typed values of a vocabulary and the primitives they are built from.
 */
package works.avocado;
