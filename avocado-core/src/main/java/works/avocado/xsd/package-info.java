/**
 * Textual forms of the XML Schema scalar types used by the vocabulary.
 */
package works.avocado.xsd;
