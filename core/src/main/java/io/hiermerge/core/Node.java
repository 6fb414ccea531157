// file: core/src/main/java/io/hiermerge/core/Node.java
package io.hiermerge.core;

/**
 * Node of the provenance-annotated tree.
 * <p>
 * The annotated tree mirrors the plain tree: mappings stay mappings, keyed
 * lists come back as sequences, and every retained leaf carries the
 * fragment metadata it was taken from.
 */
public sealed interface Node permits MappingNode, SequenceNode, AnnotatedLeaf {
}
