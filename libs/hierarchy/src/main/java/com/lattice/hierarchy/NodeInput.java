package com.lattice.hierarchy;

/**
 * Node about to be created.
 *
 * @param id    client-chosen node id; may be null when nothing in the batch refers to the node
 * @param label display label
 * @param type  node type, checked against level allow-lists
 */
public record NodeInput(String id, String label, String type) {}
