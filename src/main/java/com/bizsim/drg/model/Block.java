package com.bizsim.drg.model;

import java.util.List;

/**
 * A named namespace grouping attributes.
 *
 * Blocks carry no evaluation semantics: cycles spanning several blocks form a
 * single cyclic group exactly like cycles inside one block.
 *
 * @param name       Block name.
 * @param attributes Qualified identities of the block's attributes, in declaration order.
 */
public record Block(String name, List<String> attributes) {

    public Block {
        attributes = List.copyOf(attributes);
    }
}
