package org.dxworks.mathframe.model;

/** Content of an {@code <mi>} element. */
public final class Identifier extends LeafNode {

    public Identifier(String text) {
        super(text);
    }
}
