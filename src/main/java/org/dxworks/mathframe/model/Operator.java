package org.dxworks.mathframe.model;

/** Content of an {@code <mo>} element. */
public final class Operator extends LeafNode {

    public Operator(String text) {
        super(text);
    }
}
