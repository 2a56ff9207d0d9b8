package org.dxworks.mathframe.model;

/** Content of an {@code <mn>} element. */
public final class NumberLiteral extends LeafNode {

    public NumberLiteral(String text) {
        super(text);
    }
}
