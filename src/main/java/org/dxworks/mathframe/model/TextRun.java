package org.dxworks.mathframe.model;

/** Content of an {@code <mtext>} element. */
public final class TextRun extends LeafNode {

    public TextRun(String text) {
        super(text);
    }
}
