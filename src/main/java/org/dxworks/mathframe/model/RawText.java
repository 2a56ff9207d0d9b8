package org.dxworks.mathframe.model;

/** Character data found directly inside a container element. */
public final class RawText extends LeafNode {

    public RawText(String text) {
        super(text);
    }
}
