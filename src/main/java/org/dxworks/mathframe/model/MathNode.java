package org.dxworks.mathframe.model;

/**
 * Node of the math AST built from MathML and consumed by the OMML serializer.
 * Every node owns its children exclusively; the tree never shares nodes.
 */
public abstract class MathNode {

    /**
     * Concatenated leaf text of this node, looking through {@link Row}s only.
     * Any other construct contributes nothing.
     */
    public abstract String flatText();
}
