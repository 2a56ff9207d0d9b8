package org.dxworks.mathframe.grammar;

import org.dxworks.mathframe.DisplayStyle;

/**
 * Converts normalized LaTeX into a MathML document string.
 * <p>
 * Implementations must be reentrant; the converter calls them from several threads at once.
 */
public interface GrammarEngine {

    /**
     * @return a MathML string whose root element is {@code <math>}
     * @throws GrammarException when the input uses an unknown command or environment, or is malformed
     */
    String toMathml(String normalizedLatex, DisplayStyle style);
}
