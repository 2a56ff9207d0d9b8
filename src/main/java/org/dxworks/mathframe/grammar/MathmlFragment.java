package org.dxworks.mathframe.grammar;

import org.codehaus.stax2.XMLStreamWriter2;

import javax.xml.stream.XMLStreamException;

/**
 * A piece of MathML that writes itself as stream events.
 */
@FunctionalInterface
public interface MathmlFragment {

    void writeTo(XMLStreamWriter2 writer) throws XMLStreamException;
}
