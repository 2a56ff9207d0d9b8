package org.dxworks.mathframe;

import java.util.Locale;

public enum DisplayStyle {
    INLINE("inline"),
    DISPLAY("block");

    private final String mathmlValue;

    DisplayStyle(String mathmlValue) {
        this.mathmlValue = mathmlValue;
    }

    /** Value of the {@code display} attribute on the MathML root. */
    public String getMathmlValue() {
        return mathmlValue;
    }

    public static DisplayStyle fromName(String name) {
        if (name == null) {
            return INLINE;
        }
        switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "display":
            case "block":
                return DISPLAY;
            default:
                return INLINE;
        }
    }
}
