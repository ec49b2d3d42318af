package org.pragmatica.latex.tree;

/**
 * The delimiter pair that opened and closed a math span.
 */
public enum MathDelimiter {
    DOLLAR("$", "$", LatexNode.Math.Mode.INLINE),
    DOUBLE_DOLLAR("$$", "$$", LatexNode.Math.Mode.DISPLAY),
    PAREN("\\(", "\\)", LatexNode.Math.Mode.INLINE),
    BRACKET("\\[", "\\]", LatexNode.Math.Mode.DISPLAY);

    private final String open;
    private final String close;
    private final LatexNode.Math.Mode mode;

    MathDelimiter(String open, String close, LatexNode.Math.Mode mode) {
        this.open = open;
        this.close = close;
        this.mode = mode;
    }

    public String open() {
        return open;
    }

    public String close() {
        return close;
    }

    public LatexNode.Math.Mode mode() {
        return mode;
    }
}
