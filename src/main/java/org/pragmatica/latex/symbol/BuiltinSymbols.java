package org.pragmatica.latex.symbol;

/**
 * Arities of commonly used LaTeX kernel and package commands.
 */
final class BuiltinSymbols {
    private BuiltinSymbols() {}

    static void seed(SymbolTable table) {
        seedDocumentStructure(table);
        seedTextFormatting(table);
        seedReferences(table);
        seedLayout(table);
        seedMath(table);
        seedDefinitions(table);
        seedEnvironments(table);
    }

    private static void seedDocumentStructure(SymbolTable table) {
        table.defineCommand("documentclass", Arity.of(1, 1))
             .defineCommand("usepackage", Arity.of(1, 1))
             .defineCommand("RequirePackage", Arity.of(1, 1))
             .defineCommand("title", Arity.of(1, 1))
             .defineCommand("author", Arity.of(1, 1))
             .defineCommand("date", Arity.mandatory(1))
             .defineCommand("thanks", Arity.mandatory(1))
             .defineCommand("input", Arity.mandatory(1))
             .defineCommand("include", Arity.mandatory(1))
             .defineCommand("item", Arity.of(1, 0))
             .defineCommand("bibliography", Arity.mandatory(1))
             .defineCommand("bibliographystyle", Arity.mandatory(1))
             .defineCommand("bibitem", Arity.of(1, 1));
        for (var heading : new String[]{"part", "chapter", "section", "subsection", "subsubsection",
                                        "paragraph", "subparagraph"}) {
            table.defineCommand(heading, Arity.of(1, 1))
                 .defineCommand(heading + "*", Arity.mandatory(1));
        }
    }

    private static void seedTextFormatting(SymbolTable table) {
        for (var name : new String[]{"textbf", "textit", "texttt", "textsf", "textrm", "textsc", "textsl",
                                     "textup", "textmd", "textnormal", "emph", "underline", "mbox", "fbox",
                                     "footnotetext", "marginpar", "uppercase", "lowercase",
                                     "MakeUppercase", "MakeLowercase"}) {
            table.defineCommand(name, Arity.mandatory(1));
        }
        table.defineCommand("footnote", Arity.of(1, 1))
             .defineCommand("caption", Arity.of(1, 1))
             .defineCommand("textcolor", Arity.of(1, 2))
             .defineCommand("color", Arity.of(1, 1))
             .defineCommand("colorbox", Arity.of(1, 2))
             .defineCommand("makebox", Arity.of(2, 1))
             .defineCommand("framebox", Arity.of(2, 1))
             .defineCommand("parbox", Arity.of(1, 2))
             .defineCommand("raisebox", Arity.of(2, 2))
             .defineCommand("includegraphics", Arity.of(1, 1))
             .defineCommand("includegraphics*", Arity.of(1, 1));
    }

    private static void seedReferences(SymbolTable table) {
        for (var name : new String[]{"label", "ref", "eqref", "pageref", "autoref", "nameref", "url", "nocite"}) {
            table.defineCommand(name, Arity.mandatory(1));
        }
        table.defineCommand("cite", Arity.of(1, 1))
             .defineCommand("citep", Arity.of(2, 1))
             .defineCommand("citet", Arity.of(2, 1))
             .defineCommand("href", Arity.mandatory(2));
    }

    private static void seedLayout(SymbolTable table) {
        table.defineCommand("\\", Arity.of(1, 0))
             .defineCommand("\\*", Arity.of(1, 0))
             .defineCommand("hspace", Arity.mandatory(1))
             .defineCommand("hspace*", Arity.mandatory(1))
             .defineCommand("vspace", Arity.mandatory(1))
             .defineCommand("vspace*", Arity.mandatory(1))
             .defineCommand("setlength", Arity.mandatory(2))
             .defineCommand("addtolength", Arity.mandatory(2))
             .defineCommand("setcounter", Arity.mandatory(2))
             .defineCommand("addtocounter", Arity.mandatory(2))
             .defineCommand("newcounter", Arity.of(1, 1))
             .defineCommand("pagestyle", Arity.mandatory(1))
             .defineCommand("thispagestyle", Arity.mandatory(1))
             .defineCommand("linebreak", Arity.of(1, 0))
             .defineCommand("pagebreak", Arity.of(1, 0));
    }

    private static void seedMath(SymbolTable table) {
        for (var name : new String[]{"mathbf", "mathrm", "mathit", "mathsf", "mathtt", "mathcal", "mathbb",
                                     "mathfrak", "boldsymbol", "text", "operatorname", "hat", "widehat", "bar",
                                     "vec", "tilde", "widetilde", "dot", "ddot", "overline", "underbrace",
                                     "overbrace", "mathring", "pmod"}) {
            table.defineCommand(name, Arity.mandatory(1));
        }
        table.defineCommand("frac", Arity.mandatory(2))
             .defineCommand("dfrac", Arity.mandatory(2))
             .defineCommand("tfrac", Arity.mandatory(2))
             .defineCommand("binom", Arity.mandatory(2))
             .defineCommand("stackrel", Arity.mandatory(2))
             .defineCommand("overset", Arity.mandatory(2))
             .defineCommand("underset", Arity.mandatory(2))
             .defineCommand("sqrt", Arity.of(1, 1))
             .defineCommand("tag", Arity.mandatory(1))
             .defineCommand("DeclareMathOperator", Arity.mandatory(2))
             .defineCommand("DeclareMathOperator*", Arity.mandatory(2));
    }

    // Definition commands themselves are parsed by MacroDefinitions; these entries keep
    // them visible to \let and to callers inspecting the table.
    private static void seedDefinitions(SymbolTable table) {
        for (var name : new String[]{"newcommand", "renewcommand", "providecommand", "DeclareRobustCommand"}) {
            table.defineCommand(name, Arity.of(2, 2))
                 .defineCommand(name + "*", Arity.of(2, 2));
        }
        for (var name : new String[]{"newenvironment", "renewenvironment"}) {
            table.defineCommand(name, Arity.of(2, 3))
                 .defineCommand(name + "*", Arity.of(2, 3));
        }
    }

    private static void seedEnvironments(SymbolTable table) {
        table.defineEnvironment("tabular", Arity.of(1, 1))
             .defineEnvironment("tabular*", Arity.of(1, 2))
             .defineEnvironment("tabularx", Arity.of(1, 2))
             .defineEnvironment("array", Arity.of(1, 1))
             .defineEnvironment("minipage", Arity.of(3, 1))
             .defineEnvironment("figure", Arity.of(1, 0))
             .defineEnvironment("figure*", Arity.of(1, 0))
             .defineEnvironment("table", Arity.of(1, 0))
             .defineEnvironment("table*", Arity.of(1, 0))
             .defineEnvironment("thebibliography", Arity.mandatory(1))
             .defineEnvironment("list", Arity.mandatory(2))
             .defineEnvironment("alignat", Arity.mandatory(1))
             .defineEnvironment("alignat*", Arity.mandatory(1))
             .defineEnvironment("subfigure", Arity.of(1, 1))
             .defineEnvironment("wrapfigure", Arity.of(1, 2));
    }
}
