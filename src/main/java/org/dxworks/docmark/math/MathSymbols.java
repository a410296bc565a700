package org.dxworks.docmark.math;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * LaTeX command table shared by both math renderers.
 * Keys are command names without the leading backslash.
 */
public final class MathSymbols {

    private static final Map<String, String> SYMBOLS;

    static {
        Map<String, String> m = new HashMap<>();

        // Greek, lower case
        m.put("alpha", "α");
        m.put("beta", "β");
        m.put("gamma", "γ");
        m.put("delta", "δ");
        m.put("epsilon", "ε");
        m.put("varepsilon", "ε");
        m.put("zeta", "ζ");
        m.put("eta", "η");
        m.put("theta", "θ");
        m.put("vartheta", "ϑ");
        m.put("iota", "ι");
        m.put("kappa", "κ");
        m.put("lambda", "λ");
        m.put("mu", "μ");
        m.put("nu", "ν");
        m.put("xi", "ξ");
        m.put("pi", "π");
        m.put("rho", "ρ");
        m.put("sigma", "σ");
        m.put("tau", "τ");
        m.put("upsilon", "υ");
        m.put("phi", "φ");
        m.put("varphi", "φ");
        m.put("chi", "χ");
        m.put("psi", "ψ");
        m.put("omega", "ω");

        // Greek, upper case
        m.put("Alpha", "Α");
        m.put("Beta", "Β");
        m.put("Gamma", "Γ");
        m.put("Delta", "Δ");
        m.put("Epsilon", "Ε");
        m.put("Zeta", "Ζ");
        m.put("Eta", "Η");
        m.put("Theta", "Θ");
        m.put("Iota", "Ι");
        m.put("Kappa", "Κ");
        m.put("Lambda", "Λ");
        m.put("Mu", "Μ");
        m.put("Nu", "Ν");
        m.put("Xi", "Ξ");
        m.put("Pi", "Π");
        m.put("Rho", "Ρ");
        m.put("Sigma", "Σ");
        m.put("Tau", "Τ");
        m.put("Upsilon", "Υ");
        m.put("Phi", "Φ");
        m.put("Chi", "Χ");
        m.put("Psi", "Ψ");
        m.put("Omega", "Ω");

        // Binary operators
        m.put("times", "×");
        m.put("div", "÷");
        m.put("pm", "±");
        m.put("mp", "∓");
        m.put("cdot", "·");
        m.put("ast", "∗");
        m.put("star", "⋆");
        m.put("circ", "∘");
        m.put("bullet", "•");
        m.put("oplus", "⊕");
        m.put("ominus", "⊖");
        m.put("otimes", "⊗");
        m.put("oslash", "⊘");
        m.put("odot", "⊙");

        // Relations
        m.put("leq", "≤");
        m.put("le", "≤");
        m.put("geq", "≥");
        m.put("ge", "≥");
        m.put("neq", "≠");
        m.put("ne", "≠");
        m.put("approx", "≈");
        m.put("equiv", "≡");
        m.put("sim", "∼");
        m.put("simeq", "≃");
        m.put("cong", "≅");
        m.put("propto", "∝");
        m.put("ll", "≪");
        m.put("gg", "≫");
        m.put("subset", "⊂");
        m.put("supset", "⊃");
        m.put("subseteq", "⊆");
        m.put("supseteq", "⊇");
        m.put("in", "∈");
        m.put("notin", "∉");
        m.put("ni", "∋");

        // Arrows
        m.put("rightarrow", "→");
        m.put("leftarrow", "←");
        m.put("leftrightarrow", "↔");
        m.put("Rightarrow", "⇒");
        m.put("Leftarrow", "⇐");
        m.put("Leftrightarrow", "⇔");
        m.put("uparrow", "↑");
        m.put("downarrow", "↓");
        m.put("to", "→");
        m.put("gets", "←");
        m.put("mapsto", "↦");

        // Big operators and logic
        m.put("infty", "∞");
        m.put("partial", "∂");
        m.put("nabla", "∇");
        m.put("forall", "∀");
        m.put("exists", "∃");
        m.put("nexists", "∄");
        m.put("emptyset", "∅");
        m.put("varnothing", "∅");
        m.put("neg", "¬");
        m.put("lnot", "¬");
        m.put("land", "∧");
        m.put("lor", "∨");
        m.put("cap", "∩");
        m.put("cup", "∪");
        m.put("int", "∫");
        m.put("iint", "∬");
        m.put("iiint", "∭");
        m.put("oint", "∮");
        m.put("sum", "∑");
        m.put("prod", "∏");
        m.put("coprod", "∐");

        // Named functions
        m.put("lim", "lim");
        m.put("limsup", "lim sup");
        m.put("liminf", "lim inf");
        m.put("max", "max");
        m.put("min", "min");
        m.put("sup", "sup");
        m.put("inf", "inf");
        m.put("sin", "sin");
        m.put("cos", "cos");
        m.put("tan", "tan");
        m.put("cot", "cot");
        m.put("sec", "sec");
        m.put("csc", "csc");
        m.put("arcsin", "arcsin");
        m.put("arccos", "arccos");
        m.put("arctan", "arctan");
        m.put("sinh", "sinh");
        m.put("cosh", "cosh");
        m.put("tanh", "tanh");
        m.put("log", "log");
        m.put("ln", "ln");
        m.put("exp", "exp");
        m.put("deg", "deg");
        m.put("det", "det");
        m.put("dim", "dim");
        m.put("ker", "ker");
        m.put("hom", "hom");
        m.put("arg", "arg");
        m.put("gcd", "gcd");

        // Delimiters
        m.put("{", "{");
        m.put("}", "}");
        m.put("lbrace", "{");
        m.put("rbrace", "}");
        m.put("langle", "⟨");
        m.put("rangle", "⟩");
        m.put("lceil", "⌈");
        m.put("rceil", "⌉");
        m.put("lfloor", "⌊");
        m.put("rfloor", "⌋");
        m.put("left", "");
        m.put("right", "");

        // Ellipses
        m.put("ldots", "…");
        m.put("dots", "…");
        m.put("cdots", "⋯");
        m.put("vdots", "⋮");
        m.put("ddots", "⋱");

        // Spacing
        m.put("quad", " ");
        m.put("qquad", "  ");
        m.put("space", " ");
        m.put(",", " ");
        m.put(";", " ");
        m.put(":", " ");
        m.put(" ", " ");

        // Escaped specials
        m.put("%", "%");
        m.put("$", "$");
        m.put("&", "&");
        m.put("#", "#");
        m.put("_", "_");

        SYMBOLS = Collections.unmodifiableMap(m);
    }

    private MathSymbols() {}

    /**
     * Looks up a command by its full name. Callers tokenize the whole command
     * before the lookup, so {@code \in} never matches inside {@code \infty}.
     */
    public static Optional<String> lookup(String command) {
        return Optional.ofNullable(SYMBOLS.get(command));
    }

    /**
     * Resolves a command to its display text, keeping unknown commands as
     * their literal {@code \name} form.
     */
    public static String resolve(String command) {
        return lookup(command).orElse("\\" + command);
    }
}
