package org.pragmatica.cliffs.grammar;

import org.pragmatica.cliffs.error.GrammarException;
import org.pragmatica.cliffs.tree.Flattener;
import org.pragmatica.cliffs.tree.SyntaxNode;
import org.pragmatica.cliffs.tree.SyntaxRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Parser for command syntax specifications.
 *
 * <p>A single pass over the grammar tokens driven by a small state machine. Open scopes
 * (parenthesized sequences, optional sequences, unordered groups, variant groups and their variants)
 * live on a stack of frames; the top frame receives new nodes.
 */
public final class GrammarParser {
    private static final Logger log = LoggerFactory.getLogger(GrammarParser.class);

    private enum State {
        NORMAL,
        BEFORE_PARAM_NAME,
        AFTER_PARAM_NAME,
        BEFORE_PARAM_TYPE,
        AFTER_PARAM_TYPE,
        BEFORE_IDENTIFIER,
        AFTER_TAIL,
        BEFORE_TAIL_END
    }

    private enum FrameKind {
        ROOT("sequence"),
        SEQUENCE("sequence"),
        OPTIONAL("optional_sequence"),
        UNORDERED("unordered_group"),
        GROUP("variant_group"),
        VARIANT("variant");

        private final String nodeName;

        FrameKind(String nodeName) {
            this.nodeName = nodeName;
        }
    }

    private static final class Frame {
        private final FrameKind kind;
        private final List<SyntaxNode> children = new ArrayList<>();
        private final List<SyntaxNode.Sequence> variants = new ArrayList<>();
        private final boolean parenthesized;
        // A tail was placed in this scope, nothing may follow it
        private boolean terminal;

        private Frame(FrameKind kind, boolean parenthesized) {
            this.kind = kind;
            this.parenthesized = parenthesized;
        }

        private SyntaxNode lastChild() {
            return children.isEmpty() ? null : children.get(children.size() - 1);
        }

        private void replaceLastChild(SyntaxNode node) {
            children.set(children.size() - 1, node);
        }
    }

    private final List<GrammarToken> tokens;
    private final CompilerConfig config;
    private final SymbolTable symbols;
    private final Deque<Frame> frames;

    private State state;
    private GrammarToken.Symbol paramName;
    private GrammarToken.Symbol paramType;
    private boolean rawTail;

    private GrammarParser(List<GrammarToken> tokens, CompilerConfig config) {
        this.tokens = tokens;
        this.config = config;
        this.symbols = new SymbolTable();
        this.frames = new ArrayDeque<>();
        this.frames.push(new Frame(FrameKind.ROOT, false));
        this.state = State.NORMAL;
    }

    /**
     * Parse a syntax specification into the root node of its syntax tree.
     *
     * @throws GrammarException when the specification is malformed
     */
    public static SyntaxNode parse(String grammarText) {
        return parse(grammarText, CompilerConfig.DEFAULT);
    }

    /**
     * Parse a syntax specification with custom options.
     *
     * @throws GrammarException when the specification is malformed
     */
    public static SyntaxNode parse(String grammarText, CompilerConfig config) {
        var root = new GrammarParser(GrammarLexer.tokenize(grammarText), config).parseAll();
        return simplify(grammarText, root, config.simplifyMode());
    }

    private SyntaxNode parseAll() {
        for (var token : tokens) {
            if (token instanceof GrammarToken.Eof eof) {
                return finish(eof);
            }
            consume(token);
        }
        throw new IllegalStateException("Token stream is missing its end marker");
    }

    private void consume(GrammarToken token) {
        if (token instanceof GrammarToken.Symbol symbol) {
            onSymbol(symbol);
        } else if (token instanceof GrammarToken.LAngle) {
            expectState(token, State.NORMAL);
            ensureOpen(token);
            state = State.BEFORE_PARAM_NAME;
        } else if (token instanceof GrammarToken.Colon) {
            onColon(token);
        } else if (token instanceof GrammarToken.Ellipsis) {
            expectState(token, State.AFTER_PARAM_NAME);
            rawTail = false;
            state = State.AFTER_TAIL;
        } else if (token instanceof GrammarToken.Star) {
            onStar(token);
        } else if (token instanceof GrammarToken.RAngle) {
            onRAngle(token);
        } else if (token instanceof GrammarToken.Caret || token instanceof GrammarToken.Tilde) {
            onLiteralModifier(token);
        } else if (token instanceof GrammarToken.Pipe) {
            onPipe(token);
        } else if (token instanceof GrammarToken.LParen) {
            open(token, FrameKind.SEQUENCE);
        } else if (token instanceof GrammarToken.RParen) {
            onRParen(token);
        } else if (token instanceof GrammarToken.LBracket) {
            open(token, FrameKind.OPTIONAL);
        } else if (token instanceof GrammarToken.RBracket) {
            onRBracket(token);
        } else if (token instanceof GrammarToken.LBrace) {
            open(token, FrameKind.UNORDERED);
        } else if (token instanceof GrammarToken.RBrace) {
            onRBrace(token);
        } else {
            throw unexpected(token);
        }
    }

    // === Symbols and parameters ===

    private void onSymbol(GrammarToken.Symbol symbol) {
        switch (state) {
            case BEFORE_PARAM_NAME -> {
                paramName = symbol;
                state = State.AFTER_PARAM_NAME;
            }
            case BEFORE_PARAM_TYPE -> {
                paramType = symbol;
                state = State.AFTER_PARAM_TYPE;
            }
            case BEFORE_IDENTIFIER -> {
                assignIdentifier(symbol);
                state = State.NORMAL;
            }
            case NORMAL -> {
                ensureOpen(symbol);
                current().children.add(new SyntaxNode.Literal(symbol.text(), !config.allCaseInsensitive(), false));
            }
            default -> throw unexpected(symbol);
        }
    }

    private void onColon(GrammarToken token) {
        if (state == State.AFTER_PARAM_NAME) {
            state = State.BEFORE_PARAM_TYPE;
            return;
        }
        expectState(token, State.NORMAL);
        var last = current().lastChild();
        if (!(last instanceof SyntaxNode.OptionalSequence) && !(last instanceof SyntaxNode.VariantGroup)) {
            throw unexpected(token, "cannot assign identifier to "
                                    + (last == null ? "nothing" : last.nodeName()));
        }
        state = State.BEFORE_IDENTIFIER;
    }

    private void assignIdentifier(GrammarToken.Symbol symbol) {
        var frame = current();
        var last = frame.lastChild();
        if (last instanceof SyntaxNode.OptionalSequence optional) {
            if (optional.identifier().isPresent() || hasInheritedIdentifier(optional)) {
                throw unexpected(symbol, "optional sequence already has an identifier");
            }
            // [a|b]:id identifies the variant group, as if written [(a|b):id]
            if (optional.children().size() == 1
                && optional.children().get(0) instanceof SyntaxNode.VariantGroup group
                && !group.parenthesized()
                && group.identifier().isEmpty()) {
                var identified = group.withIdentifier(symbols.register(symbol), true);
                frame.replaceLastChild(new SyntaxNode.OptionalSequence(List.of(identified), Optional.empty()));
            } else {
                frame.replaceLastChild(optional.withIdentifier(symbols.register(symbol)));
            }
        } else if (last instanceof SyntaxNode.VariantGroup group) {
            if (group.identifier().isPresent()) {
                throw unexpected(symbol, "variant group already has an identifier");
            }
            frame.replaceLastChild(group.withIdentifier(symbols.register(symbol), false));
        } else {
            throw unexpected(symbol);
        }
    }

    private static boolean hasInheritedIdentifier(SyntaxNode.OptionalSequence optional) {
        return optional.children().size() == 1
               && optional.children().get(0) instanceof SyntaxNode.VariantGroup group
               && group.inheritedIdentifier();
    }

    private void onStar(GrammarToken token) {
        if (state == State.AFTER_PARAM_NAME) {
            // <name*> is the varargs spelling of <name...>
            rawTail = false;
        } else if (state == State.AFTER_TAIL) {
            rawTail = true;
        } else {
            throw unexpected(token);
        }
        state = State.BEFORE_TAIL_END;
    }

    private void onRAngle(GrammarToken token) {
        switch (state) {
            case AFTER_PARAM_NAME, AFTER_PARAM_TYPE -> {
                var type = Optional.ofNullable(paramType).map(GrammarToken.Symbol::text);
                current().children.add(new SyntaxNode.Parameter(symbols.register(paramName), type));
            }
            case AFTER_TAIL, BEFORE_TAIL_END -> {
                var frame = current();
                frame.children.add(new SyntaxNode.Tail(symbols.register(paramName), rawTail));
                frame.terminal = true;
            }
            default -> throw unexpected(token);
        }
        paramName = null;
        paramType = null;
        rawTail = false;
        state = State.NORMAL;
    }

    private void onLiteralModifier(GrammarToken token) {
        expectState(token, State.NORMAL);
        var frame = current();
        if (!(frame.lastChild() instanceof SyntaxNode.Literal literal)) {
            throw unexpected(token, "modifier must follow a literal");
        }
        frame.replaceLastChild(token instanceof GrammarToken.Caret
                               ? literal.withCaseSensitive(false)
                               : literal.withTolerant(true));
    }

    // === Scopes ===

    private void open(GrammarToken token, FrameKind kind) {
        expectState(token, State.NORMAL);
        ensureOpen(token);
        frames.push(new Frame(kind, false));
    }

    private void onPipe(GrammarToken token) {
        expectState(token, State.NORMAL);
        var frame = current();
        if (frame.children.isEmpty()) {
            throw unexpected(token, "empty variant");
        }
        switch (frame.kind) {
            case VARIANT -> {
                closeVariant();
                frames.push(new Frame(FrameKind.VARIANT, false));
            }
            case SEQUENCE -> {
                // (a b|c): the parenthesized sequence becomes a variant group
                frames.pop();
                startGroup(frame, true);
            }
            case ROOT, OPTIONAL -> {
                // a b|c or [a b|c]: the group takes over the children of the current scope
                var first = new Frame(FrameKind.VARIANT, false);
                first.children.addAll(frame.children);
                first.terminal = frame.terminal;
                frame.children.clear();
                frame.terminal = false;
                startGroup(first, false);
            }
            default -> throw unexpected(token, "cannot define variants in " + frame.kind.nodeName
                                               + ", maybe you meant to use parentheses?");
        }
    }

    private void startGroup(Frame firstVariant, boolean parenthesized) {
        var group = new Frame(FrameKind.GROUP, parenthesized);
        group.variants.add(new SyntaxNode.Sequence(firstVariant.children));
        group.terminal = firstVariant.terminal;
        frames.push(group);
        frames.push(new Frame(FrameKind.VARIANT, false));
    }

    private void onRParen(GrammarToken token) {
        expectState(token, State.NORMAL);
        var frame = current();
        if (frame.kind == FrameKind.SEQUENCE) {
            if (frame.children.isEmpty()) {
                throw unexpected(token, "empty sequence");
            }
            close(new SyntaxNode.Sequence(frame.children));
            return;
        }
        if (frame.kind != FrameKind.VARIANT || !enclosingGroup().parenthesized) {
            throw unexpected(token);
        }
        if (frame.children.isEmpty()) {
            throw unexpected(token, "empty variant");
        }
        closeVariant();
        closeGroup();
    }

    private void onRBracket(GrammarToken token) {
        expectState(token, State.NORMAL);
        var frame = current();
        if (frame.kind == FrameKind.VARIANT) {
            if (enclosingGroup().parenthesized || frameBelowGroup().kind != FrameKind.OPTIONAL) {
                throw unexpected(token);
            }
            if (frame.children.isEmpty()) {
                throw unexpected(token, "empty variant");
            }
            closeVariant();
            closeGroup();
            frame = current();
        }
        if (frame.kind != FrameKind.OPTIONAL) {
            throw unexpected(token);
        }
        if (frame.children.isEmpty()) {
            throw unexpected(token, "empty optional sequence");
        }
        close(new SyntaxNode.OptionalSequence(frame.children, Optional.empty()));
    }

    private void onRBrace(GrammarToken token) {
        expectState(token, State.NORMAL);
        var frame = current();
        if (frame.kind != FrameKind.UNORDERED) {
            throw unexpected(token);
        }
        if (frame.children.isEmpty()) {
            throw unexpected(token, "empty unordered group");
        }
        if (frame.terminal && frame.children.size() > 1) {
            throw unexpected(token, "a tail cannot share an unordered group");
        }
        close(new SyntaxNode.UnorderedGroup(frame.children));
    }

    private void closeVariant() {
        var variant = frames.pop();
        var group = current();
        group.variants.add(new SyntaxNode.Sequence(variant.children));
        group.terminal |= variant.terminal;
    }

    private void closeGroup() {
        var group = current();
        close(new SyntaxNode.VariantGroup(group.variants, Optional.empty(), false, group.parenthesized));
    }

    private void close(SyntaxNode node) {
        var frame = frames.pop();
        var parent = current();
        parent.children.add(node);
        parent.terminal |= frame.terminal;
    }

    private SyntaxNode finish(GrammarToken.Eof eof) {
        switch (state) {
            case NORMAL -> {
            }
            case BEFORE_IDENTIFIER -> throw new GrammarException("Missing identifier", eof.text(), eof.span().start());
            default -> throw new GrammarException("Unterminated parameter", eof.text(), eof.span().start());
        }
        // a|b at the top level runs to the end of the specification
        if (current().kind == FrameKind.VARIANT
            && !enclosingGroup().parenthesized
            && frameBelowGroup().kind == FrameKind.ROOT) {
            if (current().children.isEmpty()) {
                throw unexpected(eof, "empty variant");
            }
            closeVariant();
            closeGroup();
        }
        if (frames.size() > 1) {
            throw new GrammarException("Unterminated expression: " + nestingPath());
        }
        var root = frames.pop();
        if (root.children.isEmpty()) {
            throw new GrammarException("Empty syntax specification");
        }
        if (root.children.size() == 1 && config.simplifyMode() != SimplifyMode.NO) {
            return root.children.get(0);
        }
        return new SyntaxNode.Sequence(root.children);
    }

    private static SyntaxNode simplify(String grammarText, SyntaxNode root, SimplifyMode mode) {
        if (mode == SimplifyMode.NO) {
            return root;
        }
        var flat = Flattener.flatten(root);
        switch (mode) {
            case WARN -> {
                if (!flat.equals(root)) {
                    log.info("Syntax \"{}\" can be simplified to \"{}\"", grammarText, SyntaxRenderer.render(flat));
                }
                return root;
            }
            case YES -> {
                if (!flat.equals(root)) {
                    log.info("Syntax \"{}\" simplified to \"{}\"", grammarText, SyntaxRenderer.render(flat));
                }
                return flat;
            }
            default -> {
                return flat;
            }
        }
    }

    // === Helpers ===

    private Frame current() {
        return frames.peek();
    }

    private Frame enclosingGroup() {
        var iterator = frames.iterator();
        iterator.next();
        return iterator.next();
    }

    private Frame frameBelowGroup() {
        var iterator = frames.iterator();
        iterator.next();
        iterator.next();
        return iterator.next();
    }

    private void ensureOpen(GrammarToken token) {
        if (current().terminal) {
            throw unexpected(token, "nothing may follow a tail");
        }
    }

    private void expectState(GrammarToken token, State expected) {
        if (state != expected) {
            throw unexpected(token);
        }
    }

    private String nestingPath() {
        var path = new ArrayList<String>();
        var iterator = frames.descendingIterator();
        while (iterator.hasNext()) {
            var frame = iterator.next();
            if (frame.kind != FrameKind.ROOT) {
                path.add(frame.kind.nodeName);
            }
        }
        return String.join(" > ", path);
    }

    private static GrammarException unexpected(GrammarToken token) {
        return GrammarException.unexpected(token.text(), token.span().start());
    }

    private static GrammarException unexpected(GrammarToken token, String reason) {
        return GrammarException.unexpected(token.text(), token.span().start(), reason);
    }
}
