package com.simpla.dictamen.parser;

import com.simpla.dictamen.lexer.DictamenPatterns;
import com.simpla.dictamen.lexer.LineToken;
import com.simpla.dictamen.lexer.TokenType;
import com.simpla.dictamen.model.Action;
import com.simpla.dictamen.model.Operation;
import com.simpla.dictamen.resolver.TargetResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Finite-state machine over the token stream that opens, fills and seals {@link Operation}s.
 * Each state has a table of token handlers; a token with no handler in the current state is ignored.
 * Instances keep per-run state and are not thread-safe.
 */
public class OperationStateMachine {

    private static final Logger LOG = LoggerFactory.getLogger(OperationStateMachine.class);

    public static final int MAX_INTERMEDIATE_LINES = 6;
    public static final String NO_TITLE = "SIN_TITULO";

    @FunctionalInterface
    interface Transition {
        ParserState apply(LineToken token, LineToken next);
    }

    private final TargetResolver targetResolver;
    private final Map<ParserState, Map<TokenType, Transition>> table = new EnumMap<>(ParserState.class);

    private ParserState state;
    private Operation current;
    private List<String> captured;
    private String titleContext;
    private List<Operation> sealed;

    public OperationStateMachine(TargetResolver targetResolver) {
        this.targetResolver = targetResolver;
        for (ParserState s : ParserState.values()) {
            Map<TokenType, Transition> row = new EnumMap<>(TokenType.class);
            row.put(TokenType.OPERATION_HEADER, this::openOperation);
            row.put(TokenType.TITLE_HEADING, this::enterTitle);
            table.put(s, row);
        }

        Map<TokenType, Transition> header = table.get(ParserState.HEADER_CAPTURE);
        header.put(TokenType.TRIGGER, this::startBodyAfterTrigger);
        header.put(TokenType.ARTICLE_HEADER, this::headerLineInHeader);
        header.put(TokenType.PLAIN_TEXT, this::plainLineInHeader);

        Map<TokenType, Transition> body = table.get(ParserState.BODY_CAPTURE);
        body.put(TokenType.STRUCTURAL_HEADING, this::closeOnStructure);
        body.put(TokenType.TRIGGER, this::captureLine);
        body.put(TokenType.ARTICLE_HEADER, this::captureLine);
        body.put(TokenType.PLAIN_TEXT, this::captureLine);
        body.put(TokenType.BLANK, this::captureBlank);
    }

    public List<Operation> run(List<LineToken> tokens) {
        state = ParserState.IDLE;
        current = null;
        captured = new ArrayList<>();
        titleContext = NO_TITLE;
        sealed = new ArrayList<>();

        for (int i = 0; i < tokens.size(); i++) {
            LineToken token = tokens.get(i);
            LineToken next = i + 1 < tokens.size() ? tokens.get(i + 1) : null;
            Transition transition = table.get(state).get(token.getType());
            if (transition != null) {
                ParserState target = transition.apply(token, next);
                if (target != state) {
                    LOG.debug("{} -> {} on {}", state, target, token);
                }
                state = target;
            }
        }
        sealCurrent();
        state = ParserState.IDLE;

        LOG.debug("State machine produced {} operations", sealed.size());
        return sealed;
    }

    ParserState getState() {
        return state;
    }

    private ParserState openOperation(LineToken token, LineToken next) {
        sealCurrent();
        current = Operation.open(token.getArticleNumber(), token.getText(), token.getAction(), titleContext);
        captured = new ArrayList<>();
        if (token.hasTrigger()) {
            addCaptured(token.textAfterTrigger());
            return ParserState.BODY_CAPTURE;
        }
        return ParserState.HEADER_CAPTURE;
    }

    private ParserState enterTitle(LineToken token, LineToken next) {
        sealCurrent();
        titleContext = token.getTitleNumber();
        return ParserState.IDLE;
    }

    private ParserState closeOnStructure(LineToken token, LineToken next) {
        sealCurrent();
        return ParserState.IDLE;
    }

    private ParserState startBodyAfterTrigger(LineToken token, LineToken next) {
        addIntermediate(token.textBeforeTrigger());
        addCaptured(token.textAfterTrigger());
        return ParserState.BODY_CAPTURE;
    }

    private ParserState headerLineInHeader(LineToken token, LineToken next) {
        if (token.hasTrigger()) {
            return startBodyAfterTrigger(token, next);
        }
        // without a trigger only an incorporation starts its body at the new article's header
        if (current.getAction() == Action.INCORPORATES) {
            addCaptured(token.getText());
            return ParserState.BODY_CAPTURE;
        }
        addIntermediate(token.getText());
        return ParserState.HEADER_CAPTURE;
    }

    private ParserState plainLineInHeader(LineToken token, LineToken next) {
        if (current.getAction() == Action.INCORPORATES && looksLikeProse(token, next)) {
            addCaptured(token.getText());
            return ParserState.BODY_CAPTURE;
        }
        addIntermediate(token.getText());
        return ParserState.HEADER_CAPTURE;
    }

    private ParserState captureLine(LineToken token, LineToken next) {
        addCaptured(token.getText());
        return ParserState.BODY_CAPTURE;
    }

    private ParserState captureBlank(LineToken token, LineToken next) {
        if (!captured.isEmpty() && !captured.get(captured.size() - 1).isEmpty()) {
            captured.add("");
        }
        return ParserState.BODY_CAPTURE;
    }

    private static boolean looksLikeProse(LineToken token, LineToken next) {
        if (DictamenPatterns.PURE_NUMBER.matcher(token.getText()).matches()) {
            return false;
        }
        if (next == null) {
            return false;
        }
        TokenType type = next.getType();
        return type != TokenType.BLANK && type != TokenType.STRUCTURAL_HEADING && type != TokenType.TITLE_HEADING;
    }

    private void addCaptured(String line) {
        String text = line.trim();
        if (!text.isEmpty()) {
            captured.add(text);
        }
    }

    private void addIntermediate(String line) {
        String text = line.trim();
        if (!text.isEmpty() && current.getIntermediateText().size() < MAX_INTERMEDIATE_LINES) {
            current.addIntermediateLine(text);
        }
    }

    private void sealCurrent() {
        if (current == null) {
            return;
        }
        current.seal(captured);
        targetResolver.resolve(current);
        sealed.add(current);
        LOG.debug("Sealed dictamen article {} ({}) -> {}", current.getDictamenArticle(),
                current.getAction(), current.getTarget());
        current = null;
        captured = new ArrayList<>();
    }
}
