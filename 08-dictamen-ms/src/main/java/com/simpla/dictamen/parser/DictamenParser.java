package com.simpla.dictamen.parser;

import com.simpla.dictamen.config.HeuristicsConfig;
import com.simpla.dictamen.lexer.DictamenTokenizer;
import com.simpla.dictamen.lexer.LineToken;
import com.simpla.dictamen.model.Operation;
import com.simpla.dictamen.normalizer.LineNormalizer;
import com.simpla.dictamen.resolver.LawNumberResolver;
import com.simpla.dictamen.resolver.TargetResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Entry point of the dictamen parser: raw PDF lines in, resolved operations out.
 * Never throws on malformed text; unresolved laws and targets are left for the audit to report.
 */
public class DictamenParser {

    private static final Logger LOG = LoggerFactory.getLogger(DictamenParser.class);

    private final LineNormalizer normalizer;
    private final DictamenTokenizer tokenizer;
    private final TargetResolver targetResolver;
    private final LawNumberResolver lawResolver;

    public DictamenParser() {
        this(HeuristicsConfig.defaults());
    }

    public DictamenParser(HeuristicsConfig config) {
        this.normalizer = new LineNormalizer();
        this.tokenizer = new DictamenTokenizer();
        this.targetResolver = new TargetResolver();
        this.lawResolver = new LawNumberResolver(config);
    }

    public ParsedDictamen parse(List<String> rawLines) {
        List<String> lines = normalizer.normalize(rawLines);
        List<LineToken> tokens = tokenizer.tokenize(lines);
        List<Operation> operations = new OperationStateMachine(targetResolver).run(tokens);
        for (Operation operation : operations) {
            lawResolver.resolve(operation);
        }

        long unresolved = operations.stream().filter(op -> op.getTarget() == null).count();
        long unknownLaw = operations.stream().filter(op -> LawNumberResolver.UNKNOWN.equals(op.getLawNumber())).count();
        LOG.info("Parsed {} operations from {} lines ({} without target, {} with unknown law)",
                operations.size(), rawLines.size(), unresolved, unknownLaw);
        return new ParsedDictamen(lines, operations);
    }

    public TargetResolver getTargetResolver() {
        return targetResolver;
    }

    public LawNumberResolver getLawResolver() {
        return lawResolver;
    }
}
