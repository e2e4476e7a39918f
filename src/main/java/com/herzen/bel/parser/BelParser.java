package com.herzen.bel.parser;

import com.herzen.bel.config.BelParserProperties;
import com.herzen.bel.domain.Statements.BelStatement;
import com.herzen.bel.domain.Terms.Term;
import com.herzen.bel.parser.error.MalformedTermException;
import com.herzen.bel.parser.modifier.ModifierRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class BelParser {
    private static final Logger log = LoggerFactory.getLogger(BelParser.class);

    private final StatementParser statementParser;
    private final TermParser termParser;

    public BelParser(BelParserProperties properties) {
        ConceptParser conceptParser = new ConceptParser(properties.isAllowNakedNames());
        this.termParser = new TermParser(conceptParser, ModifierRegistry.standard(conceptParser));
        this.statementParser = new StatementParser(termParser, new ControlParser(), properties.isAllowNested());
    }

    public BelStatement parseStatement(String text) {
        BelStatement statement = statementParser.parse(text);
        log.debug("Parsed {} as {}", text, statement.getClass().getSimpleName());
        return statement;
    }

    public Term parseTerm(String text) {
        BelScanner scanner = new BelScanner(text);
        Term term = termParser.parseTerm(scanner);
        if (!scanner.atEnd()) {
            throw new MalformedTermException("Unexpected text after term",
                    scanner.spanOfUpcoming(), scanner.rest());
        }
        return term;
    }
}
