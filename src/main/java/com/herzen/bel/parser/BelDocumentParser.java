package com.herzen.bel.parser;

import com.herzen.bel.config.BelParserProperties;
import com.herzen.bel.parser.ParserDtos.DocumentParseResult;
import com.herzen.bel.parser.ParserDtos.ParseError;
import com.herzen.bel.parser.ParserDtos.ParsedLine;
import com.herzen.bel.parser.error.BelSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.concurrent.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Component
public class BelDocumentParser {
    private static final Logger log = LoggerFactory.getLogger(BelDocumentParser.class);
    static final String UNPARSEABLE = "UNPARSEABLE_STATEMENT";
    private static final Pattern DOCUMENT_PATTERN = Pattern.compile("^SET\\s+DOCUMENT\\s+(\\w+)\\s*=\\s*(.*)$");

    private final BelParser parser;
    private final BelParserProperties properties;

    public BelDocumentParser(BelParser parser, BelParserProperties properties) {
        this.parser = parser;
        this.properties = properties;
    }

    public DocumentParseResult parse(String content, boolean failFast) {
        Map<String, String> metadata = new LinkedHashMap<>();
        List<Line> lines = logicalLines(content == null ? "" : content, metadata);

        ExecutorService executor = Executors.newFixedThreadPool(Math.max(1, properties.getWorkers()));
        List<ParsedLine> statements = new ArrayList<>();
        List<ParseError> errors = new ArrayList<>();
        try {
            List<Future<Outcome>> futures = new ArrayList<>();
            for (Line line : lines) {
                futures.add(executor.submit(() -> parseLine(line)));
            }
            for (int i = 0; i < futures.size(); i++) {
                Outcome outcome = await(futures.get(i));
                if (outcome.error() != null) {
                    errors.add(outcome.error());
                    if (failFast) {
                        log.debug("Stopping at line {} in fail-fast mode", outcome.error().line());
                        futures.subList(i + 1, futures.size()).forEach(f -> f.cancel(true));
                        break;
                    }
                } else {
                    statements.add(outcome.parsed());
                }
            }
        } finally {
            executor.shutdownNow();
        }
        log.debug("Parsed {} of {} statements, {} errors", statements.size(), lines.size(), errors.size());
        return new DocumentParseResult(metadata, statements, errors);
    }

    private Outcome parseLine(Line line) {
        try {
            return new Outcome(new ParsedLine(line.number(), line.text(), parser.parseStatement(line.text())), null);
        } catch (BelSyntaxException e) {
            return new Outcome(null, ParseError.from(e, line.number()));
        } catch (RuntimeException | StackOverflowError e) {
            log.warn("Line {} could not be parsed", line.number(), e);
            return new Outcome(null, ParseError.semantic(UNPARSEABLE, "Statement could not be parsed: " + e, line.number(), null));
        }
    }

    private Outcome await(Future<Outcome> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while parsing document", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Statement parser failed", e.getCause());
        }
    }

    private List<Line> logicalLines(String content, Map<String, String> metadata) {
        List<Line> result = new ArrayList<>();
        String[] raw = content.split("\\R", -1);
        StringBuilder pending = new StringBuilder();
        int pendingLine = -1;

        for (int i = 0; i < raw.length; i++) {
            String trimmed = raw[i].strip();
            if (pending.length() == 0) {
                if (trimmed.isEmpty() || trimmed.startsWith("#")) continue;
                pendingLine = i + 1;
            }
            if (trimmed.endsWith("\\")) {
                pending.append(trimmed, 0, trimmed.length() - 1).append(' ');
                continue;
            }
            pending.append(trimmed);
            accept(pending.toString().strip(), pendingLine, metadata, result);
            pending.setLength(0);
        }
        if (pending.length() > 0) {
            accept(pending.toString().strip(), pendingLine, metadata, result);
        }
        return result;
    }

    private void accept(String text, int line, Map<String, String> metadata, List<Line> result) {
        if (text.startsWith(BelLanguage.DEFINE + " ")) {
            log.debug("Skipping definition at line {}: {}", line, text);
            return;
        }
        Matcher matcher = DOCUMENT_PATTERN.matcher(text);
        if (matcher.matches()) {
            metadata.put(matcher.group(1), unquote(matcher.group(2).strip()));
            return;
        }
        result.add(new Line(line, text));
    }

    private String unquote(String value) {
        if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
            return value.substring(1, value.length() - 1).replace("\\\"", "\"");
        }
        return value;
    }

    private record Line(int number, String text) {}

    private record Outcome(ParsedLine parsed, ParseError error) {}
}
