package com.herzen.bel.parser;

import com.herzen.bel.domain.Concept;
import com.herzen.bel.domain.FunctionKind;
import com.herzen.bel.domain.Modifiers.Modifier;
import com.herzen.bel.domain.Statements.Participant;
import com.herzen.bel.domain.Statements.ProcessKind;
import com.herzen.bel.domain.Statements.ProcessModifier;
import com.herzen.bel.domain.Terms.*;
import com.herzen.bel.parser.error.InvalidModifierException;
import com.herzen.bel.parser.error.MalformedTermException;
import com.herzen.bel.parser.modifier.ModifierGrammar;
import com.herzen.bel.parser.modifier.ModifierRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.herzen.bel.parser.BelLanguage.*;

public class TermParser {
    private static final Logger log = LoggerFactory.getLogger(TermParser.class);
    static final int MAX_DEPTH = 64;
    private static final Pattern FUSION_RANGE = Pattern.compile("([cgrpmn])\\.(\\d+|\\?)_(\\d+|\\?|\\*)");

    private final ConceptParser conceptParser;
    private final ModifierRegistry registry;

    public TermParser(ConceptParser conceptParser, ModifierRegistry registry) {
        this.conceptParser = conceptParser;
        this.registry = registry;
    }

    private record Located(Term term, Concept location) {}

    public Term parseTerm(BelScanner scanner) {
        return unlocated(scanner);
    }

    public Participant parseParticipant(BelScanner scanner) {
        scanner.skipWhitespace();
        int start = scanner.position();
        if (scanner.peekFunctionCall()) {
            String tag = scanner.peekWord();
            ProcessKind kind = PROCESS_MODIFIERS.get(tag);
            if (kind != null) return processModifier(scanner, tag, kind);
            if (ACTIVITIES.containsKey(tag) && !FUNCTIONS.containsKey(tag) && !MOLECULAR_ACTIVITY_TAGS.contains(tag)) {
                return legacyActivity(scanner, tag, start);
            }
        }
        Located located = located(scanner);
        return new Participant(located.term(), null, located.location());
    }

    private Participant processModifier(BelScanner scanner, String tag, ProcessKind kind) {
        scanner.skipWhitespace();
        int start = scanner.position();
        scanner.readWord();
        scanner.consume('(');
        Located inner = located(scanner);
        ProcessModifier modifier = switch (kind) {
            case ACTIVITY -> ProcessModifier.activity(scanner.consume(',') ? molecularActivity(scanner) : null);
            case TRANSLOCATION -> translocation(scanner, start);
            default -> ProcessModifier.of(kind);
        };
        close(scanner, tag);
        return new Participant(inner.term(), modifier, inner.location());
    }

    private Participant legacyActivity(BelScanner scanner, String tag, int start) {
        scanner.readWord();
        scanner.consume('(');
        Located inner = located(scanner);
        close(scanner, tag);
        String activity = ACTIVITIES.get(tag);
        log.debug("Upgrading legacy activity {}() to act(..., ma({}))", tag, activity);
        scanner.warn("LEGACY_ACTIVITY", tag + "() upgraded to act(..., ma(" + activity + "))", scanner.spanFrom(start));
        return new Participant(inner.term(), ProcessModifier.activity(Concept.belDefault(activity)), inner.location());
    }

    private Concept molecularActivity(BelScanner scanner) {
        scanner.skipWhitespace();
        int start = scanner.position();
        String tag = scanner.readWord();
        if (tag == null || !MOLECULAR_ACTIVITY_TAGS.contains(tag) || !scanner.consume('(')) {
            throw new MalformedTermException("Expected ma(...) as the second argument of act()", scanner.spanFrom(start), tag);
        }
        Concept effect;
        if (conceptParser.atQualifiedConcept(scanner)) {
            effect = conceptParser.parse(scanner);
        } else {
            scanner.skipWhitespace();
            int valueStart = scanner.position();
            String value = scanner.readWordOrQuoted();
            String normalized = value == null ? null : ACTIVITIES.get(value);
            if (normalized == null) {
                throw new MalformedTermException("Unknown molecular activity: " + value, scanner.spanFrom(valueStart), value);
            }
            effect = Concept.belDefault(normalized);
        }
        close(scanner, tag);
        return effect;
    }

    private ProcessModifier translocation(BelScanner scanner, int start) {
        if (!scanner.consume(',')) {
            throw new MalformedTermException("tloc() needs fromLoc(...) and toLoc(...)", scanner.spanFrom(start),
                    scanner.text().substring(start, scanner.position()));
        }
        Concept from;
        Concept to;
        if (FROM_LOC.equals(scanner.peekWord())) {
            from = locationArgument(scanner, FROM_LOC);
            expectComma(scanner, TO_LOC + "(...)");
            to = locationArgument(scanner, TO_LOC);
        } else {
            from = conceptParser.parse(scanner);
            expectComma(scanner, "target location");
            to = conceptParser.parse(scanner);
            scanner.warn("LEGACY_TRANSLOCATION", "tloc() without fromLoc()/toLoc() keywords", scanner.spanFrom(start));
        }
        return new ProcessModifier(ProcessKind.TRANSLOCATION, null, from, to);
    }

    private Concept locationArgument(BelScanner scanner, String keyword) {
        scanner.skipWhitespace();
        int start = scanner.position();
        if (!scanner.consumeKeyword(keyword) || !scanner.consume('(')) {
            throw new MalformedTermException("Expected " + keyword + "(...)", scanner.spanFrom(start), scanner.upcomingToken());
        }
        Concept concept = conceptParser.parse(scanner);
        close(scanner, keyword);
        return concept;
    }

    private Term unlocated(BelScanner scanner) {
        scanner.skipWhitespace();
        int start = scanner.position();
        Located located = located(scanner);
        if (located.location() != null) {
            scanner.warn("LOCATION_IGNORED", "loc() on a nested term does not change its identity and is dropped",
                    scanner.spanFrom(start));
        }
        return located.term();
    }

    private Located located(BelScanner scanner) {
        scanner.skipWhitespace();
        int start = scanner.position();
        String tag = scanner.readWord();
        if (tag == null) {
            throw new MalformedTermException("Expected a BEL term", scanner.spanOfUpcoming(), scanner.upcomingToken());
        }
        FunctionKind function = FUNCTIONS.get(tag);
        if (function == null) {
            throw new MalformedTermException("Unknown function: " + tag, scanner.spanFrom(start), tag);
        }
        if (!scanner.consume('(')) {
            throw new MalformedTermException("Expected '(' after " + tag, scanner.spanOfUpcoming(), scanner.upcomingToken());
        }
        if (scanner.enter() > MAX_DEPTH) {
            throw new MalformedTermException("Terms nested deeper than " + MAX_DEPTH + " levels", scanner.spanFrom(start), tag);
        }
        Located located = switch (function) {
            case REACTION -> new Located(reaction(scanner), null);
            case COMPLEX, COMPOSITE -> listOrNamed(scanner, function, tag);
            default -> entity(scanner, function, tag);
        };
        scanner.leave();
        close(scanner, tag);
        return located;
    }

    private Located entity(BelScanner scanner, FunctionKind function, String tag) {
        if (scanner.peekFunctionCall()) {
            String word = scanner.peekWord();
            if (FUSION_TAGS.contains(word) && (function == FunctionKind.PROTEIN || function == FunctionKind.GENE || function == FunctionKind.RNA)) {
                FusionTerm fusion = fusion(scanner, function);
                return new Located(fusion, trailing(scanner, function, tag, null));
            }
            throw new MalformedTermException(word + "(...) cannot precede the concept of " + tag + "()",
                    scanner.spanOfUpcoming(), word);
        }
        Concept concept = conceptParser.parse(scanner);
        List<Modifier> variants = new ArrayList<>();
        Concept location = trailing(scanner, function, tag, variants);
        return new Located(new EntityTerm(function, concept, variants), location);
    }

    /**
     * Arguments after the concept: modifiers allowed for {@code function} followed by an optional
     * {@code loc()}. A null {@code variants} list means no modifiers are accepted.
     */
    private Concept trailing(BelScanner scanner, FunctionKind function, String tag, List<Modifier> variants) {
        Concept location = null;
        while (scanner.consume(',')) {
            scanner.skipWhitespace();
            int start = scanner.position();
            if (location != null) {
                throw new MalformedTermException("loc() must be the last argument of " + tag + "()", scanner.spanOfUpcoming(), scanner.upcomingToken());
            }
            if (!scanner.peekFunctionCall()) {
                throw new MalformedTermException("Expected a modifier or loc() in " + tag + "()", scanner.spanOfUpcoming(), scanner.upcomingToken());
            }
            String argument = scanner.readWord();
            if (LOCATION_TAGS.contains(argument)) {
                if (function.isProcess()) {
                    throw new InvalidModifierException(tag + "() does not take a location", scanner.spanFrom(start), argument);
                }
                location = location(scanner, argument);
                continue;
            }
            Optional<ModifierGrammar> grammar = variants == null ? Optional.empty() : registry.find(function, argument);
            if (grammar.isEmpty()) {
                if (registry.isModifierTag(argument)) {
                    throw new InvalidModifierException(argument + "() is not allowed in " + tag + "()", scanner.spanFrom(start), argument);
                }
                throw new MalformedTermException("Unknown modifier " + argument + "() in " + tag + "()", scanner.spanFrom(start), argument);
            }
            variants.add(grammar.get().parse(scanner, function));
        }
        return location;
    }

    private Concept location(BelScanner scanner, String tag) {
        if (!scanner.consume('(')) {
            throw new MalformedTermException("Expected '(' after " + tag, scanner.spanOfUpcoming(), scanner.upcomingToken());
        }
        Concept concept = conceptParser.parse(scanner);
        close(scanner, tag);
        return concept;
    }

    private FusionTerm fusion(BelScanner scanner, FunctionKind function) {
        String tag = scanner.readWord();
        scanner.consume('(');
        Concept partner5p = conceptParser.parse(scanner);
        expectComma(scanner, "5' range");
        FusionRange range5p = fusionRange(scanner);
        expectComma(scanner, "3' partner");
        Concept partner3p = conceptParser.parse(scanner);
        expectComma(scanner, "3' range");
        FusionRange range3p = fusionRange(scanner);
        close(scanner, tag);
        return new FusionTerm(function, partner5p, range5p, partner3p, range3p);
    }

    private FusionRange fusionRange(BelScanner scanner) {
        scanner.skipWhitespace();
        int start = scanner.position();
        if (scanner.consume('?')) return FusionRange.missing();
        String value = scanner.readQuoted();
        if (value == null) {
            throw new MalformedTermException("Expected a quoted fusion range or '?'", scanner.spanOfUpcoming(), scanner.upcomingToken());
        }
        if (value.equals("?")) return FusionRange.missing();
        Matcher matcher = FUSION_RANGE.matcher(value);
        if (!matcher.matches()) {
            throw new MalformedTermException("Malformed fusion range: " + value, scanner.spanFrom(start), value);
        }
        return new FusionRange(matcher.group(1), matcher.group(2), matcher.group(3));
    }

    private Located listOrNamed(BelScanner scanner, FunctionKind function, String tag) {
        if (scanner.peekIs(')')) {
            throw new MalformedTermException(tag + "() needs members or a concept", scanner.spanOfUpcoming(), tag);
        }
        if (!scanner.peekFunctionCall() || LOCATION_TAGS.contains(scanner.peekWord())) {
            Concept concept = conceptParser.parse(scanner);
            return new Located(EntityTerm.of(function, concept), trailing(scanner, function, tag, null));
        }
        List<Term> members = new ArrayList<>();
        Concept location = null;
        do {
            if (scanner.peekFunctionCall() && LOCATION_TAGS.contains(scanner.peekWord())) {
                location = location(scanner, scanner.readWord());
                if (scanner.peekIs(',')) {
                    throw new MalformedTermException("loc() must be the last argument of " + tag + "()", scanner.spanOfUpcoming(), ",");
                }
                break;
            }
            members.add(unlocated(scanner));
        } while (scanner.consume(','));
        if (members.isEmpty()) {
            throw new MalformedTermException(tag + "() needs at least one member", scanner.spanHere(), tag);
        }
        return new Located(new ListTerm(function, members), location);
    }

    private ReactionTerm reaction(BelScanner scanner) {
        List<Term> reactants = group(scanner, REACTANTS);
        if (!scanner.consume(',')) {
            throw new MalformedTermException("Expected products(...) after reactants(...)", scanner.spanOfUpcoming(), scanner.upcomingToken());
        }
        List<Term> products = group(scanner, PRODUCTS);
        if (scanner.peekIs(',')) {
            throw new MalformedTermException("reaction() takes exactly two groups, reactants(...) then products(...)",
                    scanner.spanOfUpcoming(), ",");
        }
        return new ReactionTerm(reactants, products);
    }

    private List<Term> group(BelScanner scanner, String expected) {
        scanner.skipWhitespace();
        int start = scanner.position();
        String word = scanner.readWord();
        if (!expected.equals(word) || !scanner.consume('(')) {
            throw new MalformedTermException("Expected " + expected + "(...)" + (word == null ? "" : " but found " + word),
                    scanner.spanFrom(start), word == null ? scanner.upcomingToken() : word);
        }
        List<Term> terms = new ArrayList<>();
        if (!scanner.peekIs(')')) {
            do {
                terms.add(unlocated(scanner));
            } while (scanner.consume(','));
        }
        close(scanner, expected);
        return terms;
    }

    private void expectComma(BelScanner scanner, String expected) {
        if (!scanner.consume(',')) {
            throw new MalformedTermException("Expected ',' before " + expected, scanner.spanOfUpcoming(), scanner.upcomingToken());
        }
    }

    private void close(BelScanner scanner, String tag) {
        if (!scanner.consume(')')) {
            throw new MalformedTermException("Expected ')' to close " + tag + "()", scanner.spanOfUpcoming(), scanner.upcomingToken());
        }
    }
}
