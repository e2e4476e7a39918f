package com.herzen.bel.parser.modifier;

import com.herzen.bel.domain.FunctionKind;
import com.herzen.bel.domain.Modifiers.Fragment;
import com.herzen.bel.parser.BelScanner;
import com.herzen.bel.parser.error.InvalidModifierException;

import java.math.BigInteger;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class FragmentGrammar extends AbstractModifierGrammar {
    private static final Pattern RANGE = Pattern.compile("(\\d+|\\?)_(\\d+|\\?|\\*)");

    @Override
    public Set<String> tags() {
        return Set.of("frag", "fragment");
    }

    @Override
    protected String name() {
        return "frag";
    }

    @Override
    public Fragment parse(BelScanner scanner, FunctionKind function) {
        open(scanner);
        scanner.skipWhitespace();
        int start = scanner.position();
        String range = scanner.peekRaw() == '"'
                ? scanner.readQuoted()
                : scanner.readWhile(c -> Character.isDigit(c) || c == '_' || c == '?' || c == '*');
        if (range == null) {
            throw new InvalidModifierException("frag expects a range such as \"5_20\" or \"?\"", scanner.spanOfUpcoming(), scanner.upcomingToken());
        }
        String description = null;
        if (scanner.consume(',')) {
            description = word(scanner, "a description");
        }
        close(scanner, 2);

        if (Fragment.UNKNOWN.equals(range)) {
            return new Fragment(null, null, description);
        }
        Matcher matcher = RANGE.matcher(range);
        if (!matcher.matches()) {
            throw new InvalidModifierException("Malformed fragment range: " + range, scanner.spanFrom(start), range);
        }
        String from = matcher.group(1);
        String to = matcher.group(2);
        if (!from.equals(Fragment.UNKNOWN) && to.chars().allMatch(Character::isDigit)
                && new BigInteger(from).compareTo(new BigInteger(to)) > 0) {
            throw new InvalidModifierException("Fragment start " + from + " is after its stop " + to, scanner.spanFrom(start), range);
        }
        return new Fragment(from, to, description);
    }
}
