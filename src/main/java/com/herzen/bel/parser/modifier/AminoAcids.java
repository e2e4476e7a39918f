package com.herzen.bel.parser.modifier;

import com.herzen.bel.domain.SourceSpan;
import com.herzen.bel.parser.error.InvalidVariantNotationException;
import com.herzen.bel.parser.error.PlaceholderAminoAcidException;

import static com.herzen.bel.parser.BelLanguage.*;

public final class AminoAcids {
    public static String resolve(String token, SourceSpan span) {
        if (token == null || token.isEmpty()) {
            throw new InvalidVariantNotationException("Expected an amino acid code", span, token);
        }
        if (PLACEHOLDER_AMINO_ACID.equals(token)) {
            throw new PlaceholderAminoAcidException(span, token);
        }
        if (AMINO_ACID_TRIPLES.contains(token)) return token;
        String triple = AMINO_ACIDS.get(token);
        if (triple == null) {
            throw new InvalidVariantNotationException("Unknown amino acid code: " + token, span, token);
        }
        return triple;
    }

    public static boolean isKnown(String token) {
        return token != null && (AMINO_ACID_TRIPLES.contains(token) || AMINO_ACIDS.containsKey(token));
    }

    private AminoAcids() {}
}
