package com.herzen.bel.parser.error;

import com.herzen.bel.domain.SourceSpan;

public class PlaceholderAminoAcidException extends InvalidVariantNotationException {
    public PlaceholderAminoAcidException(SourceSpan span, String token) {
        super("Placeholder amino acid '" + token + "' is not a valid residue code", span, token);
    }
}
