package com.herzen.bel.parser.modifier;

import com.herzen.bel.domain.SourceSpan;
import com.herzen.bel.parser.error.InvalidVariantNotationException;
import com.herzen.bel.parser.error.PlaceholderAminoAcidException;

import java.util.ArrayList;
import java.util.List;

import static com.herzen.bel.parser.BelLanguage.*;

public final class HgvsParser {
    public enum CoordinateSystem {
        PROTEIN('p'),
        CODING_DNA('c'),
        GENOMIC('g'),
        RNA('r'),
        MITOCHONDRIAL('m'),
        NON_CODING('n'),
        UNSPECIFIED(' ');

        private final char prefix;

        CoordinateSystem(char prefix) {
            this.prefix = prefix;
        }

        public char prefix() {
            return prefix;
        }

        static CoordinateSystem fromPrefix(char c) {
            for (CoordinateSystem system : values()) {
                if (system != UNSPECIFIED && system.prefix == c) return system;
            }
            return null;
        }
    }

    public record HgvsNotation(CoordinateSystem system, List<Object> tokens) {
        public HgvsNotation {
            tokens = List.copyOf(tokens);
        }
    }

    public static final String UNCHANGED = "=";
    public static final String UNKNOWN = "?";

    public static HgvsNotation parse(String notation) {
        return parse(notation, 0);
    }

    /** @param offset start of {@code notation} in the enclosing statement, used for error spans */
    public static HgvsNotation parse(String notation, int offset) {
        return new Cursor(notation == null ? "" : notation, offset).notation();
    }

    private static final class Cursor {
        private final String text;
        private final int offset;
        private final List<Object> tokens = new ArrayList<>();
        private int pos;

        Cursor(String text, int offset) {
            this.text = text;
            this.offset = offset;
        }

        HgvsNotation notation() {
            if (text.isEmpty()) throw error("Empty variant notation");
            if (text.equals(UNCHANGED) || text.equals(UNKNOWN)) {
                return new HgvsNotation(CoordinateSystem.UNSPECIFIED, List.of(text));
            }
            if (text.length() < 3 || text.charAt(1) != '.') throw error("Variant must start with a coordinate prefix such as 'p.' or 'c.'");
            CoordinateSystem system = CoordinateSystem.fromPrefix(text.charAt(0));
            if (system == null) throw error("Unknown coordinate system '" + text.charAt(0) + "'");
            pos = 2;

            if (consume(UNCHANGED) || consume(UNKNOWN)) {
                tokens.add(text.substring(2, 3));
            } else if (system == CoordinateSystem.PROTEIN) {
                protein();
            } else {
                nucleotide(system == CoordinateSystem.RNA);
            }
            if (pos != text.length()) throw error("Unexpected text in variant: " + text.substring(pos));
            return new HgvsNotation(system, tokens);
        }

        private void protein() {
            if (Character.isDigit(peek())) {
                tokens.add(integer());
                if (!consume("*")) throw error("Expected '*' after a bare protein position");
                tokens.add("*");
                return;
            }
            tokens.add(aminoAcid());
            tokens.add(integer());
            if (consume("_")) {
                tokens.add(aminoAcid());
                tokens.add(integer());
                if (consume("delins")) {
                    tokens.add("delins");
                    tokens.add(aminoAcidSequence());
                } else if (consume("del")) {
                    tokens.add("del");
                } else if (consume("dup")) {
                    tokens.add("dup");
                } else if (consume("ins")) {
                    tokens.add("ins");
                    tokens.add(aminoAcidSequence());
                } else {
                    throw error("Expected del, dup, ins or delins after a protein range");
                }
                return;
            }
            if (consume("delins")) {
                tokens.add("delins");
                tokens.add(aminoAcidSequence());
            } else if (consume("del")) {
                tokens.add("del");
            } else if (consume("dup")) {
                tokens.add("dup");
            } else if (consume(UNCHANGED) || consume(UNKNOWN) || consume("*")) {
                tokens.add(text.substring(pos - 1, pos));
            } else if (consume("Ter")) {
                tokens.add("*");
            } else {
                tokens.add(aminoAcid());
                if (consume("fs")) {
                    tokens.add("fs");
                    if (consume("*") || consume("Ter")) {
                        tokens.add("*" + (consume(UNKNOWN) ? UNKNOWN : integer().toString()));
                    }
                }
            }
        }

        private void nucleotide(boolean rna) {
            tokens.add(coordinate());
            boolean ranged = consume("_");
            if (ranged) tokens.add(coordinate());

            if (consume("delins")) {
                tokens.add("delins");
                tokens.add(sequence(rna, true));
            } else if (consume("del")) {
                tokens.add("del");
                addOptional(sequence(rna, false));
            } else if (consume("dup")) {
                tokens.add("dup");
                addOptional(sequence(rna, false));
            } else if (consume("ins")) {
                if (!ranged) throw error("Insertion needs a flanking range such as 76_77ins");
                tokens.add("ins");
                tokens.add(sequence(rna, true));
            } else if (consume("inv")) {
                if (!ranged) throw error("Inversion needs a range");
                tokens.add("inv");
            } else if (consume(UNCHANGED)) {
                tokens.add(UNCHANGED);
            } else if (!ranged && isNucleotide(peek(), rna)) {
                tokens.add(String.valueOf(text.charAt(pos++)));
                if (!consume(">")) throw error("Expected '>' in nucleotide substitution");
                tokens.add(">");
                if (!isNucleotide(peek(), rna)) throw error("Expected substituted nucleotide after '>'");
                tokens.add(String.valueOf(text.charAt(pos++)));
            } else {
                throw error("Expected del, dup, ins, delins, inv or a substitution");
            }
        }

        private Object coordinate() {
            int start = pos;
            boolean plain = true;
            if (consume("-") || consume("*")) plain = false;
            integer();
            if (peek() == '+' || peek() == '-') {
                pos++;
                integer();
                plain = false;
            }
            String value = text.substring(start, pos);
            return plain ? Integer.valueOf(value) : value;
        }

        private String aminoAcid() {
            int start = pos;
            if (pos + 3 <= text.length()) {
                String triple = text.substring(pos, pos + 3);
                if (AMINO_ACID_TRIPLES.contains(triple)) {
                    pos += 3;
                    return triple;
                }
            }
            if (pos >= text.length() || !Character.isUpperCase(text.charAt(pos))) {
                throw error("Expected an amino acid code");
            }
            String single = String.valueOf(text.charAt(pos++));
            SourceSpan span = new SourceSpan(offset + start, offset + pos);
            if (PLACEHOLDER_AMINO_ACID.equals(single)) throw new PlaceholderAminoAcidException(span, single);
            return AminoAcids.resolve(single, span);
        }

        private String aminoAcidSequence() {
            StringBuilder sb = new StringBuilder(aminoAcid());
            while (pos < text.length() && Character.isUpperCase(text.charAt(pos))) sb.append(aminoAcid());
            return sb.toString();
        }

        private String sequence(boolean rna, boolean required) {
            int start = pos;
            while (isNucleotide(peek(), rna)) pos++;
            if (start == pos) {
                if (required) throw error("Expected a " + (rna ? "RNA" : "DNA") + " sequence");
                return null;
            }
            return text.substring(start, pos);
        }

        private void addOptional(String value) {
            if (value != null) tokens.add(value);
        }

        private boolean isNucleotide(int c, boolean rna) {
            if (c < 0) return false;
            return rna ? RNA_NUCLEOTIDES.contains((char) c) || c == 'n' : DNA_NUCLEOTIDES.contains((char) c) || c == 'N';
        }

        private Integer integer() {
            int start = pos;
            while (pos < text.length() && Character.isDigit(text.charAt(pos))) pos++;
            if (start == pos) throw error("Expected a position");
            try {
                return Integer.valueOf(text.substring(start, pos));
            } catch (NumberFormatException e) {
                throw error("Position out of range: " + text.substring(start, pos));
            }
        }

        private boolean consume(String literal) {
            if (!text.startsWith(literal, pos)) return false;
            pos += literal.length();
            return true;
        }

        private int peek() {
            return pos < text.length() ? text.charAt(pos) : -1;
        }

        private InvalidVariantNotationException error(String message) {
            int at = Math.min(pos, Math.max(0, text.length() - 1));
            return new InvalidVariantNotationException(message, new SourceSpan(offset + at, offset + at + 1), text);
        }
    }

    private HgvsParser() {}
}
