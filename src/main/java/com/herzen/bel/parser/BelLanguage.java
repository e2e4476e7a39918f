package com.herzen.bel.parser;

import com.herzen.bel.domain.FunctionKind;
import com.herzen.bel.domain.Statements.ProcessKind;

import java.util.Map;
import java.util.Set;

import static java.util.Map.entry;

public final class BelLanguage {
    public static final String SET = "SET";
    public static final String UNSET = "UNSET";
    public static final String ALL = "ALL";
    public static final String DEFINE = "DEFINE";
    public static final String DOCUMENT = "DOCUMENT";
    public static final String CITATION = "Citation";
    public static final String EVIDENCE = "Evidence";
    public static final String SUPPORTING_TEXT = "SupportingText";
    public static final String STATEMENT_GROUP = "STATEMENT_GROUP";

    public static final Map<String, FunctionKind> FUNCTIONS = Map.ofEntries(
            entry("a", FunctionKind.ABUNDANCE),
            entry("abundance", FunctionKind.ABUNDANCE),
            entry("g", FunctionKind.GENE),
            entry("geneAbundance", FunctionKind.GENE),
            entry("r", FunctionKind.RNA),
            entry("rnaAbundance", FunctionKind.RNA),
            entry("m", FunctionKind.MIRNA),
            entry("microRNAAbundance", FunctionKind.MIRNA),
            entry("p", FunctionKind.PROTEIN),
            entry("proteinAbundance", FunctionKind.PROTEIN),
            entry("complex", FunctionKind.COMPLEX),
            entry("complexAbundance", FunctionKind.COMPLEX),
            entry("composite", FunctionKind.COMPOSITE),
            entry("compositeAbundance", FunctionKind.COMPOSITE),
            entry("bp", FunctionKind.BIOLOGICAL_PROCESS),
            entry("biologicalProcess", FunctionKind.BIOLOGICAL_PROCESS),
            entry("o", FunctionKind.PATHOLOGY),
            entry("path", FunctionKind.PATHOLOGY),
            entry("pathology", FunctionKind.PATHOLOGY),
            entry("pop", FunctionKind.POPULATION),
            entry("populationAbundance", FunctionKind.POPULATION),
            entry("rxn", FunctionKind.REACTION),
            entry("reaction", FunctionKind.REACTION)
    );

    public static final Set<String> FUSION_TAGS = Set.of("fus", "fusion");
    public static final Set<String> LOCATION_TAGS = Set.of("loc", "location");
    public static final Set<String> MOLECULAR_ACTIVITY_TAGS = Set.of("ma", "molecularActivity");
    public static final String REACTANTS = "reactants";
    public static final String PRODUCTS = "products";
    public static final String LIST = "list";
    public static final String FROM_LOC = "fromLoc";
    public static final String TO_LOC = "toLoc";

    public static final Map<String, ProcessKind> PROCESS_MODIFIERS = Map.ofEntries(
            entry("act", ProcessKind.ACTIVITY),
            entry("activity", ProcessKind.ACTIVITY),
            entry("deg", ProcessKind.DEGRADATION),
            entry("degradation", ProcessKind.DEGRADATION),
            entry("tloc", ProcessKind.TRANSLOCATION),
            entry("translocation", ProcessKind.TRANSLOCATION),
            entry("sec", ProcessKind.CELL_SECRETION),
            entry("cellSecretion", ProcessKind.CELL_SECRETION),
            entry("surf", ProcessKind.CELL_SURFACE_EXPRESSION),
            entry("cellSurfaceExpression", ProcessKind.CELL_SURFACE_EXPRESSION)
    );

    /** BEL 1.0 activity functions and {@code ma()} values, mapped to the BEL 2.0 default names. */
    public static final Map<String, String> ACTIVITIES = Map.ofEntries(
            entry("catalyticActivity", "cat"),
            entry("cat", "cat"),
            entry("chaperoneActivity", "chap"),
            entry("chap", "chap"),
            entry("gtpBoundActivity", "gtp"),
            entry("gtp", "gtp"),
            entry("kinaseActivity", "kin"),
            entry("kin", "kin"),
            entry("peptidaseActivity", "pep"),
            entry("pep", "pep"),
            entry("phosphataseActivity", "phos"),
            entry("phos", "phos"),
            entry("ribosylationActivity", "ribo"),
            entry("ribo", "ribo"),
            entry("transcriptionalActivity", "tscript"),
            entry("tscript", "tscript"),
            entry("transportActivity", "tport"),
            entry("tport", "tport"),
            entry("molecularActivity", "molecularActivity"),
            entry("guanineNucleotideExchangeFactorActivity", "gef"),
            entry("gef", "gef"),
            entry("gtpaseActivatingProteinActivity", "gap"),
            entry("gap", "gap")
    );

    public static final Map<String, String> PMOD_TYPES = Map.ofEntries(
            entry("Ac", "Ac"),
            entry("acetylation", "Ac"),
            entry("ADPRib", "ADPRib"),
            entry("ADP-ribosylation", "ADPRib"),
            entry("adenosine diphosphoribosyl", "ADPRib"),
            entry("Farn", "Farn"),
            entry("farnesylation", "Farn"),
            entry("Gerger", "Gerger"),
            entry("geranylgeranylation", "Gerger"),
            entry("Glyco", "Glyco"),
            entry("glycosylation", "Glyco"),
            entry("Hy", "Hy"),
            entry("hydroxylation", "Hy"),
            entry("ISG", "ISG"),
            entry("ISGylation", "ISG"),
            entry("ISG15-protein conjugation", "ISG"),
            entry("Me", "Me"),
            entry("methylation", "Me"),
            entry("Me1", "Me1"),
            entry("monomethylation", "Me1"),
            entry("mono-methylation", "Me1"),
            entry("Me2", "Me2"),
            entry("dimethylation", "Me2"),
            entry("di-methylation", "Me2"),
            entry("Me3", "Me3"),
            entry("trimethylation", "Me3"),
            entry("tri-methylation", "Me3"),
            entry("Myr", "Myr"),
            entry("myristoylation", "Myr"),
            entry("Nedd", "Nedd"),
            entry("neddylation", "Nedd"),
            entry("NGlyco", "NGlyco"),
            entry("N-linked glycosylation", "NGlyco"),
            entry("NO", "NO"),
            entry("Nitrosylation", "NO"),
            entry("OGlyco", "OGlyco"),
            entry("O-linked glycosylation", "OGlyco"),
            entry("Palm", "Palm"),
            entry("palmitoylation", "Palm"),
            entry("Ph", "Ph"),
            entry("phosphorylation", "Ph"),
            entry("Sulf", "Sulf"),
            entry("sulfation", "Sulf"),
            entry("sulphation", "Sulf"),
            entry("sulfur addition", "Sulf"),
            entry("sulphur addition", "Sulf"),
            entry("sulfonation", "sulfonation"),
            entry("sulphonation", "sulfonation"),
            entry("Sumo", "Sumo"),
            entry("SUMOylation", "Sumo"),
            entry("Ub", "Ub"),
            entry("ubiquitination", "Ub"),
            entry("ubiquitinylation", "Ub"),
            entry("ubiquitylation", "Ub"),
            entry("UbK48", "UbK48"),
            entry("Lysine 48-linked polyubiquitination", "UbK48"),
            entry("UbK63", "UbK63"),
            entry("Lysine 63-linked polyubiquitination", "UbK63"),
            entry("UbMono", "UbMono"),
            entry("monoubiquitination", "UbMono"),
            entry("UbPoly", "UbPoly"),
            entry("polyubiquitination", "UbPoly"),
            entry("Ox", "Ox"),
            entry("oxidation", "Ox")
    );

    public static final Map<String, String> PMOD_LEGACY = Map.of(
            "P", "Ph",
            "A", "Ac",
            "F", "Farn",
            "G", "Glyco",
            "H", "Hy",
            "M", "Me",
            "R", "ADPRib",
            "S", "Sumo",
            "U", "Ub",
            "O", "Ox"
    );

    public static final Map<String, String> GMOD_TYPES = Map.of(
            "methylation", "Me",
            "Me", "Me",
            "M", "Me"
    );

    public static final Map<String, String> AMINO_ACIDS = Map.ofEntries(
            entry("A", "Ala"),
            entry("R", "Arg"),
            entry("N", "Asn"),
            entry("D", "Asp"),
            entry("C", "Cys"),
            entry("E", "Glu"),
            entry("Q", "Gln"),
            entry("G", "Gly"),
            entry("H", "His"),
            entry("I", "Ile"),
            entry("L", "Leu"),
            entry("K", "Lys"),
            entry("M", "Met"),
            entry("F", "Phe"),
            entry("P", "Pro"),
            entry("S", "Ser"),
            entry("T", "Thr"),
            entry("W", "Trp"),
            entry("Y", "Tyr"),
            entry("V", "Val")
    );

    public static final Set<String> AMINO_ACID_TRIPLES = Set.copyOf(AMINO_ACIDS.values());

    public static final String PLACEHOLDER_AMINO_ACID = "X";

    public static final Set<Character> DNA_NUCLEOTIDES = Set.of('A', 'C', 'G', 'T');
    public static final Set<Character> RNA_NUCLEOTIDES = Set.of('a', 'c', 'g', 'u');

    private BelLanguage() {}
}
