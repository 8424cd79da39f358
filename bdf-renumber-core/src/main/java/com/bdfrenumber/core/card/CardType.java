package com.bdfrenumber.core.card;

import com.bdfrenumber.core.model.Namespace;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

import static com.bdfrenumber.core.card.RewriteRule.defines;
import static com.bdfrenumber.core.card.RewriteRule.field;
import static com.bdfrenumber.core.card.RewriteRule.fields;
import static com.bdfrenumber.core.card.RewriteRule.list;
import static com.bdfrenumber.core.card.RewriteRule.oneOf;
import static com.bdfrenumber.core.card.RewriteRule.strided;
import static com.bdfrenumber.core.card.RewriteRule.weightedGroups;
import static com.bdfrenumber.core.model.Namespace.CONSTRAINT_SET;
import static com.bdfrenumber.core.model.Namespace.CONTACT;
import static com.bdfrenumber.core.model.Namespace.COORDINATE_SYSTEM;
import static com.bdfrenumber.core.model.Namespace.ELEMENT;
import static com.bdfrenumber.core.model.Namespace.LOAD_SET;
import static com.bdfrenumber.core.model.Namespace.MATERIAL;
import static com.bdfrenumber.core.model.Namespace.METHOD;
import static com.bdfrenumber.core.model.Namespace.MPC_SET;
import static com.bdfrenumber.core.model.Namespace.NODE;
import static com.bdfrenumber.core.model.Namespace.OUTPUT_SET;
import static com.bdfrenumber.core.model.Namespace.PROPERTY;
import static com.bdfrenumber.core.model.Namespace.TABLE;

/**
 * Closed set of bulk data card types the renumberer understands.
 *
 * <p>Each type declares the namespace of its primary ID (field 1) and the
 * explicit list of rules for every other field that references an ID. A rule
 * that starts at field 1 takes over the primary ID as well. A type
 * with an empty rule list is primary-only: materials, methods and tables
 * reference nothing else. Types with no primary namespace are keyless when
 * they still reference IDs ({@code SUPORT}) and inert otherwise
 * ({@code PARAM}): inert cards pass through untouched.
 *
 * <p>Card names not listed here are unknown and go through the writer's
 * fallback path verbatim.
 */
public enum CardType {

    // Grid points
    GRID(NODE, field(2, COORDINATE_SYSTEM), field(6, COORDINATE_SYSTEM)),
    SPOINT(NODE, list(1, NODE)),

    // Shells
    CQUAD4(ELEMENT, field(2, PROPERTY), fields(3, 6, NODE), field(7, COORDINATE_SYSTEM)),
    CQUADR(ELEMENT, field(2, PROPERTY), fields(3, 6, NODE), field(7, COORDINATE_SYSTEM)),
    CQUAD8(ELEMENT, field(2, PROPERTY), fields(3, 10, NODE), field(15, COORDINATE_SYSTEM)),
    CTRIA3(ELEMENT, field(2, PROPERTY), fields(3, 5, NODE), field(6, COORDINATE_SYSTEM)),
    CTRIAR(ELEMENT, field(2, PROPERTY), fields(3, 5, NODE), field(6, COORDINATE_SYSTEM)),
    CTRIA6(ELEMENT, field(2, PROPERTY), fields(3, 8, NODE), field(9, COORDINATE_SYSTEM)),
    CSHEAR(ELEMENT, field(2, PROPERTY), fields(3, 6, NODE)),

    // Solids
    CHEXA(ELEMENT, field(2, PROPERTY), list(3, NODE)),
    CPENTA(ELEMENT, field(2, PROPERTY), list(3, NODE)),
    CTETRA(ELEMENT, field(2, PROPERTY), list(3, NODE)),
    CPYRAM(ELEMENT, field(2, PROPERTY), list(3, NODE)),

    // Line elements
    CBAR(ELEMENT, field(2, PROPERTY), fields(3, 5, NODE)),
    CBEAM(ELEMENT, field(2, PROPERTY), fields(3, 5, NODE)),
    CROD(ELEMENT, field(2, PROPERTY), fields(3, 4, NODE)),
    CTUBE(ELEMENT, field(2, PROPERTY), fields(3, 4, NODE)),
    CONROD(ELEMENT, fields(2, 3, NODE), field(4, MATERIAL)),
    CBUSH(ELEMENT, field(2, PROPERTY), fields(3, 5, NODE), field(8, COORDINATE_SYSTEM)),
    CGAP(ELEMENT, field(2, PROPERTY), fields(3, 5, NODE), field(8, COORDINATE_SYSTEM)),
    CVISC(ELEMENT, field(2, PROPERTY), fields(3, 4, NODE)),
    PLOTEL(ELEMENT, fields(2, 3, NODE)),
    CWELD(ELEMENT,
        field(2, PROPERTY),
        field(3, NODE),
        fields(5, 6, NODE),
        field(7, COORDINATE_SYSTEM),
        fields(9, 10, PROPERTY).when(4, "PARTPAT"),
        fields(9, 10, ELEMENT).when(4, "ELEMID", "ELPAT"),
        fields(10, 25, NODE).when(4, "GRIDID")),
    CFAST(ELEMENT,
        field(2, PROPERTY),
        fields(4, 5, PROPERTY).when(3, "PROP"),
        fields(4, 5, ELEMENT).when(3, "ELEM"),
        fields(6, 8, NODE)),

    // Scalar elements
    CELAS1(ELEMENT, field(2, PROPERTY), field(3, NODE), field(5, NODE)),
    CELAS2(ELEMENT, field(3, NODE), field(5, NODE)),
    CELAS3(ELEMENT, field(2, PROPERTY), fields(3, 4, NODE)),
    CELAS4(ELEMENT, fields(3, 4, NODE)),
    CDAMP1(ELEMENT, field(2, PROPERTY), field(3, NODE), field(5, NODE)),
    CDAMP2(ELEMENT, field(3, NODE), field(5, NODE)),
    CDAMP3(ELEMENT, field(2, PROPERTY), fields(3, 4, NODE)),
    CDAMP4(ELEMENT, fields(3, 4, NODE)),

    // Heat transfer surfaces
    CHBDYG(ELEMENT, fields(9, 16, NODE)),
    CHBDYE(ELEMENT, field(2, ELEMENT)),

    // Rigid elements
    RBE2(ELEMENT, field(2, NODE), list(4, NODE)),
    RBE3(ELEMENT, field(3, NODE), weightedGroups(5, NODE)),
    RBAR(ELEMENT, fields(2, 3, NODE)),

    // Masses
    CONM1(ELEMENT, field(2, NODE), field(3, COORDINATE_SYSTEM)),
    CONM2(ELEMENT, field(2, NODE), field(3, COORDINATE_SYSTEM)),
    CMASS1(ELEMENT, field(2, PROPERTY), field(3, NODE), field(5, NODE)),
    CMASS2(ELEMENT, field(3, NODE), field(5, NODE)),
    CMASS3(ELEMENT, field(2, PROPERTY), fields(3, 4, NODE)),
    CMASS4(ELEMENT, fields(3, 4, NODE)),

    // Properties
    PSHELL(PROPERTY, field(2, MATERIAL), field(4, MATERIAL), field(6, MATERIAL), field(11, MATERIAL)),
    PCOMP(PROPERTY, strided(9, 4, MATERIAL)),
    PCOMPG(PROPERTY, strided(10, 8, MATERIAL)),
    PSOLID(PROPERTY, field(2, MATERIAL), field(3, COORDINATE_SYSTEM)),
    PBAR(PROPERTY, field(2, MATERIAL)),
    PBARL(PROPERTY, field(2, MATERIAL)),
    PBEAM(PROPERTY, field(2, MATERIAL)),
    PBEAML(PROPERTY, field(2, MATERIAL)),
    PROD(PROPERTY, field(2, MATERIAL)),
    PTUBE(PROPERTY, field(2, MATERIAL)),
    PSHEAR(PROPERTY, field(2, MATERIAL)),
    PWELD(PROPERTY, field(2, MATERIAL)),
    PLSOLID(PROPERTY, field(2, MATERIAL)),
    PCOMPLS(PROPERTY, field(3, COORDINATE_SYSTEM), strided(10, 8, MATERIAL)),
    PFAST(PROPERTY, field(3, COORDINATE_SYSTEM)),
    // every integer after the PID is a table ID; K, B, GE and KN are skipped as keywords
    PBUSHT(PROPERTY, fields(2, Integer.MAX_VALUE, TABLE)),
    PBUSH(PROPERTY),
    PELAS(PROPERTY),
    PDAMP(PROPERTY),
    PGAP(PROPERTY),
    PVISC(PROPERTY),

    // Materials
    MAT1(MATERIAL),
    MAT2(MATERIAL),
    MAT3(MATERIAL),
    MAT4(MATERIAL),
    MAT5(MATERIAL),
    MAT8(MATERIAL),
    MAT9(MATERIAL),
    MAT10(MATERIAL),
    MAT11(MATERIAL),

    // Coordinate systems
    CORD1R(COORDINATE_SYSTEM, fields(2, 4, NODE), defines(5, COORDINATE_SYSTEM), fields(6, 8, NODE)),
    CORD1C(COORDINATE_SYSTEM, fields(2, 4, NODE), defines(5, COORDINATE_SYSTEM), fields(6, 8, NODE)),
    CORD1S(COORDINATE_SYSTEM, fields(2, 4, NODE), defines(5, COORDINATE_SYSTEM), fields(6, 8, NODE)),
    CORD2R(COORDINATE_SYSTEM, field(2, COORDINATE_SYSTEM)),
    CORD2C(COORDINATE_SYSTEM, field(2, COORDINATE_SYSTEM)),
    CORD2S(COORDINATE_SYSTEM, field(2, COORDINATE_SYSTEM)),
    CORD3G(COORDINATE_SYSTEM, field(7, COORDINATE_SYSTEM)),

    // Constraints
    SPC(CONSTRAINT_SET, field(2, NODE), field(5, NODE)),
    SPC1(CONSTRAINT_SET, list(3, NODE)),
    SPCADD(CONSTRAINT_SET, list(2, CONSTRAINT_SET)),
    MPC(MPC_SET, strided(2, 8, NODE), strided(5, 8, NODE)),
    MPCADD(MPC_SET, list(2, MPC_SET)),
    SUPORT(null, strided(1, 2, NODE)),
    SUPORT1(CONSTRAINT_SET, strided(2, 2, NODE)),

    // Static loads
    FORCE(LOAD_SET, field(2, NODE), field(3, COORDINATE_SYSTEM)),
    MOMENT(LOAD_SET, field(2, NODE), field(3, COORDINATE_SYSTEM)),
    FORCE1(LOAD_SET, field(2, NODE), fields(4, 5, NODE)),
    MOMENT1(LOAD_SET, field(2, NODE), fields(4, 5, NODE)),
    PLOAD(LOAD_SET, fields(3, 6, NODE)),
    PLOAD2(LOAD_SET, list(3, ELEMENT)),
    PLOAD4(LOAD_SET,
        field(2, ELEMENT),
        fields(7, 8, NODE).unless(7, "THRU"),
        field(8, ELEMENT).when(7, "THRU"),
        field(9, COORDINATE_SYSTEM)),
    GRAV(LOAD_SET, field(2, COORDINATE_SYSTEM)),
    RFORCE(LOAD_SET, field(2, NODE), field(3, COORDINATE_SYSTEM)),
    TEMP(LOAD_SET, field(2, NODE), field(4, NODE), field(6, NODE)),
    TEMPD(LOAD_SET),

    // Load combinations
    LOAD(LOAD_SET, strided(4, 2, LOAD_SET)),
    DLOAD(LOAD_SET, strided(4, 2, LOAD_SET)),

    // Dynamic loads
    DAREA(LOAD_SET, field(2, NODE), field(5, NODE)),
    RLOAD1(LOAD_SET, field(2, LOAD_SET), fields(5, 6, TABLE)),
    RLOAD2(LOAD_SET, field(2, LOAD_SET), fields(5, 6, TABLE)),
    TLOAD1(LOAD_SET, field(2, LOAD_SET), field(5, TABLE)),
    TLOAD2(LOAD_SET, field(2, LOAD_SET)),

    // Contact
    BSURF(CONTACT, list(2, ELEMENT)),
    BSURFS(CONTACT,
        strided(9, 4, ELEMENT),
        strided(10, 4, NODE),
        strided(11, 4, NODE),
        strided(12, 4, NODE)),
    BCTSET(CONTACT, strided(2, 8, CONTACT), strided(3, 8, CONTACT)),
    BCTADD(CONTACT, list(2, CONTACT)),
    BCTPARA(CONTACT),
    BCTPARM(CONTACT),
    BCONP(CONTACT, fields(2, 3, CONTACT), field(6, CONTACT), field(8, COORDINATE_SYSTEM)),
    BLSEG(CONTACT, list(2, NODE)),
    BCBODY(CONTACT, field(4, CONTACT)),
    BFRIC(CONTACT),

    // Output sets
    SET1(OUTPUT_SET, oneOf(FieldPath.list(2), NODE, ELEMENT)),
    SET3(OUTPUT_SET,
        list(3, NODE).when(2, "GRID", "POINT"),
        list(3, ELEMENT).when(2, "ELEM"),
        list(3, PROPERTY).when(2, "PROP")),

    // Methods
    EIGRL(METHOD),
    EIGR(METHOD),
    EIGC(METHOD),

    // Tables
    TABLED1(TABLE),
    TABLED2(TABLE),
    TABLED3(TABLE),
    TABLED4(TABLE),
    TABLEM1(TABLE),
    TABLEM2(TABLE),
    TABLEM3(TABLE),
    TABLEM4(TABLE),
    TABDMP1(TABLE),

    // Keyless parameters
    PARAM(null),
    MDLPRM(null);

    private static final Map<String, CardType> BY_NAME = Arrays.stream(values())
        .collect(Collectors.toUnmodifiableMap(CardType::name, Function.identity()));

    private final Namespace primaryNamespace;
    private final List<RewriteRule> rules;

    CardType(Namespace primaryNamespace, RewriteRule... rules) {
        this.primaryNamespace = primaryNamespace;
        this.rules = List.of(rules);
    }

    /**
     * Namespace of the primary ID in field 1.
     *
     * @return primary namespace, or null for keyless and inert types
     */
    public Namespace primaryNamespace() {
        return primaryNamespace;
    }

    /**
     * Reference rules for every field other than the primary ID.
     *
     * @return immutable rule list, possibly empty
     */
    public List<RewriteRule> rules() {
        return rules;
    }

    /**
     * Returns true if cards of this type carry no ID at all.
     *
     * @return true for parameter cards
     */
    public boolean isInert() {
        return primaryNamespace == null && rules.isEmpty();
    }

    /**
     * Returns true if cards of this type reference IDs but define none.
     *
     * @return true for cards such as {@code SUPORT}
     */
    public boolean isKeyless() {
        return primaryNamespace == null && !rules.isEmpty();
    }

    /**
     * Looks up a card type by card name. A trailing large-field {@code *} is ignored.
     *
     * @param cardName card name as written in the deck
     * @return the card type, or empty when the name is unknown
     */
    public static Optional<CardType> fromName(String cardName) {
        if (cardName == null) {
            return Optional.empty();
        }
        String name = cardName.trim().toUpperCase(Locale.ROOT);
        if (name.endsWith("*")) {
            name = name.substring(0, name.length() - 1);
        }
        return Optional.ofNullable(BY_NAME.get(name));
    }
}
