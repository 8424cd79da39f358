package com.bdfrenumber.core.writer;

import com.bdfrenumber.core.card.CardType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Order in which card types are written within each output file.
 *
 * <p>Known types missing from the order are still written, by the writer's
 * fallback path, after the ordered sections.
 *
 * @param sections sections in write order
 */
public record SectionOrder(List<Section> sections) {

    /**
     * Compact constructor with validation.
     */
    public SectionOrder {
        Objects.requireNonNull(sections, "sections must not be null");
        sections = List.copyOf(sections);
    }

    /**
     * A named group of card types.
     *
     * @param title section name
     * @param types card types in write order
     */
    public record Section(String title, List<CardType> types) {

        /**
         * Compact constructor with validation.
         */
        public Section {
            Objects.requireNonNull(title, "title must not be null");
            types = types == null ? List.of() : List.copyOf(types);
        }
    }

    /**
     * Standard order: coordinate systems, nodes, elements, heat transfer
     * surfaces, rigid elements, masses, properties, materials, loads, load combinations, dynamic loads,
     * constraints, contact, sets, methods, tables.
     *
     * @return the standard section order
     */
    public static SectionOrder standard() {
        return new SectionOrder(List.of(
            section("Coordinate systems", CardType.CORD2R, CardType.CORD2C, CardType.CORD2S,
                CardType.CORD1R, CardType.CORD1C, CardType.CORD1S, CardType.CORD3G),
            section("Nodes", CardType.GRID, CardType.SPOINT),
            section("Elements", CardType.CHEXA, CardType.CPENTA, CardType.CTETRA, CardType.CPYRAM,
                CardType.CQUAD4, CardType.CQUAD8, CardType.CTRIA3, CardType.CTRIA6, CardType.CQUADR, CardType.CTRIAR,
                CardType.CSHEAR, CardType.CBAR, CardType.CBEAM, CardType.CROD, CardType.CTUBE, CardType.CONROD,
                CardType.CBUSH, CardType.CELAS1, CardType.CELAS2, CardType.CELAS3, CardType.CELAS4,
                CardType.CDAMP1, CardType.CDAMP2, CardType.CDAMP3, CardType.CDAMP4, CardType.CGAP, CardType.CVISC,
                CardType.CWELD, CardType.CFAST, CardType.PLOTEL),
            section("Heat transfer", CardType.CHBDYG, CardType.CHBDYE),
            section("Rigid elements", CardType.RBE2, CardType.RBE3, CardType.RBAR),
            section("Masses", CardType.CONM1, CardType.CONM2, CardType.CMASS1, CardType.CMASS2,
                CardType.CMASS3, CardType.CMASS4),
            section("Properties", CardType.PSHELL, CardType.PCOMP, CardType.PCOMPG, CardType.PSOLID,
                CardType.PLSOLID, CardType.PCOMPLS, CardType.PBAR, CardType.PBARL, CardType.PBEAM, CardType.PBEAML,
                CardType.PROD, CardType.PTUBE, CardType.PBUSH, CardType.PBUSHT, CardType.PELAS, CardType.PDAMP,
                CardType.PGAP, CardType.PSHEAR, CardType.PWELD, CardType.PFAST, CardType.PVISC),
            section("Materials", CardType.MAT1, CardType.MAT2, CardType.MAT3, CardType.MAT4, CardType.MAT5,
                CardType.MAT8, CardType.MAT9, CardType.MAT10, CardType.MAT11),
            section("Loads", CardType.FORCE, CardType.MOMENT, CardType.FORCE1, CardType.MOMENT1, CardType.PLOAD,
                CardType.PLOAD2, CardType.PLOAD4, CardType.GRAV, CardType.RFORCE, CardType.TEMP, CardType.TEMPD,
                CardType.DAREA),
            section("Load combinations", CardType.LOAD, CardType.DLOAD),
            section("Dynamic loads", CardType.RLOAD1, CardType.RLOAD2, CardType.TLOAD1, CardType.TLOAD2),
            section("Constraints", CardType.SPC, CardType.SPC1, CardType.SPCADD, CardType.MPC, CardType.MPCADD,
                CardType.SUPORT, CardType.SUPORT1),
            section("Contact", CardType.BSURF, CardType.BSURFS, CardType.BCTSET, CardType.BCTADD, CardType.BCONP,
                CardType.BCBODY, CardType.BCTPARA, CardType.BCTPARM, CardType.BLSEG, CardType.BFRIC),
            section("Sets", CardType.SET1, CardType.SET3),
            section("Methods", CardType.EIGRL, CardType.EIGR, CardType.EIGC),
            section("Tables", CardType.TABLED1, CardType.TABLED2, CardType.TABLED3, CardType.TABLED4,
                CardType.TABLEM1, CardType.TABLEM2, CardType.TABLEM3, CardType.TABLEM4, CardType.TABDMP1)
        ));
    }

    /**
     * Returns a copy of this order without the given card types.
     *
     * @param removed card types to drop
     * @return reduced order
     */
    public SectionOrder without(CardType... removed) {
        Set<CardType> drop = Set.of(removed);
        List<Section> kept = new ArrayList<>();
        for (Section section : sections) {
            kept.add(new Section(section.title(),
                section.types().stream().filter(type -> !drop.contains(type)).toList()));
        }
        return new SectionOrder(kept);
    }

    /**
     * Returns true if the card type has a place in this order.
     *
     * @param type card type
     * @return true if some section lists the type
     */
    public boolean contains(CardType type) {
        return sections.stream().anyMatch(section -> section.types().contains(type));
    }

    private static Section section(String title, CardType... types) {
        return new Section(title, Arrays.asList(types));
    }
}
