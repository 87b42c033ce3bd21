package dev.blanke.cobfuscator.analysis.scope;

/**
 * The disjoint identifier universes of C, in each of which redeclaration and shadowing rules are enforced
 * independently.
 */
public enum NameSpace {

    /**
     * Variables, functions, typedef names and enumeration constants.
     */
    ORDINARY,

    /**
     * Tags of structures, unions and enumerations.
     */
    TAG,

    /**
     * Members of structures and unions. Each aggregate has a namespace of its own.
     */
    MEMBER,

    /**
     * Labels, which are function-wide and cannot be shadowed.
     */
    LABEL
}
