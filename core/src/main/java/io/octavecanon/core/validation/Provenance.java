package io.octavecanon.core.validation;

/** Where a value returned by {@link FieldReader} came from. */
public enum Provenance {
    /** Written in the document. */
    PRESENT,
    /** Not in the document; the schema default was returned. */
    DEFAULTED,
    /** Not in the document and no default exists. */
    ABSENT
}
