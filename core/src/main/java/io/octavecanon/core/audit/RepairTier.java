package io.octavecanon.core.audit;

/**
 * Classification of a transformation by how much it may be trusted to preserve meaning.
 */
public enum RepairTier {

    /**
     * Always applied. Changes representation only: Unicode composition, line endings,
     * operator aliases, envelope completion.
     */
    NORMALIZATION,

    /**
     * Applied only when the caller explicitly requests repair. Schema-bounded coercions
     * such as enum case-folding or string-to-number conversion.
     */
    REPAIR,

    /**
     * Never applied under any flag: inventing missing fields, inferring targets. Exists so
     * that such candidates can be classified and reported, never logged as performed.
     */
    FORBIDDEN
}
