package io.octavecanon.core.error;

/**
 * Raised when a literal zone's content hash differs before and after a pipeline stage.
 * Literal zones are never modified, so this always indicates a defect in the engine
 * rather than a problem with the input.
 */
public final class LiteralZoneIntegrityException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    private final String location;

    public LiteralZoneIntegrityException(String location, String preHash, String postHash) {
        super("Literal zone at " + location + " changed during repair: pre=" + preHash + " post=" + postHash);
        this.location = location;
    }

    public LiteralZoneIntegrityException(String message) {
        super(message);
        this.location = null;
    }

    /** Path of the zone whose content changed, or {@code null} for count mismatches. */
    public String location() {
        return location;
    }
}
