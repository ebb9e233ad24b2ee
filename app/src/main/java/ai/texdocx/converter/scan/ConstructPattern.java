package ai.texdocx.converter.scan;

import java.util.Optional;

/**
 * One entry of the construct catalogue.
 */
public interface ConstructPattern {

    ConstructKind kind();

    /**
     * Finds the next construct whose opening token starts at or after {@code from}.
     *
     * <p>An opening token without a valid closing yields a match with {@code closingVerified == false} covering only
     * that token, so callers can report it and keep scanning behind it.
     */
    Optional<ConstructMatch> find(CharSequence text, int from);
}
