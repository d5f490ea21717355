package org.ascenoria.content.model;

/**
 * Any record contributed by a content pack.
 * <p>
 * The {@link #key()} is what the merge engine folds on: for entities it is the id,
 * for relation records it is a composite of the endpoints.
 */
public interface ContentRecord {

    /**
     * Returns the merge key of this record, unique within its collection after a valid merge.
     *
     * @return The merge key.
     */
    String key();
}
