package org.ascenoria.content.model;

/**
 * A record describing one gameplay concept (building, technology, scenario, ...).
 * <p>
 * Entities are identified by a stable, collection-unique string id and carry a
 * localized display name. They are immutable and only ever produced by the content pipeline.
 */
public interface EntityDefinition extends ContentRecord {

    /**
     * @return The stable identifier, unique within the owning collection.
     */
    String id();

    /**
     * @return The localized display name. English is always present.
     */
    LocalizedText name();

    /**
     * @return The localized description, or {@code null} if the entity has none.
     */
    LocalizedText description();

    @Override
    default String key() {
        return id();
    }
}
