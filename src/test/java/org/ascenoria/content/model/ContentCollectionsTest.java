package org.ascenoria.content.model;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class ContentCollectionsTest {

    @Test
    void collectionsAreFoundByName() {
        assertThat(ContentCollections.byName("weapon")).contains(ContentCollections.WEAPONS);
        assertThat(ContentCollections.byName("weapons")).isEmpty();
    }

    @Test
    void relationCollectionIsNotAnEntityCollection() {
        assertThat(ContentCollections.TECHNOLOGY_PREREQUISITES.isEntityCollection()).isFalse();
        assertThat(ContentCollections.TECHNOLOGIES.isEntityCollection()).isTrue();
    }

    @Test
    void prerequisiteKeyCombinesBothEndpoints() {
        assertThat(new TechnologyPrerequisite("tech_a", "tech_b").key()).isEqualTo("tech_a->tech_b");
    }

    @Test
    void prerequisiteKeysStayDistinctWhenEndpointsContainTheSeparator() {
        String left = new TechnologyPrerequisite("a->b", "c").key();
        String right = new TechnologyPrerequisite("a", "b->c").key();

        assertThat(left).isNotEqualTo(right);
        assertThat(TechnologyPrerequisite.keyOf("a\\", ">b")).isNotEqualTo(TechnologyPrerequisite.keyOf("a\\-", "b"));
    }

    @Test
    void collectionNamesAndFilesAreUnique() {
        assertThat(ContentCollections.ALL).extracting(CollectionType::name).doesNotHaveDuplicates();
        assertThat(ContentCollections.ALL).extracting(CollectionType::fileName).doesNotHaveDuplicates();
        assertThat(ContentCollections.byName("planet_surface_type")).contains(ContentCollections.PLANET_SURFACE_TYPES);
        assertThat(ContentCollections.SCANNERS.fileName()).isEqualTo("scanners");
    }

    @Test
    void tileDistributionSumIsARecordCheck() {
        RecordCheck<PlanetSurfaceType> check = ContentCollections.PLANET_SURFACE_TYPES.checks().get(0);
        LocalizedText name = LocalizedText.of("Terran");

        assertThat(check.violation(new PlanetSurfaceType("terran", name, null,
                new TileDistribution(10, 50, 10, 20, 10)))).isEmpty();
        assertThat(check.violation(new PlanetSurfaceType("terran", name, null,
                new TileDistribution(10, 50, 10, 20, 11)))).contains("tile_distribution must sum to 100 (was 101)");
    }

    @Test
    void nonFiniteValuesNeverSatisfyABound() {
        for (FieldConstraint.Bound bound : FieldConstraint.Bound.values()) {
            assertThat(bound.accepts(Double.NaN)).as(bound.name()).isFalse();
            assertThat(bound.accepts(Double.POSITIVE_INFINITY)).as(bound.name()).isFalse();
        }
    }

    @Test
    void boundsAcceptTheirEdges() {
        assertThat(FieldConstraint.Bound.POSITIVE.accepts(0)).isFalse();
        assertThat(FieldConstraint.Bound.NON_NEGATIVE.accepts(0)).isTrue();
        assertThat(FieldConstraint.Bound.UNIT_INTERVAL.accepts(1.0)).isTrue();
        assertThat(FieldConstraint.Bound.UNIT_INTERVAL.accepts(1.01)).isFalse();
    }

    @Test
    void weaponDeclaresItsConstraintsAndTechnologyReference() {
        assertThat(ContentCollections.WEAPONS.constraints())
                .extracting(FieldConstraint::field)
                .contains("damage", "fire_rate", "range", "power_use", "industry_cost");
        assertThat(ContentCollections.WEAPONS.references())
                .singleElement()
                .satisfies(ref -> {
                    assertThat(ref.field()).isEqualTo("unlocked_by_tech_id");
                    assertThat(ref.target()).isEqualTo(ContentCollections.TECHNOLOGIES);
                });
    }
}
