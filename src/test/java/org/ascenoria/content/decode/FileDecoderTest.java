package org.ascenoria.content.decode;

import org.ascenoria.content.api.ContentParseException;
import org.ascenoria.content.api.ContentSchemaException;
import org.ascenoria.content.model.BuildableOn;
import org.ascenoria.content.model.ContentCollections;
import org.ascenoria.content.model.OrbitalItem;
import org.ascenoria.content.model.PlanetSurfaceType;
import org.ascenoria.content.model.SpecialBehavior;
import org.ascenoria.content.model.SurfaceBuilding;
import org.ascenoria.content.model.TechnologyPrerequisite;
import org.ascenoria.content.model.TileDistribution;
import org.ascenoria.content.model.VictoryRules;
import org.ascenoria.content.sources.ModDescriptor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.ascenoria.content.ContentFixtures.building;
import static org.ascenoria.content.ContentFixtures.write;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class FileDecoderTest {

    @TempDir
    Path dir;

    private FileDecoder decoder;

    @BeforeEach
    void setUp() {
        decoder = new FileDecoder();
    }

    @Test
    void decodesTomlRecordsInFileOrder() throws Exception {
        // given
        Path file = dir.resolve("surface_buildings.toml");
        write(file, building("housing", 5) + building("farm", 3));

        // when
        List<SurfaceBuilding> buildings = decoder.decodeCollection(file, ContentCollections.SURFACE_BUILDINGS);

        // then
        assertThat(buildings).extracting(SurfaceBuilding::id).containsExactly("housing", "farm");
        SurfaceBuilding housing = buildings.get(0);
        assertThat(housing.productionCost()).isEqualTo(5);
        assertThat(housing.buildableOn()).isEqualTo(BuildableOn.WHITE);
        assertThat(housing.specialBehavior()).isEqualTo(SpecialBehavior.NONE);
        assertThat(housing.yieldsHousing()).isEqualTo(1);
        assertThat(housing.yieldsFood()).isZero();
        assertThat(housing.unlockedByTech()).isEmpty();
        assertThat(housing.name().get("ru")).isEqualTo("housing");
    }

    @Test
    void jsonAndTomlDecodeToEqualRecords() throws Exception {
        Path toml = dir.resolve("a/surface_buildings.toml");
        write(toml, building("housing", 5));
        Path json = dir.resolve("b/surface_buildings.json");
        write(json, """
                {"surface_building": [{
                  "id": "housing",
                  "name": {"en": "housing", "ru": "housing"},
                  "buildable_on": "white",
                  "production_cost": 5,
                  "yields_housing": 1
                }]}
                """);

        assertThat(decoder.decodeCollection(json, ContentCollections.SURFACE_BUILDINGS))
                .isEqualTo(decoder.decodeCollection(toml, ContentCollections.SURFACE_BUILDINGS));
    }

    @Test
    void plainStringNameIsEnglish() throws Exception {
        Path file = dir.resolve("technologies.toml");
        write(file, """
                [[technology]]
                id = "tech_basic"
                name = "Basic"
                science_cost = 10
                """);

        assertThat(decoder.decodeCollection(file, ContentCollections.TECHNOLOGIES))
                .singleElement()
                .satisfies(tech -> assertThat(tech.name().english()).isEqualTo("Basic"));
    }

    @Test
    void malformedSyntaxIsAParseError() {
        Path file = dir.resolve("surface_buildings.toml");
        write(file, "[[surface_building]\nid = \"housing\n");

        assertThatThrownBy(() -> decoder.decodeCollection(file, ContentCollections.SURFACE_BUILDINGS))
                .isInstanceOf(ContentParseException.class);
    }

    @Test
    void missingRequiredFieldIsASchemaError() {
        Path file = dir.resolve("surface_buildings.toml");
        write(file, """
                [[surface_building]]
                id = "housing"
                name = "Housing"
                buildable_on = "white"
                """);

        assertThatThrownBy(() -> decoder.decodeCollection(file, ContentCollections.SURFACE_BUILDINGS))
                .isInstanceOf(ContentSchemaException.class)
                .hasMessageContaining("surface_building[0]")
                .hasMessageContaining("production_cost");
    }

    @Test
    void unknownFieldIsASchemaError() {
        Path file = dir.resolve("surface_buildings.toml");
        write(file, building("housing", 5).replace("yields_housing = 1", "yields_gold = 1"));

        assertThatThrownBy(() -> decoder.decodeCollection(file, ContentCollections.SURFACE_BUILDINGS))
                .isInstanceOf(ContentSchemaException.class)
                .hasMessageContaining("yields_gold");
    }

    @Test
    void quotedNumberIsNotCoerced() {
        Path file = dir.resolve("surface_buildings.toml");
        write(file, building("housing", 5).replace("production_cost = 5", "production_cost = \"5\""));

        assertThatThrownBy(() -> decoder.decodeCollection(file, ContentCollections.SURFACE_BUILDINGS))
                .isInstanceOf(ContentSchemaException.class);
    }

    @Test
    void unknownEnumValueIsASchemaError() {
        Path file = dir.resolve("surface_buildings.toml");
        write(file, building("housing", 5).replace("\"white\"", "\"grey\""));

        assertThatThrownBy(() -> decoder.decodeCollection(file, ContentCollections.SURFACE_BUILDINGS))
                .isInstanceOf(ContentSchemaException.class);
    }

    @Test
    void unknownTopLevelKeyIsASchemaError() {
        Path file = dir.resolve("surface_buildings.toml");
        write(file, building("housing", 5) + "[extra]\nvalue = 1\n");

        assertThatThrownBy(() -> decoder.decodeCollection(file, ContentCollections.SURFACE_BUILDINGS))
                .isInstanceOf(ContentSchemaException.class)
                .hasMessageContaining("'extra'");
    }

    @Test
    void blankIdIsASchemaError() {
        Path file = dir.resolve("surface_buildings.toml");
        write(file, building(" ", 5));

        assertThatThrownBy(() -> decoder.decodeCollection(file, ContentCollections.SURFACE_BUILDINGS))
                .isInstanceOf(ContentSchemaException.class)
                .hasMessageContaining("'id' must not be blank");
    }

    @Test
    void nameWithoutEnglishIsASchemaError() {
        Path file = dir.resolve("technologies.toml");
        write(file, """
                [[technology]]
                id = "tech_basic"
                name = { ru = "Базовая" }
                science_cost = 10
                """);

        assertThatThrownBy(() -> decoder.decodeCollection(file, ContentCollections.TECHNOLOGIES))
                .isInstanceOf(ContentSchemaException.class);
    }

    @Test
    void decodesRelationRecords() throws Exception {
        Path file = dir.resolve("technology_prerequisites.json");
        write(file, "{\"technology_prerequisite\": [{\"from\": \"tech_a\", \"to\": \"tech_b\"}]}");

        assertThat(decoder.decodeCollection(file, ContentCollections.TECHNOLOGY_PREREQUISITES))
                .containsExactly(new TechnologyPrerequisite("tech_a", "tech_b"));
    }

    @Test
    void decodesNestedTileDistribution() throws Exception {
        Path file = dir.resolve("planet_surface_types.toml");
        write(file, """
                [[planet_surface_type]]
                id = "desert"
                name = "Desert"
                tile_distribution = { black = 30, white = 40, red = 25, green = 5, blue = 0 }
                """);

        List<PlanetSurfaceType> surfaces = decoder.decodeCollection(file, ContentCollections.PLANET_SURFACE_TYPES);

        assertThat(surfaces).singleElement().satisfies(surface -> {
            assertThat(surface.tileDistribution()).isEqualTo(new TileDistribution(30, 40, 25, 5, 0));
            assertThat(surface.tileDistribution().total()).isEqualTo(100);
        });
    }

    @Test
    void tileDistributionMissingAColorIsASchemaError() {
        Path file = dir.resolve("planet_surface_types.toml");
        write(file, """
                [[planet_surface_type]]
                id = "desert"
                name = "Desert"
                tile_distribution = { black = 30, white = 40, red = 30 }
                """);

        assertThatThrownBy(() -> decoder.decodeCollection(file, ContentCollections.PLANET_SURFACE_TYPES))
                .isInstanceOf(ContentSchemaException.class);
    }

    @Test
    void orbitalItemBonusesDefaultToZero() throws Exception {
        Path file = dir.resolve("orbital_items.json");
        write(file, "{\"orbital_item\": [{\"id\": \"orbital_habitat\", \"name\": \"Habitat\","
                + " \"max_population_bonus\": 2, \"slot_size\": 1}]}");

        List<OrbitalItem> items = decoder.decodeCollection(file, ContentCollections.ORBITAL_ITEMS);

        assertThat(items).singleElement().satisfies(item -> {
            assertThat(item.maxPopulationBonus()).isEqualTo(2);
            assertThat(item.industryBonus()).isZero();
            assertThat(item.unlockedByTechId()).isNull();
        });
    }

    @Test
    void decodesVictoryRules() throws Exception {
        Path file = dir.resolve("victory_rules.toml");
        write(file, "[victory_rules]\ndomination_threshold = 0.75\n");

        VictoryRules rules = decoder.decodeVictoryRules(file);

        assertThat(rules.dominationThreshold()).isEqualTo(0.75);
        assertThat(rules.turnLimit()).isNull();
    }

    @Test
    void descriptorWithWrongTypeIsASchemaError() {
        Path file = dir.resolve("mod.toml");
        write(file, "priority = \"high\"\n");

        assertThatThrownBy(() -> decoder.decodeDocument(file, ModDescriptor.class))
                .isInstanceOf(ContentSchemaException.class);
    }
}
