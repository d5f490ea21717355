package org.ascenoria.content.model;

import org.ascenoria.content.derived.BuildingStats;
import org.ascenoria.content.derived.EngineStats;
import org.ascenoria.content.derived.HullStats;
import org.ascenoria.content.derived.NoDerivedStats;
import org.ascenoria.content.derived.OrbitalItemStats;
import org.ascenoria.content.derived.ScenarioStats;
import org.ascenoria.content.derived.TechnologyStats;
import org.ascenoria.content.derived.WeaponStats;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The fixed set of content collections, in stable collection order.
 * <p>
 * Collections that are referenced by others are declared first so that reference
 * targets are always initialized.
 */
public final class ContentCollections {

    public static final CollectionType<SurfaceCellType, NoDerivedStats> SURFACE_CELL_TYPES =
            CollectionType.builder("surface_cell_type", SurfaceCellType.class, NoDerivedStats.class)
                    .file("surface_cell_types")
                    .build();

    public static final CollectionType<Species, NoDerivedStats> SPECIES =
            CollectionType.builder("species", Species.class, NoDerivedStats.class)
                    .file("species")
                    .build();

    public static final CollectionType<PlanetSurfaceType, NoDerivedStats> PLANET_SURFACE_TYPES =
            CollectionType.builder("planet_surface_type", PlanetSurfaceType.class, NoDerivedStats.class)
                    .file("planet_surface_types")
                    .nonNegative("tile_distribution.black", t -> t.tileDistribution().black())
                    .nonNegative("tile_distribution.white", t -> t.tileDistribution().white())
                    .nonNegative("tile_distribution.red", t -> t.tileDistribution().red())
                    .nonNegative("tile_distribution.green", t -> t.tileDistribution().green())
                    .nonNegative("tile_distribution.blue", t -> t.tileDistribution().blue())
                    .check(ContentCollections::tileDistributionTotal)
                    .build();

    public static final CollectionType<Technology, TechnologyStats> TECHNOLOGIES =
            CollectionType.builder("technology", Technology.class, TechnologyStats.class)
                    .file("technologies")
                    .positive("science_cost", Technology::scienceCost)
                    .build();

    public static final CollectionType<TechnologyPrerequisite, NoDerivedStats> TECHNOLOGY_PREREQUISITES =
            CollectionType.builder("technology_prerequisite", TechnologyPrerequisite.class, NoDerivedStats.class)
                    .file("technology_prerequisites")
                    .references("from", TECHNOLOGIES, TechnologyPrerequisite::from)
                    .references("to", TECHNOLOGIES, TechnologyPrerequisite::to)
                    .build();

    public static final CollectionType<SurfaceBuilding, BuildingStats> SURFACE_BUILDINGS =
            CollectionType.builder("surface_building", SurfaceBuilding.class, BuildingStats.class)
                    .file("surface_buildings")
                    .positive("production_cost", SurfaceBuilding::productionCost)
                    .references("unlocked_by_tech_id", TECHNOLOGIES, SurfaceBuilding::unlockedByTechId)
                    .build();

    public static final CollectionType<PlanetSize, NoDerivedStats> PLANET_SIZES =
            CollectionType.builder("planet_size", PlanetSize.class, NoDerivedStats.class)
                    .file("planet_sizes")
                    .positive("surface_slots", PlanetSize::surfaceSlots)
                    .nonNegative("orbital_slots", PlanetSize::orbitalSlots)
                    .build();

    public static final CollectionType<OrbitalItem, OrbitalItemStats> ORBITAL_ITEMS =
            CollectionType.builder("orbital_item", OrbitalItem.class, OrbitalItemStats.class)
                    .file("orbital_items")
                    .nonNegative("industry_bonus", OrbitalItem::industryBonus)
                    .nonNegative("research_bonus", OrbitalItem::researchBonus)
                    .nonNegative("prosperity_bonus", OrbitalItem::prosperityBonus)
                    .nonNegative("max_population_bonus", OrbitalItem::maxPopulationBonus)
                    .positive("slot_size", OrbitalItem::slotSize)
                    .nonNegative("industry_cost", OrbitalItem::industryCost)
                    .references("unlocked_by_tech_id", TECHNOLOGIES, OrbitalItem::unlockedByTechId)
                    .build();

    public static final CollectionType<PlanetaryProject, NoDerivedStats> PLANETARY_PROJECTS =
            CollectionType.builder("planetary_project", PlanetaryProject.class, NoDerivedStats.class)
                    .file("planetary_projects")
                    .nonNegative("industry_cost", PlanetaryProject::industryCost)
                    .build();

    public static final CollectionType<HullClass, HullStats> HULL_CLASSES =
            CollectionType.builder("hull_class", HullClass.class, HullStats.class)
                    .file("hull_classes")
                    .positive("size_index", HullClass::sizeIndex)
                    .positive("max_items", HullClass::maxItems)
                    .build();

    public static final CollectionType<Engine, EngineStats> ENGINES =
            CollectionType.builder("engine", Engine.class, EngineStats.class)
                    .file("engines")
                    .positive("thrust_rating", Engine::thrustRating)
                    .nonNegative("power_use", Engine::powerUse)
                    .nonNegative("industry_cost", Engine::industryCost)
                    .build();

    public static final CollectionType<Weapon, WeaponStats> WEAPONS =
            CollectionType.builder("weapon", Weapon.class, WeaponStats.class)
                    .file("weapons")
                    .positive("damage", Weapon::damage)
                    .positive("fire_rate", Weapon::fireRate)
                    .positive("range", Weapon::range)
                    .nonNegative("power_use", Weapon::powerUse)
                    .nonNegative("industry_cost", Weapon::industryCost)
                    .references("unlocked_by_tech_id", TECHNOLOGIES, Weapon::unlockedByTechId)
                    .build();

    public static final CollectionType<Shield, NoDerivedStats> SHIELDS =
            CollectionType.builder("shield", Shield.class, NoDerivedStats.class)
                    .file("shields")
                    .positive("strength", Shield::strength)
                    .nonNegative("industry_cost", Shield::industryCost)
                    .build();

    public static final CollectionType<Scanner, NoDerivedStats> SCANNERS =
            CollectionType.builder("scanner", Scanner.class, NoDerivedStats.class)
                    .file("scanners")
                    .positive("range", Scanner::range)
                    .positive("strength", Scanner::strength)
                    .nonNegative("industry_cost", Scanner::industryCost)
                    .build();

    public static final CollectionType<SpecialModule, NoDerivedStats> SPECIAL_MODULES =
            CollectionType.builder("special_module", SpecialModule.class, NoDerivedStats.class)
                    .file("special_modules")
                    .nonNegative("power_use", SpecialModule::powerUse)
                    .nonNegative("range", SpecialModule::range)
                    .nonNegative("industry_cost", SpecialModule::industryCost)
                    .build();

    public static final CollectionType<VictoryCondition, NoDerivedStats> VICTORY_CONDITIONS =
            CollectionType.builder("victory_condition", VictoryCondition.class, NoDerivedStats.class)
                    .file("victory_conditions")
                    .build();

    public static final CollectionType<Scenario, ScenarioStats> SCENARIOS =
            CollectionType.builder("scenario", Scenario.class, ScenarioStats.class)
                    .file("scenarios")
                    .positive("grid_width", Scenario::gridWidth)
                    .positive("grid_height", Scenario::gridHeight)
                    .unitInterval("black_ratio", Scenario::blackRatio)
                    .references("start_building_id", SURFACE_BUILDINGS, Scenario::startBuildingId)
                    .references("victory_condition_id", VICTORY_CONDITIONS, Scenario::victoryConditionId)
                    .build();

    /** All collections in stable collection order. */
    public static final List<CollectionType<?, ?>> ALL = List.of(
            SURFACE_CELL_TYPES,
            SPECIES,
            PLANET_SURFACE_TYPES,
            TECHNOLOGIES,
            TECHNOLOGY_PREREQUISITES,
            SURFACE_BUILDINGS,
            PLANET_SIZES,
            ORBITAL_ITEMS,
            PLANETARY_PROJECTS,
            HULL_CLASSES,
            ENGINES,
            WEAPONS,
            SHIELDS,
            SCANNERS,
            SPECIAL_MODULES,
            VICTORY_CONDITIONS,
            SCENARIOS);

    /** Base name of the file holding the {@link VictoryRules} singleton. */
    public static final String VICTORY_RULES_FILE = "victory_rules";

    /** Key of the {@link VictoryRules} table inside its file. */
    public static final String VICTORY_RULES_KEY = "victory_rules";

    private static final Map<String, CollectionType<?, ?>> BY_NAME;

    static {
        final Map<String, CollectionType<?, ?>> byName = new LinkedHashMap<>();
        for (CollectionType<?, ?> type : ALL) {
            byName.put(type.name(), type);
        }
        BY_NAME = Map.copyOf(byName);
    }

    private ContentCollections() {
    }

    private static Optional<String> tileDistributionTotal(final PlanetSurfaceType surface) {
        final long total = surface.tileDistribution().total();
        return total == TileDistribution.TOTAL_PERCENT
                ? Optional.empty()
                : Optional.of("tile_distribution must sum to " + TileDistribution.TOTAL_PERCENT + " (was " + total + ")");
    }

    /**
     * Looks up a collection by its name, e.g. {@code "weapon"}.
     *
     * @param name The collection name.
     * @return The collection, or empty if unknown.
     */
    public static Optional<CollectionType<?, ?>> byName(final String name) {
        return Optional.ofNullable(BY_NAME.get(name));
    }
}
