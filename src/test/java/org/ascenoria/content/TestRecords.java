package org.ascenoria.content;

import org.ascenoria.content.decode.DecodedSource;
import org.ascenoria.content.merge.MergeEngine;
import org.ascenoria.content.merge.MergedContent;
import org.ascenoria.content.model.BuildableOn;
import org.ascenoria.content.model.CollectionType;
import org.ascenoria.content.model.ContentCollections;
import org.ascenoria.content.model.ContentRecord;
import org.ascenoria.content.model.GenerationMode;
import org.ascenoria.content.model.LocalizedText;
import org.ascenoria.content.model.OrbitalItem;
import org.ascenoria.content.model.PlanetSurfaceType;
import org.ascenoria.content.model.Scenario;
import org.ascenoria.content.model.SpecialBehavior;
import org.ascenoria.content.model.SurfaceBuilding;
import org.ascenoria.content.model.Technology;
import org.ascenoria.content.model.TechnologyPrerequisite;
import org.ascenoria.content.model.TileDistribution;
import org.ascenoria.content.model.VictoryCondition;
import org.ascenoria.content.model.VictoryRules;
import org.ascenoria.content.model.VictoryType;
import org.ascenoria.content.model.Weapon;
import org.ascenoria.content.sources.PackSource;
import org.ascenoria.content.sources.SourceKind;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory records and decoded packs for tests that start after decoding.
 */
public final class TestRecords {

    private TestRecords() {
    }

    public static LocalizedText text(String id) {
        return LocalizedText.of(Map.of("en", id, "ru", id));
    }

    public static SurfaceBuilding building(String id, int productionCost) {
        return building(id, productionCost, null);
    }

    public static SurfaceBuilding building(String id, int productionCost, String techId) {
        return new SurfaceBuilding(id, text(id), null, BuildableOn.WHITE, true, productionCost,
                1, 2, 0, 1, techId, SpecialBehavior.NONE);
    }

    public static Technology technology(String id, int scienceCost) {
        return new Technology(id, text(id), null, scienceCost);
    }

    public static TechnologyPrerequisite edge(String from, String to) {
        return new TechnologyPrerequisite(from, to);
    }

    /**
     * @return Technologies {@code tech_0 .. tech_<length-1>}, each costing 1 and requiring its predecessor.
     */
    public static ContentRecord[] technologyChain(int length) {
        final List<ContentRecord> records = new ArrayList<>();
        for (int i = 0; i < length; i++) {
            records.add(technology("tech_" + i, 1));
            if (i > 0) {
                records.add(edge("tech_" + (i - 1), "tech_" + i));
            }
        }
        return records.toArray(new ContentRecord[0]);
    }

    public static PlanetSurfaceType surfaceType(String id, int black, int white, int red, int green, int blue) {
        return new PlanetSurfaceType(id, text(id), null, new TileDistribution(black, white, red, green, blue));
    }

    public static OrbitalItem orbitalItem(String id, int industry, int research, int prosperity, int population,
                                          String techId) {
        return new OrbitalItem(id, text(id), null, industry, research, prosperity, population, 1, 10, techId);
    }

    public static Weapon weapon(String id, double damage, double fireRate, int powerUse) {
        return new Weapon(id, text(id), null, damage, fireRate, 2, powerUse, 5, null);
    }

    public static VictoryCondition victory(String id) {
        return new VictoryCondition(id, text(id), null, VictoryType.COVER_ALL_TILES);
    }

    public static Scenario scenario(String id, String startBuilding, String victoryCondition, double blackRatio) {
        return new Scenario(id, text(id), null, 10, 10, startBuilding, GenerationMode.RANDOM_WHITE_BLACK,
                blackRatio, victoryCondition);
    }

    public static DecodedSource base(ContentRecord... records) {
        return source(new PackSource(PackSource.BASE_NAME, Path.of("base"), SourceKind.BASE, 0, 1), null, records);
    }

    public static DecodedSource mod(String name, int priority, ContentRecord... records) {
        return source(new PackSource(name, Path.of(name), SourceKind.MOD, priority, 1), null, records);
    }

    public static DecodedSource source(PackSource pack, VictoryRules victoryRules, ContentRecord... records) {
        final Map<CollectionType<?, ?>, List<ContentRecord>> grouped = new LinkedHashMap<>();
        for (ContentRecord record : records) {
            grouped.computeIfAbsent(collectionOf(record), k -> new ArrayList<>()).add(record);
        }
        return new DecodedSource(pack, new LinkedHashMap<>(grouped), victoryRules);
    }

    public static MergedContent merge(DecodedSource... sources) {
        return new MergeEngine().merge(Arrays.asList(sources));
    }

    private static CollectionType<?, ?> collectionOf(ContentRecord record) {
        for (CollectionType<?, ?> type : ContentCollections.ALL) {
            if (type.recordType().isInstance(record)) {
                return type;
            }
        }
        throw new IllegalArgumentException("No collection for " + record.getClass());
    }
}
