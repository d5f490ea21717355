package org.ascenoria.content;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Builds small content packs on disk for tests.
 */
public final class ContentFixtures {

    private ContentFixtures() {
    }

    /**
     * Creates {@code root/data} with a manifest declaring the given schema version.
     */
    public static Path basePack(Path root, int schemaVersion) {
        final Path data = root.resolve("data");
        write(data.resolve("manifest.toml"), "schema_version = " + schemaVersion + "\n");
        return data;
    }

    /**
     * Creates {@code modsRoot/name/data}, with a descriptor unless both values are {@code null}.
     *
     * @return The mod's data directory.
     */
    public static Path mod(Path modsRoot, String name, Integer priority, Integer schemaVersion) {
        final Path modRoot = modsRoot.resolve(name);
        final Path data = modRoot.resolve("data");
        try {
            Files.createDirectories(data);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        final StringBuilder descriptor = new StringBuilder();
        if (priority != null) {
            descriptor.append("priority = ").append(priority).append('\n');
        }
        if (schemaVersion != null) {
            descriptor.append("schema_version = ").append(schemaVersion).append('\n');
        }
        if (descriptor.length() > 0) {
            write(modRoot.resolve("mod.toml"), descriptor.toString());
        }
        return data;
    }

    public static void write(Path file, String content) {
        try {
            Files.createDirectories(file.getParent());
            Files.writeString(file, content);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * @return A TOML surface building table with both locales.
     */
    public static String building(String id, int productionCost) {
        return building(id, productionCost, null);
    }

    public static String building(String id, int productionCost, String techId) {
        return "[[surface_building]]\n"
                + "id = \"" + id + "\"\n"
                + "name = { en = \"" + id + "\", ru = \"" + id + "\" }\n"
                + "buildable_on = \"white\"\n"
                + "production_cost = " + productionCost + "\n"
                + (techId == null ? "" : "unlocked_by_tech_id = \"" + techId + "\"\n")
                + "yields_housing = 1\n\n";
    }

    public static String technology(String id, int scienceCost) {
        return "[[technology]]\n"
                + "id = \"" + id + "\"\n"
                + "name = { en = \"" + id + "\", ru = \"" + id + "\" }\n"
                + "science_cost = " + scienceCost + "\n\n";
    }

    public static String prerequisite(String from, String to) {
        return "[[technology_prerequisite]]\n"
                + "from = \"" + from + "\"\n"
                + "to = \"" + to + "\"\n\n";
    }

    public static String weapon(String id, double damage, double fireRate, int powerUse) {
        return "[[weapon]]\n"
                + "id = \"" + id + "\"\n"
                + "name = { en = \"" + id + "\", ru = \"" + id + "\" }\n"
                + "damage = " + damage + "\n"
                + "fire_rate = " + fireRate + "\n"
                + "range = 2\n"
                + "power_use = " + powerUse + "\n\n";
    }

    /**
     * Writes a base pack whose only content is one surface building.
     *
     * @return The base data directory.
     */
    public static Path basePackWithBuilding(Path root, String id, int productionCost) {
        final Path data = basePack(root, 1);
        write(data.resolve("surface_buildings.toml"), building(id, productionCost));
        return data;
    }
}
