package org.ascenoria.content.derived;

import org.ascenoria.content.model.Engine;
import org.ascenoria.content.model.HullClass;
import org.ascenoria.content.model.OrbitalItem;
import org.ascenoria.content.model.Scenario;
import org.ascenoria.content.model.SurfaceBuilding;
import org.ascenoria.content.model.Weapon;

/**
 * Per-record formulas.
 */
final class StatFormulas {

    private StatFormulas() {
    }

    static WeaponStats weapon(Weapon weapon) {
        final double throughput = weapon.damage() * weapon.fireRate();
        final Double perPower = weapon.powerUse() > 0 ? throughput / weapon.powerUse() : null;
        return new WeaponStats(throughput, perPower);
    }

    static EngineStats engine(Engine engine) {
        return new EngineStats(engine.powerUse() > 0 ? engine.thrustRating() / engine.powerUse() : null);
    }

    static BuildingStats building(SurfaceBuilding building) {
        final long net = (long) building.yieldsFood() + building.yieldsHousing()
                + building.yieldsProduction() + building.yieldsScience();
        return new BuildingStats(net, (double) net / building.productionCost());
    }

    static OrbitalItemStats orbitalItem(OrbitalItem item) {
        return new OrbitalItemStats((long) item.industryBonus() + item.researchBonus()
                + item.prosperityBonus() + item.maxPopulationBonus());
    }

    static HullStats hull(HullClass hull) {
        return new HullStats((double) hull.maxItems() / hull.sizeIndex());
    }

    static ScenarioStats scenario(Scenario scenario) {
        final long cells = (long) scenario.gridWidth() * scenario.gridHeight();
        final long black = Math.round(cells * scenario.blackRatio());
        return new ScenarioStats(cells, black, cells - black);
    }
}
