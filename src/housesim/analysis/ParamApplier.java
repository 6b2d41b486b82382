package housesim.analysis;

import housesim.config.SimulationParamsBuilder;

@FunctionalInterface
public interface ParamApplier {
    void apply(SimulationParamsBuilder b, double v);
}
