package org.kvplane.planner.predictor;

import org.kvplane.config.PlannerConfig;
import org.kvplane.enums.PredictorType;
import org.kvplane.enums.StatusEnum;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

public class LoadPredictorFactory {

    private static final Map<PredictorType, Function<PlannerConfig, LoadPredictor>> predictorFactory =
            new ConcurrentHashMap<>();

    static {
        register(PredictorType.CONSTANT, config -> new ConstantPredictor());
        register(PredictorType.AUTOREGRESSIVE, config -> new AutoRegressivePredictor(config.getArOrder()));
        register(PredictorType.SEASONAL, config -> new SeasonalPredictor(config.getSeasonLength()));
    }

    public static void register(PredictorType type, Function<PlannerConfig, LoadPredictor> creator) {
        predictorFactory.put(type, creator);
    }

    public static LoadPredictor create(PredictorType type, PlannerConfig config) {
        Function<PlannerConfig, LoadPredictor> creator = type == null ? null : predictorFactory.get(type);
        if (creator == null) {
            throw StatusEnum.CONFIG_ERROR.toException("no load predictor registered for type " + type);
        }
        return creator.apply(config);
    }
}
