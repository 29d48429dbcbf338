package org.kvplane.config;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.kvplane.enums.StatusEnum;
import org.kvplane.util.JsonUtils;
import org.springframework.stereotype.Component;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.Locale;
import java.util.function.UnaryOperator;

/**
 * Loads {@link RouterConfig} and {@link PlannerConfig} from the environment.
 * <p>
 * Each config is first read as JSON from its own variable, then single fields are overridden by variables named
 * {@code KVPLANE_<FIELD_NAME_UPPER_SNAKE_CASE>}, e.g. {@code blockSize -> KVPLANE_BLOCK_SIZE}.
 */
@Getter
@Slf4j
@Component
public class ConfigService {

    public static final String ROUTER_CONFIG_ENV = "KVPLANE_ROUTER_CONFIG";

    public static final String PLANNER_CONFIG_ENV = "KVPLANE_PLANNER_CONFIG";

    static final String OVERRIDE_PREFIX = "KVPLANE_";

    private final RouterConfig routerConfig;

    private final PlannerConfig plannerConfig;

    public ConfigService() {
        this(System::getenv);
    }

    public ConfigService(UnaryOperator<String> env) {
        this.routerConfig = load(env, ROUTER_CONFIG_ENV, RouterConfig.class);
        this.plannerConfig = load(env, PLANNER_CONFIG_ENV, PlannerConfig.class);
        validate(routerConfig);
        validate(plannerConfig);
    }

    public RouterConfig routerConfig() {
        return routerConfig;
    }

    public PlannerConfig plannerConfig() {
        return plannerConfig;
    }

    private <T> T load(UnaryOperator<String> env, String envName, Class<T> type) {
        String json = env.apply(envName);
        log.warn("{} = {}", envName, json);
        T config;
        if (json != null && !json.isBlank()) {
            config = JsonUtils.toObject(json, type);
        } else {
            config = newInstance(type);
        }
        applyEnvironmentOverrides(env, config);
        return config;
    }

    private <T> T newInstance(Class<T> type) {
        try {
            return type.getDeclaredConstructor().newInstance();
        } catch (ReflectiveOperationException e) {
            throw StatusEnum.CONFIG_ERROR.toException("cannot create " + type.getSimpleName(), e);
        }
    }

    /**
     * Override primitive, string and enum fields from {@code KVPLANE_*} variables
     */
    private void applyEnvironmentOverrides(UnaryOperator<String> env, Object config) {
        for (Field field : config.getClass().getDeclaredFields()) {
            Class<?> fieldType = field.getType();
            if (Modifier.isStatic(field.getModifiers()) || !isSupportedType(fieldType)) {
                continue;
            }

            String envVarName = OVERRIDE_PREFIX + camelToUpperSnakeCase(field.getName());
            String envValue = env.apply(envVarName);
            if (envValue == null || envValue.trim().isEmpty()) {
                continue;
            }
            try {
                field.setAccessible(true);
                Object parsedValue = parseValue(envValue.trim(), fieldType);
                Object oldValue = field.get(config);
                field.set(config, parsedValue);
                log.info("Environment variable override: {} = {} (field: {}, old value: {})",
                        envVarName, parsedValue, field.getName(), oldValue);
            } catch (IllegalAccessException | IllegalArgumentException e) {
                throw StatusEnum.CONFIG_ERROR.toException("invalid value for " + envVarName + ": " + envValue, e);
            }
        }
    }

    private boolean isSupportedType(Class<?> type) {
        return type == int.class
                || type == Integer.class
                || type == long.class
                || type == Long.class
                || type == double.class
                || type == Double.class
                || type == boolean.class
                || type == Boolean.class
                || type == String.class
                || type.isEnum();
    }

    /**
     * e.g. schedulerTimeoutMs -> SCHEDULER_TIMEOUT_MS
     */
    static String camelToUpperSnakeCase(String camelCase) {
        StringBuilder result = new StringBuilder();
        for (int i = 0; i < camelCase.length(); i++) {
            char c = camelCase.charAt(i);
            if (Character.isUpperCase(c) && i > 0) {
                result.append('_');
            }
            result.append(Character.toUpperCase(c));
        }
        return result.toString();
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private Object parseValue(String value, Class<?> targetType) {
        if (targetType == int.class || targetType == Integer.class) {
            return Integer.parseInt(value);
        } else if (targetType == long.class || targetType == Long.class) {
            return Long.parseLong(value);
        } else if (targetType == double.class || targetType == Double.class) {
            return Double.parseDouble(value);
        } else if (targetType == boolean.class || targetType == Boolean.class) {
            return Boolean.parseBoolean(value);
        } else if (targetType == String.class) {
            return value;
        } else if (targetType.isEnum()) {
            return Enum.valueOf((Class<Enum>) targetType, value.toUpperCase(Locale.ROOT));
        }
        throw new IllegalArgumentException("Unsupported type: " + targetType);
    }

    private void validate(RouterConfig config) {
        require(config.getBlockSize() > 0, "blockSize must be > 0");
        require(config.getSchedulerTimeoutMs() > 0, "schedulerTimeoutMs must be > 0");
        require(config.getSchedulerQueueSize() > 0, "schedulerQueueSize must be > 0");
        require(config.getTemperature() >= 0, "temperature must be >= 0");
        require(config.getApproxTtlSecs() > 0, "approxTtlSecs must be > 0");
        require(config.getDefaultKvBlocksPerGpu() > 0, "defaultKvBlocksPerGpu must be > 0");
    }

    private void validate(PlannerConfig config) {
        require(config.getAdjustmentIntervalSecs() > 0, "adjustmentIntervalSecs must be > 0");
        require(config.getWindowSize() > 0, "windowSize must be > 0");
        require(config.getArOrder() > 0, "arOrder must be > 0");
        require(config.getSeasonLength() > 1, "seasonLength must be > 1");
        require(config.getTtftMs() > 0 && config.getItlMs() > 0, "SLA targets must be > 0");
        require(config.getPrefillGpusPerReplica() > 0 && config.getDecodeGpusPerReplica() > 0,
                "gpus per replica must be > 0");
        require(config.getMinPrefillReplicas() >= 0 && config.getMinDecodeReplicas() >= 0,
                "min replicas must be >= 0");
        require(config.getCorrectionAlpha() > 0 && config.getCorrectionAlpha() <= 1, "correctionAlpha must be in (0, 1]");
        require(config.getCorrectionMin() > 0 && config.getCorrectionMin() <= config.getCorrectionMax(),
                "correction range is invalid");
        require(config.getConnectorMaxRetries() >= 0, "connectorMaxRetries must be >= 0");
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw StatusEnum.CONFIG_ERROR.toException(message);
        }
    }
}
