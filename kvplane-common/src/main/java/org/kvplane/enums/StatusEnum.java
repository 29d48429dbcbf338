package org.kvplane.enums;

import lombok.Getter;
import org.apache.commons.lang3.StringUtils;
import org.kvplane.exception.ConfigException;
import org.kvplane.exception.DuplicateRequestException;
import org.kvplane.exception.JsonMapperException;
import org.kvplane.exception.KvPlaneException;
import org.kvplane.exception.MetricsSourceException;
import org.kvplane.exception.NoEligibleWorkerException;
import org.kvplane.exception.ScalingConnectorException;
import org.kvplane.exception.SchedulerUnavailableException;
import org.kvplane.exception.ServiceDiscoveryException;

@Getter
public enum StatusEnum {

    /*--------------------------------------------------- success ----------------------------------------------------*/

    SUCCESS(200, "Success", "Success.", KvPlaneException.class),

    /*------------------------------------------------ client errors -------------------------------------------------*/

    BAD_REQUEST(400, "BadRequest", "Bad request!", KvPlaneException.class),
    DUPLICATE_REQUEST(409, "DuplicateRequest", "Request id already holds a reservation!", DuplicateRequestException.class),

    /*------------------------------------------------ server errors -------------------------------------------------*/

    INTERNAL_ERROR(500, "InternalError", "Internal server error!", KvPlaneException.class),
    SERVICE_DISCOVERY_ERROR(512, "ServiceDiscoveryError", "Service discovery error!", ServiceDiscoveryException.class),
    JSON_MAPPER_ERROR(522, "JsonMapperError", "Json mapper error!", JsonMapperException.class),
    METRICS_SOURCE_ERROR(525, "MetricsSourceError", "Metrics source error!", MetricsSourceException.class),

    /*------------------------------------------------ routing errors ------------------------------------------------*/

    NO_ELIGIBLE_WORKER(8400, "NoEligibleWorker", "No eligible worker!", NoEligibleWorkerException.class),
    SCHEDULER_UNAVAILABLE(8401, "SchedulerUnavailable", "Scheduler unavailable!", SchedulerUnavailableException.class),

    /*------------------------------------------------ planner errors ------------------------------------------------*/

    SCALING_CONNECTOR_ERROR(8600, "ScalingConnectorError", "Scaling connector error!", ScalingConnectorException.class),
    CONFIG_ERROR(701, "ConfigException", "Config exception!", ConfigException.class),
    ;

    private final int code;

    private final String name;

    private final String message;

    private final Class<? extends KvPlaneException> exceptionClz;

    StatusEnum(int code, String name, String message, Class<? extends KvPlaneException> exceptionClz) {
        this.code = code;
        this.name = name;
        this.message = message;
        this.exceptionClz = exceptionClz;
    }

    public KvPlaneException toException() {
        return toException("");
    }

    public KvPlaneException toException(String exceptionMsg) {
        String msg = this.message;
        if (StringUtils.isNotBlank(exceptionMsg)) {
            msg = this.message + ": " + exceptionMsg;
        }
        try {
            return getExceptionClz().getDeclaredConstructor(int.class, String.class, String.class)
                    .newInstance(this.code, this.name, msg);
        } catch (ReflectiveOperationException e) {
            return new KvPlaneException(this.code, this.name, msg);
        }
    }

    public KvPlaneException toException(Throwable cause) {
        return toException(null, cause);
    }

    public KvPlaneException toException(String exceptionMsg, Throwable cause) {
        String msg = this.message;
        if (StringUtils.isNotBlank(exceptionMsg)) {
            msg = this.message + ": " + exceptionMsg;
        }
        try {
            return getExceptionClz().getDeclaredConstructor(int.class, String.class, String.class, Throwable.class)
                    .newInstance(this.code, this.name, msg, cause);
        } catch (ReflectiveOperationException e) {
            return new KvPlaneException(this.code, this.name, msg, cause);
        }
    }
}
