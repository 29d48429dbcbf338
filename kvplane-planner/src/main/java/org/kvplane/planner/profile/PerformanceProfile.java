package org.kvplane.planner.profile;

import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.collections4.CollectionUtils;
import org.kvplane.enums.StatusEnum;
import org.kvplane.util.JsonUtils;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Measured per-GPU throughput of the serving engine.
 * <p>
 * Prefill maps input length to prompt tokens per second. Decode holds one row per context length, each mapping
 * inter-token latency to generated tokens per second. Lookups interpolate linearly and clamp at the table ends.
 */
@Slf4j
@Data
@NoArgsConstructor
public class PerformanceProfile {

    public static final String CLASSPATH_PREFIX = "classpath:";

    private List<PrefillPoint> prefill = new ArrayList<>();

    private List<DecodeRow> decode = new ArrayList<>();

    @Data
    @NoArgsConstructor
    public static class PrefillPoint {

        private double inputLen;

        private double throughputPerGpu;

        public PrefillPoint(double inputLen, double throughputPerGpu) {
            this.inputLen = inputLen;
            this.throughputPerGpu = throughputPerGpu;
        }
    }

    @Data
    @NoArgsConstructor
    public static class DecodeRow {

        private double contextLen;

        private List<DecodePoint> points = new ArrayList<>();

        public DecodeRow(double contextLen, List<DecodePoint> points) {
            this.contextLen = contextLen;
            this.points = points;
        }
    }

    @Data
    @NoArgsConstructor
    public static class DecodePoint {

        private double itlMs;

        private double throughputPerGpu;

        public DecodePoint(double itlMs, double throughputPerGpu) {
            this.itlMs = itlMs;
            this.throughputPerGpu = throughputPerGpu;
        }
    }

    public PerformanceProfile(List<PrefillPoint> prefill, List<DecodeRow> decode) {
        this.prefill = prefill;
        this.decode = decode;
        normalize();
    }

    public static PerformanceProfile load(String path) {
        Resource resource = path.startsWith(CLASSPATH_PREFIX)
                ? new ClassPathResource(path.substring(CLASSPATH_PREFIX.length()))
                : new FileSystemResource(path);
        try (InputStream input = resource.getInputStream()) {
            PerformanceProfile profile = JsonUtils.toObject(input, PerformanceProfile.class);
            profile.normalize();
            log.info("loaded performance profile from {}: {} prefill points, {} decode rows",
                    path, profile.prefill.size(), profile.decode.size());
            return profile;
        } catch (IOException e) {
            throw StatusEnum.CONFIG_ERROR.toException("cannot read performance profile " + path, e);
        }
    }

    /**
     * Prompt tokens per second one GPU sustains at this input length
     */
    public double prefillThroughputPerGpu(double inputLen) {
        double[] xs = prefill.stream().mapToDouble(PrefillPoint::getInputLen).toArray();
        double[] ys = prefill.stream().mapToDouble(PrefillPoint::getThroughputPerGpu).toArray();
        return interpolate(xs, ys, inputLen);
    }

    /**
     * Generated tokens per second one GPU sustains at this latency and context length
     */
    public double decodeThroughputPerGpu(double itlMs, double contextLen) {
        if (contextLen <= decode.get(0).getContextLen()) {
            return rowThroughput(decode.get(0), itlMs);
        }
        DecodeRow last = decode.get(decode.size() - 1);
        if (contextLen >= last.getContextLen()) {
            return rowThroughput(last, itlMs);
        }
        for (int i = 1; i < decode.size(); i++) {
            DecodeRow upper = decode.get(i);
            if (contextLen <= upper.getContextLen()) {
                DecodeRow lower = decode.get(i - 1);
                double lowerValue = rowThroughput(lower, itlMs);
                double upperValue = rowThroughput(upper, itlMs);
                double ratio = (contextLen - lower.getContextLen()) / (upper.getContextLen() - lower.getContextLen());
                return lowerValue + ratio * (upperValue - lowerValue);
            }
        }
        return rowThroughput(last, itlMs);
    }

    private static double rowThroughput(DecodeRow row, double itlMs) {
        double[] xs = row.getPoints().stream().mapToDouble(DecodePoint::getItlMs).toArray();
        double[] ys = row.getPoints().stream().mapToDouble(DecodePoint::getThroughputPerGpu).toArray();
        return interpolate(xs, ys, itlMs);
    }

    /**
     * Piecewise linear interpolation over ascending {@code xs}, clamped to the first and last value
     */
    static double interpolate(double[] xs, double[] ys, double x) {
        if (x <= xs[0]) {
            return ys[0];
        }
        int last = xs.length - 1;
        if (x >= xs[last]) {
            return ys[last];
        }
        for (int i = 1; i <= last; i++) {
            if (x <= xs[i]) {
                double ratio = (x - xs[i - 1]) / (xs[i] - xs[i - 1]);
                return ys[i - 1] + ratio * (ys[i] - ys[i - 1]);
            }
        }
        return ys[last];
    }

    private void normalize() {
        if (CollectionUtils.isEmpty(prefill) || CollectionUtils.isEmpty(decode)) {
            throw StatusEnum.CONFIG_ERROR.toException("performance profile needs prefill and decode tables");
        }
        prefill.sort(Comparator.comparingDouble(PrefillPoint::getInputLen));
        decode.sort(Comparator.comparingDouble(DecodeRow::getContextLen));
        for (DecodeRow row : decode) {
            if (CollectionUtils.isEmpty(row.getPoints())) {
                throw StatusEnum.CONFIG_ERROR.toException(
                        "decode row for context length " + row.getContextLen() + " has no points");
            }
            row.getPoints().sort(Comparator.comparingDouble(DecodePoint::getItlMs));
        }
    }
}
