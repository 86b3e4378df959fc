/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package io.ridesim.config;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.ToNumberPolicy;
import com.google.gson.reflect.TypeToken;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.snakeyaml.engine.v2.api.Dump;
import org.snakeyaml.engine.v2.api.DumpSettings;
import org.snakeyaml.engine.v2.api.Load;
import org.snakeyaml.engine.v2.api.LoadSettings;
import org.snakeyaml.engine.v2.common.FlowStyle;
import org.snakeyaml.engine.v2.exceptions.YamlEngineException;

import java.io.IOException;
import java.lang.reflect.Type;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// Reads and writes {@link SimulationConfig} documents.
///
/// Documents are YAML or JSON with this shape; every key is optional and missing
/// keys keep their defaults:
///
/// ```yaml
/// horizon: 480
/// seed: 42
/// rides:
///   count: 3
///   capacity: 10          # or a per-ride list: capacities: [10, 10, 8]
/// arrivals:
///   bands:
///     - { start: 0, rate: 5 }
///     - { start: 120, rate: 10 }
///     - { start: 240, rate: 15 }
/// failures:
///   enabled: true
///   mean_time_to_failure: 90
///   mean_repair_time: 15
/// service:
///   sampling: per_ride    # fixed | per_ride | per_visit
///   min: 4
///   mode: 5
///   max: 6
///   fixed: 5
/// selection:
///   policy: bounded_retry # or unconditional_queue
///   retry_bound: 5
/// ```
///
/// Unknown keys and values of the wrong type are reported as an
/// {@link InvalidConfigurationException} listing all of them.
public class SimulationConfigLoader {

    private static final Logger logger = LogManager.getLogger(SimulationConfigLoader.class);

    private final static Gson gson = new GsonBuilder()
        .setPrettyPrinting()
        .setObjectToNumberStrategy(ToNumberPolicy.LONG_OR_DOUBLE)
        .create();
    private final static LoadSettings loadSettings = LoadSettings.builder().setLabel("ridesim-config").build();
    private final static DumpSettings dumpSettings =
        DumpSettings.builder().setDefaultFlowStyle(FlowStyle.BLOCK).build();

    private static final Set<String> ROOT_KEYS =
        Set.of("horizon", "seed", "rides", "arrivals", "failures", "service", "selection");
    private static final Set<String> RIDES_KEYS = Set.of("count", "capacity", "capacities");
    private static final Set<String> ARRIVALS_KEYS = Set.of("bands");
    private static final Set<String> BAND_KEYS = Set.of("start", "rate");
    private static final Set<String> FAILURES_KEYS = Set.of("enabled", "mean_time_to_failure", "mean_repair_time");
    private static final Set<String> SERVICE_KEYS = Set.of("sampling", "min", "mode", "max", "fixed");
    private static final Set<String> SELECTION_KEYS = Set.of("policy", "retry_bound");

    private SimulationConfigLoader() {
    }

    /// Loads and validates a configuration file.
    public static SimulationConfig load(Path path) throws IOException {
        return builderFrom(path).build();
    }

    /// Loads a configuration file into a builder so that callers can apply overrides
    /// before validation.
    public static SimulationConfig.Builder builderFrom(Path path) throws IOException {
        String content = Files.readString(path);
        logger.debug("Loading simulation config from {}", path);
        return builderFromString(content);
    }

    /// Parses a YAML or JSON document into a validated configuration.
    public static SimulationConfig parse(String content) {
        return builderFromString(content).build();
    }

    /// Parses a YAML or JSON document into an unvalidated builder.
    /// JSON is recognized by a leading brace.
    public static SimulationConfig.Builder builderFromString(String content) {
        String trimmed = content.trim();
        Object document;
        if (trimmed.startsWith("{") && trimmed.endsWith("}")) {
            document = parseJson(trimmed);
        } else {
            document = parseYaml(content);
        }
        if (document == null) {
            return SimulationConfig.builder();
        }
        if (!(document instanceof Map<?, ?> map)) {
            throw new InvalidConfigurationException("configuration document must be a mapping, but was "
                + document.getClass().getSimpleName());
        }
        return builderFromMap(map);
    }

    /// Applies the keys of an already parsed document to a fresh builder.
    public static SimulationConfig.Builder builderFromMap(Map<?, ?> root) {
        SimulationConfig.Builder builder = SimulationConfig.builder();
        List<String> problems = new ArrayList<>();
        checkKeys(root, ROOT_KEYS, "", problems);

        if (root.containsKey("horizon")) {
            Double horizon = asDouble(root.get("horizon"), "horizon", problems);
            if (horizon != null) builder.horizon(horizon);
        }
        if (root.containsKey("seed")) {
            Long seed = asLong(root.get("seed"), "seed", problems);
            if (seed != null) builder.seed(seed);
        }

        Map<?, ?> rides = asSection(root.get("rides"), "rides", RIDES_KEYS, problems);
        if (rides != null) {
            if (rides.containsKey("count")) {
                Integer count = asInt(rides.get("count"), "rides.count", problems);
                if (count != null) builder.rideCount(count);
            }
            if (rides.containsKey("capacity")) {
                Integer capacity = asInt(rides.get("capacity"), "rides.capacity", problems);
                if (capacity != null) builder.capacity(capacity);
            }
            if (rides.containsKey("capacities")) {
                List<?> list = asList(rides.get("capacities"), "rides.capacities", problems);
                if (list != null) {
                    List<Integer> capacities = new ArrayList<>();
                    for (int i = 0; i < list.size(); i++) {
                        capacities.add(asInt(list.get(i), "rides.capacities[" + i + "]", problems));
                    }
                    builder.capacities(capacities);
                }
            }
        }

        Map<?, ?> arrivals = asSection(root.get("arrivals"), "arrivals", ARRIVALS_KEYS, problems);
        if (arrivals != null && arrivals.containsKey("bands")) {
            List<?> list = asList(arrivals.get("bands"), "arrivals.bands", problems);
            if (list != null) {
                List<RateBand> bands = new ArrayList<>();
                for (int i = 0; i < list.size(); i++) {
                    String prefix = "arrivals.bands[" + i + "]";
                    Map<?, ?> band = asSection(list.get(i), prefix, BAND_KEYS, problems);
                    if (band == null) {
                        continue;
                    }
                    Double start = band.containsKey("start") ? asDouble(band.get("start"), prefix + ".start", problems) : null;
                    Double rate = asDouble(band.get("rate"), prefix + ".rate", problems);
                    if (rate != null) {
                        bands.add(new RateBand(start == null ? 0.0 : start, rate));
                    }
                }
                builder.arrivalBands(bands);
            }
        }

        Map<?, ?> failures = asSection(root.get("failures"), "failures", FAILURES_KEYS, problems);
        if (failures != null) {
            if (failures.containsKey("enabled")) {
                Object enabled = failures.get("enabled");
                if (enabled instanceof Boolean b) {
                    builder.failuresEnabled(b);
                } else {
                    problems.add("failures.enabled must be true or false, but was " + enabled);
                }
            }
            if (failures.containsKey("mean_time_to_failure")) {
                Double mttf = asDouble(failures.get("mean_time_to_failure"), "failures.mean_time_to_failure", problems);
                if (mttf != null) builder.meanTimeToFailure(mttf);
            }
            if (failures.containsKey("mean_repair_time")) {
                Double mttr = asDouble(failures.get("mean_repair_time"), "failures.mean_repair_time", problems);
                if (mttr != null) builder.meanRepairTime(mttr);
            }
        }

        Map<?, ?> service = asSection(root.get("service"), "service", SERVICE_KEYS, problems);
        if (service != null) {
            if (service.containsKey("sampling")) {
                Object sampling = service.get("sampling");
                try {
                    builder.serviceSampling(ServiceSampling.fromName(String.valueOf(sampling)));
                } catch (IllegalArgumentException e) {
                    problems.add("service.sampling must be one of fixed, per_ride, per_visit, but was " + sampling);
                }
            }
            Double min = service.containsKey("min")
                ? asDouble(service.get("min"), "service.min", problems) : SimulationConfig.DEFAULT_SERVICE_MIN;
            Double mode = service.containsKey("mode")
                ? asDouble(service.get("mode"), "service.mode", problems) : SimulationConfig.DEFAULT_SERVICE_MODE;
            Double max = service.containsKey("max")
                ? asDouble(service.get("max"), "service.max", problems) : SimulationConfig.DEFAULT_SERVICE_MAX;
            if (min != null && mode != null && max != null) {
                builder.triangularService(min, mode, max);
            }
            if (service.containsKey("fixed")) {
                Double fixed = asDouble(service.get("fixed"), "service.fixed", problems);
                if (fixed != null) builder.fixedServiceMinutes(fixed);
            }
        }

        Map<?, ?> selection = asSection(root.get("selection"), "selection", SELECTION_KEYS, problems);
        if (selection != null) {
            if (selection.containsKey("policy")) {
                Object policy = selection.get("policy");
                try {
                    builder.selectionPolicy(SelectionPolicy.fromName(String.valueOf(policy)));
                } catch (IllegalArgumentException e) {
                    problems.add("selection.policy must be bounded_retry or unconditional_queue, but was " + policy);
                }
            }
            if (selection.containsKey("retry_bound")) {
                Integer bound = asInt(selection.get("retry_bound"), "selection.retry_bound", problems);
                if (bound != null) builder.retryBound(bound);
            }
        }

        if (!problems.isEmpty()) {
            throw new InvalidConfigurationException(problems);
        }
        return builder;
    }

    /// @return the configuration as a block-style YAML document
    public static String toYaml(SimulationConfig config) {
        return new Dump(dumpSettings).dumpToString(config.toMap());
    }

    /// @return the configuration as pretty-printed JSON
    public static String toJson(SimulationConfig config) {
        return gson.toJson(config.toMap());
    }

    private static Object parseYaml(String content) {
        try {
            return new Load(loadSettings).loadFromString(content);
        } catch (YamlEngineException e) {
            throw new InvalidConfigurationException("malformed YAML: " + e.getMessage(), e);
        }
    }

    private static Object parseJson(String content) {
        Type type = new TypeToken<Map<String, ?>>() {}.getType();
        try {
            return gson.fromJson(content, type);
        } catch (JsonParseException e) {
            throw new InvalidConfigurationException("malformed JSON: " + e.getMessage(), e);
        }
    }

    private static void checkKeys(Map<?, ?> section, Set<String> allowed, String prefix, List<String> problems) {
        for (Object key : section.keySet()) {
            if (!allowed.contains(String.valueOf(key))) {
                problems.add("unknown key '" + prefix + key + "'");
            }
        }
    }

    private static Map<?, ?> asSection(Object value, String name, Set<String> allowed, List<String> problems) {
        if (value == null) {
            return null;
        }
        if (value instanceof Map<?, ?> map) {
            checkKeys(map, allowed, name + ".", problems);
            return map;
        }
        problems.add(name + " must be a mapping, but was " + value);
        return null;
    }

    private static List<?> asList(Object value, String name, List<String> problems) {
        if (value instanceof List<?> list) {
            return list;
        }
        problems.add(name + " must be a list, but was " + value);
        return null;
    }

    private static Double asDouble(Object value, String name, List<String> problems) {
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        problems.add(name + " must be a number, but was " + value);
        return null;
    }

    /// Accepts whole numbers in the `long` range. Integral values that do not fit are
    /// reported rather than narrowed.
    private static Long asLong(Object value, String name, List<String> problems) {
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof BigInteger big) {
            if (big.bitLength() < Long.SIZE) {
                return big.longValue();
            }
            problems.add(name + " must be between " + Long.MIN_VALUE + " and " + Long.MAX_VALUE + ", but was " + value);
            return null;
        }
        if (value instanceof BigDecimal decimal) {
            try {
                return decimal.longValueExact();
            } catch (ArithmeticException e) {
                problems.add(name + " must be a whole number between " + Long.MIN_VALUE + " and " + Long.MAX_VALUE
                    + ", but was " + value);
                return null;
            }
        }
        if (value instanceof Number n) {
            double d = n.doubleValue();
            if (d == Math.rint(d) && !Double.isInfinite(d)) {
                // 2^63 itself is not representable as a long
                if (d >= -0x1p63 && d < 0x1p63) {
                    return (long) d;
                }
                problems.add(name + " must be between " + Long.MIN_VALUE + " and " + Long.MAX_VALUE
                    + ", but was " + value);
                return null;
            }
        }
        problems.add(name + " must be a whole number, but was " + value);
        return null;
    }

    private static Integer asInt(Object value, String name, List<String> problems) {
        Long n = asLong(value, name, problems);
        if (n == null) {
            return null;
        }
        if (n < Integer.MIN_VALUE || n > Integer.MAX_VALUE) {
            problems.add(name + " must be between " + Integer.MIN_VALUE + " and " + Integer.MAX_VALUE
                + ", but was " + value);
            return null;
        }
        return n.intValue();
    }
}
