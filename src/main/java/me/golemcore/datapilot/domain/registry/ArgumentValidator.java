package me.golemcore.datapilot.domain.registry;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.datapilot.domain.exception.SchemaValidationException;
import me.golemcore.datapilot.domain.exception.Violation;
import me.golemcore.datapilot.domain.model.ArtifactReference;
import me.golemcore.datapilot.domain.model.ToolDescriptor;
import me.golemcore.datapilot.domain.model.ToolParameter;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Validates and coerces model-proposed arguments. Collects every violation
 * before failing.
 */
class ArgumentValidator {

    private static final BigDecimal LONG_MIN = BigDecimal.valueOf(Long.MIN_VALUE);
    private static final BigDecimal LONG_MAX = BigDecimal.valueOf(Long.MAX_VALUE);

    Map<String, Object> validate(ToolDescriptor descriptor, Map<String, Object> arguments) {
        Map<String, Object> input = arguments != null ? arguments : Map.of();
        List<Violation> violations = new ArrayList<>();
        Map<String, Object> coerced = new LinkedHashMap<>();

        for (String key : input.keySet()) {
            if (descriptor.parameter(key).isEmpty()) {
                violations.add(new Violation(key, Violation.Code.UNKNOWN_PARAMETER,
                        "is not a parameter of " + descriptor.getName()));
            }
        }

        for (ToolParameter parameter : descriptor.getParameters()) {
            Object raw = input.get(parameter.getName());
            if (raw == null || (raw instanceof String text && text.isBlank())) {
                if (parameter.getDefaultValue() != null) {
                    coerced.put(parameter.getName(), parameter.getDefaultValue());
                } else if (parameter.isRequired()) {
                    violations.add(new Violation(parameter.getName(), Violation.Code.MISSING_REQUIRED,
                            "is required"));
                }
                continue;
            }
            coerce(parameter, raw, violations).ifPresent(value -> coerced.put(parameter.getName(), value));
        }

        if (!violations.isEmpty()) {
            throw new SchemaValidationException(descriptor.getName(), violations);
        }
        return coerced;
    }

    private Optional<Object> coerce(ToolParameter parameter, Object raw, List<Violation> violations) {
        String field = parameter.getName();
        return switch (parameter.getType()) {
        case STRING -> asString(raw)
                .<Object>map(value -> checkAllowed(parameter, value, violations))
                .or(() -> wrongType(field, "a string", raw, violations));
        case ENUM -> asString(raw)
                .<Object>map(value -> matchEnum(parameter, value, violations))
                .or(() -> wrongType(field, "one of " + parameter.getAllowedValues(), raw, violations));
        case INTEGER -> asWholeNumber(raw)
                .map(value -> checkInteger(parameter, value, violations))
                .or(() -> wrongType(field, "an integer", raw, violations));
        case NUMBER -> asDouble(raw)
                .<Object>map(value -> checkRange(parameter, value, value, violations))
                .or(() -> wrongType(field, "a number", raw, violations));
        case BOOLEAN -> asBoolean(raw)
                .<Object>map(value -> value)
                .or(() -> wrongType(field, "true or false", raw, violations));
        case STRING_LIST -> asStringList(raw)
                .<Object>map(value -> value)
                .or(() -> wrongType(field, "a list of strings", raw, violations));
        case ARTIFACT -> asArtifactReference(parameter, raw, violations);
        };
    }

    private Object checkAllowed(ToolParameter parameter, String value, List<Violation> violations) {
        if (!parameter.getAllowedValues().isEmpty() && !parameter.getAllowedValues().contains(value)) {
            violations.add(new Violation(parameter.getName(), Violation.Code.NOT_ALLOWED,
                    "'" + value + "' is not one of " + parameter.getAllowedValues()));
        }
        return value;
    }

    private Object matchEnum(ToolParameter parameter, String value, List<Violation> violations) {
        for (String allowed : parameter.getAllowedValues()) {
            if (allowed.equalsIgnoreCase(value.trim())) {
                return allowed;
            }
        }
        violations.add(new Violation(parameter.getName(), Violation.Code.NOT_ALLOWED,
                "'" + value + "' is not one of " + parameter.getAllowedValues()));
        return value;
    }

    private Object checkRange(ToolParameter parameter, double numeric, Object value, List<Violation> violations) {
        Double min = parameter.getMinimum();
        Double max = parameter.getMaximum();
        if ((min != null && numeric < min) || (max != null && numeric > max)) {
            violations.add(new Violation(parameter.getName(), Violation.Code.OUT_OF_RANGE,
                    value + " is outside " + describeRange(min, max)));
        }
        return value;
    }

    private Object checkInteger(ToolParameter parameter, BigDecimal value, List<Violation> violations) {
        if (value.compareTo(LONG_MIN) < 0 || value.compareTo(LONG_MAX) > 0) {
            violations.add(new Violation(parameter.getName(), Violation.Code.OUT_OF_RANGE,
                    value + " is outside the 64-bit integer range"));
            return value;
        }
        long exact = value.longValueExact();
        return checkRange(parameter, exact, exact, violations);
    }

    private Optional<Object> asArtifactReference(ToolParameter parameter, Object raw, List<Violation> violations) {
        if (!(raw instanceof String) && !(raw instanceof Number)) {
            return wrongType(parameter.getName(), "an artifact reference", raw, violations);
        }
        try {
            return Optional.of(ArtifactReference.parse(raw.toString(), parameter.getArtifactName()).format());
        } catch (IllegalArgumentException e) {
            violations.add(new Violation(parameter.getName(), Violation.Code.WRONG_TYPE, e.getMessage()));
            return Optional.empty();
        }
    }

    private static Optional<Object> wrongType(String field, String expected, Object raw, List<Violation> violations) {
        violations.add(new Violation(field, Violation.Code.WRONG_TYPE,
                "expected " + expected + " but got " + describeValue(raw)));
        return Optional.empty();
    }

    private static Optional<String> asString(Object raw) {
        if (raw instanceof String text) {
            return Optional.of(text);
        }
        if (raw instanceof Number || raw instanceof Boolean) {
            return Optional.of(raw.toString());
        }
        return Optional.empty();
    }

    // Exact, so that integers beyond the long range are reported instead of clamped.
    private static Optional<BigDecimal> asWholeNumber(Object raw) {
        BigDecimal value;
        if (raw instanceof Integer || raw instanceof Long || raw instanceof Short || raw instanceof Byte) {
            value = BigDecimal.valueOf(((Number) raw).longValue());
        } else if (raw instanceof BigDecimal decimal) {
            value = decimal;
        } else if (raw instanceof BigInteger integer) {
            value = new BigDecimal(integer);
        } else if (raw instanceof Number number) {
            double numeric = number.doubleValue();
            if (!Double.isFinite(numeric)) {
                return Optional.empty();
            }
            value = BigDecimal.valueOf(numeric);
        } else if (raw instanceof String text) {
            try {
                value = new BigDecimal(text.trim());
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        } else {
            return Optional.empty();
        }
        return value.stripTrailingZeros().scale() <= 0 ? Optional.of(value) : Optional.empty();
    }

    private static Optional<Double> asDouble(Object raw) {
        if (raw instanceof Number number) {
            double value = number.doubleValue();
            return Double.isFinite(value) ? Optional.of(value) : Optional.empty();
        }
        if (raw instanceof String text) {
            try {
                double value = Double.parseDouble(text.trim());
                return Double.isFinite(value) ? Optional.of(value) : Optional.empty();
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    private static Optional<Boolean> asBoolean(Object raw) {
        if (raw instanceof Boolean value) {
            return Optional.of(value);
        }
        if (raw instanceof String text) {
            String normalized = text.trim().toLowerCase(Locale.ROOT);
            if ("true".equals(normalized)) {
                return Optional.of(Boolean.TRUE);
            }
            if ("false".equals(normalized)) {
                return Optional.of(Boolean.FALSE);
            }
        }
        return Optional.empty();
    }

    private static Optional<List<String>> asStringList(Object raw) {
        if (raw instanceof String text) {
            List<String> parts = new ArrayList<>();
            for (String part : text.split(",")) {
                if (!part.isBlank()) {
                    parts.add(part.trim());
                }
            }
            return Optional.of(parts);
        }
        if (raw instanceof List<?> list) {
            List<String> values = new ArrayList<>();
            for (Object item : list) {
                Optional<String> value = asString(item);
                if (value.isEmpty()) {
                    return Optional.empty();
                }
                values.add(value.get());
            }
            return Optional.of(values);
        }
        return Optional.empty();
    }

    private static String describeRange(Double min, Double max) {
        return "[" + (min != null ? formatNumber(min) : "-inf") + ", " + (max != null ? formatNumber(max) : "+inf")
                + "]";
    }

    private static String formatNumber(double value) {
        return value == Math.rint(value) ? Long.toString((long) value) : Double.toString(value);
    }

    private static String describeValue(Object raw) {
        if (raw instanceof Map<?, ?>) {
            return "an object";
        }
        if (raw instanceof List<?>) {
            return "a list";
        }
        return "'" + raw + "'";
    }
}
