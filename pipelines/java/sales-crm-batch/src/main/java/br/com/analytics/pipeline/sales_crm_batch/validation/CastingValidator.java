package br.com.analytics.pipeline.sales_crm_batch.validation;

import br.com.analytics.pipeline.sales_crm_batch.exception.TypeCoercionException;
import br.com.analytics.pipeline.sales_crm_batch.exception.ValueMappingConflictException;
import br.com.analytics.pipeline.sales_crm_batch.model.ColumnSpec;
import br.com.analytics.pipeline.sales_crm_batch.model.ColumnType;
import org.jspecify.annotations.Nullable;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Validator for {@code integer}, {@code float} and {@code text} columns: casts every cell to the
 * target type, then replaces raw synonyms by their canonical value when the column declares a
 * value mapping. Values without an entry in the mapping become null.
 */
public final class CastingValidator implements ColumnValidator {

    private final ColumnType type;
    private final Map<String, Object> canonicalBySynonym;

    public CastingValidator(ColumnSpec spec) {
        this(null, spec);
    }

    public CastingValidator(@Nullable String column, ColumnSpec spec) {
        if (spec.type() == null || !spec.type().isCastable()) {
            throw new IllegalArgumentException("Casting validator cannot handle type " + spec.type());
        }
        this.type = spec.type();
        this.canonicalBySynonym = spec.hasValueMapping() ? buildMapping(column, spec.valueMapping()) : null;
    }

    public ColumnType getType() {
        return type;
    }

    @Override
    public List<Object> transformType(String column, List<?> values) {
        List<Object> cast = new ArrayList<>(values.size());
        for (Object value : values) {
            cast.add(cast(column, value));
        }
        return cast;
    }

    @Override
    public List<Object> mapValue(String column, List<Object> values) {
        if (canonicalBySynonym == null) {
            return values;
        }
        List<Object> mapped = new ArrayList<>(values.size());
        for (Object value : values) {
            mapped.add(value == null ? null : canonicalBySynonym.get(String.valueOf(value)));
        }
        return mapped;
    }

    Object cast(String column, Object value) {
        if (value == null) {
            return null;
        }
        switch (type) {
            case INTEGER:
                return toLong(column, value);
            case FLOAT:
                return toDouble(column, value);
            default:
                return String.valueOf(value);
        }
    }

    private Map<String, Object> buildMapping(@Nullable String column, Map<String, List<String>> valueMapping) {
        Map<String, String> owners = new HashMap<>();
        Map<String, Object> mapping = new HashMap<>();
        for (Map.Entry<String, List<String>> entry : valueMapping.entrySet()) {
            String canonical = entry.getKey();
            Object canonicalValue = cast(column, canonical);
            claim(column, owners, mapping, canonical, canonical, canonicalValue);
            for (String synonym : entry.getValue()) {
                claim(column, owners, mapping, synonym, canonical, canonicalValue);
            }
        }
        return mapping;
    }

    private static void claim(@Nullable String column, Map<String, String> owners, Map<String, Object> mapping,
                              String synonym, String canonical, Object canonicalValue) {
        String owner = owners.putIfAbsent(synonym, canonical);
        if (owner != null && !owner.equals(canonical)) {
            throw new ValueMappingConflictException(column, synonym, owner, canonical);
        }
        mapping.put(synonym, canonicalValue);
    }

    private Long toLong(String column, Object value) {
        try {
            if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
                return ((Number) value).longValue();
            }
            if (value instanceof BigInteger) {
                return ((BigInteger) value).longValueExact();
            }
            if (value instanceof Number) {
                return new BigDecimal(value.toString()).longValueExact();
            }
            if (value instanceof String) {
                return Long.parseLong(((String) value).trim());
            }
        } catch (ArithmeticException | NumberFormatException e) {
            throw new TypeCoercionException(column, value, type);
        }
        throw new TypeCoercionException(column, value, type);
    }

    private Double toDouble(String column, Object value) {
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof String) {
            try {
                return Double.parseDouble(((String) value).trim());
            } catch (NumberFormatException e) {
                throw new TypeCoercionException(column, value, type);
            }
        }
        throw new TypeCoercionException(column, value, type);
    }
}
