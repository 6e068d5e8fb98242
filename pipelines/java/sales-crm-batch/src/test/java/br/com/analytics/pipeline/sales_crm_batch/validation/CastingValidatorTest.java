package br.com.analytics.pipeline.sales_crm_batch.validation;

import br.com.analytics.pipeline.sales_crm_batch.exception.TypeCoercionException;
import br.com.analytics.pipeline.sales_crm_batch.exception.ValueMappingConflictException;
import br.com.analytics.pipeline.sales_crm_batch.model.ColumnSpec;
import br.com.analytics.pipeline.sales_crm_batch.model.ColumnType;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CastingValidatorTest {

    @Test
    void castsIntegersFromNumbersAndStrings() {
        CastingValidator validator = new CastingValidator(ColumnSpec.of(ColumnType.INTEGER));

        List<Object> values = validator.validate("unit_sales", Arrays.asList(10, "12", " 7 ", 3.0, 5L, null));

        assertThat(values).containsExactly(10L, 12L, 7L, 3L, 5L, null);
        assertThat(values).filteredOn(value -> value != null).allMatch(value -> value instanceof Long);
    }

    @Test
    void rejectsFractionalIntegers() {
        CastingValidator validator = new CastingValidator(ColumnSpec.of(ColumnType.INTEGER));

        assertThatThrownBy(() -> validator.validate("unit_sales", List.of(1, 2.5)))
                .isInstanceOf(TypeCoercionException.class)
                .hasMessageContaining("unit_sales")
                .hasMessageContaining("2.5")
                .hasMessageContaining("integer");
    }

    @Test
    void rejectsNonNumericIntegerText() {
        CastingValidator validator = new CastingValidator(ColumnSpec.of(ColumnType.INTEGER));

        assertThatThrownBy(() -> validator.validate("unit_sales", List.of("ten")))
                .isInstanceOfSatisfying(TypeCoercionException.class, e -> {
                    assertThat(e.getColumn()).isEqualTo("unit_sales");
                    assertThat(e.getValue()).isEqualTo("ten");
                    assertThat(e.getTargetType()).isEqualTo(ColumnType.INTEGER);
                });
    }

    @Test
    void castsFloats() {
        CastingValidator validator = new CastingValidator(ColumnSpec.of(ColumnType.FLOAT));

        assertThat(validator.validate("price", List.of(1, "2.5", 0.25f))).containsExactly(1.0, 2.5, 0.25);
        assertThatThrownBy(() -> validator.validate("price", List.of("cheap")))
                .isInstanceOf(TypeCoercionException.class);
    }

    @Test
    void castsAnythingToText() {
        CastingValidator validator = new CastingValidator(ColumnSpec.of(ColumnType.TEXT));

        assertThat(validator.validate("acct_id", List.of(42, "A-1", 1.5))).containsExactly("42", "A-1", "1.5");
    }

    @Test
    void remapsSynonymsToTheirCanonicalValue() {
        ColumnSpec spec = new ColumnSpec(ColumnType.TEXT, Map.of("A", List.of("a1", " A")), null);
        CastingValidator validator = new CastingValidator(spec);

        assertThat(validator.validate("product_name", List.of("a1", " A", "A"))).containsExactly("A", "A", "A");
    }

    @Test
    void unmappedValuesBecomeMissing() {
        ColumnSpec spec = new ColumnSpec(ColumnType.TEXT, Map.of("A", List.of("a1")), null);
        CastingValidator validator = new CastingValidator(spec);

        assertThat(validator.validate("product_name", List.of("a1", "B"))).containsExactly("A", null);
    }

    @Test
    void synonymClaimedByTwoCanonicalValuesFailsFast() {
        Map<String, List<String>> mapping = new LinkedHashMap<>();
        mapping.put("A", List.of("x"));
        mapping.put("B", List.of("x"));

        assertThatThrownBy(() -> new CastingValidator(new ColumnSpec(ColumnType.TEXT, mapping, null)))
                .isInstanceOf(ValueMappingConflictException.class)
                .hasMessageContaining("'x'")
                .hasMessageContaining("'A'")
                .hasMessageContaining("'B'");
    }

    @Test
    void canonicalValueListedAsAnotherValuesSynonymIsAConflict() {
        Map<String, List<String>> mapping = new LinkedHashMap<>();
        mapping.put("A", List.of("a"));
        mapping.put("B", List.of("A"));

        assertThatThrownBy(() -> new CastingValidator(new ColumnSpec(ColumnType.TEXT, mapping, null)))
                .isInstanceOf(ValueMappingConflictException.class);
    }

    @Test
    void typeIsCastBeforeMapping() {
        ColumnSpec spec = new ColumnSpec(ColumnType.TEXT, Map.of("one", List.of("1")), null);
        CastingValidator validator = new CastingValidator(spec);

        assertThat(validator.validate("label", List.of(1, "1", "one"))).containsExactly("one", "one", "one");
    }

    @Test
    void refusesDateSpecs() {
        assertThatThrownBy(() -> new CastingValidator(ColumnSpec.of(ColumnType.DATE)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
