package br.com.analytics.pipeline.sales_crm_batch.validation;

import br.com.analytics.pipeline.sales_crm_batch.exception.ChoiceViolationException;
import br.com.analytics.pipeline.sales_crm_batch.model.ColumnSpec;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

public final class ChoicesValidator implements ColumnValidator {

    private final CastingValidator delegate;
    private final Set<Object> choices;

    public ChoicesValidator(ColumnSpec spec) {
        this(null, spec);
    }

    public ChoicesValidator(@Nullable String column, ColumnSpec spec) {
        this.delegate = new CastingValidator(column, spec);
        this.choices = new LinkedHashSet<>();
        for (String choice : spec.choices()) {
            choices.add(delegate.cast(column, choice));
        }
    }

    @Override
    public List<Object> transformType(String column, List<?> values) {
        return delegate.transformType(column, values);
    }

    @Override
    public List<Object> mapValue(String column, List<Object> values) {
        return delegate.mapValue(column, values);
    }

    @Override
    public List<Object> validate(String column, List<?> values) {
        List<Object> validated = delegate.validate(column, values);
        Set<String> offending = new TreeSet<>();
        for (Object value : validated) {
            if (value == null || !choices.contains(value)) {
                offending.add(Objects.toString(value));
            }
        }
        if (!offending.isEmpty()) {
            throw new ChoiceViolationException(column, new ArrayList<>(offending));
        }
        return validated;
    }
}
