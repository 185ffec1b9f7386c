package com.bko.gateway.execution;

import com.bko.gateway.plan.FieldSelection;
import com.bko.gateway.plan.InlineFragmentSelection;
import com.bko.gateway.plan.Selection;
import graphql.schema.GraphQLSchema;
import lombok.RequiredArgsConstructor;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.bko.gateway.execution.ExecutionConstants.TYPENAME_FIELD;

/**
 * Builds the representation of one entity from the fields its fetch {@code requires}.
 *
 * <p>An entity yields no representation when a required field has not been written to the
 * response tree, when the result carries no {@code __typename}, or when that typename does
 * not satisfy the fetch's type condition. Present values are copied as they are, including
 * {@code null} and other falsey values.
 */
@Component
@RequiredArgsConstructor
public class RepresentationBuilder {

    private static final Object MISSING = new Object();

    private final ResultMerger resultMerger;

    public Optional<Map<String, Object>> build(Map<String, Object> entity,
                                               List<Selection> requires,
                                               @Nullable String typeCondition,
                                               @Nullable GraphQLSchema schema) {
        Object selected = select(entity, requires, schema);
        if (selected == MISSING || !(selected instanceof Map<?, ?>)) {
            return Optional.empty();
        }
        Map<String, Object> representation = ResultMerger.asObject(selected);
        Object typename = representation.get(TYPENAME_FIELD);
        if (!(typename instanceof String)) {
            return Optional.empty();
        }
        if (StringUtils.hasText(typeCondition) && !TypeConditions.matches(schema, typeCondition, typename)) {
            return Optional.empty();
        }
        return Optional.of(representation);
    }

    private Object select(Object source, List<Selection> selections, @Nullable GraphQLSchema schema) {
        if (source == null) {
            return null;
        }
        if (!(source instanceof Map<?, ?>)) {
            return source;
        }
        Map<String, Object> object = ResultMerger.asObject(source);
        Map<String, Object> result = new LinkedHashMap<>();
        for (Selection selection : selections) {
            if (selection instanceof FieldSelection field) {
                String responseName = field.responseName();
                if (!object.containsKey(responseName)) {
                    return MISSING;
                }
                Object value = object.get(responseName);
                Object selected = field.hasSelections()
                        ? selectValue(value, field.selections(), schema)
                        : ResultMerger.copy(value);
                if (selected == MISSING) {
                    return MISSING;
                }
                result.put(responseName, selected);
            } else if (selection instanceof InlineFragmentSelection fragment) {
                if (StringUtils.hasText(fragment.typeCondition())
                        && !TypeConditions.matches(schema, fragment.typeCondition(), object.get(TYPENAME_FIELD))) {
                    continue;
                }
                Object selected = select(object, fragment.selections(), schema);
                if (selected == MISSING) {
                    return MISSING;
                }
                resultMerger.merge(result, ResultMerger.asObject(selected));
            }
        }
        return result;
    }

    private Object selectValue(Object value, List<Selection> selections, @Nullable GraphQLSchema schema) {
        if (value instanceof List<?> list) {
            List<Object> selected = new ArrayList<>(list.size());
            for (Object element : list) {
                Object item = selectValue(element, selections, schema);
                if (item == MISSING) {
                    return MISSING;
                }
                selected.add(item);
            }
            return selected;
        }
        return select(value, selections, schema);
    }
}
