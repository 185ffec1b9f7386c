package com.bko.gateway.execution;

import com.bko.gateway.execution.model.OperationContext;
import graphql.language.Argument;
import graphql.language.BooleanValue;
import graphql.language.Directive;
import graphql.language.Document;
import graphql.language.Field;
import graphql.language.FragmentDefinition;
import graphql.language.FragmentSpread;
import graphql.language.InlineFragment;
import graphql.language.NullValue;
import graphql.language.OperationDefinition;
import graphql.language.Selection;
import graphql.language.SelectionSet;
import graphql.language.Value;
import graphql.language.VariableDefinition;
import graphql.language.VariableReference;
import graphql.schema.GraphQLFieldDefinition;
import graphql.schema.GraphQLFieldsContainer;
import graphql.schema.GraphQLObjectType;
import graphql.schema.GraphQLSchema;
import graphql.schema.GraphQLType;
import graphql.schema.GraphQLTypeUtil;
import lombok.RequiredArgsConstructor;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.bko.gateway.execution.ExecutionConstants.TYPENAME_FIELD;

/**
 * Rebuilds the assembled response tree so that it holds exactly what the client operation
 * selected: fields fetched only to join entities are dropped and selected fields that no
 * service delivered become {@code null}.
 */
@Component
@RequiredArgsConstructor
public class ResponseShaper {

    private final ResultMerger resultMerger;

    public Map<String, Object> shape(Map<String, Object> data, OperationContext operationContext,
                                     Map<String, Object> variables) {
        Document document = operationContext.operationDocument();
        OperationDefinition operation = findOperation(document, operationContext.operationName());
        Map<String, FragmentDefinition> fragments = new LinkedHashMap<>();
        for (FragmentDefinition fragment : document.getDefinitionsOfType(FragmentDefinition.class)) {
            fragments.putIfAbsent(fragment.getName(), fragment);
        }
        Shaping shaping = new Shaping(operationContext.schema(), fragments, effectiveVariables(operation, variables));
        return shaping.shapeObject(data, operation.getSelectionSet(),
                rootType(operationContext.schema(), operation.getOperation()));
    }

    static OperationDefinition findOperation(Document document, @Nullable String operationName) {
        List<OperationDefinition> operations = document.getDefinitionsOfType(OperationDefinition.class);
        if (operationName != null) {
            return operations.stream()
                    .filter(operation -> operationName.equals(operation.getName()))
                    .findFirst()
                    .orElseThrow(() -> new IllegalArgumentException("Unknown operation named \"" + operationName + "\"."));
        }
        if (operations.size() != 1) {
            throw new IllegalArgumentException("Must provide operation name if query contains multiple operations.");
        }
        return operations.get(0);
    }

    /**
     * Request variables completed with the defaults the operation declares for variables the
     * request left out.
     */
    static Map<String, Object> effectiveVariables(OperationDefinition operation,
                                                  @Nullable Map<String, Object> variables) {
        Map<String, Object> effective = new HashMap<>();
        if (variables != null) {
            effective.putAll(variables);
        }
        for (VariableDefinition definition : operation.getVariableDefinitions()) {
            Value<?> defaultValue = definition.getDefaultValue();
            if (defaultValue == null || effective.containsKey(definition.getName())) {
                continue;
            }
            if (defaultValue instanceof BooleanValue booleanValue) {
                effective.put(definition.getName(), booleanValue.isValue());
            } else if (defaultValue instanceof NullValue) {
                effective.put(definition.getName(), null);
            }
        }
        return effective;
    }

    @Nullable
    private static GraphQLType rootType(@Nullable GraphQLSchema schema, OperationDefinition.Operation operation) {
        if (schema == null) {
            return null;
        }
        return switch (operation) {
            case MUTATION -> schema.getMutationType();
            case SUBSCRIPTION -> schema.getSubscriptionType();
            default -> schema.getQueryType();
        };
    }

    private final class Shaping {

        private final GraphQLSchema schema;
        private final Map<String, FragmentDefinition> fragments;
        private final Map<String, Object> variables;

        private Shaping(@Nullable GraphQLSchema schema, Map<String, FragmentDefinition> fragments,
                        Map<String, Object> variables) {
            this.schema = schema;
            this.fragments = fragments;
            this.variables = variables;
        }

        Map<String, Object> shapeObject(Map<String, Object> source, SelectionSet selectionSet,
                                        @Nullable GraphQLType parentType) {
            Map<String, Object> result = new LinkedHashMap<>();
            collect(source, selectionSet, runtimeTypename(source, parentType), result);
            return result;
        }

        private void collect(Map<String, Object> source, SelectionSet selectionSet, @Nullable String typename,
                             Map<String, Object> result) {
            for (Selection<?> selection : selectionSet.getSelections()) {
                if (selection instanceof Field field) {
                    if (included(field.getDirectives())) {
                        collectField(source, field, typename, result);
                    }
                } else if (selection instanceof InlineFragment fragment) {
                    if (included(fragment.getDirectives())
                            && (fragment.getTypeCondition() == null
                            || TypeConditions.matches(schema, fragment.getTypeCondition().getName(), typename))) {
                        collect(source, fragment.getSelectionSet(), typename, result);
                    }
                } else if (selection instanceof FragmentSpread spread) {
                    FragmentDefinition definition = fragments.get(spread.getName());
                    if (definition != null && included(spread.getDirectives())
                            && TypeConditions.matches(schema, definition.getTypeCondition().getName(), typename)) {
                        collect(source, definition.getSelectionSet(), typename, result);
                    }
                }
            }
        }

        private void collectField(Map<String, Object> source, Field field, @Nullable String typename,
                                  Map<String, Object> result) {
            String responseName = field.getAlias() != null ? field.getAlias() : field.getName();
            Object value;
            if (TYPENAME_FIELD.equals(field.getName())) {
                value = source.get(responseName) != null ? source.get(responseName) : typename;
            } else {
                value = source.get(responseName);
            }
            Object shaped = field.getSelectionSet() == null
                    ? value
                    : shapeValue(value, field.getSelectionSet(), fieldType(typename, field.getName()));
            if (result.containsKey(responseName)) {
                resultMerger.merge(result, Collections.singletonMap(responseName, shaped));
            } else {
                result.put(responseName, shaped);
            }
        }

        private Object shapeValue(Object value, SelectionSet selectionSet, @Nullable GraphQLType type) {
            if (value instanceof List<?> list) {
                List<Object> shaped = new ArrayList<>(list.size());
                for (Object element : list) {
                    shaped.add(shapeValue(element, selectionSet, type));
                }
                return shaped;
            }
            if (value instanceof Map<?, ?> map) {
                return shapeObject(ResultMerger.asObject(map), selectionSet, type);
            }
            return value;
        }

        @Nullable
        private String runtimeTypename(Map<String, Object> source, @Nullable GraphQLType parentType) {
            Object typename = source.get(TYPENAME_FIELD);
            if (typename instanceof String name) {
                return name;
            }
            if (parentType instanceof GraphQLObjectType objectType) {
                return objectType.getName();
            }
            return null;
        }

        @Nullable
        private GraphQLType fieldType(@Nullable String typename, String fieldName) {
            if (schema == null || typename == null) {
                return null;
            }
            GraphQLType parent = schema.getType(typename);
            if (!(parent instanceof GraphQLFieldsContainer container)) {
                return null;
            }
            GraphQLFieldDefinition definition = container.getFieldDefinition(fieldName);
            return definition == null ? null : GraphQLTypeUtil.unwrapAll(definition.getType());
        }

        private boolean included(List<Directive> directives) {
            for (Directive directive : directives) {
                if ("skip".equals(directive.getName()) && conditionValue(directive)) {
                    return false;
                }
                if ("include".equals(directive.getName()) && !conditionValue(directive)) {
                    return false;
                }
            }
            return true;
        }

        private boolean conditionValue(Directive directive) {
            Argument argument = directive.getArgument("if");
            if (argument == null) {
                return false;
            }
            Value<?> value = argument.getValue();
            if (value instanceof BooleanValue booleanValue) {
                return booleanValue.isValue();
            }
            if (value instanceof VariableReference reference) {
                return Boolean.TRUE.equals(variables.get(reference.getName()));
            }
            return false;
        }
    }
}
