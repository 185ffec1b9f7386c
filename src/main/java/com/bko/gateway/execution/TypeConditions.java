package com.bko.gateway.execution;

import graphql.schema.GraphQLInterfaceType;
import graphql.schema.GraphQLSchema;
import graphql.schema.GraphQLType;
import graphql.schema.GraphQLUnionType;
import org.springframework.lang.Nullable;

final class TypeConditions {

    private TypeConditions() {
    }

    /**
     * Whether an object of runtime type {@code typename} satisfies {@code typeCondition}:
     * the names are equal, or the condition is an interface or union the type belongs to.
     */
    static boolean matches(@Nullable GraphQLSchema schema, String typeCondition, @Nullable Object typename) {
        if (!(typename instanceof String concreteName)) {
            return false;
        }
        if (typeCondition.equals(concreteName)) {
            return true;
        }
        if (schema == null) {
            return false;
        }
        GraphQLType conditionType = schema.getType(typeCondition);
        if (conditionType instanceof GraphQLInterfaceType interfaceType) {
            return schema.getImplementations(interfaceType).stream()
                    .anyMatch(objectType -> objectType.getName().equals(concreteName));
        }
        if (conditionType instanceof GraphQLUnionType unionType) {
            return unionType.getTypes().stream()
                    .anyMatch(member -> member.getName().equals(concreteName));
        }
        return false;
    }
}
