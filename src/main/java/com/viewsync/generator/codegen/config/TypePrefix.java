package com.viewsync.generator.codegen.config;

import lombok.NonNull;
import lombok.Value;

/**
 * One row of the ordered type-to-field-prefix table.
 */
@Value
public class TypePrefix {

    @NonNull
    String typeName;

    @NonNull
    String prefix;

    public static TypePrefix of(String typeName, String prefix) {
        return new TypePrefix(typeName, prefix);
    }
}
