package com.viewsync.generator.codegen.config;

/**
 * How generated fields get their values.
 */
public enum BindingMode {

    /**
     * Generated code looks every field up by path when the view binds.
     */
    EXPLICIT_INIT,

    /**
     * Fields are persisted on the template instance and written by the reference assigner;
     * the generated initializer region stays empty.
     */
    DECLARATIVE_REFERENCE
}
