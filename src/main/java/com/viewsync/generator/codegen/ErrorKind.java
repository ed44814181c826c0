package com.viewsync.generator.codegen;

/**
 * Why generating a view for one root failed.
 */
public enum ErrorKind {
    /**
     * The root's name is not usable as a class name. Nothing is written.
     */
    INVALID_NAME,
    /**
     * The existing artifact has no class declaration to patch. Nothing is written.
     */
    MISSING_CLASS_DECLARATION,
    IO_FAILURE,
    INTERNAL_ERROR
}
