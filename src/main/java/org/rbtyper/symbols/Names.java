package org.rbtyper.symbols;

import java.util.List;

/**
 * Well-known identifiers the front end compares against. Every entry is
 * pre-entered into each {@link NameTable}.
 */
public final class Names {
    // Property declaration macros
    public static final String PROP = "prop";
    public static final String CONST = "const";
    public static final String TOKEN_PROP = "token_prop";
    public static final String TIMESTAMPED_TOKEN_PROP = "timestamped_token_prop";
    public static final String CREATED_PROP = "created_prop";
    public static final String MERCHANT_PROP = "merchant_prop";

    // Names implied by the macro aliases
    public static final String TOKEN = "token";
    public static final String CREATED = "created";
    public static final String MERCHANT = "merchant";

    // Options map keys
    public static final String IMMUTABLE = "immutable";
    public static final String FACTORY = "factory";
    public static final String DEFAULT = "default";
    public static final String COMPUTED_BY = "computed_by";
    public static final String FOREIGN = "foreign";
    public static final String IFUNSET = "ifunset";

    // Type and signature vocabulary
    public static final String NILABLE = "nilable";
    public static final String UNTYPED = "untyped";
    public static final String UNSAFE = "unsafe";
    public static final String ASSERT_TYPE = "assert_type!";
    public static final String SIG = "sig";
    public static final String PARAMS = "params";
    public static final String RETURNS = "returns";
    public static final String VOID = "void";
    public static final String SQUARE_BRACKETS = "[]";
    public static final String ENUM = "enum";

    // Methods and arguments the rewriter synthesizes or inspects
    public static final String LAMBDA = "lambda";
    public static final String PROC = "proc";
    public static final String RAISE = "raise";
    public static final String CLASS = "class";
    public static final String INITIALIZE = "initialize";
    public static final String ARG0 = "arg0";
    public static final String OPTS = "opts";

    // Constants
    public static final String CONSTANT_T = "T";
    public static final String CONSTANT_STRUCT = "Struct";
    public static final String CONSTANT_HASH = "Hash";
    public static final String CONSTANT_ARRAY = "Array";
    public static final String CONSTANT_KERNEL = "Kernel";
    public static final String CONSTANT_MUTATOR = "Mutator";
    public static final String CONSTANT_HASH_MUTATOR = "HashMutator";
    public static final String CONSTANT_ARRAY_MUTATOR = "ArrayMutator";
    public static final String CONSTANT_CHALK = "Chalk";
    public static final String CONSTANT_ODM = "ODM";

    static final List<String> ALL = List.of(
            PROP, CONST, TOKEN_PROP, TIMESTAMPED_TOKEN_PROP, CREATED_PROP, MERCHANT_PROP,
            TOKEN, CREATED, MERCHANT,
            IMMUTABLE, FACTORY, DEFAULT, COMPUTED_BY, FOREIGN, IFUNSET,
            NILABLE, UNTYPED, UNSAFE, ASSERT_TYPE, SIG, PARAMS, RETURNS, VOID, SQUARE_BRACKETS, ENUM,
            LAMBDA, PROC, RAISE, CLASS, INITIALIZE, ARG0, OPTS,
            CONSTANT_T, CONSTANT_STRUCT, CONSTANT_HASH, CONSTANT_ARRAY, CONSTANT_KERNEL,
            CONSTANT_MUTATOR, CONSTANT_HASH_MUTATOR, CONSTANT_ARRAY_MUTATOR, CONSTANT_CHALK, CONSTANT_ODM);

    private Names() {
    }
}
