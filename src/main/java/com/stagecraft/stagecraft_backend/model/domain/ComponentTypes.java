package com.stagecraft.stagecraft_backend.model.domain;

import java.util.Set;

/** Vocabularies for component stages and declared input/output types. */
public final class ComponentTypes {

    public static final String STAGE_1 = "stage1";
    public static final String STAGE_2 = "stage2";
    public static final String STAGE_3 = "stage3";
    public static final String STAGE_4 = "stage4";

    public static final Set<String> STAGES = Set.of(STAGE_1, STAGE_2, STAGE_3, STAGE_4);

    public static final String NONE = "none";

    public static final Set<String> INPUT_TYPES = Set.of(
            "string", "int", "float", "tensor", "bool", "list", "dict", "DataFrame", "Series",
            "tuple", "array", "object", "iterable", "datetime", "ndarray", "function",
            "keras.model", "callable", "any");

    public static final Set<String> OUTPUT_TYPES = Set.of(
            "string", "int", "float", "tensor", "bool", "list", "dict", "any", "DataFrame",
            "Series", "tuple", "array", "object", "iterable", "datetime", "ndarray", NONE);

    private ComponentTypes() {}
}
