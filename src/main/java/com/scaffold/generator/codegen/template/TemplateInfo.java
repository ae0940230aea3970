package com.scaffold.generator.codegen.template;

import java.nio.file.Path;

import lombok.NonNull;
import lombok.Value;

/**
 * Where a resolved template lives and which root supplied it.
 */
@Value
public class TemplateInfo {

    @NonNull
    TemplateKey key;

    @NonNull
    Path path;

    @NonNull
    TemplateSource source;
}
