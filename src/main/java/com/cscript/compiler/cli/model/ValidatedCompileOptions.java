package com.cscript.compiler.cli.model;

import java.nio.file.Path;

import com.cscript.compiler.build.OrchestratorSettings;
import com.cscript.compiler.model.Configuration;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed to run the compiler. Keeps CompileCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedCompileOptions {
    Path source;
    Configuration baseConfiguration;
    OrchestratorSettings settings;
}
