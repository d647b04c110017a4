package com.cscript.compiler.model;

import java.nio.file.Path;

import lombok.NonNull;
import lombok.Value;

/**
 * The single executable produced by a successful build.
 */
@Value
public class BuildArtifact {

    @NonNull
    Path path;
}
