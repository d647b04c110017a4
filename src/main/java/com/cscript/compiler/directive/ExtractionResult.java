package com.cscript.compiler.directive;

import java.util.List;

import com.cscript.compiler.model.Configuration;
import com.cscript.compiler.model.Diagnostic;
import com.cscript.compiler.model.SourceUnit;

import lombok.Value;

/**
 * Output of directive extraction: the unit with directive lines blanked, the
 * effective configuration and any non-fatal warnings.
 */
@Value
public class ExtractionResult {
    SourceUnit unit;
    Configuration configuration;
    List<Diagnostic> warnings;
}
