package com.cscript.compiler.build.profile;

import com.cscript.compiler.model.Configuration;
import com.cscript.compiler.model.ProfileMode;

/**
 * Decides whether a unit gets the two-pass profile-guided build.
 *
 * <p>{@code on} always profiles and {@code off} never does. {@code auto}
 * profiles only when the optimization level is {@code O3} or {@code max} and
 * the unit defines {@code main}, since only a complete program can be run.
 */
public class ProfilePolicy {

    static final String ENTRY_POINT = "main";

    private final FunctionAnnotator annotator;

    public ProfilePolicy(FunctionAnnotator annotator) {
        this.annotator = annotator;
    }

    public boolean shouldProfile(Configuration configuration, String loweredText) {
        ProfileMode mode = configuration.getProfile();
        if (mode == ProfileMode.ON) {
            return true;
        }
        if (mode == ProfileMode.OFF) {
            return false;
        }
        return configuration.getOpt().isAggressive() && annotator.definesFunction(loweredText, ENTRY_POINT);
    }
}
