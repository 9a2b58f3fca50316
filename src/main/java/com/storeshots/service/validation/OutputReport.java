package com.storeshots.service.validation;

import java.util.List;

public record OutputReport(ImageInspection inspection, double meanLuminance, List<String> warnings) {

    public OutputReport {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
