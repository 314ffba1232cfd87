package edu.harvard.hms.dbmi.avillach.profiler;

import edu.harvard.hms.dbmi.avillach.profiler.dialect.DialectInfo;
import edu.harvard.hms.dbmi.avillach.profiler.field.FieldProfile;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

public record FileProfile(Path file, DialectInfo dialect, List<FieldProfile> fields) {

    public FileProfile {
        fields = List.copyOf(fields);
    }

    public Optional<FieldProfile> field(String name) {
        return fields.stream().filter(field -> field.name().equals(name)).findFirst();
    }
}
