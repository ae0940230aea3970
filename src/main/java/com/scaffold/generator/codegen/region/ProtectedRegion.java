package com.scaffold.generator.codegen.region;

import java.util.List;
import java.util.Objects;

import lombok.Value;

/**
 * A named block of hand-written lines, including its own start and end marker lines.
 */
@Value
public class ProtectedRegion {

    String name;

    List<String> lines;

    public ProtectedRegion(String name, List<String> lines) {
        this.name = Objects.requireNonNull(name, "name");
        this.lines = List.copyOf(lines);
    }

    /**
     * The lines between the two markers.
     */
    public List<String> body() {
        return lines.size() <= 2 ? List.of() : lines.subList(1, lines.size() - 1);
    }
}
