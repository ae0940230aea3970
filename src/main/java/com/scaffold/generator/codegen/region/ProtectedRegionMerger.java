package com.scaffold.generator.codegen.region;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.scaffold.generator.codegen.model.core.context.GenerationDiagnostics;

/**
 * Carries hand-written code across regenerations.
 *
 * <p>Users wrap their code in a pair of full-line comments:
 * <pre>
 * # BRICKEND:PROTECTED-START CUSTOM_QUERIES
 * def find_active_users(db): ...
 * # BRICKEND:PROTECTED-END CUSTOM_QUERIES
 * </pre>
 * On the next run the block is lifted out of the existing file and spliced into the
 * freshly rendered content at an anchor chosen by {@link #inject}.
 */
public class ProtectedRegionMerger {

    private static final Logger log = LoggerFactory.getLogger(ProtectedRegionMerger.class);

    public static final String START_MARKER = "BRICKEND:PROTECTED-START";
    public static final String END_MARKER = "BRICKEND:PROTECTED-END";

    static final Pattern START_PATTERN =
            Pattern.compile("^\\s*#\\s*" + Pattern.quote(START_MARKER) + "\\s+(\\w+)\\s*$");
    static final Pattern END_PATTERN =
            Pattern.compile("^\\s*#\\s*" + Pattern.quote(END_MARKER) + "\\s+(\\w+)\\s*$");

    /**
     * Renders the marker comment that opens a region, for templates and tests.
     */
    public static String startMarker(String regionName) {
        return "# " + START_MARKER + " " + regionName;
    }

    public static String endMarker(String regionName) {
        return "# " + END_MARKER + " " + regionName;
    }

    /**
     * Collects every well-formed region in the content. Never fails.
     *
     * <p>A start marker opens a region and drops any region still open. An end marker
     * only closes the open region when the names match; otherwise the marker line is
     * ignored. Regions still open at end of input are dropped. When a name occurs twice
     * the later region wins.
     */
    public ProtectedRegionSet extract(String content) {
        if (content == null || content.isEmpty()) {
            return ProtectedRegionSet.empty();
        }

        Map<String, ProtectedRegion> regions = new LinkedHashMap<>();
        String currentName = null;
        List<String> currentLines = new ArrayList<>();

        for (String line : content.lines().collect(Collectors.toList())) {
            Matcher start = START_PATTERN.matcher(line);
            Matcher end = END_PATTERN.matcher(line);

            if (start.matches()) {
                currentName = start.group(1);
                currentLines = new ArrayList<>();
                currentLines.add(line);
            } else if (end.matches() && currentName != null) {
                if (end.group(1).equals(currentName)) {
                    currentLines.add(line);
                    regions.put(currentName, new ProtectedRegion(currentName, currentLines));
                    currentName = null;
                    currentLines = new ArrayList<>();
                }
            } else if (currentName != null) {
                currentLines.add(line);
            }
        }

        return new ProtectedRegionSet(regions);
    }

    /**
     * Splices the regions into newly rendered content.
     *
     * <p>Lines are scanned in order. After an import line whose next non-blank line starts a
     * top-level function definition, every region not yet placed is inserted, in lexical
     * name order, each surrounded by blank lines. Regions left over are inserted right
     * before the last top-level function definition, or appended at the end when the
     * content defines no function. Each region is placed exactly once.
     */
    public String inject(String newContent, ProtectedRegionSet regions) {
        if (regions == null || regions.isEmpty()) {
            return newContent;
        }

        List<String> lines = newContent.lines().collect(Collectors.toList());
        List<String> result = new ArrayList<>(lines.size() + regions.size() * 4);
        Set<String> injected = new HashSet<>();

        for (int i = 0; i < lines.size(); i++) {
            result.add(lines.get(i));
            if (injected.size() == regions.size() || !isAnchor(lines, i)) {
                continue;
            }
            for (ProtectedRegion region : regions.regions()) {
                if (injected.add(region.getName())) {
                    appendSurrounded(result, region);
                }
            }
        }

        List<ProtectedRegion> remaining = regions.regions().stream()
                .filter(r -> !injected.contains(r.getName()))
                .collect(Collectors.toList());
        if (!remaining.isEmpty()) {
            int lastFunction = lastDefinitionStart(result);
            if (lastFunction >= 0) {
                List<String> block = new ArrayList<>();
                for (ProtectedRegion region : remaining) {
                    appendSurrounded(block, region);
                }
                result.addAll(lastFunction, block);
            } else {
                for (ProtectedRegion region : remaining) {
                    result.add("");
                    result.addAll(region.getLines());
                }
            }
        }

        String merged = String.join("\n", result);
        return newContent.endsWith("\n") ? merged + "\n" : merged;
    }

    /**
     * Extracts regions from the file at {@code existingFile} and injects them into
     * {@code newContent}. Returns {@code newContent} untouched when the file does not exist
     * or anything goes wrong while reading or merging; a failure is logged and recorded
     * as a warning but never thrown.
     */
    public String preserveAcrossRegeneration(Path existingFile, String newContent, GenerationDiagnostics diagnostics) {
        if (!Files.exists(existingFile)) {
            return newContent;
        }
        try {
            String existing = Files.readString(existingFile, StandardCharsets.UTF_8);
            ProtectedRegionSet regions = extract(existing);
            if (!regions.isEmpty()) {
                log.debug("Preserving {} protected region(s) in {}: {}", regions.size(), existingFile, regions.names());
            }
            return inject(newContent, regions);
        } catch (IOException | RuntimeException e) {
            String message = "Could not preserve protected regions in " + existingFile + ": " + e.getMessage();
            log.warn(message);
            if (diagnostics != null) {
                diagnostics.warn(message);
            }
            return newContent;
        }
    }

    public String preserveAcrossRegeneration(Path existingFile, String newContent) {
        return preserveAcrossRegeneration(existingFile, newContent, null);
    }

    private static void appendSurrounded(List<String> target, ProtectedRegion region) {
        target.add("");
        target.addAll(region.getLines());
        target.add("");
    }

    /**
     * True when the line is an import and the next non-blank line starts a top-level function.
     */
    private static boolean isAnchor(List<String> lines, int index) {
        if (!isImportLine(lines.get(index))) {
            return false;
        }
        for (int j = index + 1; j < lines.size(); j++) {
            if (lines.get(j).isBlank()) {
                continue;
            }
            return startsDefinition(lines, j);
        }
        return false;
    }

    static boolean isImportLine(String line) {
        String stripped = line.strip();
        return stripped.startsWith("import ") || stripped.startsWith("from ");
    }

    static boolean isFunctionLine(String line) {
        return line.startsWith("def ") || line.startsWith("async def ");
    }

    /**
     * A top-level definition starts either at its {@code def} line or at the first of the
     * unindented decorator lines stacked directly on top of it.
     */
    static boolean startsDefinition(List<String> lines, int index) {
        int i = index;
        while (i < lines.size() && lines.get(i).startsWith("@")) {
            i++;
        }
        return i < lines.size() && isFunctionLine(lines.get(i));
    }

    private static int lastDefinitionStart(List<String> lines) {
        for (int i = lines.size() - 1; i >= 0; i--) {
            if (isFunctionLine(lines.get(i))) {
                int start = i;
                while (start > 0 && lines.get(start - 1).startsWith("@")) {
                    start--;
                }
                return start;
            }
        }
        return -1;
    }
}
