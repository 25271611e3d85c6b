package com.chronicle.engine.load;

import com.chronicle.model.Condition;
import com.chronicle.model.Effect;
import com.chronicle.model.EntityRef;
import com.chronicle.model.EntitySnapshot;
import com.chronicle.model.RulesJson;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Stream;

/**
 * Reads campaign snapshots from files: {@code <snapshotDir>/<campaignId>/<branchId>.json}, falling back to
 * {@code <campaignId>/main.json} when the branch file is absent.
 * <p>
 * A snapshot is {@code {"conditions": [...], "effects": [...], "entities": [...]}}. Records are parsed one by one;
 * a malformed record is skipped with a warning, so one bad record never hides the rest. Lookups by id scan every
 * snapshot under the directory, which suits tests and offline tools rather than request paths.
 */
public final class CampaignSnapshotLoader implements RulesSource {

    private static final Logger log = LoggerFactory.getLogger(CampaignSnapshotLoader.class);

    static final String MAIN_BRANCH_FILE = "main.json";
    private static final String JSON_SUFFIX = ".json";

    private final Path snapshotDir;

    public CampaignSnapshotLoader(Path snapshotDir) {
        this.snapshotDir = snapshotDir;
    }

    public Path getSnapshotDir() {
        return snapshotDir;
    }

    @Override
    public CampaignRules load(String campaignId, String branchId) {
        if (snapshotDir == null || campaignId == null || campaignId.isBlank()) return CampaignRules.empty();
        Path root = snapshotDir.toAbsolutePath().normalize();
        String fileName = (branchId != null && !branchId.isBlank() ? branchId : "main") + JSON_SUFFIX;
        Path campaignDir;
        Path file;
        try {
            campaignDir = root.resolve(campaignId).normalize();
            file = campaignDir.resolve(fileName).normalize();
        } catch (InvalidPathException e) {
            return rejected(root, campaignId, branchId);
        }
        if (!root.equals(campaignDir.getParent()) || !campaignDir.equals(file.getParent())) {
            return rejected(root, campaignId, branchId);
        }
        String suffix = "";
        if (!Files.isRegularFile(file)) {
            file = campaignDir.resolve(MAIN_BRANCH_FILE);
            suffix = " (main branch fallback)";
        }
        Optional<String> json = readFile(file);
        if (json.isEmpty()) {
            return new CampaignRules(null, null, null,
                    List.of("No snapshot for campaign " + campaignId + " branch " + branchId));
        }
        CampaignRules rules = parse(json.get(), file.toString());
        log.info("Campaign snapshot loaded from file: {}{} | conditions={} | effects={} | entities={} | warnings={}",
                file, suffix, rules.conditions().size(), rules.effects().size(), rules.entities().size(), rules.warnings().size());
        return rules;
    }

    @Override
    public Optional<Condition> findCondition(String conditionId) {
        for (CampaignRules rules : loadAll()) {
            Condition c = rules.findCondition(conditionId);
            if (c != null) return Optional.of(c);
        }
        return Optional.empty();
    }

    @Override
    public Optional<CampaignRules> findRulesForEntity(EntityRef ref) {
        return loadAll().stream().filter(rules -> rules.findEntity(ref) != null).findFirst();
    }

    @Override
    public Optional<CampaignRules> findRulesForEffect(String effectId) {
        return loadAll().stream().filter(rules -> rules.findEffect(effectId) != null).findFirst();
    }

    private static CampaignRules rejected(Path root, String campaignId, String branchId) {
        log.warn("Rejected snapshot lookup outside {} | campaignId={} | branchId={}", root, campaignId, branchId);
        return new CampaignRules(null, null, null, List.of("Invalid campaign or branch id: " + campaignId + "/" + branchId));
    }

    /** Parses one snapshot document, collecting a warning per unreadable record. */
    public static CampaignRules parse(String json, String source) {
        JsonNode root;
        try {
            root = RulesJson.readTree(json);
        } catch (UncheckedIOException e) {
            log.warn("Failed to parse campaign snapshot from {}: {}", source, e.getMessage());
            return new CampaignRules(null, null, null, List.of("Unreadable snapshot " + source + ": " + e.getMessage()));
        }
        if (root == null || !root.isObject()) {
            return new CampaignRules(null, null, null, List.of("Snapshot " + source + " is not a JSON object"));
        }
        List<String> warnings = new ArrayList<>();
        List<Condition> conditions = readRecords(root, "conditions", n -> RulesJson.fromTree(n, Condition.class), warnings);
        List<Effect> effects = readRecords(root, "effects", n -> RulesJson.fromTree(n, Effect.class), warnings);
        List<EntitySnapshot> entities = readRecords(root, "entities", EntitySnapshot::fromJson, warnings);
        for (String w : warnings) {
            log.warn("Skipped record in {}: {}", source, w);
        }
        return new CampaignRules(conditions, effects, entities, warnings);
    }

    private static <T> List<T> readRecords(JsonNode root, String field, Function<JsonNode, T> reader, List<String> warnings) {
        JsonNode array = root.path(field);
        List<T> out = new ArrayList<>();
        if (array.isMissingNode() || array.isNull()) return out;
        if (!array.isArray()) {
            warnings.add(field + " is not an array");
            return out;
        }
        for (int i = 0; i < array.size(); i++) {
            try {
                out.add(reader.apply(array.get(i)));
            } catch (RuntimeException e) {
                warnings.add(String.format("%s[%d]: %s", field, i, e.getMessage()));
            }
        }
        return out;
    }

    private List<CampaignRules> loadAll() {
        List<CampaignRules> all = new ArrayList<>();
        if (snapshotDir == null || !Files.isDirectory(snapshotDir)) return all;
        try (Stream<Path> files = Files.walk(snapshotDir, 2)) {
            files.filter(p -> Files.isRegularFile(p) && p.getFileName().toString().endsWith(JSON_SUFFIX))
                    .sorted()
                    .forEach(p -> readFile(p).ifPresent(json -> all.add(parse(json, p.toString()))));
        } catch (IOException e) {
            log.warn("Failed to list snapshot directory {}: {}", snapshotDir, e.getMessage());
        }
        return all;
    }

    private static Optional<String> readFile(Path file) {
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readString(file));
        } catch (IOException e) {
            log.warn("Failed to read snapshot file {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }
}
