// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package texweave.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import texweave.document.EnvironmentKind;
import texweave.util.Trace;
import texweave.util.annotation.Nullable;
import texweave.util.condition.ConditionContext;
import texweave.util.condition.UnhandledErrorError;
import texweave.util.condition.exception.IOExceptionCondition;

/**
 * Reads a {@link Configuration} from JSON.
 * <p>
 * Recognized top-level keys: {@code title}, {@code subtitle}, {@code author}, {@code version}, {@code date},
 * {@code language}, {@code tabs}, {@code tab_labels}, {@code environments}, {@code counters}, {@code math_macros}
 * (or {@code katex_macros}), {@code search_path}, {@code bibliography} and {@code citation_style}. Keys starting with
 * an underscore are comments and unknown keys are ignored.
 * <p>
 * An environment entry is either an object with any of {@code css} (or {@code css_class}), {@code label},
 * {@code kind}, {@code counter}, {@code numbering} and {@code reset}, or a two-element array {@code [css, label]}.
 * <p>
 * A read failure is signaled as an {@link IOExceptionCondition}; malformed JSON and values of the wrong shape as a
 * {@link ConfigurationErrorCondition}.
 */
public final class ConfigurationLoader {
    private ConfigurationLoader(final String sourceName) {
        this.sourceName = sourceName;
    }

    /**
     * Loads the configuration file at {@code path}.
     */
    public static Configuration load(final Path path) {
        try (final var trace = new Trace(() -> "Loading the configuration file " + path)) {
            trace.use();
            final String json;
            try {
                json = Files.readString(path);
            } catch (final IOException e) {
                throw ConditionContext.error(new IOExceptionCondition(e));
            }
            final var configuration = parse(json, path.toString());
            logger.info("Loaded configuration from {}", path);
            return configuration;
        }
    }

    /**
     * Parses configuration JSON; {@code sourceName} is used in error messages.
     */
    public static Configuration parse(final String json, final String sourceName) {
        final var loader = new ConfigurationLoader(sourceName);
        final JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (final JsonProcessingException e) {
            throw loader.signalError("malformed JSON: " + e.getOriginalMessage());
        }
        if (root == null || !root.isObject()) {
            throw loader.signalError("the configuration must be a JSON object");
        }
        return loader.read(root);
    }

    private Configuration read(final JsonNode root) {
        final var metadata = new Metadata(
            optionalString(root, "title"),
            optionalString(root, "subtitle"),
            optionalString(root, "author"),
            optionalString(root, "version"),
            optionalString(root, "date"),
            optionalString(root, "language")
        );
        final var language = (metadata.language() != null) ? metadata.language() : "en";
        final var defaults = DefaultEnvironments.forLanguage(language);
        final var macros = new LinkedHashMap<String, String>();
        readStringMap(root.get("katex_macros"), "katex_macros", macros);
        readStringMap(root.get("math_macros"), "math_macros", macros);
        return new Configuration(
            metadata,
            readTabs(root),
            readEnvironments(root.get("environments"), defaults),
            readCounters(root.get("counters")),
            macros,
            readStringList(root.get("search_path"), "search_path").stream().map(Path::of).toList(),
            readStringList(root.get("bibliography"), "bibliography"),
            readCitationStyle(root.get("citation_style"))
        );
    }

    private List<Tab> readTabs(final JsonNode root) {
        final var tabsNode = root.get("tabs");
        if (tabsNode == null || tabsNode.isNull()) {
            return List.of();
        }
        if (!tabsNode.isArray()) {
            throw signalError("tabs must be an array");
        }
        final var labels = new LinkedHashMap<String, String>();
        readStringMap(root.get("tab_labels"), "tab_labels", labels);
        final var tabs = new ArrayList<Tab>();
        for (final var tabNode : tabsNode) {
            if (tabNode.isTextual()) {
                final var id = tabNode.asText();
                tabs.add(new Tab(id, labels.getOrDefault(id, id)));
            } else if (tabNode.isObject()) {
                final var id = requiredString(tabNode, "id", "tabs entry");
                final var label = optionalString(tabNode, "label");
                tabs.add(new Tab(id, (label != null) ? label : labels.getOrDefault(id, id)));
            } else {
                throw signalError("tabs entries must be strings or objects with an id");
            }
        }
        return tabs;
    }

    private Map<String, EnvironmentStyle> readEnvironments(
        final @Nullable JsonNode environmentsNode,
        final Map<String, EnvironmentStyle> defaults
    ) {
        final var result = new LinkedHashMap<String, EnvironmentStyle>();
        if (environmentsNode == null || environmentsNode.isNull()) {
            return result;
        }
        if (!environmentsNode.isObject()) {
            throw signalError("environments must be an object");
        }
        final var fields = environmentsNode.fields();
        while (fields.hasNext()) {
            final var field = fields.next();
            final var name = field.getKey();
            if (name.startsWith("_")) {
                continue;
            }
            result.put(name, readEnvironment(name, field.getValue(), defaults.get(name)));
        }
        return result;
    }

    private EnvironmentStyle readEnvironment(
        final String name,
        final JsonNode node,
        final @Nullable EnvironmentStyle builtIn
    ) {
        if (node.isArray()) {
            if (node.size() != 2 || !node.get(0).isTextual() || !node.get(1).isTextual()) {
                throw signalError("environment " + name + " must be given as [css, label]");
            }
            return EnvironmentStyle.fromCssClass(name, node.get(0).asText(), node.get(1).asText());
        }
        if (!node.isObject()) {
            throw signalError("environment " + name + " must be an object or a [css, label] array");
        }
        var css = optionalString(node, "css");
        if (css == null) {
            css = optionalString(node, "css_class");
        }
        final var label = optionalString(node, "label");
        var style = (css != null)
            ? EnvironmentStyle.fromCssClass(name, css, (label != null) ? label : name)
            : (builtIn != null) ? builtIn : EnvironmentStyle.unknown(name);
        if (label != null) {
            style = style.withDisplayLabel(label);
        }
        final var kindName = optionalString(node, "kind");
        final var kind = (kindName == null) ? style.kind() : parseKind(name, kindName);
        final var counter = optionalString(node, "counter");
        final var numberingName = optionalString(node, "numbering");
        var numbering = style.numbering();
        if (numberingName != null) {
            numbering = NumberingScheme.parse(numberingName);
            if (numbering == null) {
                throw signalError("environment " + name + " has an unknown numbering scheme " + numberingName);
            }
        } else if (kind != style.kind() && kind != EnvironmentKind.THEOREM_LIKE) {
            numbering = NumberingScheme.NONE;
        } else if (kind == EnvironmentKind.THEOREM_LIKE && style.kind() != kind) {
            numbering = NumberingScheme.HIERARCHICAL;
        }
        final var resetName = optionalString(node, "reset");
        var reset = style.reset();
        if (resetName != null) {
            reset = ResetScope.parse(resetName);
            if (reset == null) {
                throw signalError("environment " + name + " has an unknown reset scope " + resetName);
            }
        } else if (numbering != NumberingScheme.NONE && style.numbering() == NumberingScheme.NONE) {
            reset = ResetScope.PER_CHAPTER;
        }
        return new EnvironmentStyle(
            kind,
            style.cssClass(),
            style.displayLabel(),
            (counter != null) ? counter : style.counter(),
            numbering,
            reset
        );
    }

    private EnvironmentKind parseKind(final String environment, final String kindName) {
        return switch (kindName.strip().toLowerCase(Locale.ROOT).replace('-', '_')) {
            case "theorem", "theorem_like" -> EnvironmentKind.THEOREM_LIKE;
            case "proof" -> EnvironmentKind.PROOF;
            case "list" -> EnvironmentKind.LIST;
            case "custom", "box" -> EnvironmentKind.CUSTOM;
            case "unknown", "plain" -> EnvironmentKind.UNKNOWN;
            default -> throw signalError("environment " + environment + " has an unknown kind " + kindName);
        };
    }

    private Map<String, CounterRule> readCounters(final @Nullable JsonNode countersNode) {
        final var result = new LinkedHashMap<String, CounterRule>();
        if (countersNode == null || countersNode.isNull()) {
            return result;
        }
        if (!countersNode.isObject()) {
            throw signalError("counters must be an object");
        }
        final var fields = countersNode.fields();
        while (fields.hasNext()) {
            final var field = fields.next();
            final var name = field.getKey();
            if (name.startsWith("_")) {
                continue;
            }
            final var node = field.getValue();
            if (!node.isObject()) {
                throw signalError("counter " + name + " must be an object");
            }
            final var numberingName = optionalString(node, "numbering");
            final var resetName = optionalString(node, "reset");
            final var numbering = (numberingName == null)
                ? NumberingScheme.HIERARCHICAL
                : NumberingScheme.parse(numberingName);
            final var reset = (resetName == null) ? ResetScope.PER_CHAPTER : ResetScope.parse(resetName);
            if (numbering == null || reset == null) {
                throw signalError("counter " + name + " has an unknown numbering scheme or reset scope");
            }
            result.put(name, new CounterRule(numbering, reset));
        }
        return result;
    }

    private CitationStyle readCitationStyle(final @Nullable JsonNode node) {
        if (node == null || node.isNull()) {
            return CitationStyle.KEY;
        }
        return switch (node.asText().strip().toLowerCase(Locale.ROOT)) {
            case "key", "alpha" -> CitationStyle.KEY;
            case "numeric", "number" -> CitationStyle.NUMERIC;
            default -> throw signalError("unknown citation style " + node.asText());
        };
    }

    private void readStringMap(final @Nullable JsonNode node, final String what, final Map<String, String> into) {
        if (node == null || node.isNull()) {
            return;
        }
        if (!node.isObject()) {
            throw signalError(what + " must be an object");
        }
        final var fields = node.fields();
        while (fields.hasNext()) {
            final var field = fields.next();
            if (field.getKey().startsWith("_")) {
                continue;
            }
            if (!field.getValue().isTextual()) {
                throw signalError(what + " entry " + field.getKey() + " must be a string");
            }
            into.put(field.getKey(), field.getValue().asText());
        }
    }

    private List<String> readStringList(final @Nullable JsonNode node, final String what) {
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (node.isTextual()) {
            return List.of(node.asText());
        }
        if (!node.isArray()) {
            throw signalError(what + " must be a string or an array of strings");
        }
        final var result = new ArrayList<String>();
        for (final var element : node) {
            if (!element.isTextual()) {
                throw signalError(what + " entries must be strings");
            }
            result.add(element.asText());
        }
        return result;
    }

    private @Nullable String optionalString(final JsonNode node, final String key) {
        final var value = node.get(key);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isValueNode()) {
            throw signalError(key + " must be a string");
        }
        return value.asText();
    }

    private String requiredString(final JsonNode node, final String key, final String what) {
        final var value = optionalString(node, key);
        if (value == null) {
            throw signalError(what + " is missing " + key);
        }
        return value;
    }

    private UnhandledErrorError signalError(final String message) {
        throw ConditionContext.error(new ConfigurationErrorCondition(sourceName, message));
    }

    private static final Logger logger = LoggerFactory.getLogger(ConfigurationLoader.class);
    private static final ObjectMapper mapper = new ObjectMapper();

    private final String sourceName;
}
