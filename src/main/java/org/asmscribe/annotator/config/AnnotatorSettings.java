package org.asmscribe.annotator.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigUtil;
import org.asmscribe.annotator.frontend.semantics.SymbolEntry;
import org.asmscribe.annotator.frontend.semantics.SymbolRole;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Immutable settings for one annotation run, built from the {@code asmscribe} configuration block.
 * <p>
 * Everything the pipeline needs is read and validated here, once, before any line is processed.
 * Components receive the resulting value objects through their constructors.
 *
 * @param classifier Line classification patterns.
 * @param layout     Record layout argument pointers refer to.
 * @param convention Calling convention.
 * @param symbols    Compiler spellings and their display names.
 * @param functions  Banner prose keyed by display name.
 * @param header     Header and footer text.
 * @param rendering  Column layout of the body.
 */
public record AnnotatorSettings(ClassifierRules classifier, RecordLayout layout, ArgumentConvention convention,
                                List<SymbolEntry> symbols, Map<String, FunctionDescription> functions,
                                HeaderMetadata header, RenderingOptions rendering) {

    public static final String ROOT = "asmscribe";

    public AnnotatorSettings {
        symbols = List.copyOf(symbols);
        functions = Map.copyOf(functions);
    }

    /**
     * @return the settings of {@code reference.conf} on the classpath.
     */
    public static AnnotatorSettings defaults() {
        return fromConfig(ConfigFactory.defaultReference());
    }

    /**
     * Reads the {@code asmscribe} block of a resolved configuration.
     *
     * @param config The application configuration (root level).
     * @return the validated settings.
     * @throws ConfigException          if a key is missing or has the wrong type.
     * @throws IllegalArgumentException if a layout or convention is inconsistent.
     */
    public static AnnotatorSettings fromConfig(Config config) {
        Config root = config.getConfig(ROOT);
        return new AnnotatorSettings(
                classifierRules(root.getConfig("classifier")),
                layout(root.getConfig("layout")),
                convention(root.getConfig("convention")),
                symbols(root),
                functions(root),
                header(root.getConfig("header")),
                new RenderingOptions(
                        root.getInt("rendering.comment-column"),
                        root.getInt("rendering.indent")));
    }

    public AnnotatorSettings withHeader(HeaderMetadata value) {
        return new AnnotatorSettings(classifier, layout, convention, symbols, functions, value, rendering);
    }

    private static ClassifierRules classifierRules(Config c) {
        return new ClassifierRules(
                c.getStringList("ignored-directives"),
                c.getStringList("function-start-directives"),
                c.getStringList("function-end-markers"),
                c.getStringList("comment-prefixes"));
    }

    private static RecordLayout layout(Config c) {
        List<RecordField> fields = new ArrayList<>();
        for (Config field : c.getConfigList("fields")) {
            fields.add(new RecordField(field.getString("name"), field.getInt("offset")));
        }
        return new RecordLayout(c.getString("name"), fields, c.getInt("size"));
    }

    private static ArgumentConvention convention(Config c) {
        Map<String, ArgumentRole> registers = new LinkedHashMap<>();
        for (Config reg : c.getConfigList("registers")) {
            String name = reg.getString("register");
            ArgumentRole role = new ArgumentRole(
                    reg.getInt("index"),
                    reg.hasPath("floating-point") && reg.getBoolean("floating-point"),
                    reg.hasPath("note") ? reg.getString("note") : "");
            if (registers.put(ArgumentConvention.normalizeRegister(name), role) != null) {
                throw new IllegalArgumentException("Convention '" + c.getString("name")
                        + "': register '" + name + "' listed twice");
            }
        }
        Map<String, String> notes = new LinkedHashMap<>();
        if (c.hasPath("notes")) {
            Config notesConfig = c.getConfig("notes");
            for (String key : notesConfig.root().keySet()) {
                notes.put(key, notesConfig.getString(ConfigUtil.joinPath(key)));
            }
        }
        return new ArgumentConvention(c.getString("name"), registers, notes);
    }

    private static List<SymbolEntry> symbols(Config root) {
        List<SymbolEntry> entries = new ArrayList<>();
        if (!root.hasPath("symbols")) {
            return entries;
        }
        for (Config symbol : root.getConfigList("symbols")) {
            SymbolRole role = symbol.hasPath("role")
                    ? symbol.getEnum(SymbolRole.class, "role")
                    : SymbolRole.FUNCTION;
            entries.add(new SymbolEntry(symbol.getString("spelling"), symbol.getString("name"), role));
        }
        return entries;
    }

    private static Map<String, FunctionDescription> functions(Config root) {
        Map<String, FunctionDescription> descriptions = new LinkedHashMap<>();
        if (!root.hasPath("functions")) {
            return descriptions;
        }
        Config functions = root.getConfig("functions");
        for (String name : functions.root().keySet()) {
            Config f = functions.getConfig(ConfigUtil.joinPath(name));
            descriptions.put(name, new FunctionDescription(
                    optionalString(f, "title"),
                    optionalString(f, "signature"),
                    optionalString(f, "description"),
                    optionalString(f, "algorithm"),
                    optionalString(f, "complexity")));
        }
        return descriptions;
    }

    private static HeaderMetadata header(Config c) {
        return new HeaderMetadata(
                !c.hasPath("enabled") || c.getBoolean("enabled"),
                optionalString(c, "title"),
                optionalString(c, "subtitle"),
                c.hasPath("description") ? c.getStringList("description") : List.of(),
                c.hasPath("footer") ? c.getStringList("footer") : List.of(),
                c.hasPath("style")
                        ? RenderStyle.valueOf(c.getString("style").toUpperCase(Locale.ROOT))
                        : RenderStyle.PLAIN,
                c.hasPath("summary") && c.getBoolean("summary"));
    }

    private static String optionalString(Config c, String path) {
        return c.hasPath(path) ? c.getString(path) : "";
    }
}
