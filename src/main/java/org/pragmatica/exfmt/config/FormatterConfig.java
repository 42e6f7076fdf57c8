package org.pragmatica.exfmt.config;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Sets;
import org.pragmatica.exfmt.error.FormatError;
import org.pragmatica.exfmt.error.FormatException;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Formatter configuration options.
 *
 * @param lineLength          preferred maximum line width
 * @param localsWithoutParens caller additions followed by {@link LocalWithoutParens#DEFAULTS}
 * @param sigils              callbacks for upper-case sigils, keyed by sigil name
 * @param migrations          enabled source rewrites
 * @param syntaxColors        decorations per token category
 * @param file                file name handed to sigil callbacks
 * @param forceDoEndBlocks    write {@code do:} keyword blocks as {@code do ... end}
 */
public record FormatterConfig(
    int lineLength,
    List<LocalWithoutParens> localsWithoutParens,
    Map<String, SigilCallback> sigils,
    Set<Migration> migrations,
    SyntaxColors syntaxColors,
    Optional<String> file,
    boolean forceDoEndBlocks
) {
    public static final int DEFAULT_LINE_LENGTH = 98;

    public static final FormatterConfig DEFAULT = new FormatterConfig(
        DEFAULT_LINE_LENGTH,
        LocalWithoutParens.DEFAULTS,
        Map.of(),
        Set.of(),
        SyntaxColors.NONE,
        Optional.empty(),
        false
    );

    public FormatterConfig {
        if (lineLength < 0) {
            throw new FormatException(new FormatError.InvalidOption("lineLength", "must be non-negative, got " + lineLength));
        }
        if (localsWithoutParens == null || syntaxColors == null || file == null || migrations == null) {
            throw new FormatException(new FormatError.InvalidOption("config", "options must not be null"));
        }
        validateSigils(sigils);

        localsWithoutParens = ImmutableList.copyOf(localsWithoutParens);
        sigils = ImmutableMap.copyOf(sigils);
        migrations = Sets.immutableEnumSet(migrations);
    }

    public boolean migrates(Migration migration) {
        return migrations.contains(migration);
    }

    public Optional<SigilCallback> sigil(String name) {
        return Optional.ofNullable(sigils.get(name));
    }

    public static Builder builder() {
        return new Builder();
    }

    private static void validateSigils(Map<String, SigilCallback> sigils) {
        if (sigils == null) {
            throw new FormatException(new FormatError.InvalidOption("sigils", "must not be null"));
        }
        for (var entry : sigils.entrySet()) {
            var name = entry.getKey();

            if (name == null || name.isEmpty()) {
                throw new FormatException(new FormatError.InvalidSigil(String.valueOf(name), "empty name"));
            }
            if (!name.chars().allMatch(c -> c >= 'A' && c <= 'Z')) {
                throw new FormatException(new FormatError.InvalidSigil(name, "name is not upper-case"));
            }
            if (entry.getValue() == null) {
                throw new FormatException(new FormatError.InvalidSigil(name, "callback is null"));
            }
        }
    }

    /**
     * Fluent builder; {@link #build()} reports invalid options as {@link FormatException}.
     */
    public static final class Builder {
        private int lineLength = DEFAULT_LINE_LENGTH;
        private final List<LocalWithoutParens> locals = new ArrayList<>();
        private final Map<String, SigilCallback> sigils = new LinkedHashMap<>();
        private final Set<Migration> migrations = EnumSet.noneOf(Migration.class);
        private SyntaxColors syntaxColors = SyntaxColors.NONE;
        private Optional<String> file = Optional.empty();
        private boolean forceDoEndBlocks;

        private Builder() {}

        public Builder lineLength(int lineLength) {
            this.lineLength = lineLength;
            return this;
        }

        public Builder localWithoutParens(String name, int arity) {
            locals.add(LocalWithoutParens.of(name, arity));
            return this;
        }

        public Builder localsWithoutParens(List<LocalWithoutParens> additions) {
            locals.addAll(additions);
            return this;
        }

        public Builder sigil(String name, SigilCallback callback) {
            sigils.put(name, callback);
            return this;
        }

        public Builder migration(Migration migration, boolean enabled) {
            if (enabled) {
                migrations.add(migration);
            } else {
                migrations.remove(migration);
            }
            return this;
        }

        /**
         * Enable or disable every migration at once.
         */
        public Builder migrate(boolean enabled) {
            if (enabled) {
                migrations.addAll(EnumSet.allOf(Migration.class));
            } else {
                migrations.clear();
            }
            return this;
        }

        public Builder syntaxColors(SyntaxColors syntaxColors) {
            this.syntaxColors = syntaxColors;
            return this;
        }

        public Builder file(String file) {
            this.file = Optional.ofNullable(file);
            return this;
        }

        public Builder forceDoEndBlocks(boolean forceDoEndBlocks) {
            this.forceDoEndBlocks = forceDoEndBlocks;
            return this;
        }

        public FormatterConfig build() {
            var merged = ImmutableList.<LocalWithoutParens>builder()
                                      .addAll(locals)
                                      .addAll(LocalWithoutParens.DEFAULTS)
                                      .build();
            return new FormatterConfig(lineLength, merged, sigils, migrations, syntaxColors, file, forceDoEndBlocks);
        }
    }
}
