package org.automatacourse.regex;

import com.google.common.base.Preconditions;
import org.automatacourse.regex.dfa.ConstructionMode;
import org.automatacourse.regex.dfa.RefinementMode;

import java.util.Locale;
import java.util.Properties;

/**
 * Settings for {@link Regex#compile(String, CompilerOptions)}.
 * <p>
 * Recognised properties:
 * <ul>
 *   <li>{@code regex.construction} - {@link ConstructionMode} name, default {@code TERMINAL_ACCEPTING}</li>
 *   <li>{@code regex.refinement} - {@link RefinementMode} name, default {@code FIRST_GROUP}</li>
 *   <li>{@code regex.simplify-notations} - {@code true}/{@code false}, default {@code false}</li>
 * </ul>
 */
public final class CompilerOptions {
    public static final String CONSTRUCTION_PROPERTY = "regex.construction";
    public static final String REFINEMENT_PROPERTY = "regex.refinement";
    public static final String SIMPLIFY_NOTATIONS_PROPERTY = "regex.simplify-notations";

    private final ConstructionMode construction;
    private final RefinementMode refinement;
    private final boolean simplifyNotations;

    private CompilerOptions(Builder builder) {
        this.construction = builder.construction;
        this.refinement = builder.refinement;
        this.simplifyNotations = builder.simplifyNotations;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static CompilerOptions defaults() {
        return builder().build();
    }

    /** Full epsilon closures and Moore refinement; recognises the exact language of any pattern. */
    public static CompilerOptions strict() {
        return builder()
                .construction(ConstructionMode.FULL_CLOSURE)
                .refinement(RefinementMode.ALL_GROUPS)
                .build();
    }

    /** Reads the options from {@code properties}; missing keys keep their defaults. */
    public static CompilerOptions fromProperties(Properties properties) {
        Builder builder = builder();
        String construction = properties.getProperty(CONSTRUCTION_PROPERTY);
        if (construction != null) {
            builder.construction(parseEnum(ConstructionMode.class, CONSTRUCTION_PROPERTY, construction));
        }
        String refinement = properties.getProperty(REFINEMENT_PROPERTY);
        if (refinement != null) {
            builder.refinement(parseEnum(RefinementMode.class, REFINEMENT_PROPERTY, refinement));
        }
        String simplify = properties.getProperty(SIMPLIFY_NOTATIONS_PROPERTY);
        if (simplify != null) {
            String value = simplify.trim().toLowerCase(Locale.ROOT);
            Preconditions.checkArgument(value.equals("true") || value.equals("false"),
                    "%s must be true or false, got '%s'", SIMPLIFY_NOTATIONS_PROPERTY, simplify);
            builder.simplifyNotations(Boolean.parseBoolean(value));
        }
        return builder.build();
    }

    public static <E extends Enum<E>> E parseEnum(Class<E> type, String name, String value) {
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (E constant : type.getEnumConstants()) {
            if (constant.name().equals(normalized)) {
                return constant;
            }
        }
        throw new IllegalArgumentException("Unknown value '" + value + "' for " + name);
    }

    public ConstructionMode getConstruction() {
        return construction;
    }

    public RefinementMode getRefinement() {
        return refinement;
    }

    public boolean isSimplifyNotations() {
        return simplifyNotations;
    }

    public Builder toBuilder() {
        return builder()
                .construction(construction)
                .refinement(refinement)
                .simplifyNotations(simplifyNotations);
    }

    @Override
    public String toString() {
        return "CompilerOptions{construction=" + construction
                + ", refinement=" + refinement
                + ", simplifyNotations=" + simplifyNotations + "}";
    }

    public static class Builder {
        private ConstructionMode construction = ConstructionMode.TERMINAL_ACCEPTING;
        private RefinementMode refinement = RefinementMode.FIRST_GROUP;
        private boolean simplifyNotations;

        public Builder construction(ConstructionMode construction) {
            this.construction = Preconditions.checkNotNull(construction, "construction");
            return this;
        }

        public Builder refinement(RefinementMode refinement) {
            this.refinement = Preconditions.checkNotNull(refinement, "refinement");
            return this;
        }

        public Builder simplifyNotations(boolean simplifyNotations) {
            this.simplifyNotations = simplifyNotations;
            return this;
        }

        /**
         * @throws IllegalArgumentException for {@code FULL_CLOSURE} with {@code FIRST_GROUP}: first-group
         *         refinement never splits the accepting group, which is only sound while accepting
         *         states have no successors
         */
        public CompilerOptions build() {
            Preconditions.checkArgument(
                    construction != ConstructionMode.FULL_CLOSURE || refinement != RefinementMode.FIRST_GROUP,
                    "%s construction requires %s refinement, got %s",
                    ConstructionMode.FULL_CLOSURE, RefinementMode.ALL_GROUPS, refinement);
            return new CompilerOptions(this);
        }
    }
}
